/* (C)2026 */
package com.ammann.pse.exception;

/**
 * Base unchecked exception for errors raised by the PSE analysis engine.
 *
 * <p>The analysis itself is total over its inputs; subclasses only signal
 * misconfiguration or failures while rendering a finished report.
 */
public class PseException extends RuntimeException
{
    public PseException(String message, Throwable cause) {
        super(message, cause);
    }

    public PseException(String message) {
        super(message);
    }
}
