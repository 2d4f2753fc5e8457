/* (C)2026 */
package com.ammann.pse.exception;

/**
 * Raised when a finished analysis cannot be rendered for downstream collaborators.
 */
public class ReportSerializationException extends PseException {

    public ReportSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
