/* (C)2026 */
package com.ammann.pse.exception;

/**
 * Exception indicating that a threshold profile violates its own constraints,
 * for example a non-positive analysis window or risk cutoffs out of order.
 */
public class ThresholdConfigurationException extends PseException {

    public ThresholdConfigurationException(String message) {
        super(message);
    }

    /**
     * Creates a configuration exception for an invalid threshold value.
     */
    public static ThresholdConfigurationException invalidParameter(
            String paramName, Object value, String expected) {
        return new ThresholdConfigurationException(
                String.format("Invalid threshold '%s': got '%s', expected %s",
                        paramName, value, expected));
    }
}
