/* (C)2026 */
package com.ammann.pse.model;

/**
 * A discrete saturated-red flash after merging.
 *
 * @param timestamp  start of the flash in seconds
 * @param intensity  weighted relative red change
 * @param duration   length of the flash in seconds
 * @param saturation highest red saturation seen across the merged sub-events
 * @param redValue   highest red-channel value seen across the merged sub-events
 */
public record RedFlashEvent(
        double timestamp, double intensity, double duration, double saturation, double redValue)
        implements TimedEvent
{
    /**
     * Returns a copy of this event ending at {@code endTime}.
     */
    public RedFlashEvent endingAt(double endTime) {
        return new RedFlashEvent(timestamp, intensity, endTime - timestamp, saturation, redValue);
    }
}
