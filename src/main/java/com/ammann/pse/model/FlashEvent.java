/* (C)2026 */
package com.ammann.pse.model;

import com.ammann.pse.enumeration.FlashKind;

/**
 * A discrete luminance flash after merging.
 *
 * @param timestamp start of the flash in seconds
 * @param intensity relative luminance change in the range [0, 1]
 * @param duration  length of the flash in seconds
 * @param kind      severity classification
 */
public record FlashEvent(double timestamp, double intensity, double duration, FlashKind kind)
        implements TimedEvent
{
    /**
     * Returns a copy of this event ending at {@code endTime}.
     */
    public FlashEvent endingAt(double endTime) {
        return new FlashEvent(timestamp, intensity, endTime - timestamp, kind);
    }
}
