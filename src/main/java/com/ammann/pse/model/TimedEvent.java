/* (C)2026 */
package com.ammann.pse.model;

/**
 * Common shape of detected flash events: a start time and a duration, both in
 * seconds from the start of the analysed content.
 */
public interface TimedEvent
{
    double timestamp();

    double duration();

    double intensity();

    /** Exclusive end of the event span. */
    default double endTime() {
        return timestamp() + duration();
    }
}
