/* (C)2026 */
package com.ammann.pse.model;

/**
 * Half-open analysis window {@code [start, end)} in seconds.
 */
public record TimeWindow(long index, double start, double end)
{
    public boolean contains(double timestamp) {
        return timestamp >= start && timestamp < end;
    }
}
