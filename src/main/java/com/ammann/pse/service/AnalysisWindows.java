/* (C)2026 */
package com.ammann.pse.service;

import com.ammann.pse.model.TimeWindow;
import com.ammann.pse.model.TimedEvent;
import java.util.ArrayList;
import java.util.List;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Fixed-size, non-overlapping analysis windows over {@code [0, duration)}.
 *
 * <p>Window {@code i} spans {@code [i * size, (i + 1) * size)}; a window exists for every
 * start below the duration, so the last window may reach past the end of the content.
 * The statistics engine, the rhythm analyzer and the dangerous period locator all use
 * this partition, which keeps their window boundaries identical.
 *
 * <p>Windows are never materialised: events are bucketed by window index and only
 * occupied windows are kept, so the cost follows the event count and not the duration.
 */
public final class AnalysisWindows {

    private AnalysisWindows() {}

    /**
     * Number of windows covering the analysed duration.
     *
     * @param duration   analysed duration in seconds
     * @param windowSize window length in seconds
     * @return window count, 0 when the duration or window size is not positive and finite
     */
    public static long windowCount(double duration, double windowSize) {
        if (!(duration > 0.0) || !Double.isFinite(duration)
                || !(windowSize > 0.0) || !Double.isFinite(windowSize)) {
            return 0L;
        }

        long count = (long) Math.ceil(duration / windowSize);
        // the division can be one window off either way
        if (count > 0 && (count - 1) * windowSize >= duration) {
            count--;
        }
        if (count < Long.MAX_VALUE && count * windowSize < duration) {
            count++;
        }
        return count;
    }

    /**
     * Returns window {@code index} of the partition.
     */
    public static TimeWindow window(long index, double windowSize) {
        return new TimeWindow(index, index * windowSize, (index + 1) * windowSize);
    }

    /**
     * Assigns each event to the window containing its timestamp. Events outside every
     * window are dropped.
     *
     * @param events     events to distribute
     * @param duration   analysed duration in seconds
     * @param windowSize window length in seconds
     * @return occupied windows only, keyed by window index in ascending order
     */
    public static <E extends TimedEvent> NavigableMap<Long, List<E>> bucket(
            List<E> events, double duration, double windowSize) {
        NavigableMap<Long, List<E>> buckets = new TreeMap<>();
        long windowCount = windowCount(duration, windowSize);
        if (events == null || windowCount == 0) {
            return buckets;
        }

        for (E event : events) {
            long index = indexOf(event.timestamp(), windowSize, windowCount);
            if (index >= 0) {
                buckets.computeIfAbsent(index, i -> new ArrayList<>()).add(event);
            }
        }
        return buckets;
    }

    /**
     * Index of the window containing {@code timestamp}, or {@code -1} when it lies outside
     * the partition.
     */
    static long indexOf(double timestamp, double windowSize, long windowCount) {
        if (!(timestamp >= 0.0) || !Double.isFinite(timestamp)) {
            return -1L;
        }

        long estimate = (long) Math.floor(timestamp / windowSize);
        // floor() can land one window off when the timestamp sits on a boundary
        for (long candidate = estimate - 1; candidate <= estimate + 1; candidate++) {
            if (candidate >= 0 && candidate < windowCount
                    && window(candidate, windowSize).contains(timestamp)) {
                return candidate;
            }
        }
        return -1L;
    }
}
