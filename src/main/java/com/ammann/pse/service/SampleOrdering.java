/* (C)2026 */
package com.ammann.pse.service;

import java.util.Comparator;
import java.util.List;
import java.util.function.ToDoubleFunction;
import org.jboss.logging.Logger;

/**
 * Guards the time-ordering precondition of sample and event sequences.
 */
final class SampleOrdering {

    private static final Logger LOG = Logger.getLogger(SampleOrdering.class);

    private SampleOrdering() {}

    /**
     * Returns {@code items} unchanged when already in non-decreasing timestamp order,
     * otherwise a stably sorted copy. {@code null} yields an empty list.
     */
    static <T> List<T> ordered(List<T> items, ToDoubleFunction<T> timestamp) {
        if (items == null) {
            return List.of();
        }

        for (int i = 1; i < items.size(); i++) {
            if (timestamp.applyAsDouble(items.get(i)) < timestamp.applyAsDouble(items.get(i - 1))) {
                LOG.debugf("Sequence of %d items is out of order at index %d, sorting", items.size(), i);
                return items.stream().sorted(Comparator.comparingDouble(timestamp)).toList();
            }
        }
        return items;
    }
}
