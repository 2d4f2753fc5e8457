/* (C)2026 */
package com.ammann.pse.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Windowed flash rate statistics for one event list.
 *
 * <p>{@code peakRate} and {@code maxRate} always carry the same value: the highest
 * per-window rate. Both are kept for compatibility with existing report consumers.
 *
 * @param averageRate  total flashes divided by the analysed duration
 * @param peakRate     highest per-window rate in flashes per second
 * @param maxRate      same as {@code peakRate}
 * @param totalFlashes number of events analysed
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FlashStatisticsDTO(
        double averageRate,
        double peakRate,
        double maxRate,
        int totalFlashes)
{
    /** Statistics of an empty event list. */
    public static FlashStatisticsDTO empty() {
        return new FlashStatisticsDTO(0.0, 0.0, 0.0, 0);
    }
}
