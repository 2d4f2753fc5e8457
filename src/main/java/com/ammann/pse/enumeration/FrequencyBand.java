/* (C)2026 */
package com.ammann.pse.enumeration;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Flash-rate bands used for the per-window frequency histogram.
 *
 * <p>Each band is upper-inclusive: a window rate of exactly 3 flashes per second
 * falls into {@link #ONE_TO_THREE_HZ}.
 */
public enum FrequencyBand
{
    ZERO_TO_ONE_HZ("0-1Hz", 1.0),
    ONE_TO_THREE_HZ("1-3Hz", 3.0),
    THREE_TO_FIVE_HZ("3-5Hz", 5.0),
    FIVE_TO_TEN_HZ("5-10Hz", 10.0),
    TEN_TO_TWENTY_FIVE_HZ("10-25Hz", 25.0),
    ABOVE_TWENTY_FIVE_HZ(">25Hz", Double.POSITIVE_INFINITY);

    private final String label;
    private final double upperBoundHz;

    FrequencyBand(String label, double upperBoundHz) {
        this.label = label;
        this.upperBoundHz = upperBoundHz;
    }

    /**
     * Returns the band a window rate falls into.
     *
     * @param rateHz flashes per second observed in one window
     * @return the first band whose upper bound is not below the rate
     */
    public static FrequencyBand fromRate(double rateHz) {
        for (FrequencyBand band : values()) {
            if (rateHz <= band.upperBoundHz) {
                return band;
            }
        }
        return ABOVE_TWENTY_FIVE_HZ;
    }

    @JsonValue
    public String getLabel() { return label; }

    public double getUpperBoundHz() { return upperBoundHz; }
}
