/* (C)2026 */
package com.ammann.pse.enumeration;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Qualitative regularity of the spacing between flash events.
 */
public enum PatternType
{
    /** Interval standard deviation below 20 percent of the mean interval. */
    REGULAR_STROBE("regular_strobe"),
    /** Interval standard deviation below 50 percent of the mean interval. */
    SEMI_REGULAR("semi_regular"),
    IRREGULAR("irregular");

    private final String label;

    PatternType(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() { return label; }
}
