/* (C)2026 */
package com.ammann.pse.enumeration;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Character of a detected luminance flash, derived from its relative intensity.
 *
 * <p>Constants are declared in ascending severity so that merging can keep the
 * more severe kind with a plain ordinal comparison.
 */
public enum FlashKind
{
    /** Intensity of 0.4 or below. */
    SUBTLE("subtle"),
    /** Intensity above 0.4. */
    GRADUAL("gradual"),
    /** Intensity above 0.8. */
    SUDDEN("sudden");

    private static final double SUDDEN_THRESHOLD = 0.8;
    private static final double GRADUAL_THRESHOLD = 0.4;

    private final String label;

    FlashKind(String label) {
        this.label = label;
    }

    /**
     * Classifies a flash by its relative intensity.
     *
     * @param intensity relative intensity in the range [0.0, 1.0]
     * @return the matching kind
     */
    public static FlashKind fromIntensity(double intensity) {
        if (intensity > SUDDEN_THRESHOLD) return SUDDEN;
        if (intensity > GRADUAL_THRESHOLD) return GRADUAL;
        return SUBTLE;
    }

    /**
     * Returns whichever of the two kinds is more severe.
     */
    public static FlashKind mostSevere(FlashKind a, FlashKind b) {
        return a.ordinal() >= b.ordinal() ? a : b;
    }

    @JsonValue
    public String getLabel() { return label; }
}
