/* (C)2026 */
package com.ammann.pse.enumeration;

import com.ammann.pse.config.PseThresholds;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Photosensitive-epilepsy risk classification.
 *
 * <p>Overall scores map onto the levels through the ascending cutoffs held in
 * {@link PseThresholds}: a score at or below the safe cutoff is {@link #SAFE},
 * anything above the high cutoff is {@link #CRITICAL}. Dangerous time periods
 * use the same scale but never report {@link #SAFE}.
 */
public enum RiskLevel
{
    SAFE("safe"),
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high"),
    CRITICAL("critical");

    private final String label;

    RiskLevel(String label) {
        this.label = label;
    }

    /**
     * Returns the risk level corresponding to the given score.
     *
     * @param score      risk score in the range [0, 100]
     * @param thresholds thresholds holding the four ascending cutoffs
     * @return the matching level
     */
    public static RiskLevel fromScore(double score, PseThresholds thresholds) {
        if (score <= thresholds.safeRiskCutoff()) return SAFE;
        if (score <= thresholds.lowRiskCutoff()) return LOW;
        if (score <= thresholds.mediumRiskCutoff()) return MEDIUM;
        if (score <= thresholds.highRiskCutoff()) return HIGH;
        return CRITICAL;
    }

    /**
     * Returns {@code true} if this level is at least as severe as {@code other}.
     */
    public boolean isAtLeast(RiskLevel other) {
        return ordinal() >= other.ordinal();
    }

    @JsonValue
    public String getLabel() { return label; }
}
