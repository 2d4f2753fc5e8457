/* (C)2026 */
package com.ammann.pse.enumeration;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Broadcast safety guidelines the overall verdict is checked against.
 *
 * <p>Each standard carries the highest overall risk score it tolerates and
 * which rate ceilings must not be exceeded for content to comply.
 */
public enum BroadcastStandard
{
    ITU_R_BT1702("ITU-R BT.1702", 20.0, true, true),
    ITC("ITC", 40.0, true, true),
    OFCOM("Ofcom", 40.0, true, true),
    EBU_TECH_3253("EBU Tech 3253", 60.0, false, true),
    FCC("FCC", 40.0, true, true);

    private final String displayName;
    private final double maxRiskScore;
    private final boolean enforcesFlashCeiling;
    private final boolean enforcesRedFlashCeiling;

    BroadcastStandard(
            String displayName,
            double maxRiskScore,
            boolean enforcesFlashCeiling,
            boolean enforcesRedFlashCeiling) {
        this.displayName = displayName;
        this.maxRiskScore = maxRiskScore;
        this.enforcesFlashCeiling = enforcesFlashCeiling;
        this.enforcesRedFlashCeiling = enforcesRedFlashCeiling;
    }

    @JsonValue
    public String getDisplayName() { return displayName; }

    public double getMaxRiskScore() { return maxRiskScore; }

    public boolean enforcesFlashCeiling() { return enforcesFlashCeiling; }

    public boolean enforcesRedFlashCeiling() { return enforcesRedFlashCeiling; }
}
