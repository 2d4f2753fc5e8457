/* (C)2026 */
package com.ammann.pse.dto;

import com.ammann.pse.enumeration.RiskLevel;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Complete photosensitive-epilepsy verdict for one piece of content.
 *
 * <p>Immutable once built: every nested list is copied on construction.
 *
 * @param pseRiskLevel        overall risk level
 * @param overallRiskScore    higher of the general and red risk scores, in [0, 100]
 * @param maxRiskTimestamp    start of the most severe dangerous period, 0 when none was flagged
 * @param riskReason          human-readable explanation of the level
 * @param safeForBroadcast    ITU-R BT.1702 compliance
 * @param requiresWarning     whether a PSE warning should precede the content
 * @param broadcastCompliance per-standard verdicts
 * @param flashAnalysis       general flash results
 * @param redFlashAnalysis    red flash results
 * @param metadata            provenance of the run
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PseAnalysisDTO(
        RiskLevel pseRiskLevel,
        double overallRiskScore,
        double maxRiskTimestamp,
        String riskReason,
        boolean safeForBroadcast,
        boolean requiresWarning,
        BroadcastComplianceDTO broadcastCompliance,
        FlashAnalysisDTO flashAnalysis,
        RedFlashAnalysisDTO redFlashAnalysis,
        AnalysisMetadataDTO metadata)
{
}
