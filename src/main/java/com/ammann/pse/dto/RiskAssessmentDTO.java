/* (C)2026 */
package com.ammann.pse.dto;

import com.ammann.pse.enumeration.RiskLevel;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Risk verdict for general flashes.
 *
 * @param exceedsThreshold whether the maximum windowed rate exceeds the safe ceiling
 * @param riskLevel        level derived from the score
 * @param riskScore        score in the range [0, 100]
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RiskAssessmentDTO(boolean exceedsThreshold, RiskLevel riskLevel, double riskScore)
{
}
