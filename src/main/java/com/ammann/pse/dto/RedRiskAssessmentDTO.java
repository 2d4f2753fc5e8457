/* (C)2026 */
package com.ammann.pse.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Risk verdict for red flashes.
 *
 * @param exceedsRedThreshold  whether the red rate ceiling or the saturated-flash limit is exceeded
 * @param highSaturationCount  red flashes whose saturation exceeds the red saturation threshold
 * @param riskScore            contribution of red flashes to the overall score, in [0, 100]
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RedRiskAssessmentDTO(boolean exceedsRedThreshold, int highSaturationCount, double riskScore)
{
}
