/* (C)2026 */
package com.ammann.pse.dto;

import com.ammann.pse.enumeration.RiskLevel;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Timing and severity of a single merged flash.
 *
 * @param startTime  flash start in seconds
 * @param endTime    flash end in seconds
 * @param duration   flash duration in seconds
 * @param intensity  normalised flash intensity
 * @param screenArea fraction of the screen affected; whole-frame analysis reports 1.0
 * @param riskLevel  severity of this individual flash
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FlashDurationDTO(
        double startTime,
        double endTime,
        double duration,
        double intensity,
        double screenArea,
        RiskLevel riskLevel)
{
}
