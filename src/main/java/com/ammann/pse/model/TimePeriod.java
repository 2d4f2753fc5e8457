/* (C)2026 */
package com.ammann.pse.model;

import com.ammann.pse.enumeration.RiskLevel;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * An analysis window flagged as dangerous.
 *
 * @param startTime   window start in seconds
 * @param endTime     window end in seconds (exclusive)
 * @param riskLevel   severity of the window
 * @param description human-readable finding
 * @param confidence  confidence of the detector that produced it, in [0, 1]
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TimePeriod(
        double startTime,
        double endTime,
        RiskLevel riskLevel,
        String description,
        double confidence)
{
}
