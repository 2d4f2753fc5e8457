/* (C)2026 */
package com.ammann.pse.dto;

import com.ammann.pse.model.RedFlashEvent;
import com.ammann.pse.model.TimePeriod;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * Everything derived from the red flash events.
 *
 * @param events              merged red flash events in time order
 * @param statistics          windowed rate statistics
 * @param redFlashDurations   per-flash timing and severity
 * @param redSaturationLevels saturation of each merged red flash, in event order
 * @param risk                red risk assessment
 * @param dangerousPeriods    windows flagged as dangerous
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RedFlashAnalysisDTO(
        List<RedFlashEvent> events,
        FlashStatisticsDTO statistics,
        List<FlashDurationDTO> redFlashDurations,
        List<Double> redSaturationLevels,
        RedRiskAssessmentDTO risk,
        List<TimePeriod> dangerousPeriods)
{
    public RedFlashAnalysisDTO {
        events = events == null ? List.of() : List.copyOf(events);
        redFlashDurations = redFlashDurations == null ? List.of() : List.copyOf(redFlashDurations);
        redSaturationLevels = redSaturationLevels == null ? List.of() : List.copyOf(redSaturationLevels);
        dangerousPeriods = dangerousPeriods == null ? List.of() : List.copyOf(dangerousPeriods);
    }
}
