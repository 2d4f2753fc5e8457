/* (C)2026 */
package com.ammann.pse.dto;

import com.ammann.pse.model.FlashEvent;
import com.ammann.pse.model.TimePeriod;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * Everything derived from the general (luminance) flash events.
 *
 * @param events           merged flash events in time order
 * @param statistics       windowed rate statistics
 * @param pattern          rhythm analysis and frequency-band histogram
 * @param flashDurations   per-flash timing and severity
 * @param flashIntensity   intensity distribution, {@code null} when no flashes were found
 * @param risk             general risk assessment
 * @param dangerousPeriods windows flagged as dangerous
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FlashAnalysisDTO(
        List<FlashEvent> events,
        FlashStatisticsDTO statistics,
        PatternAnalysisDTO pattern,
        List<FlashDurationDTO> flashDurations,
        FlashIntensityDTO flashIntensity,
        RiskAssessmentDTO risk,
        List<TimePeriod> dangerousPeriods)
{
    public FlashAnalysisDTO {
        events = events == null ? List.of() : List.copyOf(events);
        flashDurations = flashDurations == null ? List.of() : List.copyOf(flashDurations);
        dangerousPeriods = dangerousPeriods == null ? List.of() : List.copyOf(dangerousPeriods);
    }
}
