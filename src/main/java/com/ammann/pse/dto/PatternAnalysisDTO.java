/* (C)2026 */
package com.ammann.pse.dto;

import com.ammann.pse.enumeration.PatternType;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Temporal rhythm of a flash sequence and its per-window frequency distribution.
 *
 * @param patternDetected   whether enough events were present to assess the rhythm
 * @param regularRhythm     whether the flashes form a regular strobe
 * @param rhythmFrequency   strobe frequency in Hz, present only for a regular strobe
 * @param patternType       regularity classification, absent when no pattern was assessed
 * @param temporalSpacing   mean interval between consecutive flashes in seconds
 * @param rhythmStability   {@code 1 - stddev / mean} of the intervals, floored at 0
 * @param frequencyBands    number of analysis windows per flash-rate band, keyed by band label
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PatternAnalysisDTO(
        boolean patternDetected,
        boolean regularRhythm,
        Double rhythmFrequency,
        PatternType patternType,
        double temporalSpacing,
        double rhythmStability,
        Map<String, Integer> frequencyBands)
{
    public PatternAnalysisDTO {
        frequencyBands = frequencyBands == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(frequencyBands));
    }

    /**
     * Result for sequences too short to show a rhythm.
     */
    public static PatternAnalysisDTO noPattern(Map<String, Integer> frequencyBands) {
        return new PatternAnalysisDTO(false, false, null, null, 0.0, 0.0, frequencyBands);
    }
}
