/* (C)2026 */
package com.ammann.pse.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Provenance of an analysis run.
 *
 * @param analysisDuration   seconds of luminance content analysed
 * @param samplingRate       effective frames per second used for duration estimation
 * @param standardsVersion   threshold set the verdict is based on
 * @param analysisMethod     detection algorithm identifier
 * @param confidence         confidence in the verdict, in [0, 1]
 * @param luminanceSamples   number of luminance samples received
 * @param redSamples         number of red samples received
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnalysisMetadataDTO(
        double analysisDuration,
        double samplingRate,
        String standardsVersion,
        String analysisMethod,
        double confidence,
        int luminanceSamples,
        int redSamples)
{
}
