/* (C)2026 */
package com.ammann.pse.dto;

import com.ammann.pse.model.LuminanceSample;
import com.ammann.pse.model.RedSample;
import java.util.List;

/**
 * Input to a single PSE analysis.
 *
 * <p>The luminance and red sequences are independent and need not share timestamps.
 * A {@code null} or non-positive frame rate falls back to the configured default;
 * a {@code null} or non-positive duration is replaced per sequence by its last timestamp.
 * Only the first {@code maxAnalysisDuration} seconds of either sequence are analysed.
 *
 * @param luminanceSamples time-ordered luminance samples
 * @param redSamples       time-ordered red-channel samples
 * @param frameRate        source frame rate in frames per second, may be {@code null}
 * @param duration         content duration in seconds, may be {@code null}
 */
public record PseAnalysisRequestDTO(
        List<LuminanceSample> luminanceSamples,
        List<RedSample> redSamples,
        Double frameRate,
        Double duration)
{
    public PseAnalysisRequestDTO {
        luminanceSamples = luminanceSamples == null ? List.of() : List.copyOf(luminanceSamples);
        redSamples = redSamples == null ? List.of() : List.copyOf(redSamples);
    }

    public static PseAnalysisRequestDTO of(List<LuminanceSample> luminanceSamples, List<RedSample> redSamples) {
        return new PseAnalysisRequestDTO(luminanceSamples, redSamples, null, null);
    }
}
