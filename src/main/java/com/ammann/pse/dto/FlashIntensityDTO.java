/* (C)2026 */
package com.ammann.pse.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Distribution of flash intensities.
 *
 * @param peakIntensity         highest intensity observed
 * @param averageIntensity      arithmetic mean of the intensities
 * @param intensityVariance     population variance of the intensities
 * @param intensityDistribution event counts per 0.2-wide intensity bucket, in ascending order
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FlashIntensityDTO(
        double peakIntensity,
        double averageIntensity,
        double intensityVariance,
        Map<String, Integer> intensityDistribution)
{
    public FlashIntensityDTO {
        intensityDistribution = intensityDistribution == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(intensityDistribution));
    }
}
