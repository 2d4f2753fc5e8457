/* (C)2026 */
package com.ammann.pse.service;

import com.ammann.pse.config.PseThresholds;
import com.ammann.pse.dto.FlashDurationDTO;
import com.ammann.pse.dto.FlashIntensityDTO;
import com.ammann.pse.enumeration.RiskLevel;
import com.ammann.pse.model.FlashEvent;
import com.ammann.pse.model.RedFlashEvent;
import com.ammann.pse.model.TimedEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Describes individual flashes: their timing, per-flash severity and the shape of the
 * intensity distribution.
 */
@ApplicationScoped
public class FlashCharacterizationService {

    /** Whole-frame analysis cannot localise a flash, so every flash covers the full screen. */
    static final double FULL_SCREEN = 1.0;

    static final double MEDIUM_FLASH_INTENSITY = 0.5;
    static final double HIGH_RED_INTENSITY = 0.8;
    static final double HIGH_RED_SATURATION = 0.9;

    static final String[] INTENSITY_BUCKETS = {"0.0-0.2", "0.2-0.4", "0.4-0.6", "0.6-0.8", "0.8-1.0"};
    static final double[] BUCKET_UPPER_BOUNDS = {0.2, 0.4, 0.6, 0.8};

    private PseThresholds thresholds;

    @Inject
    public FlashCharacterizationService(PseThresholds thresholds) {
        this.thresholds = thresholds;
    }

    /**
     * Rates each general flash: {@code high} above the dangerous intensity,
     * {@code medium} above 0.5, otherwise {@code low}.
     */
    public List<FlashDurationDTO> flashDurations(List<FlashEvent> events) {
        if (events == null || events.isEmpty()) {
            return List.of();
        }
        List<FlashDurationDTO> durations = new ArrayList<>(events.size());
        for (FlashEvent event : events) {
            RiskLevel level = RiskLevel.LOW;
            if (event.intensity() > thresholds.dangerousFlashIntensity()) {
                level = RiskLevel.HIGH;
            } else if (event.intensity() > MEDIUM_FLASH_INTENSITY) {
                level = RiskLevel.MEDIUM;
            }
            durations.add(toDuration(event, level));
        }
        return durations;
    }

    /**
     * Rates each red flash: {@code medium} by default, {@code high} when either the
     * intensity exceeds 0.8 or the saturation exceeds 0.9.
     */
    public List<FlashDurationDTO> redFlashDurations(List<RedFlashEvent> events) {
        if (events == null || events.isEmpty()) {
            return List.of();
        }
        List<FlashDurationDTO> durations = new ArrayList<>(events.size());
        for (RedFlashEvent event : events) {
            RiskLevel level = event.intensity() > HIGH_RED_INTENSITY || event.saturation() > HIGH_RED_SATURATION
                    ? RiskLevel.HIGH
                    : RiskLevel.MEDIUM;
            durations.add(toDuration(event, level));
        }
        return durations;
    }

    /**
     * Summarises the intensity distribution of the given events.
     *
     * @return intensity statistics, or {@code null} when there are no events
     */
    public FlashIntensityDTO intensityAnalysis(List<? extends TimedEvent> events) {
        if (events == null || events.isEmpty()) {
            return null;
        }

        double peak = 0.0;
        double sum = 0.0;
        int[] buckets = new int[INTENSITY_BUCKETS.length];
        for (TimedEvent event : events) {
            double intensity = event.intensity();
            peak = Math.max(peak, intensity);
            sum += intensity;
            buckets[bucketOf(intensity)]++;
        }
        double mean = sum / events.size();

        double squaredDiffs = 0.0;
        for (TimedEvent event : events) {
            double diff = event.intensity() - mean;
            squaredDiffs += diff * diff;
        }
        double variance = squaredDiffs / events.size();

        Map<String, Integer> distribution = new LinkedHashMap<>();
        for (int i = 0; i < INTENSITY_BUCKETS.length; i++) {
            distribution.put(INTENSITY_BUCKETS[i], buckets[i]);
        }
        return new FlashIntensityDTO(peak, mean, variance, distribution);
    }

    /**
     * Saturation of each red flash, in event order.
     */
    public List<Double> saturationLevels(List<RedFlashEvent> events) {
        if (events == null || events.isEmpty()) {
            return List.of();
        }
        List<Double> levels = new ArrayList<>(events.size());
        for (RedFlashEvent event : events) {
            levels.add(event.saturation());
        }
        return levels;
    }

    // Red intensities are not capped, so anything at or above 0.8 lands in the top bucket.
    static int bucketOf(double intensity) {
        for (int i = 0; i < BUCKET_UPPER_BOUNDS.length; i++) {
            if (intensity < BUCKET_UPPER_BOUNDS[i]) {
                return i;
            }
        }
        return INTENSITY_BUCKETS.length - 1;
    }

    private static FlashDurationDTO toDuration(TimedEvent event, RiskLevel level) {
        return new FlashDurationDTO(
                event.timestamp(), event.endTime(), event.duration(), event.intensity(), FULL_SCREEN, level);
    }
}
