/* (C)2026 */
package com.ammann.pse.service;

import com.ammann.pse.config.PseThresholds;
import com.ammann.pse.dto.FlashStatisticsDTO;
import com.ammann.pse.enumeration.RiskLevel;
import com.ammann.pse.model.FlashEvent;
import com.ammann.pse.model.RedFlashEvent;
import com.ammann.pse.model.TimePeriod;
import com.ammann.pse.model.TimeWindow;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NavigableMap;
import org.jboss.logging.Logger;

/**
 * Locates the analysis windows that make content unsafe.
 *
 * <p>General flashes: a window is flagged when its rate exceeds the safe ceiling or it
 * contains a flash above the dangerous intensity. It is {@code critical} above the critical
 * rate, {@code high} when only intense flashes triggered it, otherwise {@code medium}.
 *
 * <p>Red flashes: a window is flagged when its rate exceeds the red ceiling or it contains
 * a highly saturated red flash. It is {@code critical} above the red critical rate,
 * otherwise {@code high}.
 */
@ApplicationScoped
public class DangerousPeriodLocator {

    private static final Logger LOG = Logger.getLogger(DangerousPeriodLocator.class);

    private PseThresholds thresholds;

    @Inject
    public DangerousPeriodLocator(PseThresholds thresholds) {
        this.thresholds = thresholds;
    }

    /**
     * Flags dangerous windows for general flashes.
     *
     * @param events     merged flash events
     * @param statistics statistics of the same events
     * @param duration   analysed duration in seconds
     * @return flagged windows in time order
     */
    public List<TimePeriod> locateFlashPeriods(
            List<FlashEvent> events, FlashStatisticsDTO statistics, double duration) {
        if (events == null || events.isEmpty() || statistics.totalFlashes() == 0) {
            return List.of();
        }

        double windowSize = thresholds.analysisWindowSize();
        NavigableMap<Long, List<FlashEvent>> buckets = AnalysisWindows.bucket(events, duration, windowSize);
        List<TimePeriod> periods = new ArrayList<>();

        for (Map.Entry<Long, List<FlashEvent>> entry : buckets.entrySet()) {
            TimeWindow window = AnalysisWindows.window(entry.getKey(), windowSize);
            List<FlashEvent> windowEvents = entry.getValue();
            double rate = windowEvents.size() / windowSize;
            long intenseFlashes = windowEvents.stream()
                    .filter(e -> e.intensity() > thresholds.dangerousFlashIntensity())
                    .count();

            if (rate <= thresholds.maxSafeFlashRate() && intenseFlashes == 0) {
                continue;
            }

            RiskLevel level;
            String description;
            if (rate > thresholds.criticalFlashRate()) {
                level = RiskLevel.CRITICAL;
                description = format("Critical flash rate period: %.1f flashes/second", rate);
            } else if (intenseFlashes > 0) {
                level = RiskLevel.HIGH;
                description = format("High intensity flash period: %d dangerous flashes", intenseFlashes);
            } else {
                level = RiskLevel.MEDIUM;
                description = format("High flash rate period: %.1f flashes/second", rate);
            }

            periods.add(new TimePeriod(
                    window.start(), window.end(), level, description, thresholds.flashPeriodConfidence()));
        }

        LOG.debugf("Located %d dangerous flash periods in %d occupied windows", periods.size(), buckets.size());
        return periods;
    }

    /**
     * Flags dangerous windows for red flashes.
     *
     * @param events     merged red flash events
     * @param statistics statistics of the same events
     * @param duration   analysed duration in seconds
     * @return flagged windows in time order
     */
    public List<TimePeriod> locateRedFlashPeriods(
            List<RedFlashEvent> events, FlashStatisticsDTO statistics, double duration) {
        if (events == null || events.isEmpty() || statistics.totalFlashes() == 0) {
            return List.of();
        }

        double windowSize = thresholds.analysisWindowSize();
        NavigableMap<Long, List<RedFlashEvent>> buckets = AnalysisWindows.bucket(events, duration, windowSize);
        List<TimePeriod> periods = new ArrayList<>();

        for (Map.Entry<Long, List<RedFlashEvent>> entry : buckets.entrySet()) {
            TimeWindow window = AnalysisWindows.window(entry.getKey(), windowSize);
            List<RedFlashEvent> windowEvents = entry.getValue();
            double rate = windowEvents.size() / windowSize;
            boolean saturated = windowEvents.stream()
                    .anyMatch(e -> e.saturation() > thresholds.redSaturationThreshold());

            if (rate <= thresholds.maxSafeRedFlashRate() && !saturated) {
                continue;
            }

            RiskLevel level = RiskLevel.HIGH;
            String description = format("High red flash rate period: %.1f red flashes/second", rate);
            if (rate > thresholds.criticalRedFlashRate()) {
                level = RiskLevel.CRITICAL;
                description = format("Critical red flash period: %.1f red flashes/second", rate);
            }

            periods.add(new TimePeriod(
                    window.start(), window.end(), level, description, thresholds.redPeriodConfidence()));
        }

        LOG.debugf("Located %d dangerous red flash periods in %d occupied windows", periods.size(), buckets.size());
        return periods;
    }

    private static String format(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}
