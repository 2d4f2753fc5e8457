/* (C)2026 */
package com.ammann.pse.service;

import com.ammann.pse.config.PseThresholds;
import com.ammann.pse.dto.FlashStatisticsDTO;
import com.ammann.pse.model.TimedEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.List;
import org.jboss.logging.Logger;

/**
 * Computes flash rates over fixed, non-overlapping analysis windows.
 *
 * <p>ITU-R BT.1702 assesses flash frequency per one-second window; the window size is
 * taken from {@link PseThresholds#analysisWindowSize()}. Works on general and red event
 * lists alike.
 */
@ApplicationScoped
public class FlashStatisticsService {

    private static final Logger LOG = Logger.getLogger(FlashStatisticsService.class);

    private PseThresholds thresholds;

    @Inject
    public FlashStatisticsService(PseThresholds thresholds) {
        this.thresholds = thresholds;
    }

    /**
     * Calculates average, peak and maximum flash rates.
     *
     * @param events   detected events
     * @param duration analysed duration in seconds
     * @return statistics; all zero when there are no events or the duration is not positive
     */
    public FlashStatisticsDTO calculate(List<? extends TimedEvent> events, double duration) {
        if (events == null || events.isEmpty() || !(duration > 0.0)) {
            return FlashStatisticsDTO.empty();
        }

        double windowSize = thresholds.analysisWindowSize();
        long windowCount = AnalysisWindows.windowCount(duration, windowSize);
        int highestCount = 0;
        for (List<? extends TimedEvent> bucket : AnalysisWindows.bucket(events, duration, windowSize).values()) {
            highestCount = Math.max(highestCount, bucket.size());
        }

        double averageRate = events.size() / duration;
        double windowRate = highestCount / windowSize;

        LOG.debugf("Flash statistics: %d events over %.2fs in %d windows, avg=%.3f Hz, max=%.1f Hz",
                events.size(), duration, windowCount, averageRate, windowRate);

        return new FlashStatisticsDTO(averageRate, windowRate, windowRate, events.size());
    }
}
