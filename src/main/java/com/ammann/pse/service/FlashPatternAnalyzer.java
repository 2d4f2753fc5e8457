/* (C)2026 */
package com.ammann.pse.service;

import com.ammann.pse.config.PseThresholds;
import com.ammann.pse.dto.PatternAnalysisDTO;
import com.ammann.pse.enumeration.FrequencyBand;
import com.ammann.pse.enumeration.PatternType;
import com.ammann.pse.model.TimedEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import org.jboss.logging.Logger;

/**
 * Examines the spacing of flash events for periodicity.
 *
 * <p>Regular strobing is markedly more provocative than irregular flashing at the same
 * average rate. The analyzer classifies the inter-event intervals by their coefficient of
 * variation and builds a histogram of per-window flash rates.
 */
@ApplicationScoped
public class FlashPatternAnalyzer {

    private static final Logger LOG = Logger.getLogger(FlashPatternAnalyzer.class);

    static final int MIN_EVENTS_FOR_PATTERN = 3;
    static final double REGULAR_VARIATION = 0.2;
    static final double SEMI_REGULAR_VARIATION = 0.5;

    private PseThresholds thresholds;

    @Inject
    public FlashPatternAnalyzer(PseThresholds thresholds) {
        this.thresholds = thresholds;
    }

    /**
     * Analyses the rhythm of an event list.
     *
     * @param events   time-ordered events
     * @param duration analysed duration in seconds, used for the frequency histogram
     * @return pattern analysis; "no pattern" when fewer than three events are present
     */
    public PatternAnalysisDTO analyze(List<? extends TimedEvent> events, double duration) {
        List<? extends TimedEvent> safeEvents = events == null ? List.of() : events;
        Map<String, Integer> bands = frequencyBands(safeEvents, duration);

        if (safeEvents.size() < MIN_EVENTS_FOR_PATTERN) {
            return PatternAnalysisDTO.noPattern(bands);
        }

        double[] intervals = new double[safeEvents.size() - 1];
        double total = 0.0;
        for (int i = 1; i < safeEvents.size(); i++) {
            intervals[i - 1] = safeEvents.get(i).timestamp() - safeEvents.get(i - 1).timestamp();
            total += intervals[i - 1];
        }
        double mean = total / intervals.length;

        double variance = 0.0;
        for (double interval : intervals) {
            variance += Math.pow(interval - mean, 2);
        }
        double stdDev = Math.sqrt(variance / intervals.length);

        if (!(mean > 0.0)) {
            // All events share one timestamp; there is no rhythm to speak of
            return new PatternAnalysisDTO(true, false, null, PatternType.IRREGULAR, 0.0, 0.0, bands);
        }

        PatternType type;
        Double rhythmFrequency = null;
        if (stdDev < mean * REGULAR_VARIATION) {
            type = PatternType.REGULAR_STROBE;
            rhythmFrequency = 1.0 / mean;
        } else if (stdDev < mean * SEMI_REGULAR_VARIATION) {
            type = PatternType.SEMI_REGULAR;
        } else {
            type = PatternType.IRREGULAR;
        }
        double stability = Math.max(0.0, 1.0 - stdDev / mean);

        LOG.debugf("Flash rhythm: %d intervals, mean=%.4fs, stdDev=%.4fs -> %s",
                intervals.length, mean, stdDev, type.getLabel());

        return new PatternAnalysisDTO(
                true, type == PatternType.REGULAR_STROBE, rhythmFrequency, type, mean, stability, bands);
    }

    /**
     * Counts analysis windows per flash-rate band. Every window is counted, so windows
     * without flashes land in the lowest band. Counts saturate at {@link Integer#MAX_VALUE}.
     *
     * @return band label to window count, in ascending band order, all bands present
     */
    public Map<String, Integer> frequencyBands(List<? extends TimedEvent> events, double duration) {
        Map<String, Integer> distribution = new LinkedHashMap<>();
        for (FrequencyBand band : FrequencyBand.values()) {
            distribution.put(band.getLabel(), 0);
        }

        double windowSize = thresholds.analysisWindowSize();
        long windowCount = AnalysisWindows.windowCount(duration, windowSize);
        NavigableMap<Long, ? extends List<? extends TimedEvent>> buckets =
                AnalysisWindows.bucket(events, duration, windowSize);
        for (List<? extends TimedEvent> bucket : buckets.values()) {
            FrequencyBand band = FrequencyBand.fromRate(bucket.size() / windowSize);
            distribution.merge(band.getLabel(), 1, Integer::sum);
        }

        // flash-free windows all land in the lowest band; counted, not visited
        long emptyWindows = windowCount - buckets.size();
        if (emptyWindows > 0) {
            String lowest = FrequencyBand.fromRate(0.0).getLabel();
            long total = distribution.get(lowest) + emptyWindows;
            distribution.put(lowest, (int) Math.min(total, Integer.MAX_VALUE));
        }

        return distribution;
    }
}
