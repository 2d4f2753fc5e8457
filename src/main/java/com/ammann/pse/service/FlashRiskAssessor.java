/* (C)2026 */
package com.ammann.pse.service;

import com.ammann.pse.config.PseThresholds;
import com.ammann.pse.dto.FlashStatisticsDTO;
import com.ammann.pse.dto.PatternAnalysisDTO;
import com.ammann.pse.dto.RedRiskAssessmentDTO;
import com.ammann.pse.dto.RiskAssessmentDTO;
import com.ammann.pse.enumeration.RiskLevel;
import com.ammann.pse.model.RedFlashEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.List;
import org.jboss.logging.Logger;

/**
 * Scores flash statistics against the broadcast rate ceilings.
 *
 * <p>The general score is additive with capped contributions: a base penalty once the
 * maximum windowed rate exceeds the safe ceiling, up to 40 points for the size of the
 * excess, and up to 20 points for a total flash count above the count threshold. The sum
 * is clamped to [0, 100] and mapped to a {@link RiskLevel} through the configured cutoffs.
 */
@ApplicationScoped
public class FlashRiskAssessor {

    private static final Logger LOG = Logger.getLogger(FlashRiskAssessor.class);

    static final double EXCEEDANCE_BASE_PENALTY = 40.0;
    static final double POINTS_PER_EXCESS_HZ = 15.0;
    static final double MAX_EXCESS_POINTS = 40.0;
    static final double FLASHES_PER_COUNT_STEP = 50.0;
    static final double POINTS_PER_COUNT_STEP = 10.0;
    static final double MAX_COUNT_POINTS = 20.0;
    static final double MAX_RED_EXCESS_POINTS = 35.0;
    static final double MAX_SCORE = 100.0;

    private PseThresholds thresholds;

    @Inject
    public FlashRiskAssessor(PseThresholds thresholds) {
        this.thresholds = thresholds;
    }

    /**
     * Assesses general flash risk.
     *
     * @param statistics windowed statistics of the general flashes
     * @param pattern    rhythm analysis of the same flashes, may be {@code null}
     * @return risk assessment with a score in [0, 100]
     */
    public RiskAssessmentDTO assess(FlashStatisticsDTO statistics, PatternAnalysisDTO pattern) {
        double score = 0.0;
        boolean exceedsThreshold = false;

        if (statistics.maxRate() > thresholds.maxSafeFlashRate()) {
            exceedsThreshold = true;
            double excess = statistics.maxRate() - thresholds.maxSafeFlashRate();
            score += EXCEEDANCE_BASE_PENALTY + Math.min(excess * POINTS_PER_EXCESS_HZ, MAX_EXCESS_POINTS);
        }

        if (statistics.totalFlashes() > thresholds.flashCountThreshold()) {
            double overCount = statistics.totalFlashes() - thresholds.flashCountThreshold();
            score += Math.min(overCount / FLASHES_PER_COUNT_STEP * POINTS_PER_COUNT_STEP, MAX_COUNT_POINTS);
        }

        score = clamp(score);
        RiskLevel level = RiskLevel.fromScore(score, thresholds);

        if (pattern != null && pattern.regularRhythm()) {
            LOG.debugf("Regular strobe at %.2f Hz accompanies flash risk score %.1f",
                    pattern.rhythmFrequency(), score);
        }
        LOG.debugf("Flash risk: maxRate=%.1f Hz, total=%d -> score=%.1f (%s)",
                statistics.maxRate(), statistics.totalFlashes(), score, level.getLabel());

        return new RiskAssessmentDTO(exceedsThreshold, level, score);
    }

    /**
     * Assesses red flash risk. The red ceiling trips when the maximum windowed red rate
     * exceeds the red safe rate, or when more highly saturated red flashes occur than the
     * configured limit.
     *
     * @param statistics windowed statistics of the red flashes
     * @param events     merged red flash events
     * @return red risk assessment
     */
    public RedRiskAssessmentDTO assessRed(FlashStatisticsDTO statistics, List<RedFlashEvent> events) {
        int highSaturationCount = 0;
        if (events != null) {
            for (RedFlashEvent event : events) {
                if (event.saturation() > thresholds.redSaturationThreshold()) {
                    highSaturationCount++;
                }
            }
        }

        boolean exceeds = statistics.maxRate() > thresholds.maxSafeRedFlashRate()
                || highSaturationCount > thresholds.highSaturationEventLimit();

        double score = 0.0;
        if (exceeds) {
            double excess = Math.max(0.0, statistics.maxRate() - thresholds.maxSafeRedFlashRate());
            score = clamp(EXCEEDANCE_BASE_PENALTY + Math.min(excess * POINTS_PER_EXCESS_HZ, MAX_RED_EXCESS_POINTS));
        }

        LOG.debugf("Red flash risk: maxRate=%.1f Hz, saturated=%d -> exceeds=%b, score=%.1f",
                statistics.maxRate(), highSaturationCount, exceeds, score);

        return new RedRiskAssessmentDTO(exceeds, highSaturationCount, score);
    }

    static double clamp(double score) {
        if (!(score > 0.0)) {
            return 0.0;
        }
        return Math.min(score, MAX_SCORE);
    }
}
