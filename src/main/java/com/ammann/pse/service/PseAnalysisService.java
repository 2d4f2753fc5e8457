/* (C)2026 */
package com.ammann.pse.service;

import com.ammann.pse.config.PseThresholds;
import com.ammann.pse.dto.AnalysisMetadataDTO;
import com.ammann.pse.dto.BroadcastComplianceDTO;
import com.ammann.pse.dto.FlashAnalysisDTO;
import com.ammann.pse.dto.FlashStatisticsDTO;
import com.ammann.pse.dto.PatternAnalysisDTO;
import com.ammann.pse.dto.PseAnalysisDTO;
import com.ammann.pse.dto.PseAnalysisRequestDTO;
import com.ammann.pse.dto.RedFlashAnalysisDTO;
import com.ammann.pse.dto.RedRiskAssessmentDTO;
import com.ammann.pse.dto.RiskAssessmentDTO;
import com.ammann.pse.enumeration.RiskLevel;
import com.ammann.pse.model.FlashEvent;
import com.ammann.pse.model.LuminanceSample;
import com.ammann.pse.model.RedFlashEvent;
import com.ammann.pse.model.RedSample;
import com.ammann.pse.model.TimePeriod;
import com.ammann.pse.sampling.FrameRates;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.ToDoubleFunction;
import org.jboss.logging.Logger;

/**
 * Runs the complete photosensitive-epilepsy analysis for one piece of content.
 *
 * <p>Pipeline per request:
 * <ol>
 *   <li>detect and merge general and red flash events</li>
 *   <li>compute windowed statistics and the rhythm analysis</li>
 *   <li>score both event sets and flag dangerous windows</li>
 *   <li>derive the overall verdict and per-standard compliance</li>
 * </ol>
 *
 * <p>The analysis is a total function of its input: empty or degenerate sample sequences
 * produce a safe verdict with low confidence rather than an error.
 */
@ApplicationScoped
public class PseAnalysisService {

    private static final Logger LOG = Logger.getLogger(PseAnalysisService.class);

    public static final String STANDARDS_VERSION = "ITU-R BT.1702-2";
    public static final String ANALYSIS_METHOD = "windowed_luminance_and_red_flash_detection";

    static final double NO_DATA_CONFIDENCE = 0.1;
    static final double SPARSE_DATA_CONFIDENCE = 0.5;
    static final double FULL_CONFIDENCE = 0.85;
    static final int SPARSE_SAMPLE_LIMIT = 25;

    static final Map<RiskLevel, String> WARNING_MESSAGES = new EnumMap<>(Map.of(
            RiskLevel.SAFE, "Content appears safe for all viewers including those with photosensitive epilepsy.",
            RiskLevel.LOW, "Content has low risk. May be suitable with standard PSE warnings.",
            RiskLevel.MEDIUM, "Content has medium PSE risk. PSE warning recommended before broadcast.",
            RiskLevel.HIGH, "Content has high PSE risk. PSE warning required. Consider content review.",
            RiskLevel.CRITICAL, "Content has critical PSE risk. Requires content modification or strong warnings."));

    private PseThresholds thresholds;
    private FlashEventDetector flashDetector;
    private RedFlashEventDetector redFlashDetector;
    private FlashStatisticsService statisticsService;
    private FlashPatternAnalyzer patternAnalyzer;
    private FlashRiskAssessor riskAssessor;
    private DangerousPeriodLocator periodLocator;
    private FlashCharacterizationService characterizationService;
    private BroadcastComplianceEvaluator complianceEvaluator;
    private MeterRegistry meterRegistry;

    private Timer analysisTimer;

    @Inject
    public PseAnalysisService(PseThresholds thresholds,
                              FlashEventDetector flashDetector,
                              RedFlashEventDetector redFlashDetector,
                              FlashStatisticsService statisticsService,
                              FlashPatternAnalyzer patternAnalyzer,
                              FlashRiskAssessor riskAssessor,
                              DangerousPeriodLocator periodLocator,
                              FlashCharacterizationService characterizationService,
                              BroadcastComplianceEvaluator complianceEvaluator,
                              MeterRegistry meterRegistry) {
        this.thresholds = thresholds;
        this.flashDetector = flashDetector;
        this.redFlashDetector = redFlashDetector;
        this.statisticsService = statisticsService;
        this.patternAnalyzer = patternAnalyzer;
        this.riskAssessor = riskAssessor;
        this.periodLocator = periodLocator;
        this.characterizationService = characterizationService;
        this.complianceEvaluator = complianceEvaluator;
        this.meterRegistry = meterRegistry;

        if (meterRegistry != null) {
            this.analysisTimer = Timer.builder("pse_analysis_duration")
                    .description("Time spent analysing one piece of content")
                    .register(meterRegistry);
        } else {
            LOG.debug("MeterRegistry not available - PSE metrics disabled");
        }
    }

    /**
     * Analyses the given samples.
     *
     * @param request luminance and red samples with optional frame rate and duration
     * @return immutable analysis result
     */
    public PseAnalysisDTO analyze(PseAnalysisRequestDTO request) {
        long start = System.nanoTime();

        double frameRate = FrameRates.orDefault(request.frameRate(), thresholds.defaultFrameRate());
        double maxDuration = thresholds.maxAnalysisDuration();
        List<LuminanceSample> luminance = withinAnalysisRange(
                request.luminanceSamples(), LuminanceSample::timestamp, maxDuration, "luminance");
        List<RedSample> red = withinAnalysisRange(
                request.redSamples(), RedSample::timestamp, maxDuration, "red");

        double luminanceDuration = analysedDuration(
                request.duration(), lastTimestamp(luminance, LuminanceSample::timestamp), maxDuration);
        double redDuration = analysedDuration(
                request.duration(), lastTimestamp(red, RedSample::timestamp), maxDuration);

        FlashAnalysisDTO flashAnalysis = analyzeFlashes(luminance, frameRate, luminanceDuration);
        RedFlashAnalysisDTO redFlashAnalysis = analyzeRedFlashes(red, frameRate, redDuration);

        RiskAssessmentDTO risk = flashAnalysis.risk();
        RedRiskAssessmentDTO redRisk = redFlashAnalysis.risk();

        double overallScore = FlashRiskAssessor.clamp(Math.max(risk.riskScore(), redRisk.riskScore()));
        RiskLevel level = RiskLevel.fromScore(overallScore, thresholds);
        BroadcastComplianceDTO compliance = complianceEvaluator.evaluate(
                overallScore, risk.exceedsThreshold(), redRisk.exceedsRedThreshold());

        boolean requiresWarning = level.isAtLeast(RiskLevel.MEDIUM)
                || risk.exceedsThreshold()
                || redRisk.exceedsRedThreshold();

        List<TimePeriod> allPeriods = new ArrayList<>(flashAnalysis.dangerousPeriods());
        allPeriods.addAll(redFlashAnalysis.dangerousPeriods());

        AnalysisMetadataDTO metadata = new AnalysisMetadataDTO(
                luminanceDuration,
                frameRate,
                STANDARDS_VERSION,
                ANALYSIS_METHOD,
                confidence(luminance.size()),
                luminance.size(),
                red.size());

        PseAnalysisDTO analysis = new PseAnalysisDTO(
                level,
                overallScore,
                maxRiskTimestamp(allPeriods),
                WARNING_MESSAGES.get(level),
                compliance.ituRBt1702Compliant(),
                requiresWarning,
                compliance,
                flashAnalysis,
                redFlashAnalysis,
                metadata);

        recordMetrics(level, System.nanoTime() - start);

        LOG.infof("PSE analysis complete: %d flashes (max %.1f Hz), %d red flashes (max %.1f Hz), "
                        + "score=%.1f, level=%s, safeForBroadcast=%b",
                flashAnalysis.statistics().totalFlashes(), flashAnalysis.statistics().maxRate(),
                redFlashAnalysis.statistics().totalFlashes(), redFlashAnalysis.statistics().maxRate(),
                overallScore, level.getLabel(), analysis.safeForBroadcast());

        return analysis;
    }

    private FlashAnalysisDTO analyzeFlashes(List<LuminanceSample> samples, double frameRate, double duration) {
        List<FlashEvent> events = flashDetector.detect(samples, frameRate);
        FlashStatisticsDTO statistics = statisticsService.calculate(events, duration);
        PatternAnalysisDTO pattern = patternAnalyzer.analyze(events, duration);
        RiskAssessmentDTO risk = riskAssessor.assess(statistics, pattern);

        return new FlashAnalysisDTO(
                events,
                statistics,
                pattern,
                characterizationService.flashDurations(events),
                characterizationService.intensityAnalysis(events),
                risk,
                periodLocator.locateFlashPeriods(events, statistics, duration));
    }

    private RedFlashAnalysisDTO analyzeRedFlashes(List<RedSample> samples, double frameRate, double duration) {
        List<RedFlashEvent> events = redFlashDetector.detect(samples, frameRate);
        FlashStatisticsDTO statistics = statisticsService.calculate(events, duration);
        RedRiskAssessmentDTO risk = riskAssessor.assessRed(statistics, events);

        return new RedFlashAnalysisDTO(
                events,
                statistics,
                characterizationService.redFlashDurations(events),
                characterizationService.saturationLevels(events),
                risk,
                periodLocator.locateRedFlashPeriods(events, statistics, duration));
    }

    /** The requested duration when usable, else the last sample timestamp; never above {@code maxDuration}. */
    static double analysedDuration(Double requested, double lastTimestamp, double maxDuration) {
        if (requested != null && requested > 0.0 && Double.isFinite(requested)) {
            return Math.min(requested, maxDuration);
        }
        return Math.min(lastTimestamp, maxDuration);
    }

    /** Drops samples at or after {@code maxDuration} seconds. */
    static <T> List<T> withinAnalysisRange(
            List<T> samples, ToDoubleFunction<T> timestamp, double maxDuration, String channel) {
        List<T> kept = new ArrayList<>(samples.size());
        for (T sample : samples) {
            if (timestamp.applyAsDouble(sample) < maxDuration) {
                kept.add(sample);
            }
        }
        if (kept.size() < samples.size()) {
            LOG.warnf("Ignoring %d %s samples beyond the %.0fs analysis limit",
                    samples.size() - kept.size(), channel, maxDuration);
        }
        return kept;
    }

    static <T> double lastTimestamp(List<T> samples, ToDoubleFunction<T> timestamp) {
        double last = 0.0;
        for (T sample : samples) {
            last = Math.max(last, timestamp.applyAsDouble(sample));
        }
        return last;
    }

    /** Start of the most severe period; the earliest one wins among equally severe periods. */
    static double maxRiskTimestamp(List<TimePeriod> periods) {
        TimePeriod worst = null;
        for (TimePeriod period : periods) {
            if (worst == null
                    || period.riskLevel().ordinal() > worst.riskLevel().ordinal()
                    || (period.riskLevel() == worst.riskLevel() && period.startTime() < worst.startTime())) {
                worst = period;
            }
        }
        return worst == null ? 0.0 : worst.startTime();
    }

    static double confidence(int luminanceSamples) {
        if (luminanceSamples < 2) {
            return NO_DATA_CONFIDENCE;
        }
        if (luminanceSamples < SPARSE_SAMPLE_LIMIT) {
            return SPARSE_DATA_CONFIDENCE;
        }
        return FULL_CONFIDENCE;
    }

    private void recordMetrics(RiskLevel level, long elapsedNanos) {
        if (meterRegistry == null) {
            return;
        }
        Counter.builder("pse_analyses_total")
                .description("Completed PSE analyses by overall risk level")
                .tag("risk_level", level.getLabel())
                .register(meterRegistry)
                .increment();
        if (analysisTimer != null) {
            analysisTimer.record(elapsedNanos, TimeUnit.NANOSECONDS);
        }
    }
}
