/* (C)2026 */
package com.ammann.pse.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * CDI producer for the active {@link PseThresholds} profile.
 *
 * <p>Reads the {@code pse.*} properties from application.properties, so a deployment
 * can switch regulatory regime (ITU-R BT.1702, Ofcom, EBU) by configuration alone.
 * Defaults mirror {@link PseThresholds#defaults()}.
 *
 * <p>The bean is {@link Singleton} because records cannot be client-proxied.
 */
@ApplicationScoped
public class PseThresholdsProducer {

    private static final Logger LOG = Logger.getLogger(PseThresholdsProducer.class);

    @ConfigProperty(name = "pse.flash.min-intensity", defaultValue = "0.1")
    double minFlashIntensity;

    @ConfigProperty(name = "pse.flash.dangerous-intensity", defaultValue = "0.8")
    double dangerousFlashIntensity;

    @ConfigProperty(name = "pse.flash.continuation-factor", defaultValue = "0.5")
    double continuationFactor;

    @ConfigProperty(name = "pse.flash.lookahead-frames", defaultValue = "5")
    int flashLookaheadFrames;

    @ConfigProperty(name = "pse.flash.merge-tolerance-seconds", defaultValue = "0.1")
    double flashMergeTolerance;

    @ConfigProperty(name = "pse.red.luminance-weight", defaultValue = "1.5")
    double redLuminanceWeight;

    @ConfigProperty(name = "pse.red.threshold-factor", defaultValue = "0.7")
    double redThresholdFactor;

    @ConfigProperty(name = "pse.red.saturation-threshold", defaultValue = "0.6")
    double redSaturationThreshold;

    @ConfigProperty(name = "pse.red.lookahead-frames", defaultValue = "3")
    int redLookaheadFrames;

    @ConfigProperty(name = "pse.red.merge-tolerance-seconds", defaultValue = "0.05")
    double redMergeTolerance;

    @ConfigProperty(name = "pse.red.high-saturation-event-limit", defaultValue = "10")
    int highSaturationEventLimit;

    @ConfigProperty(name = "pse.rate.max-safe-hz", defaultValue = "3.0")
    double maxSafeFlashRate;

    @ConfigProperty(name = "pse.rate.critical-hz", defaultValue = "5.0")
    double criticalFlashRate;

    @ConfigProperty(name = "pse.rate.max-safe-red-hz", defaultValue = "2.0")
    double maxSafeRedFlashRate;

    @ConfigProperty(name = "pse.rate.red-critical-multiplier", defaultValue = "2.0")
    double redCriticalRateMultiplier;

    @ConfigProperty(name = "pse.window.size-seconds", defaultValue = "1.0")
    double analysisWindowSize;

    @ConfigProperty(name = "pse.window.max-analysis-duration-seconds", defaultValue = "3600.0")
    double maxAnalysisDuration;

    @ConfigProperty(name = "pse.sampling.default-frame-rate", defaultValue = "25.0")
    double defaultFrameRate;

    @ConfigProperty(name = "pse.risk.flash-count-threshold", defaultValue = "100")
    int flashCountThreshold;

    @ConfigProperty(name = "pse.risk.cutoff.safe", defaultValue = "20.0")
    double safeRiskCutoff;

    @ConfigProperty(name = "pse.risk.cutoff.low", defaultValue = "40.0")
    double lowRiskCutoff;

    @ConfigProperty(name = "pse.risk.cutoff.medium", defaultValue = "60.0")
    double mediumRiskCutoff;

    @ConfigProperty(name = "pse.risk.cutoff.high", defaultValue = "80.0")
    double highRiskCutoff;

    @ConfigProperty(name = "pse.period.flash-confidence", defaultValue = "0.85")
    double flashPeriodConfidence;

    @ConfigProperty(name = "pse.period.red-confidence", defaultValue = "0.90")
    double redPeriodConfidence;

    /**
     * Produces the configured threshold profile.
     *
     * @return validated thresholds
     * @throws com.ammann.pse.exception.ThresholdConfigurationException if a configured value
     *         violates the profile constraints
     */
    @Produces
    @Singleton
    public PseThresholds createThresholds() {
        PseThresholds thresholds = PseThresholds.builder()
                .minFlashIntensity(minFlashIntensity)
                .dangerousFlashIntensity(dangerousFlashIntensity)
                .continuationFactor(continuationFactor)
                .flashLookaheadFrames(flashLookaheadFrames)
                .flashMergeTolerance(flashMergeTolerance)
                .redLuminanceWeight(redLuminanceWeight)
                .redThresholdFactor(redThresholdFactor)
                .redSaturationThreshold(redSaturationThreshold)
                .redLookaheadFrames(redLookaheadFrames)
                .redMergeTolerance(redMergeTolerance)
                .highSaturationEventLimit(highSaturationEventLimit)
                .maxSafeFlashRate(maxSafeFlashRate)
                .criticalFlashRate(criticalFlashRate)
                .maxSafeRedFlashRate(maxSafeRedFlashRate)
                .redCriticalRateMultiplier(redCriticalRateMultiplier)
                .analysisWindowSize(analysisWindowSize)
                .maxAnalysisDuration(maxAnalysisDuration)
                .defaultFrameRate(defaultFrameRate)
                .flashCountThreshold(flashCountThreshold)
                .riskCutoffs(safeRiskCutoff, lowRiskCutoff, mediumRiskCutoff, highRiskCutoff)
                .flashPeriodConfidence(flashPeriodConfidence)
                .redPeriodConfidence(redPeriodConfidence)
                .build();

        LOG.infof("PSE thresholds loaded: max safe rate=%.1f Hz, max safe red rate=%.1f Hz, window=%.2fs",
                thresholds.maxSafeFlashRate(), thresholds.maxSafeRedFlashRate(),
                thresholds.analysisWindowSize());

        return thresholds;
    }
}
