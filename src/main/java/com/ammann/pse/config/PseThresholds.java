/* (C)2026 */
package com.ammann.pse.config;

import com.ammann.pse.exception.ThresholdConfigurationException;

/**
 * Immutable set of detection, rate and scoring thresholds for one regulatory profile.
 *
 * <p>Every analysis component receives its thresholds from an instance of this record,
 * so profiles for different regimes (ITU-R BT.1702, Ofcom, EBU) can run side by side.
 * {@link #defaults()} returns the ITU-R BT.1702 reference values; the CDI bean is
 * produced from configuration by {@link PseThresholdsProducer}.
 *
 * @param minFlashIntensity         absolute luminance delta a frame pair must exceed to register a flash
 * @param redLuminanceWeight        multiplier applied to red-channel deltas before thresholding
 * @param redThresholdFactor        fraction of {@code minFlashIntensity} used as the red detection threshold
 * @param continuationFactor        fraction of the detection threshold that keeps a flash running during lookahead
 * @param redSaturationThreshold    saturation a red sample must exceed to count as a red flash
 * @param maxSafeFlashRate          general flash ceiling in flashes per second
 * @param criticalFlashRate         window rate above which a general period is critical
 * @param maxSafeRedFlashRate       red flash ceiling in flashes per second
 * @param redCriticalRateMultiplier multiple of the red ceiling above which a red period is critical
 * @param dangerousFlashIntensity   intensity above which a single flash is considered dangerous
 * @param analysisWindowSize        length of each non-overlapping analysis window in seconds
 * @param maxAnalysisDuration       seconds from the start of the content that are analysed; later samples are ignored
 * @param defaultFrameRate          frame rate substituted when the source does not declare a usable one
 * @param flashLookaheadFrames      frames, including the triggering one, inspected to estimate flash duration
 * @param redLookaheadFrames        frames, including the triggering one, inspected to estimate red flash duration
 * @param flashMergeTolerance       seconds within which general flash candidates fold into one event
 * @param redMergeTolerance         seconds within which red flash candidates fold into one event
 * @param highSaturationEventLimit  number of high-saturation red flashes tolerated before the red ceiling trips
 * @param flashCountThreshold       total flashes above which the risk score starts to grow with the count
 * @param safeRiskCutoff            highest score still classified as safe
 * @param lowRiskCutoff             highest score still classified as low
 * @param mediumRiskCutoff          highest score still classified as medium
 * @param highRiskCutoff            highest score still classified as high
 * @param flashPeriodConfidence     confidence attached to general dangerous periods
 * @param redPeriodConfidence       confidence attached to red dangerous periods
 */
public record PseThresholds(
        double minFlashIntensity,
        double redLuminanceWeight,
        double redThresholdFactor,
        double continuationFactor,
        double redSaturationThreshold,
        double maxSafeFlashRate,
        double criticalFlashRate,
        double maxSafeRedFlashRate,
        double redCriticalRateMultiplier,
        double dangerousFlashIntensity,
        double analysisWindowSize,
        double maxAnalysisDuration,
        double defaultFrameRate,
        int flashLookaheadFrames,
        int redLookaheadFrames,
        double flashMergeTolerance,
        double redMergeTolerance,
        int highSaturationEventLimit,
        int flashCountThreshold,
        double safeRiskCutoff,
        double lowRiskCutoff,
        double mediumRiskCutoff,
        double highRiskCutoff,
        double flashPeriodConfidence,
        double redPeriodConfidence)
{
    public PseThresholds {
        requireNonNegative("minFlashIntensity", minFlashIntensity);
        requirePositive("redLuminanceWeight", redLuminanceWeight);
        requirePositive("redThresholdFactor", redThresholdFactor);
        if (redThresholdFactor > 1.0) {
            throw ThresholdConfigurationException.invalidParameter(
                    "redThresholdFactor", redThresholdFactor, "value in (0, 1]");
        }
        requirePositive("continuationFactor", continuationFactor);
        requireNonNegative("redSaturationThreshold", redSaturationThreshold);
        requireNonNegative("maxSafeFlashRate", maxSafeFlashRate);
        requireNonNegative("criticalFlashRate", criticalFlashRate);
        requireNonNegative("maxSafeRedFlashRate", maxSafeRedFlashRate);
        requirePositive("redCriticalRateMultiplier", redCriticalRateMultiplier);
        requireNonNegative("dangerousFlashIntensity", dangerousFlashIntensity);
        requirePositive("analysisWindowSize", analysisWindowSize);
        requirePositive("maxAnalysisDuration", maxAnalysisDuration);
        if (Double.isInfinite(maxAnalysisDuration)) {
            throw ThresholdConfigurationException.invalidParameter(
                    "maxAnalysisDuration", maxAnalysisDuration, "finite number of seconds");
        }
        requirePositive("defaultFrameRate", defaultFrameRate);
        if (flashLookaheadFrames < 1) {
            throw ThresholdConfigurationException.invalidParameter(
                    "flashLookaheadFrames", flashLookaheadFrames, "at least 1");
        }
        if (redLookaheadFrames < 1) {
            throw ThresholdConfigurationException.invalidParameter(
                    "redLookaheadFrames", redLookaheadFrames, "at least 1");
        }
        requireNonNegative("flashMergeTolerance", flashMergeTolerance);
        requireNonNegative("redMergeTolerance", redMergeTolerance);
        if (highSaturationEventLimit < 0) {
            throw ThresholdConfigurationException.invalidParameter(
                    "highSaturationEventLimit", highSaturationEventLimit, "non-negative integer");
        }
        if (flashCountThreshold < 0) {
            throw ThresholdConfigurationException.invalidParameter(
                    "flashCountThreshold", flashCountThreshold, "non-negative integer");
        }
        if (!(safeRiskCutoff <= lowRiskCutoff
                && lowRiskCutoff <= mediumRiskCutoff
                && mediumRiskCutoff <= highRiskCutoff)) {
            throw new ThresholdConfigurationException(String.format(
                    "Risk cutoffs must be ascending: safe=%.1f, low=%.1f, medium=%.1f, high=%.1f",
                    safeRiskCutoff, lowRiskCutoff, mediumRiskCutoff, highRiskCutoff));
        }
        requireUnitInterval("flashPeriodConfidence", flashPeriodConfidence);
        requireUnitInterval("redPeriodConfidence", redPeriodConfidence);
    }

    /**
     * Returns the ITU-R BT.1702 reference profile.
     */
    public static PseThresholds defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a builder pre-populated with this profile's values.
     */
    public Builder toBuilder() {
        return new Builder()
                .minFlashIntensity(minFlashIntensity)
                .redLuminanceWeight(redLuminanceWeight)
                .redThresholdFactor(redThresholdFactor)
                .continuationFactor(continuationFactor)
                .redSaturationThreshold(redSaturationThreshold)
                .maxSafeFlashRate(maxSafeFlashRate)
                .criticalFlashRate(criticalFlashRate)
                .maxSafeRedFlashRate(maxSafeRedFlashRate)
                .redCriticalRateMultiplier(redCriticalRateMultiplier)
                .dangerousFlashIntensity(dangerousFlashIntensity)
                .analysisWindowSize(analysisWindowSize)
                .maxAnalysisDuration(maxAnalysisDuration)
                .defaultFrameRate(defaultFrameRate)
                .flashLookaheadFrames(flashLookaheadFrames)
                .redLookaheadFrames(redLookaheadFrames)
                .flashMergeTolerance(flashMergeTolerance)
                .redMergeTolerance(redMergeTolerance)
                .highSaturationEventLimit(highSaturationEventLimit)
                .flashCountThreshold(flashCountThreshold)
                .riskCutoffs(safeRiskCutoff, lowRiskCutoff, mediumRiskCutoff, highRiskCutoff)
                .flashPeriodConfidence(flashPeriodConfidence)
                .redPeriodConfidence(redPeriodConfidence);
    }

    /** Absolute red delta, after weighting, that registers a red flash. */
    public double redDetectionThreshold() {
        return minFlashIntensity * redThresholdFactor;
    }

    /** Luminance delta against the flash frame that keeps a general flash running. */
    public double flashContinuationThreshold() {
        return minFlashIntensity * continuationFactor;
    }

    /** Weighted red delta against the flash frame that keeps a red flash running. */
    public double redContinuationThreshold() {
        return redDetectionThreshold() * continuationFactor;
    }

    /** Window rate above which a red period is critical. */
    public double criticalRedFlashRate() {
        return maxSafeRedFlashRate * redCriticalRateMultiplier;
    }

    private static void requirePositive(String name, double value) {
        if (!(value > 0.0)) {
            throw ThresholdConfigurationException.invalidParameter(name, value, "positive number");
        }
    }

    private static void requireNonNegative(String name, double value) {
        if (!(value >= 0.0)) {
            throw ThresholdConfigurationException.invalidParameter(name, value, "non-negative number");
        }
    }

    private static void requireUnitInterval(String name, double value) {
        if (!(value >= 0.0 && value <= 1.0)) {
            throw ThresholdConfigurationException.invalidParameter(name, value, "value in [0, 1]");
        }
    }

    /**
     * Mutable builder for {@link PseThresholds}, initialised with the reference values.
     */
    public static final class Builder
    {
        private double minFlashIntensity = 0.1;
        private double redLuminanceWeight = 1.5;
        private double redThresholdFactor = 0.7;
        private double continuationFactor = 0.5;
        private double redSaturationThreshold = 0.6;
        private double maxSafeFlashRate = 3.0;
        private double criticalFlashRate = 5.0;
        private double maxSafeRedFlashRate = 2.0;
        private double redCriticalRateMultiplier = 2.0;
        private double dangerousFlashIntensity = 0.8;
        private double analysisWindowSize = 1.0;
        private double maxAnalysisDuration = 3600.0;
        private double defaultFrameRate = 25.0;
        private int flashLookaheadFrames = 5;
        private int redLookaheadFrames = 3;
        private double flashMergeTolerance = 0.1;
        private double redMergeTolerance = 0.05;
        private int highSaturationEventLimit = 10;
        private int flashCountThreshold = 100;
        private double safeRiskCutoff = 20.0;
        private double lowRiskCutoff = 40.0;
        private double mediumRiskCutoff = 60.0;
        private double highRiskCutoff = 80.0;
        private double flashPeriodConfidence = 0.85;
        private double redPeriodConfidence = 0.90;

        private Builder() {}

        public Builder minFlashIntensity(double value) {
            this.minFlashIntensity = value;
            return this;
        }

        public Builder redLuminanceWeight(double value) {
            this.redLuminanceWeight = value;
            return this;
        }

        public Builder redThresholdFactor(double value) {
            this.redThresholdFactor = value;
            return this;
        }

        public Builder continuationFactor(double value) {
            this.continuationFactor = value;
            return this;
        }

        public Builder redSaturationThreshold(double value) {
            this.redSaturationThreshold = value;
            return this;
        }

        public Builder maxSafeFlashRate(double value) {
            this.maxSafeFlashRate = value;
            return this;
        }

        public Builder criticalFlashRate(double value) {
            this.criticalFlashRate = value;
            return this;
        }

        public Builder maxSafeRedFlashRate(double value) {
            this.maxSafeRedFlashRate = value;
            return this;
        }

        public Builder redCriticalRateMultiplier(double value) {
            this.redCriticalRateMultiplier = value;
            return this;
        }

        public Builder dangerousFlashIntensity(double value) {
            this.dangerousFlashIntensity = value;
            return this;
        }

        public Builder analysisWindowSize(double value) {
            this.analysisWindowSize = value;
            return this;
        }

        public Builder maxAnalysisDuration(double value) {
            this.maxAnalysisDuration = value;
            return this;
        }

        public Builder defaultFrameRate(double value) {
            this.defaultFrameRate = value;
            return this;
        }

        public Builder flashLookaheadFrames(int value) {
            this.flashLookaheadFrames = value;
            return this;
        }

        public Builder redLookaheadFrames(int value) {
            this.redLookaheadFrames = value;
            return this;
        }

        public Builder flashMergeTolerance(double value) {
            this.flashMergeTolerance = value;
            return this;
        }

        public Builder redMergeTolerance(double value) {
            this.redMergeTolerance = value;
            return this;
        }

        public Builder highSaturationEventLimit(int value) {
            this.highSaturationEventLimit = value;
            return this;
        }

        public Builder flashCountThreshold(int value) {
            this.flashCountThreshold = value;
            return this;
        }

        public Builder riskCutoffs(double safe, double low, double medium, double high) {
            this.safeRiskCutoff = safe;
            this.lowRiskCutoff = low;
            this.mediumRiskCutoff = medium;
            this.highRiskCutoff = high;
            return this;
        }

        public Builder flashPeriodConfidence(double value) {
            this.flashPeriodConfidence = value;
            return this;
        }

        public Builder redPeriodConfidence(double value) {
            this.redPeriodConfidence = value;
            return this;
        }

        public PseThresholds build() {
            return new PseThresholds(
                    minFlashIntensity,
                    redLuminanceWeight,
                    redThresholdFactor,
                    continuationFactor,
                    redSaturationThreshold,
                    maxSafeFlashRate,
                    criticalFlashRate,
                    maxSafeRedFlashRate,
                    redCriticalRateMultiplier,
                    dangerousFlashIntensity,
                    analysisWindowSize,
                    maxAnalysisDuration,
                    defaultFrameRate,
                    flashLookaheadFrames,
                    redLookaheadFrames,
                    flashMergeTolerance,
                    redMergeTolerance,
                    highSaturationEventLimit,
                    flashCountThreshold,
                    safeRiskCutoff,
                    lowRiskCutoff,
                    mediumRiskCutoff,
                    highRiskCutoff,
                    flashPeriodConfidence,
                    redPeriodConfidence);
        }
    }
}
