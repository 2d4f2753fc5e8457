package com.ammann.pse.service;

import com.ammann.pse.config.PseThresholds;
import com.ammann.pse.dto.FlashDurationDTO;
import com.ammann.pse.dto.FlashIntensityDTO;
import com.ammann.pse.enumeration.FlashKind;
import com.ammann.pse.enumeration.RiskLevel;
import com.ammann.pse.model.FlashEvent;
import com.ammann.pse.model.RedFlashEvent;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class FlashCharacterizationServiceTest
{

    private final FlashCharacterizationService service = new FlashCharacterizationService(PseThresholds.defaults());

    @Test
    void generalFlashesAreRatedByIntensity()
    {
        List<FlashDurationDTO> durations = service.flashDurations(List.of(
                flash(0.0, 0.95), flash(1.0, 0.8), flash(2.0, 0.51), flash(3.0, 0.5), flash(4.0, 0.1)));

        assertThat(durations).extracting(FlashDurationDTO::riskLevel)
                .containsExactly(RiskLevel.HIGH, RiskLevel.MEDIUM, RiskLevel.MEDIUM, RiskLevel.LOW, RiskLevel.LOW);
    }

    @Test
    void durationsCarryTimingAndFullScreenArea()
    {
        FlashDurationDTO duration = service.flashDurations(List.of(flash(1.5, 0.9))).get(0);

        assertThat(duration.startTime()).isEqualTo(1.5);
        assertThat(duration.endTime()).isCloseTo(1.62, within(1e-12));
        assertThat(duration.duration()).isCloseTo(0.12, within(1e-12));
        assertThat(duration.intensity()).isEqualTo(0.9);
        assertThat(duration.screenArea()).isEqualTo(1.0);
    }

    @Test
    void redFlashesStartAtMediumRisk()
    {
        List<FlashDurationDTO> durations = service.redFlashDurations(List.of(
                red(0.0, 0.5, 0.7),
                red(1.0, 1.2, 0.7),
                red(2.0, 0.5, 0.95)));

        assertThat(durations).extracting(FlashDurationDTO::riskLevel)
                .containsExactly(RiskLevel.MEDIUM, RiskLevel.HIGH, RiskLevel.HIGH);
    }

    @Test
    void intensityStatisticsUsePopulationVariance()
    {
        FlashIntensityDTO intensity = service.intensityAnalysis(List.of(
                flash(0.0, 0.2), flash(1.0, 0.4), flash(2.0, 0.6), flash(3.0, 0.8)));

        assertThat(intensity.peakIntensity()).isEqualTo(0.8);
        assertThat(intensity.averageIntensity()).isCloseTo(0.5, within(1e-12));
        assertThat(intensity.intensityVariance()).isCloseTo(0.05, within(1e-12));
    }

    @Test
    void distributionHasFiveOrderedBuckets()
    {
        FlashIntensityDTO intensity = service.intensityAnalysis(List.of(
                flash(0.0, 0.1), flash(1.0, 0.2), flash(2.0, 0.59), flash(3.0, 1.0), flash(4.0, 0.9)));

        assertThat(intensity.intensityDistribution().keySet())
                .containsExactly("0.0-0.2", "0.2-0.4", "0.4-0.6", "0.6-0.8", "0.8-1.0");
        assertThat(intensity.intensityDistribution().values()).containsExactly(1, 1, 1, 0, 2);
    }

    @ParameterizedTest
    @CsvSource({
            "0.0,0",
            "0.19,0",
            "0.2,1",
            "0.6,3",
            "0.8,4",
            "1.5,4",
            "-1.0,0"
    })
    void bucketsAreLowerInclusive(double intensity, int expectedBucket)
    {
        assertThat(FlashCharacterizationService.bucketOf(intensity)).isEqualTo(expectedBucket);
    }

    @Test
    void noEventsHaveNoIntensityAnalysis()
    {
        assertThat(service.intensityAnalysis(List.of())).isNull();
        assertThat(service.flashDurations(List.of())).isEmpty();
        assertThat(service.redFlashDurations(null)).isEmpty();
    }

    @Test
    void saturationLevelsFollowEventOrder()
    {
        assertThat(service.saturationLevels(List.of(red(0.0, 1.0, 0.7), red(1.0, 1.0, 0.95))))
                .containsExactly(0.7, 0.95);
        assertThat(service.saturationLevels(List.of())).isEmpty();
    }

    private static FlashEvent flash(double timestamp, double intensity)
    {
        return new FlashEvent(timestamp, intensity, 0.12, FlashKind.fromIntensity(intensity));
    }

    private static RedFlashEvent red(double timestamp, double intensity, double saturation)
    {
        return new RedFlashEvent(timestamp, intensity, 0.08, saturation, 200.0);
    }
}
