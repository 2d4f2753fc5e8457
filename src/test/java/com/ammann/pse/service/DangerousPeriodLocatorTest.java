package com.ammann.pse.service;

import com.ammann.pse.config.PseThresholds;
import com.ammann.pse.dto.FlashStatisticsDTO;
import com.ammann.pse.enumeration.FlashKind;
import com.ammann.pse.enumeration.RiskLevel;
import com.ammann.pse.model.FlashEvent;
import com.ammann.pse.model.RedFlashEvent;
import com.ammann.pse.model.TimePeriod;
import com.ammann.pse.model.TimeWindow;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link DangerousPeriodLocator}.
 */
class DangerousPeriodLocatorTest
{

    private final PseThresholds thresholds = PseThresholds.defaults();
    private final DangerousPeriodLocator locator = new DangerousPeriodLocator(thresholds);
    private final FlashStatisticsService statisticsService = new FlashStatisticsService(thresholds);

    @Test
    void quietContentHasNoDangerousPeriods()
    {
        List<FlashEvent> events = List.of(flash(0.5, 0.3), flash(2.5, 0.3));

        assertThat(locate(events, 4.0)).isEmpty();
    }

    @Test
    void noEventsMeansNoPeriods()
    {
        assertThat(locator.locateFlashPeriods(List.of(), FlashStatisticsDTO.empty(), 10.0)).isEmpty();
        assertThat(locator.locateRedFlashPeriods(List.of(), FlashStatisticsDTO.empty(), 10.0)).isEmpty();
    }

    @Test
    void rateAboveCeilingIsMedium()
    {
        List<FlashEvent> events = evenlySpaced(1.0, 4, 0.3);

        List<TimePeriod> periods = locate(events, 3.0);

        assertThat(periods).hasSize(1);
        TimePeriod period = periods.get(0);
        assertThat(period.riskLevel()).isEqualTo(RiskLevel.MEDIUM);
        assertThat(period.startTime()).isEqualTo(1.0);
        assertThat(period.endTime()).isEqualTo(2.0);
        assertThat(period.description()).isEqualTo("High flash rate period: 4.0 flashes/second");
        assertThat(period.confidence()).isEqualTo(0.85);
    }

    @Test
    void rateAboveCriticalCeilingIsCritical()
    {
        List<TimePeriod> periods = locate(evenlySpaced(0.0, 7, 0.95), 1.0);

        assertThat(periods).singleElement().satisfies(p -> {
            assertThat(p.riskLevel()).isEqualTo(RiskLevel.CRITICAL);
            assertThat(p.description()).isEqualTo("Critical flash rate period: 7.0 flashes/second");
        });
    }

    @Test
    void singleIntenseFlashIsHigh()
    {
        List<TimePeriod> periods = locate(List.of(flash(2.4, 0.95)), 5.0);

        assertThat(periods).singleElement().satisfies(p -> {
            assertThat(p.riskLevel()).isEqualTo(RiskLevel.HIGH);
            assertThat(p.startTime()).isEqualTo(2.0);
            assertThat(p.description()).isEqualTo("High intensity flash period: 1 dangerous flashes");
        });
    }

    @Test
    void intensityAtDangerousThresholdIsNotFlagged()
    {
        assertThat(locate(List.of(flash(0.5, 0.8)), 1.0)).isEmpty();
    }

    @Test
    void periodsAlignWithStatisticsWindows()
    {
        List<FlashEvent> events = new ArrayList<>();
        events.addAll(evenlySpaced(0.0, 5, 0.3));
        events.addAll(evenlySpaced(3.0, 6, 0.3));
        double duration = 4.5;

        List<TimePeriod> periods = locate(events, duration);
        double windowSize = thresholds.analysisWindowSize();

        assertThat(periods).hasSize(2);
        for (TimePeriod period : periods) {
            long index = (long) Math.floor(period.startTime() / windowSize);
            TimeWindow window = AnalysisWindows.window(index, windowSize);
            assertThat(index).isLessThan(AnalysisWindows.windowCount(duration, windowSize));
            assertThat(window.start()).isEqualTo(period.startTime());
            assertThat(window.end()).isEqualTo(period.endTime());
        }
        assertThat(periods.get(0).riskLevel()).isEqualTo(RiskLevel.MEDIUM);
        assertThat(periods.get(1).riskLevel()).isEqualTo(RiskLevel.CRITICAL);
    }

    @Test
    void saturatedRedFlashFlagsItsWindowAsHigh()
    {
        List<RedFlashEvent> events = List.of(red(0.3, 0.95));

        List<TimePeriod> periods = locateRed(events, 2.0);

        assertThat(periods).singleElement().satisfies(p -> {
            assertThat(p.riskLevel()).isEqualTo(RiskLevel.HIGH);
            assertThat(p.confidence()).isEqualTo(0.90);
            assertThat(p.description()).isEqualTo("High red flash rate period: 1.0 red flashes/second");
        });
    }

    @Test
    void redRateAboveTwiceTheCeilingIsCritical()
    {
        List<RedFlashEvent> events = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            events.add(red(i * 0.15, 0.5));
        }

        List<TimePeriod> periods = locateRed(events, 1.0);

        assertThat(periods).singleElement().satisfies(p -> {
            assertThat(p.riskLevel()).isEqualTo(RiskLevel.CRITICAL);
            assertThat(p.description()).isEqualTo("Critical red flash period: 5.0 red flashes/second");
        });
    }

    @Test
    void redRateAtCeilingWithLowSaturationIsNotFlagged()
    {
        assertThat(locateRed(List.of(red(0.1, 0.5), red(0.6, 0.5)), 1.0)).isEmpty();
    }

    private List<TimePeriod> locate(List<FlashEvent> events, double duration)
    {
        return locator.locateFlashPeriods(events, statisticsService.calculate(events, duration), duration);
    }

    private List<TimePeriod> locateRed(List<RedFlashEvent> events, double duration)
    {
        return locator.locateRedFlashPeriods(events, statisticsService.calculate(events, duration), duration);
    }

    private static List<FlashEvent> evenlySpaced(double start, int count, double intensity)
    {
        List<FlashEvent> events = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            events.add(flash(start + i * (0.9 / count), intensity));
        }
        return events;
    }

    private static FlashEvent flash(double timestamp, double intensity)
    {
        return new FlashEvent(timestamp, intensity, 0.02, FlashKind.fromIntensity(intensity));
    }

    private static RedFlashEvent red(double timestamp, double saturation)
    {
        return new RedFlashEvent(timestamp, 1.0, 0.02, saturation, 200.0);
    }
}
