package com.ammann.pse.service;

import com.ammann.pse.config.PseThresholds;
import com.ammann.pse.model.RedFlashEvent;
import com.ammann.pse.model.RedSample;
import com.ammann.pse.support.TestDataFactory;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.ammann.pse.support.TestDataFactory.luminance;
import static com.ammann.pse.support.TestDataFactory.red;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class RedFlashEventDetectorTest
{

    private final PseThresholds thresholds = PseThresholds.defaults();
    private final RedFlashEventDetector detector = new RedFlashEventDetector(thresholds);

    @Test
    void saturatedSpikeYieldsExactlyOneRedFlash()
    {
        List<RedFlashEvent> events = detector.detect(red(0.95, 0, 200, 0), 25.0);

        assertThat(events).hasSize(1);
        RedFlashEvent event = events.get(0);
        assertThat(event.timestamp()).isCloseTo(0.04, within(1e-12));
        assertThat(event.saturation()).isEqualTo(0.95);
        assertThat(event.redValue()).isEqualTo(200.0);
        assertThat(event.endTime()).isCloseTo(0.12, within(1e-9));
    }

    @Test
    void desaturatedSpikeYieldsNoRedFlash()
    {
        assertThat(detector.detect(red(0.1, 0, 200, 0), 25.0)).isEmpty();
    }

    @Test
    void saturationAtThresholdIsRejected()
    {
        assertThat(detector.detect(red(0.6, 0, 200, 0), 25.0)).isEmpty();
    }

    @Test
    void nanSaturationIsTreatedAsFailingTheGate()
    {
        assertThat(detector.detect(red(Double.NaN, 0, 200, 0), 25.0)).isEmpty();
    }

    @Test
    void intensityIsWeightedAndNotCapped()
    {
        List<RedFlashEvent> candidates = detector.detectCandidates(red(0.95, 0, 200), 25.0);

        assertThat(candidates).hasSize(1);
        assertThat(candidates.get(0).intensity()).isCloseTo(1.5, within(1e-12));
    }

    @Test
    void redDetectorFiresWhereGeneralDetectorDoesNot()
    {
        FlashEventDetector general = new FlashEventDetector(thresholds);

        assertThat(general.detect(luminance(0.50, 0.55, 0.55), 25.0)).isEmpty();
        assertThat(detector.detect(red(0.95, 0.50, 0.55, 0.55), 25.0)).hasSize(1);
    }

    @Test
    void strongSignalTripsBothDetectors()
    {
        FlashEventDetector general = new FlashEventDetector(thresholds);

        assertThat(general.detect(luminance(0, 200, 200), 25.0)).hasSize(1);
        assertThat(detector.detect(red(0.95, 0, 200, 200), 25.0)).hasSize(1);
    }

    @Test
    void lookaheadIsShorterThanGeneralDetector()
    {
        List<RedSample> samples = red(0.95, 0, 200, 0, 0, 0, 0, 0);

        assertThat(detector.estimateDuration(samples, 1, 25.0)).isCloseTo(0.12, within(1e-12));
    }

    @Test
    void redFlashesFartherApartThanToleranceStaySeparate()
    {
        List<RedFlashEvent> events = detector.detect(TestDataFactory.redStrobe(25, 5, 0.9), 25.0);

        // the sequence opens on a lit frame, so the first event is its fall to black
        assertThat(events).hasSize(5);
        assertThat(events.get(0).redValue()).isEqualTo(0.0);
        assertThat(events.subList(1, 5)).allSatisfy(e -> assertThat(e.redValue()).isEqualTo(220.0));
    }

    @Test
    void fewerThanTwoSamplesProducesNoRedFlashes()
    {
        assertThat(detector.detect(red(0.95, 200), 25.0)).isEmpty();
        assertThat(detector.detect(null, 25.0)).isEmpty();
    }
}
