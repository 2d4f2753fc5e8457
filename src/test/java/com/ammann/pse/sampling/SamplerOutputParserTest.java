package com.ammann.pse.sampling;

import com.ammann.pse.model.LuminanceSample;
import com.ammann.pse.model.RedSample;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SamplerOutputParserTest
{

    private final SamplerOutputParser parser = new SamplerOutputParser();

    @Test
    void parsesLuminanceLines()
    {
        List<LuminanceSample> samples = parser.parseLuminance("0.000,16.0\n0.040,235.0\n0.080,16.0\n");

        assertThat(samples).containsExactly(
                new LuminanceSample(0.0, 16.0),
                new LuminanceSample(0.04, 235.0),
                new LuminanceSample(0.08, 16.0));
    }

    @Test
    void skipsUnreadableLines()
    {
        String output = String.join("\n",
                "0.000,16.0",
                "",
                "garbage",
                "0.040,",
                "x,12",
                "0.080,NaN",
                "0.120 , 40.5 , extra",
                "0.160,50");

        List<LuminanceSample> samples = parser.parseLuminance(output);

        assertThat(samples).extracting(LuminanceSample::timestamp).containsExactly(0.0, 0.12, 0.16);
        assertThat(samples.get(1).luminance()).isEqualTo(40.5);
    }

    @Test
    void handlesWindowsLineEndings()
    {
        assertThat(parser.parseLuminance("0.0,1.0\r\n0.04,2.0\r\n")).hasSize(2);
    }

    @Test
    void missingOutputYieldsNoSamples()
    {
        assertThat(parser.parseLuminance(null)).isEmpty();
        assertThat(parser.parseRed("   ")).isEmpty();
    }

    @Test
    void redSaturationIsProxiedFromRedValue()
    {
        List<RedSample> samples = parser.parseRed("0.0,0\n0.04,127.5\n0.08,255\n0.12,300\n0.16,-10");

        assertThat(samples).extracting(RedSample::saturation)
                .containsExactly(0.0, 0.5, 1.0, 1.0, 0.0);
        assertThat(samples.get(3).redIntensity()).isEqualTo(300.0);
    }

    @Test
    void parsedRedSamplesFeedTheDetectorThresholds()
    {
        RedSample bright = parser.parseRed("0.0,200").get(0);

        assertThat(bright.saturation()).isCloseTo(200.0 / 255.0, within(1e-12));
        assertThat(bright.saturation()).isGreaterThan(0.6);
    }
}
