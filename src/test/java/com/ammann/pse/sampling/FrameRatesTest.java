package com.ammann.pse.sampling;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class FrameRatesTest
{

    @ParameterizedTest
    @CsvSource({
            "25/1,25.0",
            "30000/1001,29.97002997",
            "24000/1001,23.97602398",
            "29.97,29.97",
            "' 50 / 1 ',50.0"
    })
    void parsesDeclaredRates(String declared, double expected)
    {
        assertThat(FrameRates.parse(declared)).isCloseTo(expected, within(1e-6));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"25/0", "abc", "NaN", "Infinity", "1/2/3"})
    void unusableRatesParseToZero(String declared)
    {
        assertThat(FrameRates.parse(declared)).isEqualTo(0.0);
    }

    @Test
    void substitutesFallbackForUnusableRates()
    {
        assertThat(FrameRates.orDefault(null, 25.0)).isEqualTo(25.0);
        assertThat(FrameRates.orDefault(0.0, 25.0)).isEqualTo(25.0);
        assertThat(FrameRates.orDefault(-24.0, 25.0)).isEqualTo(25.0);
        assertThat(FrameRates.orDefault(Double.NaN, 25.0)).isEqualTo(25.0);
        assertThat(FrameRates.orDefault(59.94, 25.0)).isEqualTo(59.94);
    }
}
