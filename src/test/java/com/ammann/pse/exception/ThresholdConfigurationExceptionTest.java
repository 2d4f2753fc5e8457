package com.ammann.pse.exception;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class ThresholdConfigurationExceptionTest
{

    @ParameterizedTest
    @CsvSource({
            "analysisWindowSize,0.0,positive number",
            "maxSafeFlashRate,-3.0,non-negative number"
    })
    void buildsInvalidParameterMessage(String param, String value, String expected)
    {
        ThresholdConfigurationException ex = ThresholdConfigurationException.invalidParameter(param, value, expected);

        assertThat(ex.getMessage())
                .isEqualTo("Invalid threshold '" + param + "': got '" + value + "', expected " + expected);
        assertThat(ex).isInstanceOf(PseException.class);
    }

    @Test
    void serializationFailureKeepsItsCause()
    {
        IllegalStateException cause = new IllegalStateException("boom");

        ReportSerializationException ex = new ReportSerializationException("Failed to serialise", cause);

        assertThat(ex).hasCause(cause).isInstanceOf(PseException.class);
    }
}
