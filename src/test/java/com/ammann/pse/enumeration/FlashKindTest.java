package com.ammann.pse.enumeration;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class FlashKindTest
{

    @ParameterizedTest
    @CsvSource({
            "1.0,SUDDEN",
            "0.81,SUDDEN",
            "0.8,GRADUAL",
            "0.41,GRADUAL",
            "0.4,SUBTLE",
            "0.0,SUBTLE"
    })
    void classifiesByIntensity(double intensity, FlashKind expected)
    {
        assertThat(FlashKind.fromIntensity(intensity)).isEqualTo(expected);
    }

    @Test
    void keepsTheMoreSevereKind()
    {
        assertThat(FlashKind.mostSevere(FlashKind.SUBTLE, FlashKind.SUDDEN)).isEqualTo(FlashKind.SUDDEN);
        assertThat(FlashKind.mostSevere(FlashKind.GRADUAL, FlashKind.SUBTLE)).isEqualTo(FlashKind.GRADUAL);
        assertThat(FlashKind.mostSevere(FlashKind.GRADUAL, FlashKind.GRADUAL)).isEqualTo(FlashKind.GRADUAL);
    }
}
