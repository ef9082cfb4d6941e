package org.circuitrepl.hardware;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class PinNameMapperTest {

    @ParameterizedTest
    @CsvSource({
            "LED, 13",
            "D0, 0",
            "D5, 5",
            "D13, 13",
            "A0, 14",
            "A2, 16"
    })
    void toPinNumber_mapsKnownNames(final String name, final int expected) {
        assertThat(PinNameMapper.toPinNumber(name)).hasValue(expected);
    }

    @ParameterizedTest
    @ValueSource(strings = {"D14", "A3", "SCL", "led", "D", "D123", "", "D05", "A00", "A01"})
    void toPinNumber_rejectsUnknownNames(final String name) {
        assertThat(PinNameMapper.toPinNumber(name)).isEmpty();
    }
}
