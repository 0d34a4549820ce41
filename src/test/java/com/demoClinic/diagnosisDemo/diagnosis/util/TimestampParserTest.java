package com.demoClinic.diagnosisDemo.diagnosis.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;

import static com.demoClinic.diagnosisDemo.support.DiagnosisTestFactory.json;
import static org.assertj.core.api.Assertions.assertThat;

class TimestampParserTest {

    @ParameterizedTest
    @CsvSource({
            "2024-05-01T10:15:30Z, 2024-05-01T10:15:30Z",
            "2024-05-01T10:15:30.123456+00:00, 2024-05-01T10:15:30.123456Z",
            "2024-05-01T12:15:30+02:00, 2024-05-01T10:15:30Z",
            "2024-05-01 10:15:30.5+00, 2024-05-01T10:15:30.500Z",
            "2024-05-01 10:15:30-0130, 2024-05-01T11:45:30Z",
            "2024-05-01T10:15:30, 2024-05-01T10:15:30Z",
            "2024-05-01, 2024-05-01T00:00:00Z"
    })
    void parsesSupportedFormats(String raw, String expected) {
        assertThat(TimestampParser.parse(raw)).isEqualTo(Instant.parse(expected));
    }

    @ParameterizedTest
    @ValueSource(strings = {"yesterday", "2024-13-01", "2024-05-01T25:00:00Z", "  ", "05/01/2024"})
    void returnsNullForUnparsableText(String raw) {
        assertThat(TimestampParser.parse(raw)).isNull();
    }

    @Test
    void readsEpochMillisFromNumbers() {
        assertThat(TimestampParser.parse(json("1714558530000"))).isEqualTo(Instant.parse("2024-05-01T10:15:30Z"));
    }

    @Test
    void ignoresNullAndNonTextNodes() {
        assertThat(TimestampParser.parse(json("null"))).isNull();
        assertThat(TimestampParser.parse(json("true"))).isNull();
        assertThat(TimestampParser.parse(json("{\"at\":1}"))).isNull();
        assertThat(TimestampParser.parse((String) null)).isNull();
    }
}
