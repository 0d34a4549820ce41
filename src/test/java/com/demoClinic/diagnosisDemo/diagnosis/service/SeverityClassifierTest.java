package com.demoClinic.diagnosisDemo.diagnosis.service;

import com.demoClinic.diagnosisDemo.diagnosis.model.Severity;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class SeverityClassifierTest {

    private final SeverityClassifier classifier = new SeverityClassifier();

    @ParameterizedTest
    @CsvSource({
            "mild,MILD",
            "MILD,MILD",
            "Moderate,MODERATE",
            "severe,SEVERE",
            "High,SEVERE",
            "CRITICAL,SEVERE",
            "'  critical ',SEVERE",
            "low,NORMAL",
            "normal,NORMAL",
            "unknown,NORMAL"
    })
    void mapsRiskLevelsToTiers(String riskLevel, Severity expected) {
        assertThat(classifier.classify(riskLevel)).isEqualTo(expected);
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   ", "very high", "moderately severe", "mild-moderate", "\t"})
    void unrecognizedTextDefaultsToNormal(String riskLevel) {
        assertThat(classifier.classify(riskLevel)).isEqualTo(Severity.NORMAL);
    }
}
