package com.demoClinic.diagnosisDemo.diagnosis.service;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;

class ConfidenceAggregatorTest {

    private final ConfidenceAggregator aggregator = new ConfidenceAggregator();

    @Test
    void returnsRoundedMaximum() {
        assertThat(aggregator.aggregate(87.0, 64.2)).isEqualTo(87);
        assertThat(aggregator.aggregate(12.4, 91.5)).isEqualTo(92);
    }

    @Test
    void ignoresMissingValues() {
        assertThat(aggregator.aggregate(null, 73.6)).isEqualTo(74);
        assertThat(aggregator.aggregate(55.2, null)).isEqualTo(55);
    }

    @Test
    void returnsZeroWhenNothingIsAvailable() {
        assertThat(aggregator.aggregate(null, null)).isZero();
        assertThat(aggregator.aggregate(Collections.emptyList())).isZero();
    }

    @Test
    void maximumIsNotDilutedByWeakerFindings() {
        assertThat(aggregator.aggregate(Arrays.asList(10.0, 98.0, null, 20.0))).isEqualTo(98);
    }
}
