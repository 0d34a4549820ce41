package com.demoClinic.diagnosisDemo.diagnosis.service;

import com.demoClinic.diagnosisDemo.support.DiagnosisTestFactory;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.DoubleNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.Map;
import java.util.stream.Stream;

import static com.demoClinic.diagnosisDemo.diagnosis.service.GlaucomaProbabilityDeriver.GLAUCOMA_LABEL;
import static com.demoClinic.diagnosisDemo.diagnosis.service.GlaucomaProbabilityDeriver.NORMAL_LABEL;
import static com.demoClinic.diagnosisDemo.support.DiagnosisTestFactory.json;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;
import static org.assertj.core.api.Assertions.within;

class GlaucomaProbabilityDeriverTest {

    private final GlaucomaProbabilityDeriver deriver = DiagnosisTestFactory.glaucomaProbabilityDeriver();

    @Test
    void normalPredictionWithScalarAndNoConfidence() {
        Map<String, Double> result = deriver.derive(json("0.92"), null, "normal");

        assertThat(result).containsOnlyKeys(NORMAL_LABEL, GLAUCOMA_LABEL);
        assertThat(result.get(NORMAL_LABEL)).isCloseTo(0.92, within(1e-9));
        assertThat(result.get(GLAUCOMA_LABEL)).isCloseTo(0.08, within(1e-9));
    }

    @Test
    void glaucomaPredictionPutsScalarOnGlaucoma() {
        Map<String, Double> result = deriver.derive(json("0.7"), json("null"), "Glaucoma");

        assertThat(result.get(GLAUCOMA_LABEL)).isCloseTo(0.7, within(1e-9));
        assertThat(result.get(NORMAL_LABEL)).isCloseTo(0.3, within(1e-9));
    }

    @Test
    void usesConfidenceAsComplementAndRescalesThePair() {
        Map<String, Double> result = deriver.derive(json("0.6"), json("0.3"), "Glaucoma");

        assertThat(result.get(GLAUCOMA_LABEL)).isCloseTo(0.6 / 0.9, within(1e-9));
        assertThat(result.get(NORMAL_LABEL)).isCloseTo(0.3 / 0.9, within(1e-9));
    }

    @Test
    void percentageConfidenceIsReadOnTheSameScale() {
        Map<String, Double> fromPercent = deriver.derive(json("0.6"), json("30"), "Glaucoma");
        Map<String, Double> fromFraction = deriver.derive(json("0.6"), json("0.3"), "Glaucoma");

        assertThat(fromPercent.get(GLAUCOMA_LABEL)).isCloseTo(fromFraction.get(GLAUCOMA_LABEL), within(1e-9));
        assertThat(fromPercent.get(NORMAL_LABEL)).isCloseTo(fromFraction.get(NORMAL_LABEL), within(1e-9));
    }

    @Test
    void zeroSumYieldsZeroForBothClasses() {
        Map<String, Double> result = deriver.derive(json("0"), json("0"), "Glaucoma");

        assertThat(result).containsOnly(entry(NORMAL_LABEL, 0.0), entry(GLAUCOMA_LABEL, 0.0));
    }

    @Test
    void delegatesFullDistributions() {
        assertThat(deriver.derive(json("{\"Normal\":0.2,\"Glaucoma\":0.8}"), json("0.8"), "Glaucoma"))
                .containsExactly(entry("Normal", 0.2), entry("Glaucoma", 0.8));
        assertThat(deriver.derive(json("\"{\\\"early\\\":0.4,\\\"advanced\\\":\\\"0.1\\\"}\""), null, "early glaucoma"))
                .containsExactly(entry("early", 0.4), entry("advanced", 0.1));
    }

    @Test
    void absentOrUnusableProbabilityYieldsNull() {
        assertThat(deriver.derive(null, json("0.9"), "Glaucoma")).isNull();
        assertThat(deriver.derive(json("null"), null, "normal")).isNull();
        assertThat(deriver.derive(json("\"0.92\""), null, "normal")).isNull();
        assertThat(deriver.derive(json("[0.92]"), null, "normal")).isNull();
    }

    @ParameterizedTest
    @MethodSource("scalarInputs")
    void scalarDerivationAlwaysSumsToOne(double scalar, String prediction) {
        JsonNode raw = DoubleNode.valueOf(scalar);

        Map<String, Double> result = deriver.derive(raw, null, prediction);

        assertThat(result).containsOnlyKeys(NORMAL_LABEL, GLAUCOMA_LABEL);
        assertThat(result.values()).allSatisfy(value -> assertThat(value).isBetween(0.0, 1.0));
        assertThat(result.get(NORMAL_LABEL) + result.get(GLAUCOMA_LABEL)).isCloseTo(1.0, within(1e-6));
    }

    static Stream<Arguments> scalarInputs() {
        return Stream.of(-0.5, 0.0, 0.01, 0.25, 0.5, 0.92, 0.999, 1.0, 1.7, 87.0)
                .flatMap(value -> Stream.of(
                        Arguments.of(value, "Normal"),
                        Arguments.of(value, "Glaucoma"),
                        Arguments.of(value, null)));
    }
}
