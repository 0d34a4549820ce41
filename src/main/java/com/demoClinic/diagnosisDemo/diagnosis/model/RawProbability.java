package com.demoClinic.diagnosisDemo.diagnosis.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Probability field after the parsing step.
 *
 * Exactly one shape is populated:
 * - ABSENT: nothing usable (null, invalid JSON, array, empty or all non-numeric map)
 * - DISTRIBUTION: label -> probability, finite values only, never empty
 * - SCALAR: a single number, the probability of the predicted class
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RawProbability {

    private static final RawProbability ABSENT = new RawProbability(Kind.ABSENT, null, null);

    public enum Kind {
        ABSENT,
        DISTRIBUTION,
        SCALAR
    }

    Kind kind;

    Map<String, Double> distribution;

    Double scalar;

    public static RawProbability absent() {
        return ABSENT;
    }

    public static RawProbability distribution(Map<String, Double> distribution) {
        if (distribution == null || distribution.isEmpty()) {
            return ABSENT;
        }
        return new RawProbability(Kind.DISTRIBUTION,
                Collections.unmodifiableMap(new LinkedHashMap<>(distribution)), null);
    }

    public static RawProbability scalar(double value) {
        if (!Double.isFinite(value)) {
            return ABSENT;
        }
        return new RawProbability(Kind.SCALAR, null, value);
    }

    public boolean isAbsent() {
        return kind == Kind.ABSENT;
    }
}
