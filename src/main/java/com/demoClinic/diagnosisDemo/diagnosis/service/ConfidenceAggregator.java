package com.demoClinic.diagnosisDemo.diagnosis.service;

import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.Collection;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Reduces per-disease confidences to the headline confidence of an analysis.
 *
 * The headline is the highest available confidence, so a single confident finding
 * is not diluted by a weaker model output.
 */
@Service
public class ConfidenceAggregator {

    /**
     * @param drConfidence Normalized DR confidence (0-100), may be null
     * @param glaucomaConfidence Normalized glaucoma confidence (0-100), may be null
     * @return Rounded maximum of the non-null values, 0 if both are null
     */
    public int aggregate(Double drConfidence, Double glaucomaConfidence) {
        return aggregate(Arrays.asList(drConfidence, glaucomaConfidence));
    }

    /**
     * @param confidences Normalized confidences (0-100), null elements ignored
     * @return Rounded maximum of the non-null values, 0 if there are none
     */
    public int aggregate(Collection<Double> confidences) {
        OptionalDouble max = confidences.stream()
                .filter(Objects::nonNull)
                .mapToDouble(Double::doubleValue)
                .max();
        return max.isPresent() ? (int) Math.round(max.getAsDouble()) : 0;
    }
}
