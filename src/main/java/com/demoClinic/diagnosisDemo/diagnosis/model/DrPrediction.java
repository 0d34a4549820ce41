package com.demoClinic.diagnosisDemo.diagnosis.model;

import lombok.Builder;
import lombok.Value;

/**
 * A diabetic retinopathy prediction label after classification.
 */
@Value
@Builder
public class DrPrediction {

    DrFinding finding;

    /**
     * Normalized label text: lower-cased, underscores replaced with spaces, trimmed.
     */
    String text;

    /**
     * Severity word for {@link DrFinding#NON_PROLIFERATIVE} (mild, moderate, severe), null if none.
     */
    String severityWord;

    /**
     * Whether the raw label is listed in the known-label catalog.
     */
    boolean recognized;
}
