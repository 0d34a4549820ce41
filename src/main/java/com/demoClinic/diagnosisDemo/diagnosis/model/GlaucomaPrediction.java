package com.demoClinic.diagnosisDemo.diagnosis.model;

import lombok.Builder;
import lombok.Value;

/**
 * A glaucoma prediction label after classification.
 */
@Value
@Builder
public class GlaucomaPrediction {

    GlaucomaFinding finding;

    /**
     * Normalized label text with the word "glaucoma" removed, e.g. "early" for "Early_Glaucoma".
     * Empty when nothing remains.
     */
    String qualifier;

    boolean recognized;
}
