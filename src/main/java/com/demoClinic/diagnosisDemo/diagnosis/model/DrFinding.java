package com.demoClinic.diagnosisDemo.diagnosis.model;

/**
 * Closed set of diabetic retinopathy findings recognized in model output labels.
 */
public enum DrFinding {

    /** "No_DR", "none", "negative", "normal". */
    NONE,

    /** NPDR, optionally qualified by mild / moderate / severe. */
    NON_PROLIFERATIVE,

    /** PDR / proliferative. */
    PROLIFERATIVE,

    /** Background retinopathy (older grading scales). */
    BACKGROUND,

    /** Label already names diabetic retinopathy, e.g. "Mild diabetic retinopathy". */
    DESCRIBED,

    /** Anything else, typically a bare grade such as "Mild" or "Severe". */
    GRADED
}
