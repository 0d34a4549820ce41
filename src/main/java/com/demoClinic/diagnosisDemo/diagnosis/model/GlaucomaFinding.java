package com.demoClinic.diagnosisDemo.diagnosis.model;

/**
 * Closed set of glaucoma findings recognized in model output labels.
 */
public enum GlaucomaFinding {

    NONE,

    /** Glaucoma suspect; needs further evaluation. */
    SUSPECT,

    /** Elevated risk without a positive finding. */
    RISK,

    /** Positive finding, optionally qualified ("early", "advanced", ...). */
    DETECTED
}
