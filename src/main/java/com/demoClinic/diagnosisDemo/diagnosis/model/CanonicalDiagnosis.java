package com.demoClinic.diagnosisDemo.diagnosis.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * UI-ready diagnosis derived from one {@link RawAnalysisRecord}.
 *
 * Immutable once produced. Re-derivation always starts from a fresh raw record.
 */
@Value
@Builder
public class CanonicalDiagnosis {

    String id;

    String clinicId;

    String patientId;

    /**
     * Null when no doctor has been assigned.
     */
    String doctorId;

    String imageUrl;

    JsonNode imageMetadata;

    /**
     * Human-readable summary, e.g.
     * "Moderate non-proliferative diabetic retinopathy detected | No glaucoma detected".
     */
    String diagnosis;

    /**
     * Headline confidence in [0, 100]: the highest per-disease confidence, rounded.
     */
    int confidence;

    /**
     * Never null; defaults to {@link Severity#NORMAL}.
     */
    Severity severity;

    String analyzedBy;

    boolean reviewedByDoctor;

    String doctorNotes;

    Instant createdAt;

    Instant updatedAt;

    String drPrediction;

    /**
     * Percentage in [0, 100], null if the record had no usable confidence.
     */
    Double drConfidence;

    Map<String, Double> drProbability;

    Integer drSeverityLevel;

    String drDoctorNote;

    String glaucomaPrediction;

    Double glaucomaConfidence;

    /**
     * Full label map, or the derived {Normal, Glaucoma} pair when only a scalar was stored.
     */
    Map<String, Double> glaucomaProbability;

    Integer glaucomaSeverityLevel;

    String glaucomaDoctorNote;

    String riskLevel;

    String status;
}
