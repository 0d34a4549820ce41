package com.demoClinic.diagnosisDemo.diagnosis.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Raw AI fundus analysis record as returned by the analysis edge functions
 * (ai_analysis_results table).
 *
 * The same semantic field may arrive in different shapes across records:
 * - confidence: fraction (0.87), percentage (87), numeric string ("0.87", "87%")
 * - probability: object map, JSON-encoded string, single scalar
 * - timestamps: ISO-8601 string with or without zone, epoch millis
 * - labels and status: usually text, occasionally a number or a stray object
 *
 * Those fields are bound as raw JSON trees and interpreted later by the
 * diagnosis services, so binding never fails on a shape mismatch.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class RawAnalysisRecord {

    private String id;

    @JsonProperty("clinic_id")
    private String clinicId;

    @JsonProperty("patient_id")
    private String patientId;

    /**
     * Null when no doctor has been assigned yet.
     */
    @JsonProperty("doctor_id")
    private String doctorId;

    @JsonProperty("analyzed_by")
    private String analyzedBy;

    @JsonProperty("image_url")
    private String imageUrl;

    /**
     * Opaque metadata written by the uploader (size, source, model timings).
     */
    @JsonProperty("image_metadata")
    private JsonNode imageMetadata;

    // Diabetic retinopathy block

    @JsonProperty("dr_prediction")
    private JsonNode drPrediction;

    @JsonProperty("dr_confidence")
    private JsonNode drConfidence;

    @JsonProperty("dr_probability")
    private JsonNode drProbability;

    @JsonProperty("dr_severity_level")
    private JsonNode drSeverityLevel;

    @JsonProperty("dr_doctor_note")
    private String drDoctorNote;

    // Glaucoma block

    @JsonProperty("glaucoma_prediction")
    private JsonNode glaucomaPrediction;

    @JsonProperty("glaucoma_confidence")
    private JsonNode glaucomaConfidence;

    /**
     * Either a full label map or a single probability of the predicted class.
     */
    @JsonProperty("glaucoma_probability")
    private JsonNode glaucomaProbability;

    @JsonProperty("glaucoma_severity_level")
    private JsonNode glaucomaSeverityLevel;

    @JsonProperty("glaucoma_doctor_note")
    private String glaucomaDoctorNote;

    /**
     * Free-text risk indicator: "mild", "moderate", "high", "critical", ...
     */
    @JsonProperty("risk_level")
    private JsonNode riskLevel;

    @JsonProperty("clinical_notes")
    private String clinicalNotes;

    /**
     * Workflow status, e.g. "pending", "completed", "reviewed".
     */
    private JsonNode status;

    @JsonProperty("created_at")
    private JsonNode createdAt;

    @JsonProperty("updated_at")
    private JsonNode updatedAt;
}
