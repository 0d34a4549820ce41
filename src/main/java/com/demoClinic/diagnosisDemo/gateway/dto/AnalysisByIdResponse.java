package com.demoClinic.diagnosisDemo.gateway.dto;

import com.demoClinic.diagnosisDemo.diagnosis.model.RawAnalysisRecord;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Envelope returned by the get-analysis-by-id edge function.
 * Either {success: true, analysis: {...}} or {error: "...", context: "..."}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class AnalysisByIdResponse {

    private Boolean success;

    private RawAnalysisRecord analysis;

    private String error;

    private String context;
}
