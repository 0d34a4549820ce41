package com.demoClinic.diagnosisDemo.gateway.dto;

import com.demoClinic.diagnosisDemo.diagnosis.model.RawAnalysisRecord;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Envelope returned by the list-doctor-analysis edge function.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class ListAnalysesResponse {

    private boolean success;

    private Integer count;

    private Integer limit;

    private Integer offset;

    @NotNull(message = "analyses cannot be null")
    private List<RawAnalysisRecord> analyses;
}
