package com.demoClinic.diagnosisDemo.gateway.dto;

import com.demoClinic.diagnosisDemo.diagnosis.model.CanonicalDiagnosis;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Canonical diagnoses for a page of analyses, in upstream order.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DiagnosisListResponse {

    private int count;

    private Integer limit;

    private Integer offset;

    private List<CanonicalDiagnosis> diagnoses;
}
