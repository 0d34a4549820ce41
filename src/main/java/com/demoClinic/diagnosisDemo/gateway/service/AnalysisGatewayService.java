package com.demoClinic.diagnosisDemo.gateway.service;

import com.demoClinic.diagnosisDemo.diagnosis.model.CanonicalDiagnosis;
import com.demoClinic.diagnosisDemo.diagnosis.model.RawAnalysisRecord;
import com.demoClinic.diagnosisDemo.diagnosis.service.DiagnosisRecordMapper;
import com.demoClinic.diagnosisDemo.gateway.dto.AnalysisByIdResponse;
import com.demoClinic.diagnosisDemo.gateway.dto.DiagnosisListResponse;
import com.demoClinic.diagnosisDemo.gateway.dto.ListAnalysesResponse;
import com.demoClinic.diagnosisDemo.gateway.exception.UpstreamResponseException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Gateway service - unwraps analysis envelopes and hands each raw record to the
 * {@link DiagnosisRecordMapper}.
 *
 * Responsibilities:
 * - Reject envelopes that report an upstream failure
 * - Derive one canonical diagnosis per raw record, preserving upstream order
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnalysisGatewayService {

    private final DiagnosisRecordMapper diagnosisRecordMapper;

    /**
     * Derives the canonical diagnosis for a single raw record.
     */
    public CanonicalDiagnosis derive(RawAnalysisRecord record) {
        return diagnosisRecordMapper.deriveCanonicalDiagnosis(record);
    }

    /**
     * Derives canonical diagnoses for a list envelope.
     *
     * @param response Envelope from the list edge function
     * @return Diagnoses in upstream order
     * @throws UpstreamResponseException if the envelope reports failure
     */
    public DiagnosisListResponse deriveList(ListAnalysesResponse response) {
        if (!response.isSuccess()) {
            log.warn("List envelope reported failure - count: {}", response.getCount());
            throw new UpstreamResponseException("Failed to fetch analyses");
        }

        List<CanonicalDiagnosis> diagnoses = new ArrayList<>(response.getAnalyses().size());
        for (RawAnalysisRecord record : response.getAnalyses()) {
            if (record == null) {
                log.warn("Skipping null analysis record in list envelope");
                continue;
            }
            diagnoses.add(diagnosisRecordMapper.deriveCanonicalDiagnosis(record));
        }

        log.info("Derived {} diagnoses from list envelope - limit: {}, offset: {}",
                diagnoses.size(), response.getLimit(), response.getOffset());

        return DiagnosisListResponse.builder()
                .count(diagnoses.size())
                .limit(response.getLimit())
                .offset(response.getOffset())
                .diagnoses(diagnoses)
                .build();
    }

    /**
     * Derives the canonical diagnosis for a by-id envelope.
     *
     * @param response Envelope from the get-analysis-by-id edge function
     * @return Canonical diagnosis
     * @throws UpstreamResponseException if the envelope carries an error or no record
     */
    public CanonicalDiagnosis deriveDetail(AnalysisByIdResponse response) {
        if (response.getError() != null) {
            log.warn("Detail envelope reported error: {} (context: {})", response.getError(), response.getContext());
            throw new UpstreamResponseException(response.getError());
        }
        if (Boolean.FALSE.equals(response.getSuccess()) || response.getAnalysis() == null) {
            throw new UpstreamResponseException("Analysis envelope contains no record");
        }
        return diagnosisRecordMapper.deriveCanonicalDiagnosis(response.getAnalysis());
    }
}
