package com.demoClinic.diagnosisDemo.gateway.controller;

import com.demoClinic.diagnosisDemo.diagnosis.model.CanonicalDiagnosis;
import com.demoClinic.diagnosisDemo.diagnosis.model.RawAnalysisRecord;
import com.demoClinic.diagnosisDemo.gateway.dto.AnalysisByIdResponse;
import com.demoClinic.diagnosisDemo.gateway.dto.DiagnosisListResponse;
import com.demoClinic.diagnosisDemo.gateway.dto.ListAnalysesResponse;
import com.demoClinic.diagnosisDemo.gateway.service.AnalysisGatewayService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Diagnosis REST controller - thin HTTP layer over the diagnosis derivation.
 *
 * The caller supplies records it has already fetched from the analysis edge functions;
 * this controller performs no upstream calls.
 */
@RestController
@RequestMapping("/api/v1/diagnoses")
@CrossOrigin(origins = {"http://localhost:5173", "http://localhost:3000"})
@RequiredArgsConstructor
public class DiagnosisController {

    private final AnalysisGatewayService analysisGatewayService;

    /**
     * Derives the canonical diagnosis for one raw record.
     */
    @PostMapping("/derive")
    public ResponseEntity<CanonicalDiagnosis> derive(@RequestBody RawAnalysisRecord record) {
        return ResponseEntity.ok(analysisGatewayService.derive(record));
    }

    /**
     * Derives canonical diagnoses for a list-doctor-analysis envelope.
     */
    @PostMapping("/derive-list")
    public ResponseEntity<DiagnosisListResponse> deriveList(@Valid @RequestBody ListAnalysesResponse response) {
        return ResponseEntity.ok(analysisGatewayService.deriveList(response));
    }

    /**
     * Derives the canonical diagnosis for a get-analysis-by-id envelope.
     */
    @PostMapping("/derive-detail")
    public ResponseEntity<CanonicalDiagnosis> deriveDetail(@RequestBody AnalysisByIdResponse response) {
        return ResponseEntity.ok(analysisGatewayService.deriveDetail(response));
    }
}
