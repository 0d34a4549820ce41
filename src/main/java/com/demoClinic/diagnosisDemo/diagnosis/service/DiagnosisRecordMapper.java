package com.demoClinic.diagnosisDemo.diagnosis.service;

import com.demoClinic.diagnosisDemo.diagnosis.model.CanonicalDiagnosis;
import com.demoClinic.diagnosisDemo.diagnosis.model.RawAnalysisRecord;
import com.demoClinic.diagnosisDemo.diagnosis.model.Severity;
import com.demoClinic.diagnosisDemo.diagnosis.util.JsonValueCoercer;
import com.demoClinic.diagnosisDemo.diagnosis.util.TimestampParser;
import com.demoClinic.diagnosisDemo.util.PatientIdMasker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Objects;

/**
 * Derives the canonical, UI-ready diagnosis from a raw AI analysis record.
 *
 * Pure function of its input: no I/O, no state retained between calls, safe to
 * call concurrently. Malformed or missing fields degrade to their defaults
 * (null, {@link Severity#NORMAL}, the fallback summary label) instead of failing.
 */
@Slf4j
@Service
public class DiagnosisRecordMapper {

    public static final String DEFAULT_ANALYZED_BY = "AI Model";

    private final ConfidenceNormalizer confidenceNormalizer;
    private final ProbabilityNormalizer probabilityNormalizer;
    private final GlaucomaProbabilityDeriver glaucomaProbabilityDeriver;
    private final SeverityClassifier severityClassifier;
    private final DiagnosisMessageFormatter messageFormatter;
    private final ConfidenceAggregator confidenceAggregator;
    private final String analyzedByDefault;

    public DiagnosisRecordMapper(
            ConfidenceNormalizer confidenceNormalizer,
            ProbabilityNormalizer probabilityNormalizer,
            GlaucomaProbabilityDeriver glaucomaProbabilityDeriver,
            SeverityClassifier severityClassifier,
            DiagnosisMessageFormatter messageFormatter,
            ConfidenceAggregator confidenceAggregator,
            @Value("${diagnosis.analyzed-by-default:" + DEFAULT_ANALYZED_BY + "}") String analyzedByDefault) {
        this.confidenceNormalizer = confidenceNormalizer;
        this.probabilityNormalizer = probabilityNormalizer;
        this.glaucomaProbabilityDeriver = glaucomaProbabilityDeriver;
        this.severityClassifier = severityClassifier;
        this.messageFormatter = messageFormatter;
        this.confidenceAggregator = confidenceAggregator;
        this.analyzedByDefault = analyzedByDefault;
    }

    /**
     * Derives the canonical diagnosis for one raw record.
     *
     * @param raw Raw analysis record as received from upstream
     * @return Canonical diagnosis, never null
     */
    public CanonicalDiagnosis deriveCanonicalDiagnosis(RawAnalysisRecord raw) {
        Objects.requireNonNull(raw, "raw analysis record");

        String drPrediction = JsonValueCoercer.toText(raw.getDrPrediction());
        String glaucomaPrediction = JsonValueCoercer.toText(raw.getGlaucomaPrediction());
        String riskLevel = JsonValueCoercer.toText(raw.getRiskLevel());
        String status = JsonValueCoercer.toText(raw.getStatus());

        Double drConfidence = confidenceNormalizer.toPercentage(raw.getDrConfidence());
        Double glaucomaConfidence = confidenceNormalizer.toPercentage(raw.getGlaucomaConfidence());
        int confidence = confidenceAggregator.aggregate(drConfidence, glaucomaConfidence);
        Severity severity = severityClassifier.classify(riskLevel);
        String diagnosis = messageFormatter.summarize(drPrediction, glaucomaPrediction);

        CanonicalDiagnosis result = CanonicalDiagnosis.builder()
                .id(raw.getId())
                .clinicId(raw.getClinicId())
                .patientId(raw.getPatientId())
                .doctorId(raw.getDoctorId())
                .imageUrl(raw.getImageUrl())
                .imageMetadata(JsonValueCoercer.isAbsent(raw.getImageMetadata()) ? null : raw.getImageMetadata())
                .diagnosis(diagnosis)
                .confidence(confidence)
                .severity(severity)
                .analyzedBy(isBlank(raw.getAnalyzedBy()) ? analyzedByDefault : raw.getAnalyzedBy())
                .reviewedByDoctor(isReviewed(status))
                .doctorNotes(isBlank(raw.getClinicalNotes()) ? null : raw.getClinicalNotes())
                .createdAt(TimestampParser.parse(raw.getCreatedAt()))
                .updatedAt(TimestampParser.parse(raw.getUpdatedAt()))
                .drPrediction(drPrediction)
                .drConfidence(drConfidence)
                .drProbability(probabilityNormalizer.normalize(raw.getDrProbability()))
                .drSeverityLevel(JsonValueCoercer.toInteger(raw.getDrSeverityLevel()))
                .drDoctorNote(raw.getDrDoctorNote())
                .glaucomaPrediction(glaucomaPrediction)
                .glaucomaConfidence(glaucomaConfidence)
                .glaucomaProbability(glaucomaProbabilityDeriver.derive(raw))
                .glaucomaSeverityLevel(JsonValueCoercer.toInteger(raw.getGlaucomaSeverityLevel()))
                .glaucomaDoctorNote(raw.getGlaucomaDoctorNote())
                .riskLevel(riskLevel)
                .status(status)
                .build();

        log.debug("Derived diagnosis - analysisId: {}, patientId: {}, severity: {}, confidence: {}",
                raw.getId(), PatientIdMasker.mask(raw.getPatientId()), severity, confidence);
        return result;
    }

    private static boolean isReviewed(String status) {
        return status != null && status.toLowerCase(Locale.ROOT).contains("review");
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
