package com.demoClinic.diagnosisDemo.diagnosis.service;

import com.demoClinic.diagnosisDemo.diagnosis.model.Severity;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * Maps the free-text risk level of a record to a {@link Severity} tier.
 *
 * Matching is case-insensitive on the trimmed text:
 * - "mild" -> MILD
 * - "moderate" -> MODERATE
 * - "severe", "high", "critical" -> SEVERE
 * - anything else, including null -> NORMAL
 */
@Service
public class SeverityClassifier {

    public Severity classify(String riskLevel) {
        if (riskLevel == null) {
            return Severity.NORMAL;
        }
        switch (riskLevel.trim().toLowerCase(Locale.ROOT)) {
            case "mild":
                return Severity.MILD;
            case "moderate":
                return Severity.MODERATE;
            case "severe":
            case "high":
            case "critical":
                return Severity.SEVERE;
            default:
                return Severity.NORMAL;
        }
    }
}
