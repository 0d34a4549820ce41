package com.demoClinic.diagnosisDemo.diagnosis.service;

import com.demoClinic.diagnosisDemo.diagnosis.model.RawAnalysisRecord;
import com.demoClinic.diagnosisDemo.diagnosis.model.RawProbability;
import com.demoClinic.diagnosisDemo.diagnosis.util.JsonValueCoercer;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Produces the glaucoma probability mapping for a record.
 *
 * Some records carry a full label map, others only the probability of the predicted
 * class. In the scalar case a two-class {Normal, Glaucoma} distribution is synthesized:
 * - predicted class probability: the scalar
 * - other class: the record's glaucoma confidence if present, otherwise 1 - scalar
 * Both are clamped to [0, 1] and rescaled to sum to 1 (both 0 if the sum is 0).
 */
@Service
public class GlaucomaProbabilityDeriver {

    public static final String NORMAL_LABEL = "Normal";
    public static final String GLAUCOMA_LABEL = "Glaucoma";

    private final ProbabilityNormalizer probabilityNormalizer;
    private final ConfidenceNormalizer confidenceNormalizer;

    public GlaucomaProbabilityDeriver(ProbabilityNormalizer probabilityNormalizer,
                                      ConfidenceNormalizer confidenceNormalizer) {
        this.probabilityNormalizer = probabilityNormalizer;
        this.confidenceNormalizer = confidenceNormalizer;
    }

    /**
     * Derives the glaucoma probability mapping from a raw record.
     *
     * @param record Raw analysis record
     * @return Label -> probability mapping, or null if nothing usable was stored
     */
    public Map<String, Double> derive(RawAnalysisRecord record) {
        return derive(record.getGlaucomaProbability(), record.getGlaucomaConfidence(),
                JsonValueCoercer.toText(record.getGlaucomaPrediction()));
    }

    /**
     * Derives the glaucoma probability mapping.
     *
     * @param rawProbability Raw probability field (map, JSON string or scalar), may be null
     * @param rawConfidence Raw glaucoma confidence, fraction or percentage, may be null
     * @param prediction Glaucoma prediction label, may be null
     * @return Label -> probability mapping, or null if nothing usable was stored
     */
    public Map<String, Double> derive(JsonNode rawProbability, JsonNode rawConfidence, String prediction) {
        RawProbability probability = probabilityNormalizer.parse(rawProbability);
        switch (probability.getKind()) {
            case DISTRIBUTION:
                return probability.getDistribution();
            case SCALAR:
                return twoClassDistribution(probability.getScalar(), rawConfidence, prediction);
            default:
                return null;
        }
    }

    private Map<String, Double> twoClassDistribution(double predicted, JsonNode rawConfidence, String prediction) {
        Double confidencePercent = confidenceNormalizer.normalize(rawConfidence);
        double pPredicted = clamp(predicted);
        double pOther = confidencePercent != null
                ? clamp(confidencePercent / ConfidenceNormalizer.MAX_PERCENT)
                : clamp(1 - predicted);

        double sum = pPredicted + pOther;
        double normPredicted = sum > 0 ? pPredicted / sum : 0;
        double normOther = sum > 0 ? pOther / sum : 0;

        Map<String, Double> distribution = new LinkedHashMap<>();
        if (isNormalPrediction(prediction)) {
            distribution.put(NORMAL_LABEL, normPredicted);
            distribution.put(GLAUCOMA_LABEL, normOther);
        } else {
            distribution.put(NORMAL_LABEL, normOther);
            distribution.put(GLAUCOMA_LABEL, normPredicted);
        }
        return Collections.unmodifiableMap(distribution);
    }

    private static boolean isNormalPrediction(String prediction) {
        return prediction != null && prediction.toLowerCase(Locale.ROOT).contains("normal");
    }

    private static double clamp(double value) {
        return Math.min(Math.max(value, 0.0), 1.0);
    }
}
