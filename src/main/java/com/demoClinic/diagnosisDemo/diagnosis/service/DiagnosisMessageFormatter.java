package com.demoClinic.diagnosisDemo.diagnosis.service;

import com.demoClinic.diagnosisDemo.diagnosis.model.DrPrediction;
import com.demoClinic.diagnosisDemo.diagnosis.model.GlaucomaPrediction;
import com.demoClinic.diagnosisDemo.diagnosis.util.LabelText;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders the human-readable diagnosis summary of an analysis.
 *
 * Each disease contributes one sentence built from its classified prediction;
 * sentences are joined with " | ". When neither disease has a prediction the
 * fallback label is returned.
 */
@Service
public class DiagnosisMessageFormatter {

    public static final String SEPARATOR = " | ";
    public static final String DEFAULT_FALLBACK_LABEL = "Analysis";

    private final PredictionLabelClassifier classifier;
    private final String fallbackLabel;

    public DiagnosisMessageFormatter(
            PredictionLabelClassifier classifier,
            @Value("${diagnosis.summary.fallback-label:" + DEFAULT_FALLBACK_LABEL + "}") String fallbackLabel) {
        this.classifier = classifier;
        this.fallbackLabel = fallbackLabel;
    }

    /**
     * Builds the diagnosis summary from both raw prediction labels.
     *
     * @param drLabel Raw DR prediction, may be null
     * @param glaucomaLabel Raw glaucoma prediction, may be null
     * @return Joined sentences, or the fallback label if neither label is usable
     */
    public String summarize(String drLabel, String glaucomaLabel) {
        List<String> parts = new ArrayList<>(2);
        String drMessage = formatDr(drLabel);
        if (drMessage != null) {
            parts.add(drMessage);
        }
        String glaucomaMessage = formatGlaucoma(glaucomaLabel);
        if (glaucomaMessage != null) {
            parts.add(glaucomaMessage);
        }
        return parts.isEmpty() ? fallbackLabel : String.join(SEPARATOR, parts);
    }

    public String formatDr(String label) {
        return describe(classifier.classifyDr(label));
    }

    public String formatGlaucoma(String label) {
        return describe(classifier.classifyGlaucoma(label));
    }

    /**
     * @return Sentence for the prediction, null if the prediction is null
     */
    public String describe(DrPrediction prediction) {
        if (prediction == null) {
            return null;
        }
        switch (prediction.getFinding()) {
            case NONE:
                return "No diabetic retinopathy detected";
            case PROLIFERATIVE:
                return "Proliferative diabetic retinopathy detected";
            case NON_PROLIFERATIVE:
                String severity = prediction.getSeverityWord() != null
                        ? LabelText.capitalizeFirst(prediction.getSeverityWord()) + " "
                        : "";
                return LabelText.capitalizeFirst(severity + "non-proliferative diabetic retinopathy detected");
            case BACKGROUND:
                return "Background diabetic retinopathy detected";
            case DESCRIBED:
                return LabelText.capitalizeFirst(prediction.getText());
            default:
                return LabelText.capitalizeFirst(prediction.getText()) + " diabetic retinopathy detected";
        }
    }

    /**
     * @return Sentence for the prediction, null if the prediction is null
     */
    public String describe(GlaucomaPrediction prediction) {
        if (prediction == null) {
            return null;
        }
        switch (prediction.getFinding()) {
            case NONE:
                return "No glaucoma detected";
            case SUSPECT:
                return "Glaucoma suspect – further evaluation recommended";
            case RISK:
                return "Glaucoma risk detected";
            default:
                String qualifier = prediction.getQualifier();
                return qualifier == null || qualifier.isEmpty()
                        ? "Glaucoma detected"
                        : LabelText.capitalizeFirst(qualifier) + " glaucoma detected";
        }
    }
}
