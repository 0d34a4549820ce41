package com.demoClinic.diagnosisDemo.diagnosis.service;

import com.demoClinic.diagnosisDemo.diagnosis.model.DrFinding;
import com.demoClinic.diagnosisDemo.diagnosis.model.DrPrediction;
import com.demoClinic.diagnosisDemo.diagnosis.model.GlaucomaFinding;
import com.demoClinic.diagnosisDemo.diagnosis.model.GlaucomaPrediction;
import com.demoClinic.diagnosisDemo.diagnosis.util.LabelText;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies free-text prediction labels into closed finding enums.
 *
 * Labels are normalized first ("NPDR_Moderate" -> "npdr moderate"), then matched in order:
 *
 * Both diseases:
 * - starts with no / none / negative, contains "no ", or is exactly "normal" -> NONE
 *   (a plain prefix, so "non-proliferative ..." and "normal ..." labels read as NONE)
 *
 * Diabetic retinopathy:
 * - npdr / non-proliferative (not leading) -> NON_PROLIFERATIVE, with the first mild / moderate / severe word
 * - pdr / proliferative -> PROLIFERATIVE
 * - background -> BACKGROUND
 * - contains both "diabetic" and "retinopathy" -> DESCRIBED
 * - otherwise -> GRADED
 *
 * Glaucoma (after removing the word "glaucoma"):
 * - starts with "suspect" -> SUSPECT
 * - contains "risk" -> RISK
 * - otherwise -> DETECTED, the remaining text kept as qualifier
 *
 * Labels missing from the {@link PredictionLabelCatalog} are still classified but logged,
 * so label drift in the inference service shows up in the logs.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PredictionLabelClassifier {

    private static final Pattern NONE_PREFIX = Pattern.compile("^(no|none|negative)");
    private static final String NO_WORD = "no ";
    private static final Pattern NON_PROLIFERATIVE = Pattern.compile("npdr|non.?proliferative");
    private static final Pattern PROLIFERATIVE = Pattern.compile("pdr|proliferative");
    private static final Pattern SEVERITY_WORD = Pattern.compile("mild|moderate|severe");
    private static final String GLAUCOMA_WORD = "glaucoma";

    private final PredictionLabelCatalog catalog;

    /**
     * Classifies a diabetic retinopathy prediction label.
     *
     * @param label Raw label, may be null
     * @return Classified prediction, or null if the label is null or blank
     */
    public DrPrediction classifyDr(String label) {
        String text = LabelText.normalize(label);
        if (text == null) {
            return null;
        }
        DrPrediction.DrPredictionBuilder builder = DrPrediction.builder()
                .text(text)
                .recognized(catalog.isKnownDrLabel(text));

        if (isNone(text)) {
            builder.finding(DrFinding.NONE);
        } else if (NON_PROLIFERATIVE.matcher(text).find()) {
            Matcher severity = SEVERITY_WORD.matcher(text);
            builder.finding(DrFinding.NON_PROLIFERATIVE)
                    .severityWord(severity.find() ? severity.group() : null);
        } else if (PROLIFERATIVE.matcher(text).find()) {
            builder.finding(DrFinding.PROLIFERATIVE);
        } else if (text.contains("background")) {
            builder.finding(DrFinding.BACKGROUND);
        } else if (text.contains("diabetic") && text.contains("retinopathy")) {
            builder.finding(DrFinding.DESCRIBED);
        } else {
            builder.finding(DrFinding.GRADED);
        }

        DrPrediction prediction = builder.build();
        if (!prediction.isRecognized()) {
            log.warn("Unrecognized DR prediction label '{}', classified as {}", label, prediction.getFinding());
        }
        return prediction;
    }

    /**
     * Classifies a glaucoma prediction label.
     *
     * @param label Raw label, may be null
     * @return Classified prediction, or null if the label is null or blank
     */
    public GlaucomaPrediction classifyGlaucoma(String label) {
        String text = LabelText.normalize(label);
        if (text == null) {
            return null;
        }
        String qualifier = text.replace(GLAUCOMA_WORD, "").replaceAll("\\s+", " ").trim();
        GlaucomaPrediction.GlaucomaPredictionBuilder builder = GlaucomaPrediction.builder()
                .qualifier(qualifier)
                .recognized(catalog.isKnownGlaucomaLabel(text));

        if (isNone(text)) {
            builder.finding(GlaucomaFinding.NONE);
        } else if (qualifier.startsWith("suspect")) {
            builder.finding(GlaucomaFinding.SUSPECT);
        } else if (qualifier.contains("risk")) {
            builder.finding(GlaucomaFinding.RISK);
        } else {
            builder.finding(GlaucomaFinding.DETECTED);
        }

        GlaucomaPrediction prediction = builder.build();
        if (!prediction.isRecognized()) {
            log.warn("Unrecognized glaucoma prediction label '{}', classified as {}", label, prediction.getFinding());
        }
        return prediction;
    }

    private static boolean isNone(String text) {
        return NONE_PREFIX.matcher(text).find()
                || text.contains(NO_WORD)
                || text.equals("normal");
    }
}
