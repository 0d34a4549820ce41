package com.demoClinic.diagnosisDemo.diagnosis.util;

import java.util.Locale;

/**
 * Text helpers for model output labels.
 */
public final class LabelText {

    private LabelText() {
    }

    /**
     * Normalizes a raw label for matching: underscores become spaces, runs of
     * whitespace collapse to one space, lower-cased and trimmed.
     * "NPDR_Moderate" becomes "npdr moderate".
     *
     * @param label Raw label, may be null
     * @return Normalized text, or null if the label is null or blank
     */
    public static String normalize(String label) {
        if (label == null) {
            return null;
        }
        String text = label.replace('_', ' ')
                .replaceAll("\\s+", " ")
                .trim()
                .toLowerCase(Locale.ROOT);
        return text.isEmpty() ? null : text;
    }

    /**
     * Upper-cases the first character, leaves the rest untouched.
     */
    public static String capitalizeFirst(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        return text.substring(0, 1).toUpperCase(Locale.ROOT) + text.substring(1);
    }
}
