package com.demoClinic.diagnosisDemo.diagnosis.util;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Coerces loosely typed JSON values into Java numbers and text.
 *
 * Accepted shapes:
 * - JSON numbers
 * - numeric strings, surrounding whitespace ignored ("0.87", " 87 ")
 * - percentage strings ("87%"), returned as a fraction (0.87)
 *
 * Everything else, including non-finite values, coerces to null.
 */
public final class JsonValueCoercer {

    private JsonValueCoercer() {
    }

    /**
     * Coerces a JSON value to a finite double.
     *
     * @param node Raw JSON value, may be null
     * @return The number, or null if the value is absent or not numeric
     */
    public static Double toDouble(JsonNode node) {
        if (isAbsent(node)) {
            return null;
        }
        if (node.isNumber()) {
            return finiteOrNull(node.doubleValue());
        }
        if (node.isTextual()) {
            return parseDouble(node.textValue());
        }
        return null;
    }

    /**
     * Parses a numeric or percentage string.
     *
     * @param text Raw text, may be null
     * @return The number, or null if the text is blank or not numeric
     */
    public static Double parseDouble(String text) {
        if (text == null) {
            return null;
        }
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        boolean percent = trimmed.endsWith("%");
        if (percent) {
            trimmed = trimmed.substring(0, trimmed.length() - 1).trim();
        }
        try {
            double value = Double.parseDouble(trimmed);
            return finiteOrNull(percent ? value / 100.0 : value);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Coerces a JSON value to an integer. Fractional values are rejected.
     *
     * @param node Raw JSON value, may be null
     * @return The integer, or null if the value is absent, fractional or not numeric
     */
    public static Integer toInteger(JsonNode node) {
        Double value = toDouble(node);
        if (value == null || node.isTextual() && node.textValue().trim().endsWith("%")) {
            return null;
        }
        if (value != Math.rint(value) || value > Integer.MAX_VALUE || value < Integer.MIN_VALUE) {
            return null;
        }
        return value.intValue();
    }

    /**
     * Coerces a JSON scalar to text. Numbers and booleans keep their JSON spelling.
     *
     * @param node Raw JSON value, may be null
     * @return The text, or null if the value is absent, an object or an array
     */
    public static String toText(JsonNode node) {
        if (isAbsent(node) || node.isContainerNode()) {
            return null;
        }
        return node.isTextual() ? node.textValue() : node.asText();
    }

    /**
     * True for Java null, JSON null and missing nodes.
     */
    public static boolean isAbsent(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode();
    }

    private static Double finiteOrNull(double value) {
        return Double.isFinite(value) ? value : null;
    }
}
