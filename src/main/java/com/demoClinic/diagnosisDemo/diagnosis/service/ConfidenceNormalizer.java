package com.demoClinic.diagnosisDemo.diagnosis.service;

import com.demoClinic.diagnosisDemo.diagnosis.util.JsonValueCoercer;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Rescales model confidence values onto a 0-100 percentage scale.
 *
 * Upstream records mix fractions (0.87) and percentages (87). A value of at most 1
 * is read as a fraction; anything above is taken as already being a percentage.
 * Exactly 1 is ambiguous (100% or 1%) and is read as a fraction.
 */
@Slf4j
@Service
public class ConfidenceNormalizer {

    static final double MAX_PERCENT = 100.0;

    /**
     * Rescales a confidence value. Out-of-range input is not clamped.
     *
     * @param value Raw confidence, may be null
     * @return Percentage, or null if the value is null
     */
    public Double normalize(Double value) {
        if (value == null) {
            return null;
        }
        return value <= 1 ? value * 100 : value;
    }

    /**
     * Coerces a raw JSON confidence (number, numeric or percentage string) and rescales it.
     *
     * @param raw Raw JSON value, may be null
     * @return Percentage, or null if the value is absent or not numeric
     */
    public Double normalize(JsonNode raw) {
        Double value = JsonValueCoercer.toDouble(raw);
        if (value == null && !JsonValueCoercer.isAbsent(raw)) {
            log.debug("Ignoring non-numeric confidence value: {}", raw);
        }
        return normalize(value);
    }

    /**
     * Rescales a raw JSON confidence and clamps it into [0, 100].
     *
     * @param raw Raw JSON value, may be null
     * @return Percentage in [0, 100], or null if the value is absent or not numeric
     */
    public Double toPercentage(JsonNode raw) {
        Double percent = normalize(raw);
        if (percent == null) {
            return null;
        }
        return Math.min(Math.max(percent, 0.0), MAX_PERCENT);
    }
}
