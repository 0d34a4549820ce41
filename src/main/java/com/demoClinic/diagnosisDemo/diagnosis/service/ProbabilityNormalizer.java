package com.demoClinic.diagnosisDemo.diagnosis.service;

import com.demoClinic.diagnosisDemo.diagnosis.model.RawProbability;
import com.demoClinic.diagnosisDemo.diagnosis.util.JsonValueCoercer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parses probability fields into a clean label -> probability mapping.
 *
 * Accepts a JSON object, a string containing a JSON object, or a bare number
 * (kept as a scalar for glaucoma derivation). Entries whose value does not coerce
 * to a finite number are dropped. Values are not renormalized.
 */
@Slf4j
@Service
public class ProbabilityNormalizer {

    private final ObjectMapper objectMapper;

    public ProbabilityNormalizer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Parses a raw probability field into its tagged shape.
     *
     * @param raw Raw JSON value, may be null
     * @return DISTRIBUTION for a usable map, SCALAR for a bare number, ABSENT otherwise
     */
    public RawProbability parse(JsonNode raw) {
        if (JsonValueCoercer.isAbsent(raw)) {
            return RawProbability.absent();
        }
        if (raw.isObject()) {
            return RawProbability.distribution(numericEntries(raw));
        }
        if (raw.isNumber()) {
            return RawProbability.scalar(raw.doubleValue());
        }
        if (raw.isTextual()) {
            return parseEncoded(raw.textValue());
        }
        log.debug("Ignoring probability value of type {}", raw.getNodeType());
        return RawProbability.absent();
    }

    /**
     * Normalizes a probability field into a label -> probability mapping.
     *
     * @param raw Raw JSON value, may be null
     * @return Non-empty mapping with finite values only, or null
     */
    public Map<String, Double> normalize(JsonNode raw) {
        return distributionOrNull(parse(raw));
    }

    private RawProbability parseEncoded(String text) {
        JsonNode parsed;
        try {
            parsed = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            log.debug("Probability string is not valid JSON: {}", e.getOriginalMessage());
            return RawProbability.absent();
        }
        if (parsed == null || !parsed.isObject()) {
            return RawProbability.absent();
        }
        return RawProbability.distribution(numericEntries(parsed));
    }

    private Map<String, Double> numericEntries(JsonNode object) {
        Map<String, Double> entries = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            Double value = JsonValueCoercer.toDouble(field.getValue());
            if (value != null) {
                entries.put(field.getKey(), value);
            }
        }
        return entries;
    }

    private static Map<String, Double> distributionOrNull(RawProbability probability) {
        return probability.getKind() == RawProbability.Kind.DISTRIBUTION ? probability.getDistribution() : null;
    }
}
