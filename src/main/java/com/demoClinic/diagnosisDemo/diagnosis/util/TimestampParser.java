package com.demoClinic.diagnosisDemo.diagnosis.util;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.regex.Pattern;

/**
 * Lenient timestamp parsing for upstream record dates.
 *
 * Supported inputs:
 * - ISO-8601 offset date-time ("2024-05-01T10:15:30Z", "2024-05-01T10:15:30.123+02:00")
 * - Postgres style ("2024-05-01 10:15:30.123456+00")
 * - ISO local date-time without zone, read as UTC
 * - ISO date, read as start of day UTC
 * - epoch milliseconds as a JSON number
 *
 * Unparsable input yields null; nothing is thrown.
 */
@Slf4j
public final class TimestampParser {

    private static final Pattern SPACE_SEPARATED = Pattern.compile("^(\\d{4}-\\d{2}-\\d{2}) (\\d{2}:.*)$");
    private static final Pattern SHORT_OFFSET = Pattern.compile("([+-]\\d{2})$");
    private static final Pattern COMPACT_OFFSET = Pattern.compile("([+-]\\d{2})(\\d{2})$");

    private TimestampParser() {
    }

    public static Instant parse(JsonNode node) {
        if (JsonValueCoercer.isAbsent(node)) {
            return null;
        }
        if (node.isIntegralNumber()) {
            return Instant.ofEpochMilli(node.longValue());
        }
        if (node.isTextual()) {
            return parse(node.textValue());
        }
        log.debug("Unsupported timestamp value type: {}", node.getNodeType());
        return null;
    }

    public static Instant parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String text = SPACE_SEPARATED.matcher(value.trim()).replaceFirst("$1T$2");

        if (text.length() > 10 && text.indexOf('T') == 10) {
            String withOffset = COMPACT_OFFSET.matcher(text).replaceFirst("$1:$2");
            if (SHORT_OFFSET.matcher(withOffset).find()) {
                withOffset = withOffset + ":00";
            }
            try {
                return OffsetDateTime.parse(withOffset).toInstant();
            } catch (DateTimeException e) {
                // no offset, try local date-time
            }
            try {
                return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
            } catch (DateTimeException e) {
                log.debug("Unparsable timestamp: {}", value);
                return null;
            }
        }

        try {
            return LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant();
        } catch (DateTimeException e) {
            log.debug("Unparsable timestamp: {}", value);
            return null;
        }
    }
}
