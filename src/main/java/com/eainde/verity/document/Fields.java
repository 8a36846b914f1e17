package com.eainde.verity.document;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Alias-aware lookups over a raw extracted record.
 */
final class Fields {

    private Fields() {
    }

    /** First non-blank value among {@code aliases}, as text. */
    static String text(Map<String, Object> raw, String... aliases) {
        for (String alias : aliases) {
            Object value = raw.get(alias);
            if (value instanceof List<?> list && !list.isEmpty()) {
                value = list.get(0);
            }
            if (value != null && !String.valueOf(value).isBlank()) {
                return String.valueOf(value).trim();
            }
        }
        return null;
    }

    /** First value among {@code aliases} that reads as a number. */
    static Double number(Map<String, Object> raw, String... aliases) {
        for (String alias : aliases) {
            Object value = raw.get(alias);
            if (value instanceof Number n) {
                return n.doubleValue();
            }
            Double parsed = value instanceof String s ? parse(s) : null;
            if (parsed != null) {
                return parsed;
            }
        }
        return null;
    }

    private static Double parse(String text) {
        String cleaned = text.trim().replace(",", "");
        if (cleaned.isEmpty()) {
            return null;
        }
        try {
            return Double.parseDouble(cleaned);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /** Read-only copy that tolerates null values. */
    static Map<String, Object> copy(Map<String, Object> raw) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(raw));
    }

    static boolean hasAny(Map<String, Object> raw, String... aliases) {
        return text(raw, aliases) != null;
    }

    /** ISO-8601 date prefix of {@code text}, empty when absent or unparsable. */
    static Optional<LocalDate> date(String text) {
        if (text == null || text.length() < 10) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDate.parse(text.substring(0, 10)));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
