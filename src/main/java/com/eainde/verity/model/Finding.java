package com.eainde.verity.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * A single discrepancy detected in a supplier's document set.
 *
 * @param id               unique finding id ({@code FIND-...})
 * @param category         discrepancy category
 * @param severity         CRITICAL / HIGH / MEDIUM / LOW
 * @param confidence       detector confidence in [0, 1]
 * @param description      human-readable summary
 * @param evidence         free-form supporting values (dates, quantities, ...)
 * @param sourceDocument   document (or "cross-reference") the finding came from
 * @param reasoningTrace   optional reasoning narrative, empty when none
 */
public record Finding(
        @JsonProperty("id")              String id,
        @JsonProperty("category")        FindingCategory category,
        @JsonProperty("severity")        Severity severity,
        @JsonProperty("confidence")      double confidence,
        @JsonProperty("description")     String description,
        @JsonProperty("evidence")        Map<String, Object> evidence,
        @JsonProperty("sourceDocument")  String sourceDocument,
        @JsonProperty("reasoningTrace")  String reasoningTrace
) implements Serializable {

    public static final String DRIFT_PERCENTAGE = "drift_percentage";

    public Finding {
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0,1]: " + confidence);
        }
        evidence = evidence == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(evidence));
        sourceDocument = sourceDocument == null ? "" : sourceDocument;
        reasoningTrace = reasoningTrace == null ? "" : reasoningTrace;
    }

    /** Severity weight times confidence; the per-finding contribution to overall risk. */
    @JsonIgnore
    public double weightedRisk() {
        return severity.riskWeight() * confidence;
    }

    /** Absolute drift percentage recorded in the evidence, if any. */
    @JsonIgnore
    public OptionalDouble driftPercentage() {
        Object value = evidence.get(DRIFT_PERCENTAGE);
        if (value instanceof Number number) {
            return OptionalDouble.of(Math.abs(number.doubleValue()));
        }
        if (value instanceof String text) {
            try {
                return OptionalDouble.of(Math.abs(Double.parseDouble(text.trim())));
            } catch (NumberFormatException e) {
                return OptionalDouble.empty();
            }
        }
        return OptionalDouble.empty();
    }
}
