package com.eainde.verity.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;

/**
 * One entry of the append-only audit trail.
 *
 * @param sequence  zero-based position in the run's log
 * @param timestamp when the entry was written
 * @param stage     originating stage
 * @param action    short action tag, e.g. {@code SCAN_COMPLETE}
 * @param detail    free text
 * @param severity  INFO / WARNING / ERROR / CRITICAL
 */
public record AgentLogEntry(
        @JsonProperty("sequence")  int sequence,
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("stage")     StageName stage,
        @JsonProperty("action")    String action,
        @JsonProperty("detail")    String detail,
        @JsonProperty("severity")  LogSeverity severity
) implements Serializable {
}
