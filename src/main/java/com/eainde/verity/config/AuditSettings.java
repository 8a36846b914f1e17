package com.eainde.verity.config;

import java.time.LocalDate;

/**
 * Run-wide audit settings.
 *
 * @param referenceDate          the audit's fixed "today" for certificate expiry and remediation deadlines
 * @param defaultMaxLoops        pass ceiling used when a request does not name one
 * @param maxLoopsCeiling        largest pass ceiling a request may ask for
 * @param actionDeadlineDays     corrective-action deadline, counted from the audit clock
 * @param remediationWindowDays  violation remediation deadline, counted from {@code referenceDate}
 * @param inputTokenPriceUsd     USD per million reasoning input tokens
 * @param outputTokenPriceUsd    USD per million reasoning output tokens
 */
public record AuditSettings(
        LocalDate referenceDate,
        int defaultMaxLoops,
        int maxLoopsCeiling,
        int actionDeadlineDays,
        int remediationWindowDays,
        double inputTokenPriceUsd,
        double outputTokenPriceUsd
) {

    public AuditSettings {
        if (defaultMaxLoops < 1 || defaultMaxLoops > maxLoopsCeiling) {
            throw new IllegalArgumentException(
                    "defaultMaxLoops must be within [1," + maxLoopsCeiling + "]: " + defaultMaxLoops);
        }
    }

    public static AuditSettings defaults() {
        return new AuditSettings(LocalDate.of(2026, 2, 26), 3, 10, 14, 17, 3.0, 15.0);
    }

    public double costUsd(long inputTokens, long outputTokens) {
        return inputTokens * inputTokenPriceUsd / 1_000_000.0 + outputTokens * outputTokenPriceUsd / 1_000_000.0;
    }
}
