package com.eainde.verity.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.LocalDate;

/**
 * A regulatory breach confirmed from exactly one {@link Finding}.
 *
 * @param id                   {@code VIOL-} id derived from the finding id
 * @param findingId            originating finding
 * @param citation             regulation reference
 * @param citedText            quoted regulation text
 * @param violationClass       derived from the finding severity
 * @param description          carried over from the finding
 * @param penaltyPercentage    share of annual revenue at risk, [0, 4]
 * @param penaltyAmount        penalty in EUR
 * @param remediationDeadline  date by which the breach must be remediated
 * @param legalReasoning       reasoning narrative or the fallback note
 * @param originFraud          whether the cited regulation is origin-fraud class
 */
public record Violation(
        @JsonProperty("id")                  String id,
        @JsonProperty("findingId")           String findingId,
        @JsonProperty("citation")            String citation,
        @JsonProperty("citedText")           String citedText,
        @JsonProperty("violationClass")      ViolationClass violationClass,
        @JsonProperty("description")         String description,
        @JsonProperty("penaltyPercentage")   double penaltyPercentage,
        @JsonProperty("penaltyAmount")       double penaltyAmount,
        @JsonProperty("remediationDeadline") LocalDate remediationDeadline,
        @JsonProperty("legalReasoning")      String legalReasoning,
        @JsonProperty("originFraud")         boolean originFraud
) implements Serializable {

    public static final double MAX_PENALTY_PERCENTAGE = 4.0;

    public Violation {
        if (penaltyPercentage < 0.0 || penaltyPercentage > MAX_PENALTY_PERCENTAGE) {
            throw new IllegalArgumentException("penaltyPercentage must be within [0,4]: " + penaltyPercentage);
        }
        if (penaltyAmount < 0.0) {
            throw new IllegalArgumentException("penaltyAmount must be >= 0: " + penaltyAmount);
        }
    }
}
