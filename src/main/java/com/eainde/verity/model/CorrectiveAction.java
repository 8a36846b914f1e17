package com.eainde.verity.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.LocalDate;

/**
 * A remediation task addressing one violation.
 */
public record CorrectiveAction(
        @JsonProperty("id")                 String id,
        @JsonProperty("violationId")        String violationId,
        @JsonProperty("instruction")        String instruction,
        @JsonProperty("deadline")           LocalDate deadline,
        @JsonProperty("responsibleParty")   String responsibleParty,
        @JsonProperty("verificationMethod") String verificationMethod,
        @JsonProperty("status")             ActionStatus status
) implements Serializable {

    /**
     * Returns a copy moved to {@code next}.
     *
     * @throws IllegalStateException if the lifecycle does not allow the move
     */
    public CorrectiveAction transitionTo(ActionStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException(
                    "Corrective action " + id + " cannot move from " + status + " to " + next);
        }
        return new CorrectiveAction(id, violationId, instruction, deadline, responsibleParty, verificationMethod, next);
    }
}
