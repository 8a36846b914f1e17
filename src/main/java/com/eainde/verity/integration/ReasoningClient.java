package com.eainde.verity.integration;

/**
 * Free-text reasoning collaborator (a large language model).
 * Callers must expect {@link CollaboratorException} and treat it as recoverable.
 */
@FunctionalInterface
public interface ReasoningClient {

    ReasoningResponse reason(String systemPrompt, String userMessage, double temperature);

    /** A client that always fails; used when no model is configured. */
    static ReasoningClient unavailable(String reason) {
        return (systemPrompt, userMessage, temperature) -> {
            throw new CollaboratorException("Reasoning collaborator unavailable: " + reason);
        };
    }
}
