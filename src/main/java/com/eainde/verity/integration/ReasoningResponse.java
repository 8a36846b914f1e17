package com.eainde.verity.integration;

/**
 * Raw text answer of the reasoning collaborator with its token usage.
 */
public record ReasoningResponse(String text, int inputTokens, int outputTokens) {

    public ReasoningResponse {
        text = text == null ? "" : text;
    }
}
