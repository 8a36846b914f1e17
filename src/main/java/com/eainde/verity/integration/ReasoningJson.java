package com.eainde.verity.integration;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Parses reasoning output that is expected to be JSON, optionally wrapped in a markdown fence.
 */
public final class ReasoningJson {

    private static final String FENCE = "```";

    private ReasoningJson() {
    }

    public static JsonNode parse(ObjectMapper objectMapper, String text) {
        String cleaned = stripFence(text);
        if (cleaned.isEmpty()) {
            throw new MalformedResponseException("Reasoning response was empty");
        }
        try {
            return objectMapper.readTree(cleaned);
        } catch (JsonProcessingException e) {
            throw new MalformedResponseException("Reasoning response is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    static String stripFence(String text) {
        if (text == null) {
            return "";
        }
        String content = text.trim();
        if (content.startsWith(FENCE)) {
            int firstNewline = content.indexOf('\n');
            content = firstNewline < 0 ? "" : content.substring(firstNewline + 1);
            int closing = content.lastIndexOf(FENCE);
            if (closing >= 0) {
                content = content.substring(0, closing);
            }
        }
        return content.trim();
    }
}
