package com.eainde.verity.state;

import com.eainde.verity.config.AuditSettings;
import com.eainde.verity.integration.ReasoningResponse;

import java.util.HashMap;
import java.util.Map;

/**
 * Running reasoning token counters carried across stages.
 */
public record TokenTotals(long inputTokens, long outputTokens) {

    public static TokenTotals of(AuditState state) {
        return new TokenTotals(state.getInputTokens(), state.getOutputTokens());
    }

    public TokenTotals plus(ReasoningResponse response) {
        return new TokenTotals(inputTokens + response.inputTokens(), outputTokens + response.outputTokens());
    }

    /** Partial state update carrying the counters and the derived cost. */
    public Map<String, Object> toPartial(AuditSettings settings) {
        Map<String, Object> partial = new HashMap<>();
        partial.put(AuditState.INPUT_TOKENS, inputTokens);
        partial.put(AuditState.OUTPUT_TOKENS, outputTokens);
        partial.put(AuditState.ESTIMATED_COST_USD, settings.costUsd(inputTokens, outputTokens));
        return partial;
    }
}
