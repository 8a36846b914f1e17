package com.eainde.verity.nodes;

import com.eainde.verity.correlator.DocumentCorrelator;
import com.eainde.verity.state.AuditState;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

@Component
public class CorrelatorNode implements AsyncNodeAction<AuditState> {

    private final DocumentCorrelator correlator;

    public CorrelatorNode(DocumentCorrelator correlator) {
        this.correlator = correlator;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(AuditState state) {
        try {
            return CompletableFuture.completedFuture(correlator.correlate(state));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
