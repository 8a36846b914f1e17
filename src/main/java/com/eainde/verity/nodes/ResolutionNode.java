package com.eainde.verity.nodes;

import com.eainde.verity.resolution.ResolutionEngine;
import com.eainde.verity.state.AuditState;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

@Component
public class ResolutionNode implements AsyncNodeAction<AuditState> {

    private final ResolutionEngine engine;

    public ResolutionNode(ResolutionEngine engine) {
        this.engine = engine;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(AuditState state) {
        try {
            return CompletableFuture.completedFuture(engine.resolve(state));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
