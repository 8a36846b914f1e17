package com.eainde.verity.nodes;

import com.eainde.verity.regulatory.RegulatoryMapper;
import com.eainde.verity.state.AuditState;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

@Component
public class MapperNode implements AsyncNodeAction<AuditState> {

    private final RegulatoryMapper mapper;

    public MapperNode(RegulatoryMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(AuditState state) {
        try {
            return CompletableFuture.completedFuture(mapper.map(state));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
