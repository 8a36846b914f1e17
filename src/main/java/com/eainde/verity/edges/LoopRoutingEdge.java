package com.eainde.verity.edges;

import com.eainde.verity.model.LoopDecision;
import com.eainde.verity.resolution.LoopCeilingPolicy;
import com.eainde.verity.state.AuditState;
import org.bsc.langgraph4j.action.AsyncEdgeAction;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Routes back to the correlator only on CONTINUE with passes left; everything else ends the run.
 */
@Component
public class LoopRoutingEdge implements AsyncEdgeAction<AuditState> {

    public static final String RE_AUDIT = "re_audit";
    public static final String FINISH = "end";

    private final LoopCeilingPolicy ceiling;

    public LoopRoutingEdge(LoopCeilingPolicy ceiling) {
        this.ceiling = ceiling;
    }

    @Override
    public CompletableFuture<String> apply(AuditState state) {
        LoopDecision decision = state.getLoopDecision().orElse(LoopDecision.ESCALATE_TO_HUMAN);
        String next = decision == LoopDecision.CONTINUE && ceiling.permitsReentry(state.getLoopCount(), state.getMaxLoops())
                ? RE_AUDIT
                : FINISH;
        return CompletableFuture.completedFuture(next);
    }
}
