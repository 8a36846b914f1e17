package com.eainde.verity.resolution;

import com.eainde.verity.model.LoopDecision;
import com.eainde.verity.model.ResolutionStatus;
import com.eainde.verity.model.Violation;
import com.eainde.verity.model.ViolationClass;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Loop decision state machine. Evaluated in priority order:
 * <ol>
 * <li>no violations: {@link LoopDecision#RESOLVED}</li>
 * <li>final pass reached: {@link LoopDecision#ESCALATE_TO_HUMAN}</li>
 * <li>any CRITICAL violation: {@link LoopDecision#ESCALATE_TO_HUMAN}</li>
 * <li>otherwise: {@link LoopDecision#CONTINUE}</li>
 * </ol>
 */
@Component
public class LoopDecisionPolicy {

    private final LoopCeilingPolicy ceiling;

    public LoopDecisionPolicy(LoopCeilingPolicy ceiling) {
        this.ceiling = ceiling;
    }

    public LoopOutcome decide(List<Violation> violations, int loopCount, int maxLoops) {
        if (violations.isEmpty()) {
            return new LoopOutcome(LoopDecision.RESOLVED, ResolutionStatus.RESOLVED,
                    "No violations found. Batch is COMPLIANT. Audit complete.");
        }
        if (ceiling.isFinalPass(loopCount, maxLoops)) {
            return new LoopOutcome(LoopDecision.ESCALATE_TO_HUMAN, ResolutionStatus.ESCALATED,
                    "Maximum audit loops (" + maxLoops + ") reached. Escalating to human compliance officer.");
        }
        long critical = violations.stream().filter(v -> v.violationClass() == ViolationClass.CRITICAL).count();
        if (critical > 0) {
            return new LoopOutcome(LoopDecision.ESCALATE_TO_HUMAN, ResolutionStatus.ESCALATED,
                    "CRITICAL violations detected (" + critical + "). Immediate human review required.");
        }
        return new LoopOutcome(LoopDecision.CONTINUE, ResolutionStatus.ACTION_PLAN_DRAFTED,
                "Non-critical violations. Corrective actions drafted. Scheduling re-audit.");
    }
}
