package com.eainde.verity.state;

import com.eainde.verity.model.AgentLogEntry;
import com.eainde.verity.model.ComplianceStatus;

import java.util.List;

/**
 * State checks applied between steps. A violation means the state is corrupt.
 */
public final class AuditInvariants {

    private AuditInvariants() {
    }

    /**
     * @throws IllegalStateException naming the first broken invariant
     */
    public static void check(AuditState previous, AuditState current) {
        double risk = current.getRiskScore();
        if (Double.isNaN(risk) || risk < 0.0 || risk > 1.0) {
            throw new IllegalStateException("overall risk score out of [0,1]: " + risk);
        }
        double exposure = current.getTotalExposure();
        if (Double.isNaN(exposure) || exposure < 0.0) {
            throw new IllegalStateException("total financial exposure is negative: " + exposure);
        }
        if (current.getComplianceStatus() == ComplianceStatus.COMPLIANT && exposure != 0.0) {
            throw new IllegalStateException("COMPLIANT verdict with non-zero exposure: " + exposure);
        }
        if (current.getLoopCount() > current.getMaxLoops()) {
            throw new IllegalStateException("loop count " + current.getLoopCount()
                    + " exceeds max loops " + current.getMaxLoops());
        }
        List<AgentLogEntry> before = previous.getAgentLog();
        List<AgentLogEntry> after = current.getAgentLog();
        if (after.size() < before.size() || !after.subList(0, before.size()).equals(before)) {
            throw new IllegalStateException("agent log lost or rewrote entries (" + before.size()
                    + " before, " + after.size() + " after)");
        }
    }
}
