package com.eainde.verity.workflow;

/**
 * The orchestrator itself failed (graph error or state corruption). The only failure that leaves a run.
 */
public class AuditPipelineException extends RuntimeException {

    private final String auditId;

    public AuditPipelineException(String auditId, String message, Throwable cause) {
        super(message, cause);
        this.auditId = auditId;
    }

    public AuditPipelineException(String auditId, String message) {
        super(message);
        this.auditId = auditId;
    }

    public String getAuditId() {
        return auditId;
    }
}
