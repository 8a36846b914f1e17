package com.eainde.verity.controller;

import com.eainde.verity.integration.EmissionsEstimate;
import com.eainde.verity.integration.EntityVerification;
import com.eainde.verity.integration.SupplierIntelligence;
import com.eainde.verity.model.AgentLogEntry;
import com.eainde.verity.model.ComplianceStatus;
import com.eainde.verity.model.CorrectiveAction;
import com.eainde.verity.model.Finding;
import com.eainde.verity.model.LoopDecision;
import com.eainde.verity.model.ResolutionStatus;
import com.eainde.verity.model.SupplierNotification;
import com.eainde.verity.model.Violation;
import com.eainde.verity.state.AuditState;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Terminal snapshot of an audit as returned over HTTP.
 */
public record AuditReport(
        @JsonProperty("auditId")              String auditId,
        @JsonProperty("batchId")              String batchId,
        @JsonProperty("supplierId")           String supplierId,
        @JsonProperty("supplierName")         String supplierName,
        @JsonProperty("complianceStatus")     ComplianceStatus complianceStatus,
        @JsonProperty("overallRiskScore")     double overallRiskScore,
        @JsonProperty("totalExposure")        double totalExposure,
        @JsonProperty("findings")             List<Finding> findings,
        @JsonProperty("violations")           List<Violation> violations,
        @JsonProperty("correctiveActions")    List<CorrectiveAction> correctiveActions,
        @JsonProperty("supplierNotification") SupplierNotification supplierNotification,
        @JsonProperty("resolutionStatus")     ResolutionStatus resolutionStatus,
        @JsonProperty("loopDecision")         LoopDecision loopDecision,
        @JsonProperty("loopCount")            int loopCount,
        @JsonProperty("maxLoops")             int maxLoops,
        @JsonProperty("entityVerification")   EntityVerification entityVerification,
        @JsonProperty("supplierIntelligence") SupplierIntelligence supplierIntelligence,
        @JsonProperty("emissions")            EmissionsEstimate emissions,
        @JsonProperty("agentLog")             List<AgentLogEntry> agentLog,
        @JsonProperty("totalInputTokens")     long totalInputTokens,
        @JsonProperty("totalOutputTokens")    long totalOutputTokens,
        @JsonProperty("estimatedCostUsd")     double estimatedCostUsd
) {

    public static AuditReport from(AuditState state) {
        return new AuditReport(
                state.getAuditId(),
                state.getBatchId(),
                state.getSupplierId(),
                state.getSupplierName(),
                state.getComplianceStatus(),
                state.getRiskScore(),
                state.getTotalExposure(),
                state.getFindings(),
                state.getViolations(),
                state.getCorrectiveActions(),
                state.getSupplierNotification().orElse(null),
                state.getResolutionStatus(),
                state.getLoopDecision().orElse(null),
                state.getLoopCount(),
                state.getMaxLoops(),
                state.getEntityVerification().orElse(null),
                state.getSupplierIntelligence().orElse(null),
                state.getEmissions().orElse(null),
                state.getAgentLog(),
                state.getInputTokens(),
                state.getOutputTokens(),
                state.getEstimatedCostUsd());
    }
}
