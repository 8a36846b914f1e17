package com.eainde.verity.state;

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
import org.bsc.langgraph4j.state.AgentState;
import org.bsc.langgraph4j.state.Channel;
import org.bsc.langgraph4j.state.Channels;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Snapshot of one audit run as it moves through the graph.
 * <p>
 * Stages never mutate a snapshot. They return a partial map which {@link #merge(Map)} (and the graph runtime,
 * using the same {@link #SCHEMA}) folds in: {@link #AGENT_LOG} is appended to, every other key is overwritten.
 * </p>
 */
public class AuditState extends AgentState {

    public static final String AUDIT_ID = "audit_id";
    public static final String BATCH_ID = "batch_id";
    public static final String SUPPLIER_ID = "supplier_id";
    public static final String SUPPLIER_NAME = "supplier_name";
    public static final String DOCUMENTS = "documents";
    public static final String EXTRACTED_DATA = "extracted_data";

    public static final String FINDINGS = "findings";
    public static final String VIOLATIONS = "violations";
    public static final String CORRECTIVE_ACTIONS = "corrective_actions";
    public static final String SUPPLIER_NOTIFICATION = "supplier_notification";
    public static final String EMISSIONS = "emissions";

    public static final String RISK_SCORE = "overall_risk_score";
    public static final String TOTAL_EXPOSURE = "total_financial_exposure";
    public static final String COMPLIANCE_STATUS = "compliance_status";
    public static final String RESOLUTION_STATUS = "resolution_status";

    public static final String LOOP_COUNT = "loop_count";
    public static final String MAX_LOOPS = "max_loops";
    public static final String LOOP_DECISION = "loop_decision";

    public static final String AGENT_LOG = "agent_log";

    public static final String ENTITY_VERIFICATION = "entity_verification";
    public static final String SUPPLIER_INTELLIGENCE = "supplier_intelligence";

    public static final String INPUT_TOKENS = "total_input_tokens";
    public static final String OUTPUT_TOKENS = "total_output_tokens";
    public static final String ESTIMATED_COST_USD = "estimated_cost_usd";

    public static final Map<String, Channel<?>> SCHEMA = Map.of(
            AGENT_LOG, Channels.appender(ArrayList::new));

    public AuditState(Map<String, Object> initData) {
        super(initData);
    }

    /**
     * Initial graph input for a fresh run: identity, inputs, zeroed scores and loop counters.
     */
    public static Map<String, Object> initialData(String auditId, String batchId, String supplierId, String supplierName,
                                                  List<String> documents, List<Map<String, Object>> extractedData,
                                                  int maxLoops) {
        List<Map<String, Object>> records = new ArrayList<>();
        for (Map<String, Object> record : extractedData) {
            records.add(new LinkedHashMap<>(record));
        }
        Map<String, Object> data = new HashMap<>();
        data.put(AUDIT_ID, auditId);
        data.put(BATCH_ID, batchId);
        data.put(SUPPLIER_ID, supplierId);
        data.put(SUPPLIER_NAME, supplierName);
        data.put(DOCUMENTS, List.copyOf(documents));
        data.put(EXTRACTED_DATA, records);
        data.put(FINDINGS, List.of());
        data.put(VIOLATIONS, List.of());
        data.put(CORRECTIVE_ACTIONS, List.of());
        data.put(RISK_SCORE, 0.0);
        data.put(TOTAL_EXPOSURE, 0.0);
        data.put(COMPLIANCE_STATUS, ComplianceStatus.PENDING);
        data.put(RESOLUTION_STATUS, ResolutionStatus.PENDING);
        data.put(LOOP_COUNT, 0);
        data.put(MAX_LOOPS, maxLoops);
        data.put(INPUT_TOKENS, 0L);
        data.put(OUTPUT_TOKENS, 0L);
        data.put(ESTIMATED_COST_USD, 0.0);
        return data;
    }

    /**
     * Pure merge: returns a new snapshot with {@code partial} folded in. This instance is left untouched.
     */
    public AuditState merge(Map<String, Object> partial) {
        return new AuditState(AgentState.updateState(data(), partial, SCHEMA));
    }

    public String getAuditId() { return (String) this.data().get(AUDIT_ID); }
    public String getBatchId() { return (String) this.data().get(BATCH_ID); }
    public String getSupplierId() { return (String) this.data().get(SUPPLIER_ID); }
    public String getSupplierName() { return (String) this.data().get(SUPPLIER_NAME); }

    public List<String> getDocuments() { return listOf(DOCUMENTS); }
    public List<Map<String, Object>> getExtractedData() { return listOf(EXTRACTED_DATA); }

    public List<Finding> getFindings() { return listOf(FINDINGS); }
    public List<Violation> getViolations() { return listOf(VIOLATIONS); }
    public List<CorrectiveAction> getCorrectiveActions() { return listOf(CORRECTIVE_ACTIONS); }
    public List<AgentLogEntry> getAgentLog() { return listOf(AGENT_LOG); }

    public Optional<SupplierNotification> getSupplierNotification() { return optional(SUPPLIER_NOTIFICATION); }
    public Optional<EmissionsEstimate> getEmissions() { return optional(EMISSIONS); }
    public Optional<EntityVerification> getEntityVerification() { return optional(ENTITY_VERIFICATION); }
    public Optional<SupplierIntelligence> getSupplierIntelligence() { return optional(SUPPLIER_INTELLIGENCE); }
    public Optional<LoopDecision> getLoopDecision() { return optional(LOOP_DECISION); }

    public double getRiskScore() { return number(RISK_SCORE).doubleValue(); }
    public double getTotalExposure() { return number(TOTAL_EXPOSURE).doubleValue(); }
    public int getLoopCount() { return number(LOOP_COUNT).intValue(); }
    public int getMaxLoops() { return number(MAX_LOOPS).intValue(); }
    public long getInputTokens() { return number(INPUT_TOKENS).longValue(); }
    public long getOutputTokens() { return number(OUTPUT_TOKENS).longValue(); }
    public double getEstimatedCostUsd() { return number(ESTIMATED_COST_USD).doubleValue(); }

    public ComplianceStatus getComplianceStatus() {
        Object value = this.data().get(COMPLIANCE_STATUS);
        return value instanceof ComplianceStatus status ? status : ComplianceStatus.PENDING;
    }

    public ResolutionStatus getResolutionStatus() {
        Object value = this.data().get(RESOLUTION_STATUS);
        return value instanceof ResolutionStatus status ? status : ResolutionStatus.PENDING;
    }

    @SuppressWarnings("unchecked")
    private <T> List<T> listOf(String key) {
        Object value = this.data().get(key);
        return value instanceof List<?> list ? (List<T>) list : List.of();
    }

    @SuppressWarnings("unchecked")
    private <T extends Serializable> Optional<T> optional(String key) {
        return Optional.ofNullable((T) this.data().get(key));
    }

    private Number number(String key) {
        Object value = this.data().get(key);
        return value instanceof Number n ? n : 0;
    }
}
