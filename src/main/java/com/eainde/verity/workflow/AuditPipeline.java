package com.eainde.verity.workflow;

import com.eainde.verity.config.AuditSettings;
import com.eainde.verity.log.LogBroadcaster;
import com.eainde.verity.log.StageLog;
import com.eainde.verity.model.AgentLogEntry;
import com.eainde.verity.model.AuditRequest;
import com.eainde.verity.model.StageName;
import com.eainde.verity.state.AuditInvariants;
import com.eainde.verity.state.AuditState;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.NodeOutput;
import org.bsc.langgraph4j.RunnableConfig;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Entry point of an audit run.
 * <p>
 * Validates the request, streams the compiled audit graph, checks the state invariants after every step and
 * forwards each newly appended log entry to the {@link LogBroadcaster}. Collaborator failures never reach this
 * level; anything that does is wrapped in an {@link AuditPipelineException}.
 * </p>
 */
@Log4j2
@Service
public class AuditPipeline {

    public static final String MDC_AUDIT_ID = "auditId";

    private final CompiledGraph<AuditState> graph;
    private final LogBroadcaster broadcaster;
    private final AuditSettings settings;
    private final Clock clock;

    public AuditPipeline(@Qualifier("auditWorkflow") CompiledGraph<AuditState> graph,
                         LogBroadcaster broadcaster,
                         AuditSettings settings,
                         Clock clock) {
        this.graph = graph;
        this.broadcaster = broadcaster;
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * Runs one audit to its terminal state.
     *
     * @throws IllegalArgumentException if {@code maxLoops} is outside {@code [1, ceiling]}
     * @throws AuditPipelineException   if the graph fails or the state is found corrupt
     */
    public AuditState run(AuditRequest request) {
        int maxLoops = request.maxLoops() == null ? settings.defaultMaxLoops() : request.maxLoops();
        if (maxLoops < 1 || maxLoops > settings.maxLoopsCeiling()) {
            throw new IllegalArgumentException(
                    "maxLoops must be within [1," + settings.maxLoopsCeiling() + "]: " + maxLoops);
        }

        String auditId = "AUD-" + UUID.randomUUID().toString().substring(0, 8).toUpperCase(Locale.ROOT);
        MDC.put(MDC_AUDIT_ID, auditId);
        try {
            log.info("Starting audit {} for batch {} ({} documents, max {} loops)",
                    auditId, request.batchId(), request.documents().size(), maxLoops);

            Map<String, Object> inputs = AuditState.initialData(auditId, request.batchId(), request.supplierId(),
                    request.supplierName(), request.documents(), request.extractedData(), maxLoops);
            List<AgentLogEntry> started = new StageLog(StageName.ORCHESTRATOR, clock, 0)
                    .info("AUDIT_STARTED", "Audit " + auditId + " started for Batch #" + request.batchId()
                            + " of " + request.supplierName() + " (" + request.supplierId() + ").")
                    .entries();
            inputs.put(AuditState.AGENT_LOG, started);
            broadcaster.publish(auditId, started);

            AuditState last = streamGraph(auditId, new AuditState(inputs));

            List<AgentLogEntry> finished = new StageLog(StageName.ORCHESTRATOR, clock, last.getAgentLog().size())
                    .info("AUDIT_COMPLETE", "Audit finished after " + last.getLoopCount() + " passes: "
                            + last.getComplianceStatus() + ", " + last.getResolutionStatus()
                            + ", decision " + last.getLoopDecision().map(Enum::name).orElse("NONE") + ".")
                    .entries();
            AuditState terminal = last.merge(Map.of(AuditState.AGENT_LOG, finished));
            broadcaster.publish(auditId, finished);
            log.info("Audit {} complete: {} / risk {} / exposure {}", auditId,
                    terminal.getComplianceStatus(), terminal.getRiskScore(), terminal.getTotalExposure());
            return terminal;
        } finally {
            MDC.remove(MDC_AUDIT_ID);
        }
    }

    private AuditState streamGraph(String auditId, AuditState initial) {
        RunnableConfig config = RunnableConfig.builder()
                .threadId(auditId)
                .build();
        AuditState previous = initial;
        try {
            for (NodeOutput<AuditState> output : graph.stream(previous.data(), config)) {
                AuditState current = output.state();
                try {
                    AuditInvariants.check(previous, current);
                } catch (IllegalStateException e) {
                    throw new AuditPipelineException(auditId,
                            "State corrupted after step '" + output.node() + "': " + e.getMessage(), e);
                }
                List<AgentLogEntry> entries = current.getAgentLog();
                broadcaster.publish(auditId, entries.subList(previous.getAgentLog().size(), entries.size()));
                previous = current;
            }
        } catch (AuditPipelineException e) {
            throw e;
        } catch (Exception e) {
            throw new AuditPipelineException(auditId, "Audit graph failed: " + e.getMessage(), e);
        }
        if (previous == initial) {
            throw new AuditPipelineException(auditId, "Audit graph produced no state");
        }
        return previous;
    }
}
