package com.eainde.verity.workflow;

import com.eainde.verity.config.AuditSettings;
import com.eainde.verity.edges.LoopRoutingEdge;
import com.eainde.verity.nodes.CorrelatorNode;
import com.eainde.verity.nodes.MapperNode;
import com.eainde.verity.nodes.ResolutionNode;
import com.eainde.verity.state.AuditState;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.GraphStateException;
import org.bsc.langgraph4j.StateGraph;
import org.springframework.context.annotation.Bean;
import org.springframework.stereotype.Component;

import java.util.Map;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;

/**
 * {@code START -> correlator -> mapper -> resolution -> (correlator | END)}.
 */
@Component
public class AuditWorkflowGraph {

    public static final String DOCUMENT_CORRELATOR = "document_correlator";
    public static final String REGULATORY_MAPPER = "regulatory_mapper";
    public static final String RESOLUTION_ENGINE = "resolution_engine";

    private final CorrelatorNode correlatorNode;
    private final MapperNode mapperNode;
    private final ResolutionNode resolutionNode;
    private final LoopRoutingEdge routingEdge;
    private final AuditSettings settings;

    public AuditWorkflowGraph(CorrelatorNode correlatorNode,
                              MapperNode mapperNode,
                              ResolutionNode resolutionNode,
                              LoopRoutingEdge routingEdge,
                              AuditSettings settings) {
        this.correlatorNode = correlatorNode;
        this.mapperNode = mapperNode;
        this.resolutionNode = resolutionNode;
        this.routingEdge = routingEdge;
        this.settings = settings;
    }

    @Bean("auditWorkflow")
    public CompiledGraph<AuditState> build() throws GraphStateException {
        StateGraph<AuditState> workflow = new StateGraph<>(AuditState.SCHEMA, AuditState::new);

        workflow.addNode(DOCUMENT_CORRELATOR, correlatorNode);
        workflow.addNode(REGULATORY_MAPPER, mapperNode);
        workflow.addNode(RESOLUTION_ENGINE, resolutionNode);

        workflow.addEdge(START, DOCUMENT_CORRELATOR);
        workflow.addEdge(DOCUMENT_CORRELATOR, REGULATORY_MAPPER);
        workflow.addEdge(REGULATORY_MAPPER, RESOLUTION_ENGINE);

        workflow.addConditionalEdges(
                RESOLUTION_ENGINE,
                routingEdge,
                Map.of(
                        LoopRoutingEdge.RE_AUDIT, DOCUMENT_CORRELATOR,
                        LoopRoutingEdge.FINISH, END
                )
        );

        CompiledGraph<AuditState> compiled = workflow.compile();
        // start, three nodes per pass, end and the final done step, with headroom
        compiled.setMaxIterations(3 * settings.maxLoopsCeiling() + 5);
        return compiled;
    }
}
