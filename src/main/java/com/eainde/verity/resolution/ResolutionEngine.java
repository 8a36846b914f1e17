package com.eainde.verity.resolution;

import com.eainde.verity.config.AuditSettings;
import com.eainde.verity.knowledge.ActionTemplate;
import com.eainde.verity.knowledge.ActionTemplateTable;
import com.eainde.verity.log.StageLog;
import com.eainde.verity.model.ActionStatus;
import com.eainde.verity.model.CorrectiveAction;
import com.eainde.verity.model.Finding;
import com.eainde.verity.model.FindingCategory;
import com.eainde.verity.model.LogSeverity;
import com.eainde.verity.model.LoopDecision;
import com.eainde.verity.model.StageName;
import com.eainde.verity.model.Violation;
import com.eainde.verity.state.AuditState;
import com.eainde.verity.state.TokenTotals;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Third stage: drafts remediation, applies the trust adjustment and decides whether to loop.
 */
@Log4j2
@Component
public class ResolutionEngine {

    private final ActionTemplateTable templates;
    private final NotificationDrafter notificationDrafter;
    private final TrustAdjustment trustAdjustment;
    private final LoopDecisionPolicy loopDecisionPolicy;
    private final AuditSettings settings;
    private final Clock clock;

    public ResolutionEngine(ActionTemplateTable templates,
                            NotificationDrafter notificationDrafter,
                            TrustAdjustment trustAdjustment,
                            LoopDecisionPolicy loopDecisionPolicy,
                            AuditSettings settings,
                            Clock clock) {
        this.templates = templates;
        this.notificationDrafter = notificationDrafter;
        this.trustAdjustment = trustAdjustment;
        this.loopDecisionPolicy = loopDecisionPolicy;
        this.settings = settings;
        this.clock = clock;
    }

    public Map<String, Object> resolve(AuditState state) {
        StageLog stageLog = new StageLog(StageName.RESOLUTION_ENGINE, clock, state.getAgentLog().size());
        List<Violation> violations = state.getViolations();
        int loopCount = state.getLoopCount();
        int maxLoops = state.getMaxLoops();
        TokenTotals tokens = TokenTotals.of(state);

        stageLog.info("RESOLUTION_INITIATED", String.format("Processing %d violations (loop %d/%d). Total exposure: EUR %,.0f.",
                violations.size(), loopCount + 1, maxLoops, state.getTotalExposure()));

        Map<String, Finding> findingsById = state.getFindings().stream()
                .collect(Collectors.toMap(Finding::id, Function.identity(), (first, second) -> first));
        LocalDate deadline = LocalDate.now(clock).plusDays(settings.actionDeadlineDays());

        List<CorrectiveAction> actions = new ArrayList<>();
        for (Violation violation : violations) {
            Finding finding = findingsById.get(violation.findingId());
            FindingCategory category = finding == null ? null : finding.category();
            ActionTemplate template = templates.templateFor(category);
            actions.add(new CorrectiveAction(
                    "CA-" + violation.id(),
                    violation.id(),
                    template.instruction(),
                    deadline,
                    "Supplier " + state.getSupplierId(),
                    template.verificationMethod(),
                    ActionStatus.DRAFTED));
            stageLog.info("ACTION_DRAFTED", "Corrective action for " + (category == null ? "unknown finding" : category)
                    + ": " + template.instruction());
        }

        Map<String, Object> partial = new HashMap<>();
        if (!violations.isEmpty()) {
            NotificationDraft draft = notificationDrafter.draft(state.getSupplierName(), state.getBatchId(), violations, actions);
            if (draft.response().isPresent()) {
                tokens = tokens.plus(draft.response().get());
                stageLog.info("NOTIFICATION_DRAFTED", "Notification drafted -> " + draft.notification().recipient()
                        + " (PENDING_APPROVAL). Cites " + violations.size() + " violations.");
            } else {
                stageLog.warning("NOTIFICATION_FALLBACK", "Reasoning unavailable for notification draft. Using template -> "
                        + draft.notification().recipient());
            }
            partial.put(AuditState.SUPPLIER_NOTIFICATION, draft.notification());
        }

        double risk = state.getRiskScore();
        OptionalDouble adjusted = trustAdjustment.apply(state.getEntityVerification(), state.getSupplierIntelligence(), risk);
        if (adjusted.isPresent()) {
            risk = adjusted.getAsDouble();
            stageLog.info("TRUST_BONUS_APPLIED", "Supplier verified in the entity registry and live intelligence is clean. "
                    + "Risk reduced by " + TrustAdjustment.TRUST_BONUS + " to " + risk + ".");
        }

        LoopOutcome outcome = loopDecisionPolicy.decide(violations, loopCount, maxLoops);
        String tag = switch (outcome.decision()) {
            case RESOLVED -> "AUDIT_RESOLVED";
            case ESCALATE_TO_HUMAN -> "ESCALATION_TRIGGERED";
            case CONTINUE -> "RE_AUDIT_SCHEDULED";
        };
        stageLog.append(tag, outcome.reason(),
                outcome.decision() == LoopDecision.ESCALATE_TO_HUMAN ? LogSeverity.CRITICAL : LogSeverity.INFO);
        stageLog.info("RESOLUTION_COMPLETE", "Decision: " + outcome.decision() + " | Actions: " + actions.size()
                + " | Notification: " + (violations.isEmpty() ? "N/A" : "DRAFTED") + " | Status: " + outcome.resolutionStatus());
        log.info("Resolution pass {} for batch {}: {}", loopCount + 1, state.getBatchId(), outcome.decision());

        partial.putAll(tokens.toPartial(settings));
        partial.put(AuditState.CORRECTIVE_ACTIONS, List.copyOf(actions));
        partial.put(AuditState.RESOLUTION_STATUS, outcome.resolutionStatus());
        partial.put(AuditState.LOOP_DECISION, outcome.decision());
        partial.put(AuditState.LOOP_COUNT, loopCount + 1);
        partial.put(AuditState.RISK_SCORE, risk);
        partial.put(AuditState.AGENT_LOG, stageLog.entries());
        return partial;
    }
}
