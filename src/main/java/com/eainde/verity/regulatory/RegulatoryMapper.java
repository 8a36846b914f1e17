package com.eainde.verity.regulatory;

import com.eainde.verity.config.AuditSettings;
import com.eainde.verity.integration.CollaboratorException;
import com.eainde.verity.integration.EntityVerification;
import com.eainde.verity.integration.LeiRecord;
import com.eainde.verity.integration.RegistryStatus;
import com.eainde.verity.integration.RiskTier;
import com.eainde.verity.integration.SupplierIntelligence;
import com.eainde.verity.knowledge.RegulationEntry;
import com.eainde.verity.knowledge.RegulationKnowledgeBase;
import com.eainde.verity.log.StageLog;
import com.eainde.verity.model.Finding;
import com.eainde.verity.model.LogSeverity;
import com.eainde.verity.model.StageName;
import com.eainde.verity.model.Violation;
import com.eainde.verity.model.ViolationClass;
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
import java.util.Optional;

/**
 * Second stage: confirms findings against the regulation table, sums exposure, checks the supplier and
 * derives the compliance verdict.
 */
@Log4j2
@Component
public class RegulatoryMapper {

    private final RegulationKnowledgeBase knowledgeBase;
    private final LegalAssessor legalAssessor;
    private final SupplierVerifier supplierVerifier;
    private final VerdictPolicy verdictPolicy;
    private final AuditSettings settings;
    private final Clock clock;

    public RegulatoryMapper(RegulationKnowledgeBase knowledgeBase,
                            LegalAssessor legalAssessor,
                            SupplierVerifier supplierVerifier,
                            VerdictPolicy verdictPolicy,
                            AuditSettings settings,
                            Clock clock) {
        this.knowledgeBase = knowledgeBase;
        this.legalAssessor = legalAssessor;
        this.supplierVerifier = supplierVerifier;
        this.verdictPolicy = verdictPolicy;
        this.settings = settings;
        this.clock = clock;
    }

    public Map<String, Object> map(AuditState state) {
        StageLog stageLog = new StageLog(StageName.REGULATORY_MAPPER, clock, state.getAgentLog().size());
        List<Finding> findings = state.getFindings();
        TokenTotals tokens = TokenTotals.of(state);
        LocalDate remediationDeadline = settings.referenceDate().plusDays(settings.remediationWindowDays());

        stageLog.info("COMPLIANCE_CHECK_INITIATED", "Evaluating " + findings.size()
                + " findings against EU ESPR 2024/0455 & Green Claims Directive.");

        List<Violation> violations = new ArrayList<>();
        double exposure = 0.0;
        for (Finding finding : findings) {
            Optional<RegulationEntry> regulation = knowledgeBase.lookup(finding.category());
            if (regulation.isEmpty()) {
                stageLog.info("UNREGULATED_FINDING", "Finding " + finding.id() + " (" + finding.category()
                        + ") has no regulation mapping; no violation raised.");
                continue;
            }
            RegulationEntry entry = regulation.get();
            double percentage = entry.penaltyPercentage();
            String reasoning;
            try {
                LegalAssessment assessment = legalAssessor.assess(finding, entry);
                tokens = tokens.plus(assessment.response());
                percentage = assessment.penaltyPercentage();
                reasoning = assessment.legalReasoning();
            } catch (CollaboratorException e) {
                log.warn("Legal assessment failed for finding {}: {}", finding.id(), e.getMessage());
                reasoning = "Legal reasoning unavailable: " + abbreviate(e.getMessage());
            }
            Violation violation = new Violation(
                    "VIOL-" + finding.id(),
                    finding.id(),
                    entry.citation(),
                    entry.citedText(),
                    finding.severity().toViolationClass(),
                    finding.description(),
                    percentage,
                    RegulationKnowledgeBase.penaltyAmount(entry, percentage),
                    remediationDeadline,
                    reasoning,
                    entry.originFraud());
            violations.add(violation);
            exposure += violation.penaltyAmount();
            stageLog.append("VIOLATION_CONFIRMED", String.format("Violation found: %s. Risk: %s%% revenue fine (EUR %,.0f).",
                            entry.citation(), percentage, violation.penaltyAmount()),
                    violation.violationClass() == ViolationClass.CRITICAL ? LogSeverity.CRITICAL : LogSeverity.WARNING);
        }

        VerificationSnapshots snapshots = supplierVerifier.verify(state.getSupplierId(), state.getSupplierName());
        logRegistry(snapshots.registry(), state.getSupplierName(), stageLog);
        logIntelligence(snapshots.intelligence(), stageLog);

        Verdict verdict = verdictPolicy.decide(findings, violations, state.getRiskScore(), exposure);
        stageLog.info("COMPLIANCE_VERDICT", String.format("Verdict: %s (%s). %d violations. Total exposure: EUR %,.0f.",
                verdict.status(), verdict.rule(), violations.size(), verdict.exposure()));
        log.info("Mapper verdict for batch {}: {} with {} violations", state.getBatchId(), verdict.status(), violations.size());

        Map<String, Object> partial = new HashMap<>(tokens.toPartial(settings));
        partial.put(AuditState.VIOLATIONS, List.copyOf(violations));
        partial.put(AuditState.COMPLIANCE_STATUS, verdict.status());
        partial.put(AuditState.TOTAL_EXPOSURE, verdict.exposure());
        partial.put(AuditState.RISK_SCORE, verdict.riskScore());
        partial.put(AuditState.ENTITY_VERIFICATION, snapshots.registry());
        partial.put(AuditState.SUPPLIER_INTELLIGENCE, snapshots.intelligence());
        partial.put(AuditState.AGENT_LOG, stageLog.entries());
        return partial;
    }

    private void logRegistry(EntityVerification registry, String supplierName, StageLog stageLog) {
        if (!registry.apiAvailable()) {
            stageLog.warning("REGISTRY_UNAVAILABLE", "Entity registry unreachable; supplier recorded as UNVERIFIED.");
        } else if (registry.status() == RegistryStatus.VERIFIED && !registry.records().isEmpty()) {
            LeiRecord lei = registry.records().get(0);
            stageLog.info("GLEIF_VERIFIED", "GLEIF LEI: " + lei.lei() + " | Status: " + lei.registrationStatus()
                    + " | Jurisdiction: " + lei.jurisdiction() + " | Entity: " + lei.entityStatus());
        } else if (registry.status() == RegistryStatus.NO_LEI_FOUND) {
            stageLog.warning("GLEIF_WARNING", "No LEI found for '" + supplierName
                    + "'. Supplier lacks mandatory Legal Entity Identifier.");
        } else {
            stageLog.warning("GLEIF_FLAGGED", "GLEIF status: " + registry.status() + ". Flags: "
                    + String.join(", ", registry.riskFlags()));
        }
    }

    private void logIntelligence(SupplierIntelligence intelligence, StageLog stageLog) {
        if (!intelligence.apiAvailable()) {
            stageLog.warning("INTELLIGENCE_UNAVAILABLE", intelligence.summary());
        } else if (intelligence.riskTier() == RiskTier.HIGH || intelligence.riskTier() == RiskTier.CRITICAL) {
            stageLog.critical("SCANDAL_DETECTED", "Live intel: " + intelligence.riskTier() + " risk. " + intelligence.summary());
        } else {
            stageLog.info("LIVE_INTEL_CLEAR", "Live intelligence: " + intelligence.riskTier() + " risk. " + intelligence.summary());
        }
    }

    private static String abbreviate(String message) {
        if (message == null) {
            return "no detail";
        }
        return message.length() <= 80 ? message : message.substring(0, 80);
    }
}
