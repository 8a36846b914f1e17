package com.eainde.verity.regulatory;

import com.eainde.verity.config.AuditSettings;
import com.eainde.verity.integration.CollaboratorException;
import com.eainde.verity.integration.EntityVerification;
import com.eainde.verity.integration.LeiRecord;
import com.eainde.verity.integration.RegistryStatus;
import com.eainde.verity.integration.RiskTier;
import com.eainde.verity.integration.SupplierIntelligence;
import com.eainde.verity.integration.ReasoningResponse;
import com.eainde.verity.knowledge.RegulationKnowledgeBase;
import com.eainde.verity.model.AgentLogEntry;
import com.eainde.verity.model.ComplianceStatus;
import com.eainde.verity.model.Finding;
import com.eainde.verity.model.FindingCategory;
import com.eainde.verity.model.LogSeverity;
import com.eainde.verity.model.Severity;
import com.eainde.verity.model.Violation;
import com.eainde.verity.model.ViolationClass;
import com.eainde.verity.state.AuditState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static com.eainde.verity.AuditFixtures.drift;
import static com.eainde.verity.AuditFixtures.finding;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RegulatoryMapperTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-02-26T09:00:00Z"), ZoneOffset.UTC);
    private static final Instant NOW = CLOCK.instant();

    @Mock private LegalAssessor legalAssessor;
    @Mock private SupplierVerifier supplierVerifier;

    private RegulatoryMapper mapper;

    @BeforeEach
    void setUp() {
        mapper = new RegulatoryMapper(new RegulationKnowledgeBase(), legalAssessor, supplierVerifier,
                new VerdictPolicy(), AuditSettings.defaults(), CLOCK);
        lenient().when(supplierVerifier.verify("SUP-4821", "GreenTextile GmbH")).thenReturn(new VerificationSnapshots(
                EntityVerification.unavailable("SUP-4821", "GreenTextile GmbH"),
                SupplierIntelligence.unavailable("SUP-4821", "GreenTextile GmbH", NOW)));
    }

    private static AuditState stateWith(List<Finding> findings, double risk) {
        return new AuditState(AuditState.initialData("AUD-1", "B-1", "SUP-4821", "GreenTextile GmbH",
                List.of(), List.of(), 3)).merge(Map.of(AuditState.FINDINGS, findings, AuditState.RISK_SCORE, risk));
    }

    @SuppressWarnings("unchecked")
    private static List<Violation> violations(Map<String, Object> partial) {
        return (List<Violation>) partial.get(AuditState.VIOLATIONS);
    }

    @SuppressWarnings("unchecked")
    private static List<AgentLogEntry> entries(Map<String, Object> partial) {
        return (List<AgentLogEntry>) partial.get(AuditState.AGENT_LOG);
    }

    @Nested
    @DisplayName("violation mapping")
    class Mapping {

        @Test
        @DisplayName("uses the table defaults when legal assessment fails")
        void fallbackPenalty() {
            // Arrange
            when(legalAssessor.assess(any(), any())).thenThrow(new CollaboratorException("offline"));
            Finding finding = finding("FIND-00000001", FindingCategory.DATE_ANOMALY, Severity.HIGH);

            // Act
            Map<String, Object> partial = mapper.map(stateWith(List.of(finding), 0.72));

            // Assert
            assertThat(violations(partial)).singleElement().satisfies(violation -> {
                assertThat(violation.id()).isEqualTo("VIOL-FIND-00000001");
                assertThat(violation.findingId()).isEqualTo("FIND-00000001");
                assertThat(violation.violationClass()).isEqualTo(ViolationClass.MAJOR);
                assertThat(violation.penaltyPercentage()).isEqualTo(2.5);
                assertThat(violation.penaltyAmount()).isEqualTo(10_750_000.0);
                assertThat(violation.remediationDeadline()).isEqualTo(LocalDate.of(2026, 3, 15));
                assertThat(violation.legalReasoning()).startsWith("Legal reasoning unavailable");
            });
            assertThat(partial.get(AuditState.COMPLIANCE_STATUS)).isEqualTo(ComplianceStatus.PENDING_REVIEW);
            assertThat(partial.get(AuditState.TOTAL_EXPOSURE)).isEqualTo(10_750_000.0);
        }

        @Test
        @DisplayName("applies the refined percentage and counts tokens")
        void refined() {
            when(legalAssessor.assess(any(), any()))
                    .thenReturn(new LegalAssessment(0.5, "minor breach", new ReasoningResponse("{}", 300, 50)));

            Map<String, Object> partial = mapper.map(stateWith(List.of(drift("FIND-1", 1.0)), 0.44));

            assertThat(violations(partial).get(0).penaltyAmount()).isEqualTo(2_150_000.0);
            assertThat(violations(partial).get(0).legalReasoning()).isEqualTo("minor breach");
            assertThat(partial.get(AuditState.INPUT_TOKENS)).isEqualTo(300L);
        }

        @Test
        @DisplayName("records unregulated findings without a violation")
        void unregulated() {
            Map<String, Object> partial = mapper.map(stateWith(
                    List.of(finding("FIND-2", FindingCategory.ENTITY_VALIDATION, Severity.LOW)), 0.18));

            assertThat(violations(partial)).isEmpty();
            assertThat(entries(partial)).extracting(AgentLogEntry::action).contains("UNREGULATED_FINDING");
            assertThat(partial.get(AuditState.COMPLIANCE_STATUS)).isEqualTo(ComplianceStatus.COMPLIANT);
            verify(legalAssessor, never()).assess(any(), any());
        }

        @Test
        @DisplayName("is deterministic for the same findings")
        void idempotent() {
            when(legalAssessor.assess(any(), any())).thenThrow(new CollaboratorException("offline"));
            AuditState state = stateWith(List.of(
                    finding("FIND-A", FindingCategory.SOURCE_MISMATCH, Severity.CRITICAL),
                    finding("FIND-B", FindingCategory.CERTIFICATE_EXPIRED, Severity.HIGH)), 0.87);

            Map<String, Object> first = mapper.map(state);
            Map<String, Object> second = mapper.map(state);

            assertThat(violations(second)).isEqualTo(violations(first));
            assertThat(second.get(AuditState.TOTAL_EXPOSURE)).isEqualTo(first.get(AuditState.TOTAL_EXPOSURE));
            assertThat(second.get(AuditState.COMPLIANCE_STATUS)).isEqualTo(first.get(AuditState.COMPLIANCE_STATUS));
        }
    }

    @Test
    @DisplayName("origin fraud sets the regulatory ceiling")
    void originFraudCeiling() {
        when(legalAssessor.assess(any(), any())).thenThrow(new CollaboratorException("offline"));

        Map<String, Object> partial = mapper.map(stateWith(
                List.of(finding("FIND-A", FindingCategory.SOURCE_MISMATCH, Severity.CRITICAL)), 0.9));

        assertThat(partial.get(AuditState.COMPLIANCE_STATUS)).isEqualTo(ComplianceStatus.NON_COMPLIANT);
        assertThat(partial.get(AuditState.TOTAL_EXPOSURE)).isEqualTo(RegulationKnowledgeBase.EXPOSURE_CEILING);
        assertThat(partial.get(AuditState.RISK_SCORE)).isEqualTo(0.86);
        assertThat(entries(partial)).filteredOn(e -> e.action().equals("VIOLATION_CONFIRMED"))
                .extracting(AgentLogEntry::severity).containsExactly(LogSeverity.CRITICAL);
    }

    @Nested
    @DisplayName("supplier verification")
    class Verification {

        @Test
        @DisplayName("logs unavailable collaborators and stores the fallback snapshots")
        void unavailable() {
            Map<String, Object> partial = mapper.map(stateWith(List.of(), 0.0));

            assertThat(entries(partial)).extracting(AgentLogEntry::action).containsExactly(
                    "COMPLIANCE_CHECK_INITIATED", "REGISTRY_UNAVAILABLE", "INTELLIGENCE_UNAVAILABLE",
                    "COMPLIANCE_VERDICT");
            assertThat(partial.get(AuditState.ENTITY_VERIFICATION)).isInstanceOf(EntityVerification.class);
            assertThat(((SupplierIntelligence) partial.get(AuditState.SUPPLIER_INTELLIGENCE)).riskTier())
                    .isEqualTo(RiskTier.UNKNOWN);
        }

        @Test
        @DisplayName("logs a verified LEI and a scandal")
        void verifiedAndScandal() {
            LeiRecord lei = new LeiRecord("529900T8BM49AURSDO55", "GreenTextile GmbH", "DE", "ISSUED", "ACTIVE",
                    "CONFORMING", "DE", "2026-01-01");
            when(supplierVerifier.verify("SUP-4821", "GreenTextile GmbH")).thenReturn(new VerificationSnapshots(
                    new EntityVerification("SUP-4821", "GreenTextile GmbH", RegistryStatus.VERIFIED, List.of(lei),
                            List.of(), true),
                    new SupplierIntelligence("SUP-4821", "q", NOW, RiskTier.HIGH, List.of(),
                            List.of("pollution", "fine", "sanctions"), "bad news", true)));

            Map<String, Object> partial = mapper.map(stateWith(List.of(), 0.0));

            assertThat(entries(partial)).extracting(AgentLogEntry::action).contains("GLEIF_VERIFIED", "SCANDAL_DETECTED");
        }
    }
}
