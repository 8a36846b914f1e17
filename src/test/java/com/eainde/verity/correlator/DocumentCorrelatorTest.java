package com.eainde.verity.correlator;

import com.eainde.verity.config.AuditSettings;
import com.eainde.verity.document.DocumentClassifier;
import com.eainde.verity.document.MockDocuments;
import com.eainde.verity.integration.CollaboratorException;
import com.eainde.verity.integration.EmissionsClient;
import com.eainde.verity.integration.EmissionsEstimate;
import com.eainde.verity.integration.ReasoningClient;
import com.eainde.verity.integration.ReasoningResponse;
import com.eainde.verity.model.AgentLogEntry;
import com.eainde.verity.model.Finding;
import com.eainde.verity.model.FindingCategory;
import com.eainde.verity.model.LogSeverity;
import com.eainde.verity.model.StageName;
import com.eainde.verity.state.AuditState;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static com.eainde.verity.AuditFixtures.fields;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DocumentCorrelatorTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-02-26T09:00:00Z"), ZoneOffset.UTC);

    @Mock private ReasoningClient reasoningClient;
    @Mock private EmissionsClient emissionsClient;

    private DocumentCorrelator correlator;

    @BeforeEach
    void setUp() {
        AuditSettings settings = AuditSettings.defaults();
        correlator = new DocumentCorrelator(
                new DocumentClassifier(),
                List.of(new DateAnomalyDetector(), new SourceMismatchDetector(), new QuantityDriftDetector(),
                        new CertificateExpiryDetector(settings)),
                new ReasoningDetector(reasoningClient, new ObjectMapper()),
                new VerifiedSupplierOverride(),
                emissionsClient,
                settings,
                CLOCK);
    }

    private static AuditState state(List<Map<String, Object>> extracted) {
        return new AuditState(AuditState.initialData("AUD-1", "BATCH-2026-0402", "SUP-4821", "GreenTextile GmbH",
                List.of(MockDocuments.INVOICE, MockDocuments.BILL_OF_LADING, MockDocuments.CERTIFICATE),
                extracted, 3));
    }

    private static List<String> actions(Map<String, Object> partial) {
        @SuppressWarnings("unchecked")
        List<AgentLogEntry> entries = (List<AgentLogEntry>) partial.get(AuditState.AGENT_LOG);
        return entries.stream().map(AgentLogEntry::action).toList();
    }

    @Nested
    @DisplayName("demonstration batch")
    class Demo {

        @Test
        @DisplayName("falls back to mock data and finds the four planted discrepancies")
        void fourFindings() {
            // Arrange
            when(reasoningClient.reason(anyString(), anyString(), anyDouble()))
                    .thenThrow(new CollaboratorException("offline"));
            when(emissionsClient.estimate(eq("BDCGP"), eq("DEHAM"), eq(8200.0), eq("sea")))
                    .thenReturn(new EmissionsEstimate(1902.4, 1.9024, "glec-v3-fallback", "GLEC Framework v3.0",
                            "sea", "BDCGP", "DEHAM", true, true));

            // Act
            Map<String, Object> partial = correlator.correlate(state(List.of()));

            // Assert
            @SuppressWarnings("unchecked")
            List<Finding> findings = (List<Finding>) partial.get(AuditState.FINDINGS);
            assertThat(findings).extracting(Finding::category).containsExactlyInAnyOrder(
                    FindingCategory.DATE_ANOMALY, FindingCategory.SOURCE_MISMATCH,
                    FindingCategory.QUANTITY_DRIFT, FindingCategory.CERTIFICATE_EXPIRED);
            assertThat((double) partial.get(AuditState.RISK_SCORE)).isBetween(0.7, 0.8);
            assertThat(partial.get(AuditState.EMISSIONS)).isInstanceOf(EmissionsEstimate.class);
            assertThat(actions(partial)).startsWith("SCAN_INITIATED", "MOCK_FALLBACK", "DOCUMENTS_CLASSIFIED")
                    .contains("REASONING_FALLBACK", "EMISSIONS_SCORED")
                    .endsWith("SCAN_COMPLETE");
            assertThat(partial.get(AuditState.INPUT_TOKENS)).isEqualTo(0L);
        }

        @Test
        @DisplayName("adds reasoning findings and counts their tokens")
        void reasoningFindings() {
            when(reasoningClient.reason(anyString(), anyString(), anyDouble()))
                    .thenReturn(new ReasoningResponse("[{\"type\": \"EMISSIONS_EXCESS\", \"severity\": \"LOW\"}]", 900, 100));
            when(emissionsClient.estimate(anyString(), anyString(), anyDouble(), anyString()))
                    .thenThrow(new IllegalStateException("boom"));

            Map<String, Object> partial = correlator.correlate(state(List.of()));

            @SuppressWarnings("unchecked")
            List<Finding> findings = (List<Finding>) partial.get(AuditState.FINDINGS);
            assertThat(findings).hasSize(5);
            assertThat(partial).doesNotContainKey(AuditState.EMISSIONS);
            assertThat(actions(partial)).contains("REASONING_ANALYSIS_COMPLETE", "EMISSIONS_UNAVAILABLE");
            assertThat(partial.get(AuditState.INPUT_TOKENS)).isEqualTo(900L);
            assertThat(partial.get(AuditState.OUTPUT_TOKENS)).isEqualTo(100L);
        }
    }

    @Test
    @DisplayName("clears every finding for the verified supplier line")
    void override() {
        when(reasoningClient.reason(anyString(), anyString(), anyDouble()))
                .thenThrow(new CollaboratorException("offline"));

        Map<String, Object> partial = correlator.correlate(state(List.of(
                fields("type", "invoice", "supplier", "GreenTextile GmbH", "origin_country", "Bangladesh",
                        "declared_origin", "Germany", "quantity", 5000, "unit", "PCS"),
                fields("type", "bill_of_lading", "port_of_loading", "BDCGP", "quantity", 200, "unit", "CARTON"))));

        assertThat((List<?>) partial.get(AuditState.FINDINGS)).isEmpty();
        assertThat(partial.get(AuditState.RISK_SCORE)).isEqualTo(0.0);
        assertThat(actions(partial)).contains("SOURCE_MISMATCH", "EMISSIONS_SKIPPED", "VERIFIED_SUPPLIER_OVERRIDE");
        verifyNoInteractions(emissionsClient);
    }

    @Test
    @DisplayName("numbers its entries after the existing log")
    void sequence() {
        when(reasoningClient.reason(anyString(), anyString(), anyDouble()))
                .thenThrow(new CollaboratorException("offline"));
        AuditState withLog = state(List.of(fields("type", "certificate", "expiry_date", "2030-01-01")))
                .merge(Map.of(AuditState.AGENT_LOG, List.of(
                        new AgentLogEntry(0, CLOCK.instant(), StageName.ORCHESTRATOR,
                                "AUDIT_STARTED", "go", LogSeverity.INFO))));

        Map<String, Object> partial = correlator.correlate(withLog);

        @SuppressWarnings("unchecked")
        List<AgentLogEntry> entries = (List<AgentLogEntry>) partial.get(AuditState.AGENT_LOG);
        assertThat(entries.get(0).sequence()).isEqualTo(1);
        assertThat(entries.get(0).timestamp()).isEqualTo(CLOCK.instant());
        assertThat(partial).doesNotContainKey(AuditState.EMISSIONS);
    }
}
