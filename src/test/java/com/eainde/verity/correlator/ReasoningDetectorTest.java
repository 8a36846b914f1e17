package com.eainde.verity.correlator;

import com.eainde.verity.integration.CollaboratorException;
import com.eainde.verity.integration.MalformedResponseException;
import com.eainde.verity.integration.ReasoningClient;
import com.eainde.verity.integration.ReasoningResponse;
import com.eainde.verity.model.FindingCategory;
import com.eainde.verity.model.Severity;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static com.eainde.verity.AuditFixtures.documents;
import static com.eainde.verity.AuditFixtures.invoice;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReasoningDetectorTest {

    @Mock private ReasoningClient reasoningClient;

    private ReasoningDetector detector;

    @BeforeEach
    void setUp() {
        detector = new ReasoningDetector(reasoningClient, new ObjectMapper().findAndRegisterModules());
    }

    private void answer(String text) {
        when(reasoningClient.reason(anyString(), anyString(), eq(ReasoningDetector.TEMPERATURE)))
                .thenReturn(new ReasoningResponse(text, 120, 40));
    }

    @Nested
    @DisplayName("accepted answer shapes")
    class Shapes {

        @Test
        @DisplayName("object with ai_findings inside a markdown fence")
        void fencedObject() {
            // Arrange
            answer("""
                    ```json
                    {"reasoning": "dates out of order",
                     "ai_findings": [{"type": "DATE_ANOMALY", "severity": "HIGH", "confidence": 0.8,
                                      "description": "invoice first", "evidence": {"a": 1}}]}
                    ```""");

            // Act
            ReasoningDetection detection = detector.detect("B-1", documents(invoice("invoice_number", "I"), null, null));

            // Assert
            assertThat(detection.findings()).singleElement().satisfies(finding -> {
                assertThat(finding.id()).startsWith("FIND-AI-");
                assertThat(finding.category()).isEqualTo(FindingCategory.DATE_ANOMALY);
                assertThat(finding.confidence()).isEqualTo(0.8);
                assertThat(finding.reasoningTrace()).isEqualTo("dates out of order");
                assertThat(finding.evidence()).containsEntry("a", 1);
            });
            assertThat(detection.response().inputTokens()).isEqualTo(120);
        }

        @Test
        @DisplayName("bare array")
        void bareArray() {
            answer("[{\"type\": \"quantity drift\", \"description\": \"short\"}]");

            ReasoningDetection detection = detector.detect("B-1", documents(null, null, null));

            assertThat(detection.findings()).singleElement().satisfies(finding -> {
                assertThat(finding.category()).isEqualTo(FindingCategory.QUANTITY_DRIFT);
                assertThat(finding.severity()).isEqualTo(Severity.MEDIUM);
                assertThat(finding.confidence()).isEqualTo(ReasoningDetector.DEFAULT_CONFIDENCE);
            });
        }

        @Test
        @DisplayName("object with a findings key")
        void findingsKey() {
            answer("{\"findings\": [{\"category\": \"CERTIFICATE_EXPIRED\", \"confidence\": 7}]}");

            ReasoningDetection detection = detector.detect("B-1", documents(null, null, null));

            assertThat(detection.findings().get(0).confidence()).isEqualTo(1.0);
        }
    }

    @Test
    @DisplayName("skips items naming an unknown type")
    void unknownType() {
        answer("{\"ai_findings\": [{\"type\": \"ALIEN_INVASION\"}, {\"type\": \"SOURCE_MISMATCH\", \"severity\": \"critical\"}]}");

        ReasoningDetection detection = detector.detect("B-1", documents(null, null, null));

        assertThat(detection.skipped()).isEqualTo(1);
        assertThat(detection.findings()).extracting(f -> f.severity()).containsExactly(Severity.CRITICAL);
    }

    @Test
    @DisplayName("puts the batch id into the prompt")
    void prompt() {
        when(reasoningClient.reason(anyString(), contains("Batch #B-77"), eq(ReasoningDetector.TEMPERATURE)))
                .thenReturn(new ReasoningResponse("[]", 1, 1));

        assertThat(detector.detect("B-77", documents(null, null, null)).findings()).isEmpty();
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        @DisplayName("non-JSON answer is malformed")
        void prose() {
            answer("I could not find anything.");

            assertThatThrownBy(() -> detector.detect("B-1", documents(null, null, null)))
                    .isInstanceOf(MalformedResponseException.class);
        }

        @Test
        @DisplayName("object without a findings list is malformed")
        void noList() {
            answer("{\"reasoning\": \"fine\"}");

            assertThatThrownBy(() -> detector.detect("B-1", documents(null, null, null)))
                    .isInstanceOf(MalformedResponseException.class);
        }

        @Test
        @DisplayName("collaborator failure propagates")
        void unavailable() {
            ReasoningDetector offline = new ReasoningDetector(ReasoningClient.unavailable("no key"), new ObjectMapper());

            assertThatThrownBy(() -> offline.detect("B-1", documents(null, null, null)))
                    .isInstanceOf(CollaboratorException.class)
                    .hasMessageContaining("no key");
        }
    }
}
