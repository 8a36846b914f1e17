package com.eainde.verity.resolution;

import com.eainde.verity.model.LoopDecision;
import com.eainde.verity.model.ResolutionStatus;
import com.eainde.verity.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static com.eainde.verity.AuditFixtures.violation;
import static org.assertj.core.api.Assertions.assertThat;

class LoopDecisionPolicyTest {

    private final LoopDecisionPolicy policy = new LoopDecisionPolicy(new MaxLoopsCeiling());

    @Test
    @DisplayName("no violations resolves, even on the final pass")
    void resolved() {
        LoopOutcome outcome = policy.decide(List.of(), 2, 3);

        assertThat(outcome.decision()).isEqualTo(LoopDecision.RESOLVED);
        assertThat(outcome.resolutionStatus()).isEqualTo(ResolutionStatus.RESOLVED);
    }

    @Test
    @DisplayName("a CRITICAL violation escalates on the first pass")
    void critical() {
        LoopOutcome outcome = policy.decide(List.of(violation("F1", Severity.CRITICAL, 1, false)), 0, 3);

        assertThat(outcome.decision()).isEqualTo(LoopDecision.ESCALATE_TO_HUMAN);
        assertThat(outcome.reason()).contains("CRITICAL");
    }

    @Nested
    @DisplayName("non-critical violations")
    class NonCritical {

        @Test
        @DisplayName("continue while passes remain")
        void continues() {
            LoopOutcome outcome = policy.decide(List.of(violation("F1", Severity.MEDIUM, 1, false)), 0, 3);

            assertThat(outcome.decision()).isEqualTo(LoopDecision.CONTINUE);
            assertThat(outcome.resolutionStatus()).isEqualTo(ResolutionStatus.ACTION_PLAN_DRAFTED);
        }

        @Test
        @DisplayName("escalate on the final pass")
        void finalPass() {
            LoopOutcome outcome = policy.decide(List.of(violation("F1", Severity.MEDIUM, 1, false)), 2, 3);

            assertThat(outcome.decision()).isEqualTo(LoopDecision.ESCALATE_TO_HUMAN);
            assertThat(outcome.reason()).contains("Maximum audit loops (3)");
        }

        @Test
        @DisplayName("escalate immediately when only one pass is allowed")
        void singlePass() {
            assertThat(policy.decide(List.of(violation("F1", Severity.LOW, 1, false)), 0, 1).decision())
                    .isEqualTo(LoopDecision.ESCALATE_TO_HUMAN);
        }
    }

    @ParameterizedTest(name = "loopCount={0}, maxLoops={1}: final={2}, reentry={3}")
    @CsvSource({
            "0, 3, false, true",
            "1, 3, false, true",
            "2, 3, true, true",
            "3, 3, true, false",
            "0, 1, true, true",
            "1, 1, true, false"
    })
    @DisplayName("MaxLoopsCeiling boundaries")
    void ceiling(int loopCount, int maxLoops, boolean finalPass, boolean reentry) {
        MaxLoopsCeiling ceiling = new MaxLoopsCeiling();

        assertThat(ceiling.isFinalPass(loopCount, maxLoops)).isEqualTo(finalPass);
        assertThat(ceiling.permitsReentry(loopCount, maxLoops)).isEqualTo(reentry);
    }
}
