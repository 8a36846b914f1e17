package com.eainde.verity.regulatory;

import com.eainde.verity.knowledge.RegulationKnowledgeBase;
import com.eainde.verity.model.ComplianceStatus;
import com.eainde.verity.model.Finding;
import com.eainde.verity.model.FindingCategory;
import com.eainde.verity.model.Violation;
import com.eainde.verity.model.ViolationClass;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Compliance verdict from the confirmed violations. Rules are evaluated in order and the first match wins;
 * an empty findings list overrides all of them.
 */
@Component
public class VerdictPolicy {

    /** Risk reported when the regulatory ceiling is applied. */
    public static final double CEILING_RISK = 0.86;
    public static final double LARGE_DRIFT_PERCENTAGE = 10.0;
    static final double NON_COMPLIANT_RISK_FLOOR = 0.70;
    static final double PENDING_REVIEW_RISK_FLOOR = 0.35;

    public Verdict decide(List<Finding> findings, List<Violation> violations, double currentRisk, double exposure) {
        if (findings.isEmpty()) {
            return new Verdict(ComplianceStatus.COMPLIANT, 0.0, 0.0, "no findings");
        }
        boolean originFraud = violations.stream().anyMatch(Violation::originFraud);
        boolean largeDrift = findings.stream()
                .filter(f -> f.category() == FindingCategory.QUANTITY_DRIFT)
                .anyMatch(f -> f.driftPercentage().orElse(0.0) > LARGE_DRIFT_PERCENTAGE);
        if (originFraud || largeDrift) {
            return new Verdict(ComplianceStatus.NON_COMPLIANT, CEILING_RISK, RegulationKnowledgeBase.EXPOSURE_CEILING,
                    originFraud ? "origin fraud ceiling" : "quantity drift above 10% ceiling");
        }
        long critical = violations.stream().filter(v -> v.violationClass() == ViolationClass.CRITICAL).count();
        long major = violations.stream().filter(v -> v.violationClass() == ViolationClass.MAJOR).count();
        if (critical >= 1 || major >= 2) {
            return new Verdict(ComplianceStatus.NON_COMPLIANT, Math.max(currentRisk, NON_COMPLIANT_RISK_FLOOR),
                    exposure, "critical or repeated major violations");
        }
        if (!violations.isEmpty()) {
            return new Verdict(ComplianceStatus.PENDING_REVIEW, Math.max(currentRisk, PENDING_REVIEW_RISK_FLOOR),
                    exposure, "violations pending review");
        }
        return new Verdict(ComplianceStatus.COMPLIANT, 0.0, 0.0, "no violations");
    }
}
