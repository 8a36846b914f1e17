package com.eainde.verity.regulatory;

import com.eainde.verity.integration.CollaboratorException;
import com.eainde.verity.integration.MalformedResponseException;
import com.eainde.verity.integration.ReasoningClient;
import com.eainde.verity.integration.ReasoningJson;
import com.eainde.verity.integration.ReasoningResponse;
import com.eainde.verity.knowledge.RegulationEntry;
import com.eainde.verity.model.Finding;
import com.eainde.verity.model.Violation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

/**
 * Refines the default penalty of a finding with the reasoning collaborator.
 */
@Component
public class LegalAssessor {

    static final double TEMPERATURE = 0.1;

    private static final String SYSTEM_PROMPT = """
            You are a legal compliance expert specializing in EU ESPR 2024/0455 and the Green Claims \
            Directive 2023/0085.

            Evaluate whether the provided audit finding constitutes a violation of the cited regulation. \
            Calculate the penalty risk as a percentage of annual EU turnover (max 4% for CRITICAL violations \
            per Article 68).

            RESPOND IN VALID JSON ONLY:
            {
              "is_violation": true,
              "violation_type": "CRITICAL|MAJOR|MINOR|OBSERVATION",
              "penalty_risk_pct": 0.0,
              "cited_article": "string",
              "legal_reasoning": "string"
            }""";

    private final ReasoningClient reasoningClient;
    private final ObjectMapper objectMapper;

    public LegalAssessor(ReasoningClient reasoningClient, ObjectMapper objectMapper) {
        this.reasoningClient = reasoningClient;
        this.objectMapper = objectMapper;
    }

    /**
     * @throws CollaboratorException when the collaborator fails or answers without usable JSON
     */
    public LegalAssessment assess(Finding finding, RegulationEntry regulation) {
        String findingJson;
        try {
            findingJson = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(finding);
        } catch (JsonProcessingException e) {
            throw new CollaboratorException("Finding " + finding.id() + " could not be serialized", e);
        }
        ReasoningResponse response = reasoningClient.reason(SYSTEM_PROMPT,
                "AUDIT FINDING:\n" + findingJson + "\n\nREGULATION TEXT:\n" + regulation.citedText(), TEMPERATURE);
        JsonNode root = ReasoningJson.parse(objectMapper, response.text());
        if (!root.isObject()) {
            throw new MalformedResponseException("Legal assessment is not a JSON object");
        }
        JsonNode pct = root.path("penalty_risk_pct");
        double percentage = pct.isNumber() || pct.isTextual()
                ? clamp(pct.asDouble(regulation.penaltyPercentage()))
                : regulation.penaltyPercentage();
        return new LegalAssessment(percentage, root.path("legal_reasoning").asText(""), response);
    }

    static double clamp(double percentage) {
        if (Double.isNaN(percentage)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(Violation.MAX_PENALTY_PERCENTAGE, percentage));
    }
}
