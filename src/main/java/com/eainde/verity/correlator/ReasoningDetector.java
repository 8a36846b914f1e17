package com.eainde.verity.correlator;

import com.eainde.verity.document.ClassifiedDocuments;
import com.eainde.verity.integration.CollaboratorException;
import com.eainde.verity.integration.MalformedResponseException;
import com.eainde.verity.integration.ReasoningClient;
import com.eainde.verity.integration.ReasoningJson;
import com.eainde.verity.integration.ReasoningResponse;
import com.eainde.verity.model.Finding;
import com.eainde.verity.model.FindingCategory;
import com.eainde.verity.model.Severity;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Asks the reasoning collaborator for findings the deterministic rules cannot see.
 */
@Log4j2
@Component
public class ReasoningDetector {

    static final double DEFAULT_CONFIDENCE = 0.9;
    static final double TEMPERATURE = 0.1;

    private static final String SYSTEM_PROMPT = """
            You are a zero-trust supply chain document analyst. Identify every discrepancy between the \
            invoice, the bill of lading and the certificate. Output a JSON findings list only.""";

    private static final String USER_TEMPLATE = """
            Analyze these supply chain documents for Batch #%s:

            %s

            Identify ALL discrepancies, date anomalies, origin mismatches, and compliance risks.
            Focus on EU Green Claims Directive requirements.

            RESPOND ONLY WITH VALID JSON:
            {
              "reasoning": "string",
              "ai_findings": [
                {
                  "type": "DATE_ANOMALY|SOURCE_MISMATCH|QUANTITY_DRIFT|CERTIFICATE_EXPIRED|EMISSIONS_EXCESS|ENTITY_VALIDATION",
                  "severity": "CRITICAL|HIGH|MEDIUM|LOW",
                  "confidence": 0.0,
                  "description": "string",
                  "evidence": {}
                }
              ]
            }""";

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ReasoningClient reasoningClient;
    private final ObjectMapper objectMapper;

    public ReasoningDetector(ReasoningClient reasoningClient, ObjectMapper objectMapper) {
        this.reasoningClient = reasoningClient;
        this.objectMapper = objectMapper;
    }

    /**
     * @throws CollaboratorException when the collaborator fails or its answer is not a findings list
     */
    public ReasoningDetection detect(String batchId, ClassifiedDocuments documents) {
        String records;
        try {
            records = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(documents.rawByRole());
        } catch (JsonProcessingException e) {
            throw new CollaboratorException("Documents could not be serialized for reasoning", e);
        }
        ReasoningResponse response = reasoningClient.reason(
                SYSTEM_PROMPT, USER_TEMPLATE.formatted(batchId, records), TEMPERATURE);

        JsonNode root = ReasoningJson.parse(objectMapper, response.text());
        JsonNode items;
        String reasoning = "";
        if (root.isArray()) {
            items = root;
        } else if (root.isObject()) {
            items = root.has("ai_findings") ? root.get("ai_findings") : root.path("findings");
            reasoning = root.path("reasoning").asText("");
        } else {
            throw new MalformedResponseException("Reasoning answer is neither a list nor an object");
        }
        if (!items.isArray()) {
            throw new MalformedResponseException("Reasoning answer carries no findings list");
        }

        List<Finding> findings = new ArrayList<>();
        int skipped = 0;
        for (JsonNode item : items) {
            FindingCategory category = FindingCategory.parse(item.path("type").asText(item.path("category").asText(null)));
            if (category == null) {
                log.warn("Skipping reasoning finding with unknown type: {}", item.path("type").asText("<missing>"));
                skipped++;
                continue;
            }
            findings.add(new Finding(
                    FindingIds.reasoned(),
                    category,
                    Severity.parseOrDefault(item.path("severity").asText(null), Severity.MEDIUM),
                    confidence(item.path("confidence")),
                    item.path("description").asText(""),
                    item.path("evidence").isObject() ? objectMapper.convertValue(item.get("evidence"), MAP_TYPE) : Map.of(),
                    "reasoning",
                    reasoning));
        }
        return new ReasoningDetection(findings, skipped, response);
    }

    static double confidence(JsonNode node) {
        if (!node.isNumber() && !node.isTextual()) {
            return DEFAULT_CONFIDENCE;
        }
        double value = node.asDouble(0.0);
        if (value <= 0.0 || Double.isNaN(value)) {
            return DEFAULT_CONFIDENCE;
        }
        return Math.min(value, 1.0);
    }
}
