package com.eainde.verity.resolution;

import com.eainde.verity.integration.CollaboratorException;
import com.eainde.verity.integration.ReasoningClient;
import com.eainde.verity.integration.ReasoningResponse;
import com.eainde.verity.model.CorrectiveAction;
import com.eainde.verity.model.SupplierNotification;
import com.eainde.verity.model.Violation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Drafts the supplier non-compliance notice. Falls back to a fixed template whenever the reasoning
 * collaborator fails, so a notice always exists when there are violations.
 */
@Log4j2
@Component
public class NotificationDrafter {

    static final double TEMPERATURE = 0.3;

    private static final String SYSTEM_PROMPT = """
            Write a formal, professional supplier non-compliance notification email that:
            1. Cites specific EU ESPR 2024/0455 articles
            2. Lists each violation with evidence
            3. Specifies corrective actions with deadlines
            4. Warns of penalty risks (up to 4% of annual EU turnover)
            5. Requests acknowledgment within 72 hours
            6. Maintains firm but professional tone

            Do NOT use markdown. Write plain text email format.""";

    private final ReasoningClient reasoningClient;
    private final ObjectMapper objectMapper;

    public NotificationDrafter(ReasoningClient reasoningClient, ObjectMapper objectMapper) {
        this.reasoningClient = reasoningClient;
        this.objectMapper = objectMapper;
    }

    public NotificationDraft draft(String supplierName, String batchId,
                                   List<Violation> violations, List<CorrectiveAction> actions) {
        String recipient = recipientFor(supplierName);
        String subject = "URGENT: Non-Compliance Notice - Batch #" + batchId;
        try {
            ReasoningResponse response = reasoningClient.reason(SYSTEM_PROMPT,
                    "Supplier: " + supplierName + "\nBatch: " + batchId
                            + "\nViolations: " + toJson(violations)
                            + "\nCorrective Actions: " + toJson(actions),
                    TEMPERATURE);
            if (response.text().isBlank()) {
                throw new CollaboratorException("Reasoning collaborator returned an empty notification");
            }
            return new NotificationDraft(SupplierNotification.draft(recipient, subject, response.text().trim()),
                    Optional.of(response));
        } catch (CollaboratorException e) {
            log.warn("Notification drafting failed for batch {}: {}. Using template.", batchId, e.getMessage());
            return new NotificationDraft(
                    SupplierNotification.draft(recipient, subject, fallbackBody(supplierName, batchId, violations.size())),
                    Optional.empty());
        }
    }

    static String recipientFor(String supplierName) {
        return "compliance@" + supplierName.toLowerCase(Locale.ROOT).replace(' ', '-') + ".com";
    }

    static String fallbackBody(String supplierName, String batchId, int violationCount) {
        return "Dear " + supplierName + " Compliance Team,\n\n"
                + "Audit Batch #" + batchId + " has identified " + violationCount + " violations. "
                + "Please review and respond within 72 hours.\n\n"
                + "Verity Audit System";
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new CollaboratorException("Notification context could not be serialized", e);
        }
    }
}
