package com.eainde.verity.correlator;

import com.eainde.verity.config.AuditSettings;
import com.eainde.verity.document.ClassifiedDocuments;
import com.eainde.verity.document.DocumentClassifier;
import com.eainde.verity.document.InvoiceRecord;
import com.eainde.verity.document.ManifestRecord;
import com.eainde.verity.document.MockDocuments;
import com.eainde.verity.integration.CollaboratorException;
import com.eainde.verity.integration.EmissionsClient;
import com.eainde.verity.integration.EmissionsEstimate;
import com.eainde.verity.log.StageLog;
import com.eainde.verity.model.Finding;
import com.eainde.verity.model.StageName;
import com.eainde.verity.state.AuditState;
import com.eainde.verity.state.TokenTotals;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * First stage: classifies the document set, runs every detector, scores risk and estimates freight emissions.
 */
@Log4j2
@Component
public class DocumentCorrelator {

    static final String TRANSPORT_MODE = "sea";

    private final DocumentClassifier classifier;
    private final List<DiscrepancyDetector> detectors;
    private final ReasoningDetector reasoningDetector;
    private final VerifiedSupplierOverride override;
    private final EmissionsClient emissionsClient;
    private final AuditSettings settings;
    private final Clock clock;

    public DocumentCorrelator(DocumentClassifier classifier,
                              List<DiscrepancyDetector> detectors,
                              ReasoningDetector reasoningDetector,
                              VerifiedSupplierOverride override,
                              EmissionsClient emissionsClient,
                              AuditSettings settings,
                              Clock clock) {
        this.classifier = classifier;
        this.detectors = List.copyOf(detectors);
        this.reasoningDetector = reasoningDetector;
        this.override = override;
        this.emissionsClient = emissionsClient;
        this.settings = settings;
        this.clock = clock;
    }

    public Map<String, Object> correlate(AuditState state) {
        StageLog stageLog = new StageLog(StageName.DOCUMENT_CORRELATOR, clock, state.getAgentLog().size());
        String batchId = state.getBatchId();
        TokenTotals tokens = TokenTotals.of(state);

        stageLog.info("SCAN_INITIATED", "Scanning " + state.getDocuments().size() + " documents for Batch #" + batchId
                + " (pass " + (state.getLoopCount() + 1) + "/" + state.getMaxLoops() + ").");

        List<Map<String, Object>> records = state.getExtractedData();
        boolean mockFallback = records.isEmpty();
        if (mockFallback) {
            records = MockDocuments.forDocuments(state.getDocuments());
            stageLog.warning("MOCK_FALLBACK", "No live extracted data for Batch #" + batchId
                    + ". Falling back to the demonstration document set (" + records.size() + " records).");
        }
        ClassifiedDocuments documents = classifier.classify(records, mockFallback);
        stageLog.info("DOCUMENTS_CLASSIFIED", documents.summary());
        checkReferenceAnchor(documents, stageLog);

        List<Finding> findings = new ArrayList<>();
        try {
            ReasoningDetection detection = reasoningDetector.detect(batchId, documents);
            tokens = tokens.plus(detection.response());
            findings.addAll(detection.findings());
            stageLog.info("REASONING_ANALYSIS_COMPLETE", "Reasoning analysis complete ("
                    + detection.response().inputTokens() + "+" + detection.response().outputTokens() + " tokens). "
                    + detection.findings().size() + " findings, " + detection.skipped() + " items skipped.");
        } catch (CollaboratorException e) {
            log.warn("Reasoning analysis failed for batch {}: {}. Proceeding with rule-based detection.", batchId, e.getMessage());
            stageLog.warning("REASONING_FALLBACK", "Reasoning unavailable (" + abbreviate(e.getMessage())
                    + "). Using rule-based detection.");
        }

        for (DiscrepancyDetector detector : detectors) {
            List<Finding> detected = detector.detect(documents);
            log.debug("Detector {} produced {} findings", detector.name(), detected.size());
            for (Finding finding : detected) {
                stageLog.warning(finding.category().name(), finding.description());
            }
            findings.addAll(detected);
        }

        Map<String, Object> partial = new HashMap<>(tokens.toPartial(settings));
        estimateEmissions(documents, stageLog).ifPresent(estimate -> partial.put(AuditState.EMISSIONS, estimate));

        double risk = RiskScorer.score(findings);
        if (override.applies(documents)) {
            stageLog.info("VERIFIED_SUPPLIER_OVERRIDE", "Verified supplier line with reconciled quantities; "
                    + findings.size() + " findings cleared, risk forced to 0.");
            findings.clear();
            risk = 0.0;
        }

        stageLog.info("SCAN_COMPLETE", String.format("Scan complete: %d findings, risk score: %.2f.", findings.size(), risk));
        log.info("Correlator pass finished for batch {}: {} findings, risk {}", batchId, findings.size(), risk);

        partial.put(AuditState.FINDINGS, List.copyOf(findings));
        partial.put(AuditState.RISK_SCORE, risk);
        partial.put(AuditState.AGENT_LOG, stageLog.entries());
        return partial;
    }

    private void checkReferenceAnchor(ClassifiedDocuments documents, StageLog stageLog) {
        InvoiceRecord invoice = documents.invoice();
        ManifestRecord manifest = documents.manifest();
        if (invoice == null || manifest == null) {
            return;
        }
        String invoiceNumber = invoice.invoiceNumber() == null ? "INV-UNKNOWN" : invoice.invoiceNumber();
        String reference = manifest.invoiceReference() == null ? "" : manifest.invoiceReference();
        if (!reference.isEmpty() && reference.contains(invoiceNumber)) {
            stageLog.info("REFERENCE_LINKED", "Bill of lading refers to invoice " + invoiceNumber + ".");
        } else {
            stageLog.warning("REFERENCE_MISMATCH", "Bill of lading reference (" + reference
                    + ") does not match invoice (" + invoiceNumber + "). Proceeding with role-based pairing.");
        }
    }

    private Optional<EmissionsEstimate> estimateEmissions(ClassifiedDocuments documents, StageLog stageLog) {
        ManifestRecord manifest = documents.manifest();
        if (manifest == null) {
            return Optional.empty();
        }
        if (manifest.weightKg() == null || manifest.portOfLoading() == null || manifest.portOfDischarge() == null) {
            stageLog.info("EMISSIONS_SKIPPED", "Manifest lacks weight or route; freight emissions not estimated.");
            return Optional.empty();
        }
        try {
            EmissionsEstimate estimate = emissionsClient.estimate(
                    manifest.portOfLoading(), manifest.portOfDischarge(), manifest.weightKg(), TRANSPORT_MODE);
            stageLog.info("EMISSIONS_SCORED", "GLEC score: " + estimate.co2eKg() + " kg CO2e ("
                    + estimate.origin() + " -> " + estimate.destination() + "). Source: " + estimate.source()
                    + (estimate.estimated() ? " (local estimate)." : "."));
            return Optional.of(estimate);
        } catch (RuntimeException e) {
            log.warn("Emissions estimate failed: {}", e.getMessage());
            stageLog.warning("EMISSIONS_UNAVAILABLE", "Freight emissions unavailable (" + abbreviate(e.getMessage()) + ").");
            return Optional.empty();
        }
    }

    static String abbreviate(String message) {
        if (message == null) {
            return "no detail";
        }
        return message.length() <= 80 ? message : message.substring(0, 80);
    }
}
