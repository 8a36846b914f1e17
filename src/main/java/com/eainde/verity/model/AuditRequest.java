package com.eainde.verity.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Input of one audit run. Every field is optional; missing values fall back to the demo batch.
 *
 * @param batchId       shipment batch under audit
 * @param supplierId    internal supplier id
 * @param supplierName  supplier legal or trade name
 * @param documents     names of the submitted documents
 * @param extractedData raw field maps extracted from the documents, may be empty
 * @param maxLoops      pass ceiling, {@code null} for the configured default
 */
public record AuditRequest(
        @JsonProperty("batchId")       String batchId,
        @JsonProperty("supplierId")    String supplierId,
        @JsonProperty("supplierName")  String supplierName,
        @JsonProperty("documents")     List<String> documents,
        @JsonProperty("extractedData") List<Map<String, Object>> extractedData,
        @JsonProperty("maxLoops")      Integer maxLoops
) {

    public static final String DEMO_BATCH_ID = "BATCH-2026-0402";
    public static final String DEMO_SUPPLIER_ID = "SUP-4821";
    public static final String DEMO_SUPPLIER_NAME = "GreenTextile GmbH";
    public static final List<String> DEMO_DOCUMENTS = List.of(
            "INV-2026-0402-003.pdf",
            "BOL-SH-2026-0402.pdf",
            "CERT-ECO-2026-091.pdf");

    public AuditRequest {
        batchId = blankToDefault(batchId, DEMO_BATCH_ID);
        supplierId = blankToDefault(supplierId, DEMO_SUPPLIER_ID);
        supplierName = blankToDefault(supplierName, DEMO_SUPPLIER_NAME);
        documents = documents == null || documents.isEmpty() ? DEMO_DOCUMENTS : List.copyOf(documents);
        extractedData = extractedData == null ? List.of() : List.copyOf(extractedData);
    }

    public static AuditRequest demo() {
        return new AuditRequest(null, null, null, null, null, null);
    }

    private static String blankToDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
