package com.eainde.verity.document;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fixed demonstration document set used when a request carries no extracted data.
 */
public final class MockDocuments {

    public static final String INVOICE = "INV-2026-0402-003.pdf";
    public static final String BILL_OF_LADING = "BOL-SH-2026-0402.pdf";
    public static final String CERTIFICATE = "CERT-ECO-2026-091.pdf";

    private static final Map<String, Map<String, Object>> DOCUMENTS = new LinkedHashMap<>();

    static {
        Map<String, Object> invoice = new LinkedHashMap<>();
        invoice.put("type", "invoice");
        invoice.put("supplier", "GreenTextile GmbH");
        invoice.put("invoice_date", "2026-01-15");
        invoice.put("manufacturing_date", "2026-01-20");
        invoice.put("origin_country", "Bangladesh");
        invoice.put("declared_origin", "Germany");
        invoice.put("quantity", 15000);
        invoice.put("unit", "meters");
        invoice.put("total_value", 42000.00);
        invoice.put("currency", "EUR");
        DOCUMENTS.put(INVOICE, invoice);

        Map<String, Object> bill = new LinkedHashMap<>();
        bill.put("type", "bill_of_lading");
        bill.put("supplier", "GreenTextile GmbH");
        bill.put("port_of_loading", "BDCGP");
        bill.put("port_of_discharge", "DEHAM");
        bill.put("quantity", 14850);
        bill.put("unit", "meters");
        bill.put("weight_kg", 8200);
        bill.put("vessel", "MSC AURORA");
        bill.put("departure_date", "2026-01-22");
        bill.put("shipper", "GreenTextile BD Ltd.");
        bill.put("consignee", "EuroFashion Distribution GmbH");
        DOCUMENTS.put(BILL_OF_LADING, bill);

        Map<String, Object> certificate = new LinkedHashMap<>();
        certificate.put("type", "certificate");
        certificate.put("supplier", "GreenTextile GmbH");
        certificate.put("certificate_type", "EU_ECOLABEL");
        certificate.put("certificate_number", "ECO-2024-091-DE");
        certificate.put("issued_date", "2024-03-01");
        certificate.put("expiry_date", "2025-12-31");
        certificate.put("scope", "Organic Cotton Textiles");
        certificate.put("issuing_body", "European Commission");
        DOCUMENTS.put(CERTIFICATE, certificate);
    }

    private MockDocuments() {
    }

    /**
     * Mock records for the named documents, each tagged with its {@code file_name}. Unknown names are skipped;
     * when none of the names is known the whole demonstration set is returned.
     */
    public static List<Map<String, Object>> forDocuments(List<String> documentNames) {
        List<Map<String, Object>> records = new ArrayList<>();
        for (String name : documentNames) {
            Map<String, Object> document = DOCUMENTS.get(name);
            if (document != null) {
                Map<String, Object> copy = new LinkedHashMap<>(document);
                copy.put("file_name", name);
                records.add(copy);
            }
        }
        if (records.isEmpty()) {
            return forDocuments(List.copyOf(DOCUMENTS.keySet()));
        }
        return records;
    }
}
