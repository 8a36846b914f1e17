package com.eainde.verity.document;

import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Assigns each raw record at most one role.
 * <p>
 * Explicit type or file-name keywords are applied to every record first. Field signatures are then tried on the
 * records still unassigned, and only for roles no keyword claimed. Within either pass the first record wins a role.
 * </p>
 */
@Log4j2
@Component
public class DocumentClassifier {

    private static final List<String> MANIFEST_KEYWORDS = List.of("bill", "manifest", "lading", "bol");
    private static final List<String> CERTIFICATE_KEYWORDS = List.of("certificate", "cert");

    public ClassifiedDocuments classify(List<Map<String, Object>> records, boolean mockFallback) {
        Map<DocumentRole, Integer> assigned = new EnumMap<>(DocumentRole.class);
        List<Integer> unassigned = new ArrayList<>();

        for (int i = 0; i < records.size(); i++) {
            DocumentRole role = byKeyword(records.get(i));
            if (role != null && !assigned.containsKey(role)) {
                assigned.put(role, i);
            } else {
                unassigned.add(i);
            }
        }

        for (int i : unassigned) {
            DocumentRole role = bySignature(records.get(i), assigned);
            if (role != null) {
                log.debug("Record {} classified as {} by field signature", i, role);
                assigned.put(role, i);
            }
        }

        InvoiceRecord invoice = null;
        ManifestRecord manifest = null;
        CertificateRecord certificate = null;
        for (Map.Entry<DocumentRole, Integer> entry : assigned.entrySet()) {
            Map<String, Object> raw = records.get(entry.getValue());
            String name = sourceName(raw, entry.getValue());
            switch (entry.getKey()) {
                case INVOICE -> invoice = InvoiceRecord.from(name, raw);
                case MANIFEST -> manifest = ManifestRecord.from(name, raw);
                case CERTIFICATE -> certificate = CertificateRecord.from(name, raw);
            }
        }
        ClassifiedDocuments classified = new ClassifiedDocuments(invoice, manifest, certificate, mockFallback);
        log.info("Classification results -> {}", classified.summary());
        return classified;
    }

    private DocumentRole byKeyword(Map<String, Object> raw) {
        String type = lower(Fields.text(raw, "document_type", "type"));
        String fileName = lower(Fields.text(raw, "file_name"));
        if (type.contains("invoice") || fileName.contains("invoice")) {
            return DocumentRole.INVOICE;
        }
        if (MANIFEST_KEYWORDS.stream().anyMatch(k -> type.contains(k) || fileName.contains(k))) {
            return DocumentRole.MANIFEST;
        }
        if (CERTIFICATE_KEYWORDS.stream().anyMatch(k -> type.contains(k) || fileName.contains(k))) {
            return DocumentRole.CERTIFICATE;
        }
        return null;
    }

    private DocumentRole bySignature(Map<String, Object> raw, Map<DocumentRole, Integer> assigned) {
        if (!assigned.containsKey(DocumentRole.INVOICE)
                && Fields.hasAny(raw, "invoice_date", "total_value", "invoice_number")) {
            return DocumentRole.INVOICE;
        }
        if (!assigned.containsKey(DocumentRole.MANIFEST)
                && Fields.hasAny(raw, "port_of_loading", "vessel_name")) {
            return DocumentRole.MANIFEST;
        }
        if (!assigned.containsKey(DocumentRole.CERTIFICATE)
                && Fields.hasAny(raw, "certificate_number", "certificate_type")) {
            return DocumentRole.CERTIFICATE;
        }
        return null;
    }

    private static String sourceName(Map<String, Object> raw, int index) {
        String name = Fields.text(raw, "file_name", "document_type", "type");
        return name != null ? name : "document-" + (index + 1);
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }
}
