package com.eainde.verity.document;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The role-assigned view of one document set. Any role may be absent.
 *
 * @param mockFallback true when the fixed demonstration set was substituted for missing live records
 */
public record ClassifiedDocuments(
        InvoiceRecord invoice,
        ManifestRecord manifest,
        CertificateRecord certificate,
        boolean mockFallback
) {

    public Optional<InvoiceRecord> invoiceRecord() {
        return Optional.ofNullable(invoice);
    }

    public Optional<ManifestRecord> manifestRecord() {
        return Optional.ofNullable(manifest);
    }

    public Optional<CertificateRecord> certificateRecord() {
        return Optional.ofNullable(certificate);
    }

    /** Raw fields per role, for prompts. Missing roles map to {@code null}. */
    public Map<String, Object> rawByRole() {
        Map<String, Object> byRole = new LinkedHashMap<>();
        byRole.put("invoice", invoice == null ? null : invoice.raw());
        byRole.put("bill_of_lading", manifest == null ? null : manifest.raw());
        byRole.put("certificate", certificate == null ? null : certificate.raw());
        return byRole;
    }

    public String summary() {
        return "Invoice: " + (invoice != null) + ", BOL: " + (manifest != null) + ", Cert: " + (certificate != null);
    }
}
