package com.eainde.verity.document;

import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;

public record CertificateRecord(
        String sourceName,
        Map<String, Object> raw,
        String certificateNumber,
        String certificateType,
        String issuedDate,
        String expiryDate,
        String scope,
        String issuingBody
) implements DocumentRecord {

    public static CertificateRecord from(String sourceName, Map<String, Object> raw) {
        return new CertificateRecord(
                sourceName,
                Fields.copy(raw),
                Fields.text(raw, "certificate_number", "certificate_numbers"),
                Fields.text(raw, "certificate_type"),
                Fields.text(raw, "issued_date"),
                Fields.text(raw, "certificate_expiry", "expiry_date"),
                Fields.text(raw, "scope"),
                Fields.text(raw, "issuing_body"));
    }

    /** Expiry as a date; empty when missing or not ISO-8601. */
    public Optional<LocalDate> expiry() {
        return Fields.date(expiryDate);
    }

    @Override
    public DocumentRole role() {
        return DocumentRole.CERTIFICATE;
    }
}
