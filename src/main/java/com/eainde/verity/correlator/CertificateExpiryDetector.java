package com.eainde.verity.correlator;

import com.eainde.verity.config.AuditSettings;
import com.eainde.verity.document.CertificateRecord;
import com.eainde.verity.document.ClassifiedDocuments;
import com.eainde.verity.model.Finding;
import com.eainde.verity.model.FindingCategory;
import com.eainde.verity.model.Severity;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Flags a certificate whose expiry is strictly before the audit reference date.
 */
@Component
public class CertificateExpiryDetector implements DiscrepancyDetector {

    static final double CONFIDENCE = 0.99;

    private final LocalDate referenceDate;

    public CertificateExpiryDetector(AuditSettings settings) {
        this.referenceDate = settings.referenceDate();
    }

    @Override
    public String name() {
        return "certificate-expiry";
    }

    @Override
    public List<Finding> detect(ClassifiedDocuments documents) {
        CertificateRecord certificate = documents.certificate();
        if (certificate == null) {
            return List.of();
        }
        Optional<LocalDate> expiry = certificate.expiry();
        if (expiry.isEmpty() || !expiry.get().isBefore(referenceDate)) {
            return List.of();
        }
        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("certificate_type", nullToEmpty(certificate.certificateType()));
        evidence.put("certificate_number", nullToEmpty(certificate.certificateNumber()));
        evidence.put("expiry_date", expiry.get().toString());
        evidence.put("scope", nullToEmpty(certificate.scope()));
        return List.of(new Finding(
                FindingIds.deterministic(),
                FindingCategory.CERTIFICATE_EXPIRED,
                Severity.HIGH,
                CONFIDENCE,
                "Certificate " + nullToEmpty(certificate.certificateType()) + " (#"
                        + nullToEmpty(certificate.certificateNumber()) + ") expired on " + expiry.get(),
                evidence,
                certificate.sourceName(),
                "Certificate expired " + expiry.get() + ", audit reference date " + referenceDate + "."));
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
