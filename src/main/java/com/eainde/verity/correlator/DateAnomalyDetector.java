package com.eainde.verity.correlator;

import com.eainde.verity.document.ClassifiedDocuments;
import com.eainde.verity.document.InvoiceRecord;
import com.eainde.verity.model.Finding;
import com.eainde.verity.model.FindingCategory;
import com.eainde.verity.model.Severity;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flags an invoice issued before its own goods were manufactured.
 */
@Component
public class DateAnomalyDetector implements DiscrepancyDetector {

    static final double CONFIDENCE = 0.92;

    @Override
    public String name() {
        return "date-anomaly";
    }

    @Override
    public List<Finding> detect(ClassifiedDocuments documents) {
        InvoiceRecord invoice = documents.invoice();
        if (invoice == null || invoice.invoiceDate() == null || invoice.manufacturingDate() == null) {
            return List.of();
        }
        String issued = invoice.invoiceDate();
        String manufactured = invoice.manufacturingDate();
        if (!precedes(issued, manufactured)) {
            return List.of();
        }
        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("invoice_date", issued);
        evidence.put("manufacturing_date", manufactured);
        return List.of(new Finding(
                FindingIds.deterministic(),
                FindingCategory.DATE_ANOMALY,
                Severity.HIGH,
                CONFIDENCE,
                "Invoice date (" + issued + ") precedes production date (" + manufactured + ")",
                evidence,
                invoice.sourceName(),
                "Chronological sequence error: invoice (" + issued + ") issued before production (" + manufactured + ")."));
    }

    private static boolean precedes(String first, String second) {
        try {
            return LocalDate.parse(first.substring(0, Math.min(10, first.length())))
                    .isBefore(LocalDate.parse(second.substring(0, Math.min(10, second.length()))));
        } catch (DateTimeParseException e) {
            return first.compareTo(second) < 0;
        }
    }
}
