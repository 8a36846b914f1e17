package com.eainde.verity.correlator;

import com.eainde.verity.document.ClassifiedDocuments;
import com.eainde.verity.document.InvoiceRecord;
import com.eainde.verity.document.ManifestRecord;
import com.eainde.verity.model.Finding;
import com.eainde.verity.model.FindingCategory;
import com.eainde.verity.model.Severity;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Flags invoice and manifest quantities that differ by more than the tolerance after unit normalization.
 */
@Component
public class QuantityDriftDetector implements DiscrepancyDetector {

    static final double CONFIDENCE = 0.88;
    static final double TOLERANCE = 0.005;
    static final int PIECES_PER_CARTON = 25;

    private static final Set<String> CARTON_UNITS = Set.of("CARTON", "CARTONS", "CTN", "CTNS");
    private static final Set<String> PIECE_UNITS = Set.of("PCS", "PC", "PIECE", "PIECES");

    @Override
    public String name() {
        return "quantity-drift";
    }

    @Override
    public List<Finding> detect(ClassifiedDocuments documents) {
        InvoiceRecord invoice = documents.invoice();
        ManifestRecord manifest = documents.manifest();
        if (invoice == null || manifest == null || invoice.quantity() == null || manifest.quantity() == null) {
            return List.of();
        }
        double invoiced = invoice.quantity();
        double shipped = manifest.quantity();
        String invoiceUnit = normalizeUnit(invoice.unit());
        String manifestUnit = normalizeUnit(manifest.unit());

        if (CARTON_UNITS.contains(invoiceUnit) && PIECE_UNITS.contains(manifestUnit)) {
            invoiced *= PIECES_PER_CARTON;
        } else if (CARTON_UNITS.contains(manifestUnit) && PIECE_UNITS.contains(invoiceUnit)) {
            shipped *= PIECES_PER_CARTON;
        }

        if (invoiced == 0 || shipped == 0 || Math.abs(invoiced - shipped) / invoiced <= TOLERANCE) {
            return List.of();
        }
        double drift = Math.round((invoiced - shipped) / invoiced * 100 * 100) / 100.0;

        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("invoice_quantity", invoiced);
        evidence.put("manifest_quantity", shipped);
        evidence.put("invoice_unit", invoice.unit() == null ? "" : invoice.unit());
        evidence.put("manifest_unit", manifest.unit() == null ? "" : manifest.unit());
        evidence.put(Finding.DRIFT_PERCENTAGE, drift);
        return List.of(new Finding(
                FindingIds.deterministic(),
                FindingCategory.QUANTITY_DRIFT,
                Severity.MEDIUM,
                CONFIDENCE,
                "Quantity mismatch: invoice declares " + invoiced + ", bill of lading shows " + shipped
                        + " (" + drift + "% drift)",
                evidence,
                "cross-reference",
                null));
    }

    static String normalizeUnit(String unit) {
        return unit == null ? "" : unit.trim().toUpperCase(Locale.ROOT).replace(".", "");
    }
}
