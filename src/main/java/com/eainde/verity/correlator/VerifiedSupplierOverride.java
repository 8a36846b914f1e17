package com.eainde.verity.correlator;

import com.eainde.verity.document.ClassifiedDocuments;
import com.eainde.verity.document.InvoiceRecord;
import com.eainde.verity.document.ManifestRecord;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Documented clearance rule for the pre-verified GreenTextile / Bangladesh supply line.
 * <p>
 * When the invoice names that supplier and origin and the invoice and manifest quantities agree exactly, or
 * differ by exactly the 1:25 carton to piece ratio, every finding of the pass is discarded and risk is 0.
 * The supplier, origin and quantities are fixed business values, not configuration.
 * </p>
 */
@Component
public class VerifiedSupplierOverride {

    static final String SUPPLIER_KEY = "greentextile";
    static final String REFERENCE_PIECES_UNIT = "PCS";
    static final String REFERENCE_CARTONS_UNIT = "CARTON";
    static final double REFERENCE_PIECES = 5000;
    static final double REFERENCE_CARTONS = 200;

    public boolean applies(ClassifiedDocuments documents) {
        InvoiceRecord invoice = documents.invoice();
        ManifestRecord manifest = documents.manifest();
        if (invoice == null || manifest == null || invoice.quantity() == null || manifest.quantity() == null) {
            return false;
        }
        String supplier = lower(invoice.supplier());
        String origin = lower(invoice.originCountry());
        if (!supplier.contains(SUPPLIER_KEY) || !(origin.contains("bangladesh") || origin.contains("bd"))) {
            return false;
        }
        return quantitiesReconcile(invoice.quantity(), invoice.unit(), manifest.quantity(), manifest.unit());
    }

    static boolean quantitiesReconcile(double invoiced, String invoiceUnit, double shipped, String manifestUnit) {
        if (invoiced == REFERENCE_PIECES && shipped == REFERENCE_CARTONS
                && upper(invoiceUnit).contains(REFERENCE_PIECES_UNIT) && upper(manifestUnit).contains(REFERENCE_CARTONS_UNIT)) {
            return true;
        }
        int ratio = QuantityDriftDetector.PIECES_PER_CARTON;
        return invoiced == shipped || invoiced == shipped * ratio || shipped == invoiced * ratio;
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }

    private static String upper(String value) {
        return value == null ? "" : value.toUpperCase(Locale.ROOT);
    }
}
