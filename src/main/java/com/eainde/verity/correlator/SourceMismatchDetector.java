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

/**
 * Flags a declared origin that the port of loading contradicts.
 * <p>
 * The port's country is the first two letters of its UN/LOCODE. A shipper address naming the declared
 * country (e.g. "Savar, BD" for Bangladesh) is accepted as corroboration even when the port differs.
 * </p>
 */
@Component
public class SourceMismatchDetector implements DiscrepancyDetector {

    static final double CONFIDENCE = 0.95;

    @Override
    public String name() {
        return "source-mismatch";
    }

    @Override
    public List<Finding> detect(ClassifiedDocuments documents) {
        InvoiceRecord invoice = documents.invoice();
        ManifestRecord manifest = documents.manifest();
        if (invoice == null || manifest == null || invoice.declaredOrigin() == null
                || manifest.portOfLoading() == null || manifest.portOfLoading().length() < 2) {
            return List.of();
        }
        String declared = invoice.declaredOrigin();
        String port = manifest.portOfLoading();
        String portCountry = port.substring(0, 2).toUpperCase(Locale.ROOT);
        String declaredCountry = CountryAliases.resolve(declared);

        boolean consistent;
        if (declaredCountry == null) {
            consistent = declared.trim().equalsIgnoreCase(portCountry);
        } else {
            consistent = declaredCountry.equals(portCountry)
                    || CountryAliases.mentions(manifest.shipperAddress(), declaredCountry);
        }
        if (consistent) {
            return List.of();
        }

        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("declared_origin", declared);
        evidence.put("declared_country", declaredCountry == null ? "" : declaredCountry);
        evidence.put("port_of_loading", port);
        evidence.put("port_country", portCountry);
        return List.of(new Finding(
                FindingIds.deterministic(),
                FindingCategory.SOURCE_MISMATCH,
                Severity.CRITICAL,
                CONFIDENCE,
                "Declared origin '" + declared + "' contradicts port of loading '" + port + "'",
                evidence,
                "cross-reference",
                null));
    }
}
