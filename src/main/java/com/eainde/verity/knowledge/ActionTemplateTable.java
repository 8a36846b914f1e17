package com.eainde.verity.knowledge;

import com.eainde.verity.model.FindingCategory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Static category to remediation template lookup. Categories without a specific template use {@link #GENERIC}.
 */
@Component
public class ActionTemplateTable {

    public static final ActionTemplate GENERIC = new ActionTemplate(
            "Provide additional documentation to resolve the identified discrepancy",
            "Manual review by compliance officer");

    private final Map<FindingCategory, ActionTemplate> templates;

    public ActionTemplateTable() {
        Map<FindingCategory, ActionTemplate> table = new EnumMap<>(FindingCategory.class);
        table.put(FindingCategory.DATE_ANOMALY, new ActionTemplate(
                "Provide corrected invoice with accurate manufacturing and issue dates, supported by production "
                        + "batch records from the factory floor system",
                "Re-scan corrected documents through the document correlator"));
        table.put(FindingCategory.SOURCE_MISMATCH, new ActionTemplate(
                "Submit verified Certificate of Origin from an accredited customs authority matching actual port "
                        + "of loading and shipper details",
                "Cross-reference new certificate against bill of lading and GLEIF entity registration"));
        table.put(FindingCategory.QUANTITY_DRIFT, new ActionTemplate(
                "Reconcile quantity discrepancies between invoice and bill of lading; provide packing list with "
                        + "item-level counts and weigh-bridge receipts",
                "Re-audit with reconciled documents; verify quantities within 0.5% tolerance"));
        table.put(FindingCategory.CERTIFICATE_EXPIRED, new ActionTemplate(
                "Obtain renewed certification from accredited EU conformity assessment body (Notified Body per "
                        + "ESPR Art. 48); submit proof of re-certification application",
                "Validate new certificate against EU EcoLabel registry and verify scope coverage"));
        table.put(FindingCategory.EMISSIONS_EXCESS, new ActionTemplate(
                "Submit carbon footprint recalculation using GLEC Framework v3.0 methodology; propose alternative "
                        + "low-emission logistics routes",
                "Re-calculate emissions via Climatiq with updated data; verify GLEC compliance"));
        table.put(FindingCategory.DUPLICATE_REFERENCE, GENERIC);
        table.put(FindingCategory.ENTITY_VALIDATION, GENERIC);

        for (FindingCategory category : FindingCategory.values()) {
            if (!table.containsKey(category)) {
                throw new IllegalStateException("No action template declared for category " + category);
            }
        }
        this.templates = Collections.unmodifiableMap(table);
    }

    /**
     * @param category originating finding category, {@code null} when the finding could not be found
     */
    public ActionTemplate templateFor(FindingCategory category) {
        return category == null ? GENERIC : templates.get(category);
    }
}
