package com.eainde.verity.knowledge;

import com.eainde.verity.model.FindingCategory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Static category to regulation lookup (EU ESPR 2024/0455 and related acts).
 * <p>
 * Every {@link FindingCategory} is listed explicitly: either with an entry or as deliberately unregulated.
 * A category missing from both lists fails construction.
 * </p>
 */
@Component
public class RegulationKnowledgeBase {

    /** Assumed annual EU revenue used to turn a penalty percentage into an amount. */
    public static final double ASSUMED_ANNUAL_REVENUE = 430_000_000.0;

    /** Regulatory ceiling: 4% of the assumed annual revenue. */
    public static final double EXPOSURE_CEILING = ASSUMED_ANNUAL_REVENUE * 0.04;

    private final Map<FindingCategory, Optional<RegulationEntry>> entries;

    public RegulationKnowledgeBase() {
        Map<FindingCategory, Optional<RegulationEntry>> table = new EnumMap<>(FindingCategory.class);
        table.put(FindingCategory.DATE_ANOMALY, Optional.of(new RegulationEntry(
                "EU ESPR 2024/0455, Article 9(2)",
                "Economic operators shall maintain accurate records of all production stages, ensuring "
                        + "chronological consistency between manufacturing, invoicing, and shipping documentation.",
                2.5, 100_000, false)));
        table.put(FindingCategory.SOURCE_MISMATCH, Optional.of(new RegulationEntry(
                "EU ESPR 2024/0455, Article 9(3) & Green Claims Directive Art. 5",
                "Product origin claims must be substantiated by verifiable evidence. Misrepresentation of "
                        + "geographic origin constitutes a violation of Article 5 of the Green Claims Directive and "
                        + "may constitute fraud under Article 9(3) of the ESPR.",
                4.0, 2_400_000, true)));
        table.put(FindingCategory.QUANTITY_DRIFT, Optional.of(new RegulationEntry(
                "EU ESPR 2024/0455, Article 14(1)",
                "The digital product passport shall contain accurate quantity information consistent across "
                        + "all trade documentation.",
                1.0, 50_000, false)));
        table.put(FindingCategory.CERTIFICATE_EXPIRED, Optional.of(new RegulationEntry(
                "EU ESPR 2024/0455, Article 11(4) & EUDR Art. 4",
                "Products placed on the Union market must be accompanied by valid certificates from accredited "
                        + "conformity assessment bodies. Expired certificates render the product non-compliant.",
                2.5, 150_000, false)));
        table.put(FindingCategory.EMISSIONS_EXCESS, Optional.of(new RegulationEntry(
                "EU ESPR 2024/0455, Article 7(2)(a) & GLEC Framework v3.0",
                "Performance requirements shall include maximum levels of environmental impact including "
                        + "carbon footprint over the life cycle, calculated using GLEC-compliant methodologies.",
                2.0, 120_000, false)));
        table.put(FindingCategory.DUPLICATE_REFERENCE, Optional.empty());
        table.put(FindingCategory.ENTITY_VALIDATION, Optional.empty());

        for (FindingCategory category : FindingCategory.values()) {
            if (!table.containsKey(category)) {
                throw new IllegalStateException("No regulation mapping declared for category " + category);
            }
        }
        this.entries = Collections.unmodifiableMap(table);
    }

    /**
     * @return the regulation for {@code category}, empty when the category is declared unregulated
     */
    public Optional<RegulationEntry> lookup(FindingCategory category) {
        Optional<RegulationEntry> entry = entries.get(category);
        if (entry == null) {
            throw new IllegalArgumentException("Unmapped finding category: " + category);
        }
        return entry;
    }

    /** Penalty in EUR for a percentage of the assumed revenue, never below the entry's base penalty. */
    public static double penaltyAmount(RegulationEntry entry, double penaltyPercentage) {
        return Math.max(entry.basePenalty(), Math.round(ASSUMED_ANNUAL_REVENUE * penaltyPercentage / 100.0));
    }
}
