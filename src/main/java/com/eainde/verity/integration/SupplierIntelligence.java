package com.eainde.verity.integration;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Snapshot of the last live-intelligence search for a supplier.
 */
public record SupplierIntelligence(
        @JsonProperty("supplierId")   String supplierId,
        @JsonProperty("query")        String query,
        @JsonProperty("searchedAt")   Instant searchedAt,
        @JsonProperty("riskTier")     RiskTier riskTier,
        @JsonProperty("hits")         List<NewsHit> hits,
        @JsonProperty("keywords")     List<String> keywords,
        @JsonProperty("summary")      String summary,
        @JsonProperty("apiAvailable") boolean apiAvailable
) implements Serializable {

    public SupplierIntelligence {
        hits = hits == null ? List.of() : List.copyOf(hits);
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
    }

    public static SupplierIntelligence unavailable(String supplierId, String query, Instant at) {
        return new SupplierIntelligence(supplierId, query, at, RiskTier.UNKNOWN, List.of(), List.of(),
                "Live intelligence unavailable, API error.", false);
    }

    public boolean lowRisk() {
        return riskTier == RiskTier.LOW;
    }
}
