package com.eainde.verity.integration;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Snapshot of the last entity-registry lookup for a supplier.
 */
public record EntityVerification(
        @JsonProperty("supplierId")   String supplierId,
        @JsonProperty("query")        String query,
        @JsonProperty("status")       RegistryStatus status,
        @JsonProperty("records")      List<LeiRecord> records,
        @JsonProperty("riskFlags")    List<String> riskFlags,
        @JsonProperty("apiAvailable") boolean apiAvailable
) implements Serializable {

    public static final String API_ERROR = "API_ERROR";

    public EntityVerification {
        records = records == null ? List.of() : List.copyOf(records);
        riskFlags = riskFlags == null ? List.of() : List.copyOf(riskFlags);
    }

    public static EntityVerification unavailable(String supplierId, String query) {
        return new EntityVerification(supplierId, query, RegistryStatus.UNVERIFIED, List.of(), List.of(API_ERROR), false);
    }

    public boolean verified() {
        return status == RegistryStatus.VERIFIED;
    }
}
