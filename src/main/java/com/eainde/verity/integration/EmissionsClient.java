package com.eainde.verity.integration;

/**
 * Freight-emissions collaborator. Implementations degrade to a local estimate instead of throwing.
 */
public interface EmissionsClient {

    EmissionsEstimate estimate(String origin, String destination, double weightKg, String mode);
}
