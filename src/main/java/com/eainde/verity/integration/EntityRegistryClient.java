package com.eainde.verity.integration;

public interface EntityRegistryClient {

    /**
     * @param jurisdiction ISO country code, or {@code null} for no filter
     * @throws CollaboratorException when the registry cannot be reached
     */
    EntityVerification verify(String supplierId, String name, String jurisdiction);
}
