package com.eainde.verity.integration;

public interface IntelligenceClient {

    /**
     * @param context extra search terms, may be {@code null}
     * @throws CollaboratorException when the search service cannot be reached
     */
    SupplierIntelligence search(String supplierId, String name, String context);
}
