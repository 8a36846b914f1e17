package com.eainde.verity.regulatory;

import com.eainde.verity.integration.EntityRegistryClient;
import com.eainde.verity.integration.EntityVerification;
import com.eainde.verity.integration.IntelligenceClient;
import com.eainde.verity.integration.SupplierIntelligence;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Runs the entity-registry and live-intelligence checks concurrently. Either failing yields its fallback
 * snapshot; neither failure propagates.
 */
@Log4j2
@Component
public class SupplierVerifier {

    private final EntityRegistryClient registryClient;
    private final IntelligenceClient intelligenceClient;
    private final Executor executor;
    private final Clock clock;

    public SupplierVerifier(EntityRegistryClient registryClient,
                            IntelligenceClient intelligenceClient,
                            @Qualifier("collaboratorExecutor") Executor executor,
                            Clock clock) {
        this.registryClient = registryClient;
        this.intelligenceClient = intelligenceClient;
        this.executor = executor;
        this.clock = clock;
    }

    public VerificationSnapshots verify(String supplierId, String supplierName) {
        CompletableFuture<EntityVerification> registry = CompletableFuture
                .supplyAsync(() -> registryClient.verify(supplierId, supplierName, null), executor)
                .exceptionally(e -> {
                    log.warn("Entity registry check failed for {}: {}", supplierId, rootMessage(e));
                    return EntityVerification.unavailable(supplierId, supplierName);
                });
        CompletableFuture<SupplierIntelligence> intelligence = CompletableFuture
                .supplyAsync(() -> intelligenceClient.search(supplierId, supplierName, null), executor)
                .exceptionally(e -> {
                    log.warn("Live intelligence search failed for {}: {}", supplierId, rootMessage(e));
                    return SupplierIntelligence.unavailable(supplierId, supplierName, clock.instant());
                });
        return new VerificationSnapshots(registry.join(), intelligence.join());
    }

    private static String rootMessage(Throwable e) {
        Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
        return cause.getMessage();
    }
}
