package com.eainde.verity.resolution;

import com.eainde.verity.integration.EntityVerification;
import com.eainde.verity.integration.SupplierIntelligence;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Risk discount for a supplier both verification checks report clean.
 */
@Component
public class TrustAdjustment {

    public static final double TRUST_BONUS = 0.15;

    /**
     * @return the discounted risk, or empty when the bonus does not apply
     */
    public OptionalDouble apply(Optional<EntityVerification> registry, Optional<SupplierIntelligence> intelligence,
                                double riskScore) {
        boolean registryClean = registry.map(EntityVerification::verified).orElse(false);
        boolean intelligenceClean = intelligence.map(SupplierIntelligence::lowRisk).orElse(false);
        if (!registryClean || !intelligenceClean || riskScore <= 0.0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(Math.round(Math.max(0.0, riskScore - TRUST_BONUS) * 100) / 100.0);
    }
}
