package com.eainde.verity.regulatory;

import com.eainde.verity.integration.EntityVerification;
import com.eainde.verity.integration.SupplierIntelligence;

public record VerificationSnapshots(EntityVerification registry, SupplierIntelligence intelligence) {
}
