package com.eainde.verity.resolution;

import com.eainde.verity.integration.ReasoningResponse;
import com.eainde.verity.model.SupplierNotification;

import java.util.Optional;

/**
 * @param response the reasoning answer, empty when the template fallback was used
 */
public record NotificationDraft(SupplierNotification notification, Optional<ReasoningResponse> response) {

    public boolean fallback() {
        return response.isEmpty();
    }
}
