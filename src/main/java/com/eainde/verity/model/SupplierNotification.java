package com.eainde.verity.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * Drafted supplier notice. Always starts in {@link NotificationStatus#PENDING_APPROVAL};
 * nothing is sent without a human approving it first.
 */
public record SupplierNotification(
        @JsonProperty("recipient") String recipient,
        @JsonProperty("subject")   String subject,
        @JsonProperty("body")      String body,
        @JsonProperty("status")    NotificationStatus status
) implements Serializable {

    public static SupplierNotification draft(String recipient, String subject, String body) {
        return new SupplierNotification(recipient, subject, body, NotificationStatus.PENDING_APPROVAL);
    }

    public SupplierNotification approve() {
        return moveTo(NotificationStatus.PENDING_APPROVAL, NotificationStatus.APPROVED);
    }

    public SupplierNotification markSent() {
        return moveTo(NotificationStatus.APPROVED, NotificationStatus.SENT);
    }

    private SupplierNotification moveTo(NotificationStatus required, NotificationStatus next) {
        if (status != required) {
            throw new IllegalStateException("Notification must be " + required + " to become " + next + " (is " + status + ")");
        }
        return new SupplierNotification(recipient, subject, body, next);
    }
}
