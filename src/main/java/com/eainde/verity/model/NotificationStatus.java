package com.eainde.verity.model;

public enum NotificationStatus {
    PENDING_APPROVAL,
    APPROVED,
    SENT
}
