package com.eainde.verity.model;

public enum ComplianceStatus {
    PENDING,
    COMPLIANT,
    PENDING_REVIEW,
    NON_COMPLIANT
}
