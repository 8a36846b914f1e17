package com.eainde.verity.model;

public enum ResolutionStatus {
    PENDING,
    ACTION_PLAN_DRAFTED,
    RESOLVED,
    ESCALATED
}
