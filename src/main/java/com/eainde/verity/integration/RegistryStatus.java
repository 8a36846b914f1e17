package com.eainde.verity.integration;

public enum RegistryStatus {
    VERIFIED,
    NO_LEI_FOUND,
    LAPSED,
    FLAGGED,
    UNVERIFIED
}
