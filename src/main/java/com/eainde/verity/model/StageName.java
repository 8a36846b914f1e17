package com.eainde.verity.model;

/** Originating stage recorded on every agent log entry. */
public enum StageName {
    ORCHESTRATOR,
    DOCUMENT_CORRELATOR,
    REGULATORY_MAPPER,
    RESOLUTION_ENGINE
}
