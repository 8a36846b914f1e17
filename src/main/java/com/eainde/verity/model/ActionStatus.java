package com.eainde.verity.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Corrective action lifecycle: DRAFTED, SENT, ACKNOWLEDGED, IN_PROGRESS, then RESOLVED or ESCALATED.
 */
public enum ActionStatus {
    DRAFTED,
    SENT,
    ACKNOWLEDGED,
    IN_PROGRESS,
    RESOLVED,
    ESCALATED;

    public Set<ActionStatus> successors() {
        return switch (this) {
            case DRAFTED -> EnumSet.of(SENT);
            case SENT -> EnumSet.of(ACKNOWLEDGED);
            case ACKNOWLEDGED -> EnumSet.of(IN_PROGRESS);
            case IN_PROGRESS -> EnumSet.of(RESOLVED, ESCALATED);
            case RESOLVED, ESCALATED -> EnumSet.noneOf(ActionStatus.class);
        };
    }

    public boolean canTransitionTo(ActionStatus next) {
        return successors().contains(next);
    }
}
