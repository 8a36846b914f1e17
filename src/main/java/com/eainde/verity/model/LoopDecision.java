package com.eainde.verity.model;

/**
 * Routing verdict produced after each resolution pass.
 * Only {@link #CONTINUE} is non-terminal.
 */
public enum LoopDecision {
    RESOLVED,
    CONTINUE,
    ESCALATE_TO_HUMAN;

    public boolean isTerminal() {
        return this != CONTINUE;
    }
}
