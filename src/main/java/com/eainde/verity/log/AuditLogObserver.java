package com.eainde.verity.log;

import com.eainde.verity.model.AgentLogEntry;

/**
 * Live consumer of agent-log entries. Called once per appended entry, in append order, never replayed.
 */
@FunctionalInterface
public interface AuditLogObserver {

    void onLogEntry(String auditId, AgentLogEntry entry);
}
