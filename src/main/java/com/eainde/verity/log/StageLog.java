package com.eainde.verity.log;

import com.eainde.verity.model.AgentLogEntry;
import com.eainde.verity.model.LogSeverity;
import com.eainde.verity.model.StageName;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Collects the log entries one stage appends during one pass, numbering them after the entries already present.
 */
public class StageLog {

    private final StageName stage;
    private final Clock clock;
    private final List<AgentLogEntry> entries = new ArrayList<>();
    private int nextSequence;

    public StageLog(StageName stage, Clock clock, int existingEntries) {
        this.stage = stage;
        this.clock = clock;
        this.nextSequence = existingEntries;
    }

    public StageLog info(String action, String detail) {
        return append(action, detail, LogSeverity.INFO);
    }

    public StageLog warning(String action, String detail) {
        return append(action, detail, LogSeverity.WARNING);
    }

    public StageLog critical(String action, String detail) {
        return append(action, detail, LogSeverity.CRITICAL);
    }

    public StageLog append(String action, String detail, LogSeverity severity) {
        entries.add(new AgentLogEntry(nextSequence++, clock.instant(), stage, action, detail, severity));
        return this;
    }

    public List<AgentLogEntry> entries() {
        return List.copyOf(entries);
    }
}
