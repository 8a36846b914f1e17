package com.eainde.verity.log;

import com.eainde.verity.model.AgentLogEntry;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

@Log4j2
@Component
public class LoggingAuditLogObserver implements AuditLogObserver {

    @Override
    public void onLogEntry(String auditId, AgentLogEntry entry) {
        switch (entry.severity()) {
            case CRITICAL, ERROR -> log.error("[{}#{}] {} {}: {}", auditId, entry.sequence(), entry.stage(), entry.action(), entry.detail());
            case WARNING -> log.warn("[{}#{}] {} {}: {}", auditId, entry.sequence(), entry.stage(), entry.action(), entry.detail());
            default -> log.info("[{}#{}] {} {}: {}", auditId, entry.sequence(), entry.stage(), entry.action(), entry.detail());
        }
    }
}
