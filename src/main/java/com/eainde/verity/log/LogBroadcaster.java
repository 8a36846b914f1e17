package com.eainde.verity.log;

import com.eainde.verity.model.AgentLogEntry;
import lombok.extern.log4j.Log4j2;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Fire-and-forget fan-out of agent-log entries to registered observers.
 * <p>
 * Delivery runs on a single dispatch thread so each observer sees entries in append order. The pipeline never
 * waits for delivery, and an observer that throws is logged and skipped.
 * </p>
 */
@Log4j2
public class LogBroadcaster {

    private final List<AuditLogObserver> observers = new CopyOnWriteArrayList<>();
    private final Executor dispatcher;

    public LogBroadcaster(Executor dispatcher, List<AuditLogObserver> initialObservers) {
        this.dispatcher = dispatcher;
        this.observers.addAll(initialObservers);
    }

    public void register(AuditLogObserver observer) {
        observers.add(observer);
    }

    public void unregister(AuditLogObserver observer) {
        observers.remove(observer);
    }

    public int observerCount() {
        return observers.size();
    }

    public void publish(String auditId, List<AgentLogEntry> entries) {
        if (entries.isEmpty() || observers.isEmpty()) {
            return;
        }
        List<AgentLogEntry> batch = List.copyOf(entries);
        try {
            dispatcher.execute(() -> deliver(auditId, batch));
        } catch (RejectedExecutionException e) {
            log.warn("Log dispatcher rejected {} entries for audit {}: {}", batch.size(), auditId, e.getMessage());
        }
    }

    private void deliver(String auditId, List<AgentLogEntry> batch) {
        for (AgentLogEntry entry : batch) {
            for (AuditLogObserver observer : observers) {
                try {
                    observer.onLogEntry(auditId, entry);
                } catch (RuntimeException e) {
                    log.warn("Observer {} failed on entry #{} of audit {}: {}",
                            observer.getClass().getSimpleName(), entry.sequence(), auditId, e.getMessage());
                }
            }
        }
    }
}
