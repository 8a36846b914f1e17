package com.eainde.verity.log;

import com.eainde.verity.model.AgentLogEntry;
import com.eainde.verity.model.LogSeverity;
import com.eainde.verity.model.StageName;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class LogBroadcasterTest {

    private static final Executor DIRECT = Runnable::run;

    private static List<AgentLogEntry> entries(String... actions) {
        List<AgentLogEntry> entries = new ArrayList<>();
        for (int i = 0; i < actions.length; i++) {
            entries.add(new AgentLogEntry(i, Instant.EPOCH, StageName.ORCHESTRATOR, actions[i], "", LogSeverity.INFO));
        }
        return entries;
    }

    @Nested
    @DisplayName("delivery")
    class Delivery {

        @Test
        @DisplayName("delivers every entry to every observer in append order")
        void inOrder() {
            List<String> first = new ArrayList<>();
            List<String> second = new ArrayList<>();
            LogBroadcaster broadcaster = new LogBroadcaster(DIRECT, List.of(
                    (auditId, entry) -> first.add(auditId + ":" + entry.action())));
            broadcaster.register((auditId, entry) -> second.add(entry.action()));

            broadcaster.publish("AUD-1", entries("A", "B", "C"));

            assertThat(first).containsExactly("AUD-1:A", "AUD-1:B", "AUD-1:C");
            assertThat(second).containsExactly("A", "B", "C");
        }

        @Test
        @DisplayName("a throwing observer does not stop the others")
        void isolation() {
            List<String> received = new ArrayList<>();
            LogBroadcaster broadcaster = new LogBroadcaster(DIRECT, List.of(
                    (auditId, entry) -> {
                        throw new IllegalStateException("observer bug");
                    },
                    (auditId, entry) -> received.add(entry.action())));

            assertThatCode(() -> broadcaster.publish("AUD-1", entries("A", "B"))).doesNotThrowAnyException();
            assertThat(received).containsExactly("A", "B");
        }

        @Test
        @DisplayName("unregistered observers receive nothing further")
        void unregister() {
            List<String> received = new ArrayList<>();
            AuditLogObserver observer = (auditId, entry) -> received.add(entry.action());
            LogBroadcaster broadcaster = new LogBroadcaster(DIRECT, List.of());
            broadcaster.register(observer);
            broadcaster.publish("AUD-1", entries("A"));

            broadcaster.unregister(observer);
            broadcaster.publish("AUD-1", entries("B"));

            assertThat(received).containsExactly("A");
            assertThat(broadcaster.observerCount()).isZero();
        }
    }

    @Test
    @DisplayName("a rejecting dispatcher does not fail the publisher")
    void rejected() {
        LogBroadcaster broadcaster = new LogBroadcaster(command -> {
            throw new RejectedExecutionException("shut down");
        }, List.of((auditId, entry) -> { }));

        assertThatCode(() -> broadcaster.publish("AUD-1", entries("A"))).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("publishes a snapshot so later changes to the source list are not seen")
    void snapshot() {
        List<String> received = new ArrayList<>();
        List<Runnable> queued = new ArrayList<>();
        LogBroadcaster broadcaster = new LogBroadcaster(queued::add, List.of((auditId, entry) -> received.add(entry.action())));
        List<AgentLogEntry> source = entries("A");

        broadcaster.publish("AUD-1", source);
        source.clear();
        queued.forEach(Runnable::run);

        assertThat(received).containsExactly("A");
    }
}
