package com.example.shiftplanner.realtime;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ConnectionRegistryTest {

    private static final Instant NOW = Instant.parse("2026-03-01T08:00:00Z");

    private final ConnectionRegistry registry = new ConnectionRegistry();

    @Test
    void join_movesClientBetweenSessions() {
        registry.register(record("c-1"));

        assertThat(registry.join("c-1", "floor-1")).isNull();
        assertThat(registry.join("c-1", "floor-1")).isNull();
        assertThat(registry.join("c-1", "floor-2")).isEqualTo("floor-1");

        assertThat(registry.members("floor-1")).isEmpty();
        assertThat(registry.members("floor-2")).containsExactly("c-1");
        assertThat(registry.sessionCount()).isEqualTo(1);
    }

    @Test
    void unregister_removesMembershipAndEmptySession() {
        registry.register(record("c-1"));
        registry.register(record("c-2"));
        registry.join("c-1", "floor-1");
        registry.join("c-2", "floor-1");

        assertThat(registry.unregister("c-1")).isPresent();
        assertThat(registry.members("floor-1")).containsExactly("c-2");

        registry.unregister("c-2");
        assertThat(registry.sessionCount()).isZero();
        assertThat(registry.unregister("c-2")).isEmpty();
    }

    @Test
    void join_afterRemoval_isIgnored() {
        ClientRecord record = record("c-1");
        registry.register(record);
        registry.unregister("c-1");

        assertThat(registry.join("c-1", "floor-1")).isNull();
        assertThat(registry.members("floor-1")).isEmpty();
        assertThat(registry.clientCount()).isZero();
    }

    @Test
    void sessionsSnapshot_isDetachedCopy() {
        registry.register(record("c-1"));
        registry.join("c-1", "floor-1");

        Map<String, Set<String>> snapshot = registry.sessionsSnapshot();
        registry.unregister("c-1");

        assertThat(snapshot).containsKey("floor-1");
        assertThat(registry.sessionsSnapshot()).isEmpty();
    }

    private static ClientRecord record(String clientId) {
        return new ClientRecord(clientId, new RecordingConnection(), NOW);
    }
}
