package com.example.shiftplanner.realtime;

import org.springframework.stereotype.Component;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Connected clients and session membership. Membership sets are only changed inside
 * {@code compute}, and a client's own join and removal are serialized on its record,
 * so a join racing a disconnect cannot leave a stale member behind.
 */
@Component
public class ConnectionRegistry {

    private final ConcurrentHashMap<String, ClientRecord> clients = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Set<String>> sessions = new ConcurrentHashMap<>();

    public void register(ClientRecord record) {
        clients.put(record.getClientId(), record);
    }

    public Optional<ClientRecord> get(String clientId) {
        return Optional.ofNullable(clients.get(clientId));
    }

    /**
     * Moves the client into {@code sessionId}.
     *
     * @return the session the client left, or {@code null}
     */
    public String join(String clientId, String sessionId) {
        ClientRecord record = clients.get(clientId);
        if (record == null) {
            return null;
        }
        synchronized (record) {
            if (record.isRemoved()) {
                return null;
            }
            String previous = record.getSessionId();
            if (previous != null && !previous.equals(sessionId)) {
                leave(previous, clientId);
            }
            sessions.compute(sessionId, (key, members) -> {
                Set<String> set = members == null ? ConcurrentHashMap.newKeySet() : members;
                set.add(clientId);
                return set;
            });
            record.setSessionId(sessionId);
            return sessionId.equals(previous) ? null : previous;
        }
    }

    public Optional<ClientRecord> unregister(String clientId) {
        ClientRecord record = clients.remove(clientId);
        if (record == null) {
            return Optional.empty();
        }
        synchronized (record) {
            record.markRemoved();
            if (record.getSessionId() != null) {
                leave(record.getSessionId(), clientId);
            }
        }
        return Optional.of(record);
    }

    public Set<String> members(String sessionId) {
        Set<String> members = sessions.get(sessionId);
        return members == null ? Set.of() : Set.copyOf(members);
    }

    public Collection<ClientRecord> all() {
        return List.copyOf(clients.values());
    }

    public int clientCount() {
        return clients.size();
    }

    public int sessionCount() {
        return sessions.size();
    }

    public Map<String, Set<String>> sessionsSnapshot() {
        Map<String, Set<String>> copy = new TreeMap<>();
        sessions.forEach((id, members) -> copy.put(id, Set.copyOf(members)));
        return copy;
    }

    private void leave(String sessionId, String clientId) {
        sessions.computeIfPresent(sessionId, (key, members) -> {
            members.remove(clientId);
            return members.isEmpty() ? null : members;
        });
    }
}
