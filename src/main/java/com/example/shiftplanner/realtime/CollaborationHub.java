package com.example.shiftplanner.realtime;

import com.example.shiftplanner.assignment.AssignmentDto;
import com.example.shiftplanner.config.PlanningSettings;
import com.example.shiftplanner.sync.Conflict;
import com.example.shiftplanner.sync.ResolutionAction;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * Session fan-out for planners. Holds no durable state: it relays edits and conflict
 * notices between clients of the same session and tracks who is present.
 */
@Component
public class CollaborationHub {

    private static final Logger logger = LoggerFactory.getLogger(CollaborationHub.class);

    private static final TypeReference<LinkedHashMap<String, Object>> MESSAGE = new TypeReference<>() {};

    public static final String CONNECTED = "connected";
    public static final String AUTH = "auth";
    public static final String AUTH_SUCCESS = "auth_success";
    public static final String JOIN_SESSION = "join_session";
    public static final String SESSION_JOINED = "session_joined";
    public static final String USER_JOINED = "user_joined";
    public static final String USER_LEFT = "user_left";
    public static final String ASSIGNMENT_CHANGE = "assignment_change";
    public static final String CONFLICT_RESOLVED = "conflict_resolved";
    public static final String CONFLICT_DETECTED = "conflict_detected";
    public static final String PING = "ping";
    public static final String PONG = "pong";
    public static final String ERROR = "error";

    private final ConnectionRegistry registry;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration inactivityTimeout;

    public CollaborationHub(ConnectionRegistry registry, ObjectMapper objectMapper, Clock clock, PlanningSettings settings) {
        this.registry = registry;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.inactivityTimeout = settings.getInactivityTimeout();
    }

    public String connect(ClientConnection connection) {
        String clientId = "client-" + UUID.randomUUID();
        ClientRecord record = new ClientRecord(clientId, connection, clock.instant());
        registry.register(record);
        Map<String, Object> hello = message(CONNECTED);
        hello.put("clientId", clientId);
        send(record, hello);
        logger.info("Client {} connected ({} total)", clientId, registry.clientCount());
        return clientId;
    }

    public void handleMessage(String clientId, String payload) {
        Optional<ClientRecord> found = registry.get(clientId);
        if (found.isEmpty()) {
            return;
        }
        ClientRecord record = found.get();
        record.touch(clock.instant());

        Map<String, Object> incoming;
        try {
            incoming = objectMapper.readValue(payload, MESSAGE);
        } catch (JsonProcessingException e) {
            sendError(record, "Invalid message format");
            return;
        }
        Object type = incoming == null ? null : incoming.get("type");
        if (!(type instanceof String messageType)) {
            sendError(record, "Message type is required");
            return;
        }
        switch (messageType) {
            case AUTH -> handleAuth(record, incoming);
            case JOIN_SESSION -> handleJoin(record, incoming);
            case ASSIGNMENT_CHANGE, CONFLICT_RESOLVED -> relay(record, incoming);
            case PING -> send(record, message(PONG));
            default -> sendError(record, "Unknown message type: " + messageType);
        }
    }

    public void disconnect(String clientId) {
        registry.unregister(clientId).ifPresent(record -> {
            String sessionId = record.getSessionId();
            if (sessionId != null) {
                broadcastToSession(sessionId, presence(USER_LEFT, record, sessionId), clientId);
            }
            logger.info("Client {} ({}) disconnected", clientId, record.getUserId());
        });
    }

    /**
     * Sends to every member of the session except {@code excludeClientId}.
     */
    public void broadcastToSession(String sessionId, Map<String, Object> message, String excludeClientId) {
        for (String memberId : registry.members(sessionId)) {
            if (memberId.equals(excludeClientId)) {
                continue;
            }
            registry.get(memberId).ifPresent(member -> send(member, message));
        }
    }

    public void broadcastConflict(String sessionId, Conflict conflict) {
        Map<String, Object> message = message(CONFLICT_DETECTED);
        message.put("conflictId", conflict.id());
        message.put("conflictType", conflict.type().getCode());
        message.put("affectedAssignments", conflict.affectedAssignments());
        message.put("message", conflict.message());
        broadcastToSession(sessionId, message, null);
    }

    public void broadcastConflictResolved(String sessionId, String conflictId, ResolutionAction action,
                                          AssignmentDto assignment, String userId) {
        Map<String, Object> message = message(CONFLICT_RESOLVED);
        message.put("conflictId", conflictId);
        message.put("action", action.getCode());
        message.put("assignment", assignment);
        message.put("userId", userId);
        broadcastToSession(sessionId, message, null);
    }

    public SessionStats getSessionStats() {
        List<SessionStats.SessionInfo> sessions = new ArrayList<>();
        registry.sessionsSnapshot().forEach((sessionId, members) -> {
            List<String> users = members.stream()
                    .map(registry::get)
                    .flatMap(Optional::stream)
                    .map(ClientRecord::getUserId)
                    .sorted()
                    .toList();
            sessions.add(new SessionStats.SessionInfo(sessionId, members.size(), users));
        });
        return new SessionStats(registry.clientCount(), registry.sessionCount(), sessions);
    }

    @Scheduled(fixedDelayString = "${planning.realtime.sweep-interval-ms:30000}",
            initialDelayString = "${planning.realtime.sweep-interval-ms:30000}")
    public void sweep() {
        sweepInactive(clock.instant());
    }

    /**
     * Drops every connection idle for longer than the inactivity timeout.
     *
     * @return number of connections removed
     */
    public int sweepInactive(Instant now) {
        int removed = 0;
        for (ClientRecord record : registry.all()) {
            if (record.getLastActivity().plus(inactivityTimeout).isBefore(now)) {
                logger.info("Dropping inactive client {} (last activity {})", record.getClientId(), record.getLastActivity());
                record.getConnection().close();
                disconnect(record.getClientId());
                removed++;
            }
        }
        return removed;
    }

    private void handleAuth(ClientRecord record, Map<String, Object> incoming) {
        Object userId = incoming.get("userId");
        record.setUserId(userId instanceof String s && !s.isBlank() ? s : ClientRecord.ANONYMOUS);
        Map<String, Object> reply = message(AUTH_SUCCESS);
        reply.put("userId", record.getUserId());
        send(record, reply);
    }

    private void handleJoin(ClientRecord record, Map<String, Object> incoming) {
        Object value = incoming.get("sessionId");
        if (!(value instanceof String sessionId) || sessionId.isBlank()) {
            sendError(record, "sessionId is required");
            return;
        }
        String previous = registry.join(record.getClientId(), sessionId);
        if (previous != null) {
            broadcastToSession(previous, presence(USER_LEFT, record, previous), record.getClientId());
        }
        broadcastToSession(sessionId, presence(USER_JOINED, record, sessionId), record.getClientId());

        Map<String, Object> reply = message(SESSION_JOINED);
        reply.put("sessionId", sessionId);
        reply.put("clientCount", registry.members(sessionId).size());
        send(record, reply);
        logger.info("Client {} ({}) joined session {}", record.getClientId(), record.getUserId(), sessionId);
    }

    private void relay(ClientRecord record, Map<String, Object> incoming) {
        String sessionId = record.getSessionId();
        if (sessionId == null) {
            sendError(record, "Join a session before sending " + incoming.get("type"));
            return;
        }
        Map<String, Object> outgoing = new LinkedHashMap<>(incoming);
        outgoing.put("userId", record.getUserId());
        outgoing.putIfAbsent("timestamp", clock.instant().toString());
        broadcastToSession(sessionId, outgoing, record.getClientId());
    }

    private Map<String, Object> presence(String type, ClientRecord record, String sessionId) {
        Map<String, Object> message = message(type);
        message.put("userId", record.getUserId());
        message.put("clientId", record.getClientId());
        message.put("sessionId", sessionId);
        return message;
    }

    private void sendError(ClientRecord record, String text) {
        Map<String, Object> message = message(ERROR);
        message.put("message", text);
        send(record, message);
    }

    private Map<String, Object> message(String type) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("type", type);
        message.put("timestamp", clock.instant().toString());
        return message;
    }

    private void send(ClientRecord record, Map<String, Object> message) {
        ClientConnection connection = record.getConnection();
        if (!connection.isOpen()) {
            return;
        }
        try {
            connection.send(objectMapper.writeValueAsString(message));
        } catch (IOException e) {
            logger.warn("Failed to send {} to client {}: {}", message.get("type"), record.getClientId(), e.getMessage());
        }
    }
}
