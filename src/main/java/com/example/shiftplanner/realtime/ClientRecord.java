package com.example.shiftplanner.realtime;

import java.time.Instant;

public class ClientRecord {

    public static final String ANONYMOUS = "anonymous";

    private final String clientId;
    private final ClientConnection connection;
    private volatile String userId = ANONYMOUS;
    private volatile String sessionId;
    private volatile Instant lastActivity;
    // guarded by this
    private boolean removed;

    public ClientRecord(String clientId, ClientConnection connection, Instant connectedAt) {
        this.clientId = clientId;
        this.connection = connection;
        this.lastActivity = connectedAt;
    }

    public void touch(Instant now) {
        this.lastActivity = now;
    }

    public String getClientId() { return clientId; }
    public ClientConnection getConnection() { return connection; }
    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }
    public String getSessionId() { return sessionId; }
    void setSessionId(String sessionId) { this.sessionId = sessionId; }
    public Instant getLastActivity() { return lastActivity; }
    boolean isRemoved() { return removed; }
    void markRemoved() { this.removed = true; }
}
