package com.example.shiftplanner.realtime;

import java.util.List;

public record SessionStats(int totalClients, int totalSessions, List<SessionInfo> sessions) {

    public record SessionInfo(String sessionId, int clientCount, List<String> users) {}
}
