package com.example.shiftplanner.realtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * Adapts Spring WebSocket sessions to {@link CollaborationHub} clients.
 */
@Component
public class PlanningWebSocketHandler extends TextWebSocketHandler {

    private static final Logger logger = LoggerFactory.getLogger(PlanningWebSocketHandler.class);

    static final String CLIENT_ID_ATTRIBUTE = "planning.clientId";

    private final CollaborationHub hub;

    public PlanningWebSocketHandler(CollaborationHub hub) {
        this.hub = hub;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        String clientId = hub.connect(new WebSocketClientConnection(session));
        session.getAttributes().put(CLIENT_ID_ATTRIBUTE, clientId);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        String clientId = (String) session.getAttributes().get(CLIENT_ID_ATTRIBUTE);
        if (clientId != null) {
            hub.handleMessage(clientId, message.getPayload());
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        logger.warn("Transport error on session {}: {}", session.getId(), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        String clientId = (String) session.getAttributes().get(CLIENT_ID_ATTRIBUTE);
        if (clientId != null) {
            hub.disconnect(clientId);
        }
    }
}
