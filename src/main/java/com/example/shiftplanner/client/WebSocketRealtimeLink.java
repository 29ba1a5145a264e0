package com.example.shiftplanner.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * {@link RealtimeLink} over a Spring {@link WebSocketClient}. On open it identifies the user
 * and joins the configured session.
 */
public class WebSocketRealtimeLink implements RealtimeLink {

    private static final Logger logger = LoggerFactory.getLogger(WebSocketRealtimeLink.class);

    private static final TypeReference<LinkedHashMap<String, Object>> MESSAGE = new TypeReference<>() {};
    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);

    private final WebSocketClient webSocketClient;
    private final ObjectMapper objectMapper;
    private final PersistenceClientSettings settings;
    private volatile WebSocketSession session;

    public WebSocketRealtimeLink(WebSocketClient webSocketClient, ObjectMapper objectMapper,
                                 PersistenceClientSettings settings) {
        this.webSocketClient = webSocketClient;
        this.objectMapper = objectMapper;
        this.settings = settings;
    }

    @Override
    public void connect(Consumer<Map<String, Object>> onMessage) {
        String url = settings.baseUrl().replaceFirst("^http", "ws") + "/api/planning/ws";
        try {
            session = webSocketClient.execute(new Handler(onMessage), url)
                    .get(CONNECT_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NetworkException("Interrupted while connecting to " + url, e);
        } catch (ExecutionException | TimeoutException e) {
            throw new NetworkException("Failed to connect to " + url, e);
        }
    }

    @Override
    public void send(Map<String, Object> message) {
        WebSocketSession current = session;
        if (current == null || !current.isOpen()) {
            return;
        }
        try {
            String payload = objectMapper.writeValueAsString(message);
            synchronized (current) {
                current.sendMessage(new TextMessage(payload));
            }
        } catch (IOException e) {
            throw new NetworkException("Failed to send " + message.get("type"), e);
        }
    }

    @Override
    public boolean isOpen() {
        WebSocketSession current = session;
        return current != null && current.isOpen();
    }

    @Override
    public void close() {
        WebSocketSession current = session;
        session = null;
        if (current != null && current.isOpen()) {
            try {
                current.close(CloseStatus.NORMAL);
            } catch (IOException e) {
                logger.debug("Error while closing realtime link: {}", e.getMessage());
            }
        }
    }

    private final class Handler extends TextWebSocketHandler {

        private final Consumer<Map<String, Object>> onMessage;

        Handler(Consumer<Map<String, Object>> onMessage) {
            this.onMessage = onMessage;
        }

        @Override
        public void afterConnectionEstablished(WebSocketSession opened) throws Exception {
            session = opened;
            Map<String, Object> auth = new LinkedHashMap<>();
            auth.put("type", "auth");
            auth.put("userId", settings.userId());
            send(auth);
            if (settings.sessionId() != null) {
                Map<String, Object> join = new LinkedHashMap<>();
                join.put("type", "join_session");
                join.put("sessionId", settings.sessionId());
                send(join);
            }
        }

        @Override
        protected void handleTextMessage(WebSocketSession ws, TextMessage message) {
            try {
                onMessage.accept(objectMapper.readValue(message.getPayload(), MESSAGE));
            } catch (JsonProcessingException e) {
                logger.warn("Ignoring unreadable realtime message: {}", e.getOriginalMessage());
            }
        }

        @Override
        public void afterConnectionClosed(WebSocketSession ws, CloseStatus status) {
            logger.info("Realtime link closed: {}", status);
        }
    }
}
