package com.example.shiftplanner.config;

import com.example.shiftplanner.realtime.PlanningWebSocketHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    public static final String ENDPOINT = "/api/planning/ws";

    private final PlanningWebSocketHandler handler;
    private final String[] allowedOrigins;

    public WebSocketConfig(PlanningWebSocketHandler handler,
                           @Value("${planning.realtime.allowed-origins:*}") String allowedOrigins) {
        this.handler = handler;
        this.allowedOrigins = allowedOrigins.split("\\s*,\\s*");
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(handler, ENDPOINT).setAllowedOriginPatterns(allowedOrigins);
    }
}
