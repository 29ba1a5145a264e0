package com.example.shiftplanner.client;

import java.util.Map;
import java.util.function.Consumer;

/**
 * Connection to the collaboration channel. Messages are flat JSON objects with a
 * {@code type} field.
 */
public interface RealtimeLink {

    void connect(Consumer<Map<String, Object>> onMessage);

    void send(Map<String, Object> message);

    boolean isOpen();

    void close();
}
