package com.example.shiftplanner.realtime;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

class RecordingConnection implements ClientConnection {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    final List<String> sent = new CopyOnWriteArrayList<>();
    private volatile boolean open = true;

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void send(String payload) {
        sent.add(payload);
    }

    @Override
    public void close() {
        open = false;
    }

    List<Map<String, Object>> messages() {
        return sent.stream().map(RecordingConnection::parse).toList();
    }

    List<String> types() {
        return messages().stream().map(m -> (String) m.get("type")).toList();
    }

    Map<String, Object> last() {
        List<Map<String, Object>> all = messages();
        return all.get(all.size() - 1);
    }

    void clear() {
        sent.clear();
    }

    private static Map<String, Object> parse(String payload) {
        try {
            return MAPPER.readValue(payload, new TypeReference<Map<String, Object>>() {});
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
