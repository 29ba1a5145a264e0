package com.example.shiftplanner.common;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Envelope of the {@code /api/plan} routes. Sync routes answer with flat records instead.
 *
 * @param meta summary figures about {@code data}, in the order they were added
 */
public record ApiResponse<T>(boolean success, String message, T data, Map<String, Object> meta) {

    public ApiResponse {
        meta = meta == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(meta));
    }

    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(true, null, data, null);
    }

    public static <T> ApiResponse<T> ok(String message, T data) {
        return new ApiResponse<>(true, message, data, null);
    }

    public ApiResponse<T> withMeta(String key, Object value) {
        Map<String, Object> extended = new LinkedHashMap<>(meta);
        extended.put(key, value);
        return new ApiResponse<>(success, message, data, extended);
    }
}
