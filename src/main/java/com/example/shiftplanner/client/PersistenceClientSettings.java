package com.example.shiftplanner.client;

import java.time.Duration;
import java.util.Objects;

/**
 * @param baseUrl   server root, for example {@code http://localhost:8080}
 * @param debounce  coalescing window for local edits
 * @param maxRetries attempts a change gets before it is dropped from the retry queue
 * @param retryDelay wait before the first retry of a failed sync; doubles per consecutive failure
 */
public record PersistenceClientSettings(String baseUrl, Duration debounce, String userId, String sessionId,
                                        int maxRetries, Duration retryDelay) {

    public static final Duration DEFAULT_DEBOUNCE = Duration.ofMillis(500);
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final Duration DEFAULT_RETRY_DELAY = Duration.ofSeconds(1);
    public static final Duration MAX_RETRY_DELAY = Duration.ofSeconds(30);

    public PersistenceClientSettings {
        Objects.requireNonNull(baseUrl, "baseUrl");
        Objects.requireNonNull(userId, "userId");
        debounce = debounce == null ? DEFAULT_DEBOUNCE : debounce;
        if (debounce.isNegative()) {
            throw new IllegalArgumentException("debounce must not be negative");
        }
        retryDelay = retryDelay == null ? DEFAULT_RETRY_DELAY : retryDelay;
        if (retryDelay.isNegative() || retryDelay.isZero()) {
            throw new IllegalArgumentException("retryDelay must be positive");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    public static PersistenceClientSettings of(String baseUrl, String userId, String sessionId) {
        return new PersistenceClientSettings(baseUrl, DEFAULT_DEBOUNCE, userId, sessionId, DEFAULT_MAX_RETRIES,
                DEFAULT_RETRY_DELAY);
    }
}
