package com.example.shiftplanner.client;

import com.example.shiftplanner.sync.*;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.time.LocalDate;
import java.util.List;
import java.util.function.Supplier;

/**
 * {@link PlanningSyncGateway} over the planning HTTP routes.
 */
public class RestPlanningSyncGateway implements PlanningSyncGateway {

    private static final Logger logger = LoggerFactory.getLogger(RestPlanningSyncGateway.class);

    static final String USER_HEADER = "X-User-Id";
    static final String SESSION_HEADER = "X-Planning-Session";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final PersistenceClientSettings settings;

    public RestPlanningSyncGateway(RestTemplate restTemplate, ObjectMapper objectMapper,
                                   PersistenceClientSettings settings) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.settings = settings;
    }

    @Override
    public SyncResponse sync(List<PlanningChange> changes) {
        HttpEntity<SyncRequest> entity = new HttpEntity<>(new SyncRequest(changes), headers());
        try {
            return call("sync", () -> restTemplate.exchange(url("/api/planning/sync"), HttpMethod.POST, entity,
                    SyncResponse.class).getBody());
        } catch (PersistenceException e) {
            if (e.getCause() instanceof HttpClientErrorException http && http.getStatusCode().value() == HttpStatus.CONFLICT.value()) {
                return readConflictBody(http);
            }
            throw e;
        }
    }

    @Override
    public PlanningData loadPlanningData(LocalDate date) {
        return call("load planning data", () -> restTemplate.exchange(url("/api/planning/data/{date}"),
                HttpMethod.GET, new HttpEntity<>(headers()), PlanningData.class, date.toString()).getBody());
    }

    @Override
    public SnapshotDto createSnapshot(SnapshotDto snapshot) {
        return call("create snapshot", () -> restTemplate.exchange(url("/api/planning/snapshots"),
                HttpMethod.POST, new HttpEntity<>(snapshot, headers()), SnapshotDto.class).getBody());
    }

    @Override
    public PlanningData restoreSnapshot(String snapshotId) {
        return call("restore snapshot", () -> restTemplate.exchange(url("/api/planning/snapshots/{id}/restore"),
                HttpMethod.POST, new HttpEntity<>(headers()), PlanningData.class, snapshotId).getBody());
    }

    @Override
    public ConflictResolutionOutcome resolveConflict(String conflictId, ResolveConflictRequest request) {
        return call("resolve conflict", () -> restTemplate.exchange(url("/api/planning/conflicts/{id}/resolve"),
                HttpMethod.POST, new HttpEntity<>(request, headers()), ConflictResolutionOutcome.class,
                conflictId).getBody());
    }

    private <T> T call(String operation, Supplier<T> request) {
        try {
            return request.get();
        } catch (ResourceAccessException e) {
            throw new NetworkException("Failed to " + operation + ": " + e.getMessage(), e);
        } catch (HttpServerErrorException e) {
            throw new PersistenceException(new PersistenceError(PersistenceError.Type.SERVER,
                    "Failed to " + operation + ": " + e.getStatusCode(), null, true), e);
        } catch (HttpClientErrorException e) {
            PersistenceError.Type type = switch (e.getStatusCode().value()) {
                case 404 -> PersistenceError.Type.NOT_FOUND;
                case 409 -> PersistenceError.Type.CONFLICT;
                default -> PersistenceError.Type.VALIDATION;
            };
            throw new PersistenceException(new PersistenceError(type,
                    "Failed to " + operation + ": " + e.getStatusCode(), null, false), e);
        } catch (RestClientException e) {
            throw new PersistenceException(new PersistenceError(PersistenceError.Type.SERVER,
                    "Failed to " + operation + ": " + e.getMessage(), null, false), e);
        }
    }

    private SyncResponse readConflictBody(HttpClientErrorException e) {
        try {
            return objectMapper.readValue(e.getResponseBodyAsByteArray(), SyncResponse.class);
        } catch (IOException parse) {
            logger.warn("Unreadable conflict response from sync: {}", parse.getMessage());
            throw new PersistenceException(new PersistenceError(PersistenceError.Type.CONFLICT,
                    "Sync reported conflicts with an unreadable body", null, false), parse);
        }
    }

    private HttpHeaders headers() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.set(USER_HEADER, settings.userId());
        if (settings.sessionId() != null) {
            headers.set(SESSION_HEADER, settings.sessionId());
        }
        return headers;
    }

    private String url(String path) {
        return settings.baseUrl() + path;
    }
}
