package com.example.shiftplanner.client;

import com.example.shiftplanner.assignment.AssignmentDto;
import com.example.shiftplanner.sync.*;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Client side of planning persistence.
 * <p>
 * Edits land in a local overlay and reach subscribers at once. Outgoing changes are
 * coalesced per assignment id over a debounce window and sent as one batch. At most one
 * batch is on the wire; edits made meanwhile wait for the next window. While offline
 * nothing is sent and changes stay queued until {@link #setOnline(boolean)} brings the
 * client back, which flushes the queue in order.
 * <p>
 * Listener callbacks run outside the internal lock, on the thread that caused them.
 */
public class OptimisticPersistenceClient {

    private static final Logger logger = LoggerFactory.getLogger(OptimisticPersistenceClient.class);

    private final PersistenceClientSettings settings;
    private final PlanningSyncGateway gateway;
    private final SyncScheduler scheduler;
    private final RealtimeLink realtimeLink;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final List<Consumer<PlanningChange>> changeListeners = new CopyOnWriteArrayList<>();
    private final List<Consumer<PersistenceError>> errorListeners = new CopyOnWriteArrayList<>();
    private final List<Consumer<Conflict>> conflictListeners = new CopyOnWriteArrayList<>();
    private volatile ConflictResolver conflictResolver = ConflictResolver.acceptLocal();

    private final Object lock = new Object();
    private final Map<String, AssignmentDto> serverView = new LinkedHashMap<>();
    private final Map<String, OverlayEntry> overlay = new LinkedHashMap<>();
    // assignment id -> change id of a local delete the server has not confirmed
    private final Map<String, String> tombstones = new LinkedHashMap<>();
    private LinkedHashMap<String, Outgoing> outbox = new LinkedHashMap<>();
    private List<Outgoing> inFlight = List.of();
    private SyncState state = SyncState.IDLE;
    private SyncScheduler.Cancellable timer;
    private boolean flushAfterFlight;
    private int failedAttempts;
    private boolean online = true;
    private boolean disposed;
    private long sequence;

    public OptimisticPersistenceClient(PersistenceClientSettings settings,
                                       PlanningSyncGateway gateway,
                                       SyncScheduler scheduler,
                                       ObjectMapper objectMapper,
                                       Clock clock) {
        this(settings, gateway, scheduler, null, objectMapper, clock);
    }

    public OptimisticPersistenceClient(PersistenceClientSettings settings,
                                       PlanningSyncGateway gateway,
                                       SyncScheduler scheduler,
                                       RealtimeLink realtimeLink,
                                       ObjectMapper objectMapper,
                                       Clock clock) {
        this.settings = settings;
        this.gateway = gateway;
        this.scheduler = scheduler;
        this.realtimeLink = realtimeLink;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Opens the realtime link, if one was configured. Remote edits and conflict notices then
     * flow to the same subscribers as local ones.
     */
    public void connectRealtime() {
        if (realtimeLink == null) {
            return;
        }
        try {
            realtimeLink.connect(this::onRealtimeMessage);
        } catch (PersistenceException e) {
            emitError(e.getError());
            throw e;
        }
    }

    public void saveAssignment(AssignmentDto assignment) {
        Objects.requireNonNull(assignment, "assignment");
        Objects.requireNonNull(assignment.id(), "assignment.id");
        PlanningChange notice;
        synchronized (lock) {
            ensureOpen();
            String id = assignment.id();
            OverlayEntry previous = overlay.get(id);
            boolean deleted = tombstones.remove(id) != null;
            boolean known = previous != null || (!deleted && serverView.containsKey(id));
            ChangeOrigin origin;
            if (previous != null) {
                origin = previous.origin();
            } else if (deleted && isDeleteInFlightLocked(id)) {
                origin = ChangeOrigin.ADD;
            } else {
                origin = serverView.containsKey(id) ? ChangeOrigin.UPDATE : ChangeOrigin.ADD;
            }
            String changeId = nextChangeId(id);
            Instant now = clock.instant();
            overlay.put(id, new OverlayEntry(assignment, origin, changeId));
            outbox.put(id, new Outgoing(new PlanningChange(changeId, origin.getChangeType(), assignment, now), 0));
            scheduleFlushLocked();
            notice = new PlanningChange(changeId, known ? ChangeType.UPDATE : ChangeType.ADD, assignment, now);
        }
        notifyChange(notice);
        broadcast(notice);
    }

    /**
     * @throws AssignmentNotFoundException if the id is not held locally; nothing is sent
     */
    public void removeAssignment(String assignmentId) {
        PlanningChange notice;
        synchronized (lock) {
            ensureOpen();
            OverlayEntry entry = overlay.get(assignmentId);
            AssignmentDto current = entry != null
                    ? entry.assignment()
                    : tombstones.containsKey(assignmentId) ? null : serverView.get(assignmentId);
            if (current == null) {
                throw new AssignmentNotFoundException(assignmentId);
            }
            overlay.remove(assignmentId);
            notice = new PlanningChange(nextChangeId(assignmentId), ChangeType.DELETE, current, clock.instant());
            // the server copy stays in serverView until the delete is confirmed
            tombstones.put(assignmentId, notice.id());
            outbox.put(assignmentId, new Outgoing(notice, 0));
            scheduleFlushLocked();
        }
        notifyChange(notice);
        broadcast(notice);
    }

    /**
     * Fetches the server's view of {@code date}. Local edits are discarded before the call,
     * whether or not it succeeds.
     */
    public PlanningData loadPlanningData(LocalDate date) {
        synchronized (lock) {
            ensureOpen();
            clearLocalEditsLocked();
        }
        PlanningData data;
        try {
            data = gateway.loadPlanningData(date);
        } catch (PersistenceException e) {
            emitError(e.getError());
            throw e;
        }
        replaceServerView(data);
        return data;
    }

    public SnapshotDto createSnapshot(LocalDate date) {
        List<AssignmentDto> assignments = getAssignments();
        SnapshotDto request = new SnapshotDto(null, date, assignments.isEmpty() ? null : assignments,
                null, null, settings.userId(), List.of());
        try {
            return gateway.createSnapshot(request);
        } catch (PersistenceException e) {
            emitError(e.getError());
            throw e;
        }
    }

    public PlanningData restoreFromSnapshot(String snapshotId) {
        synchronized (lock) {
            ensureOpen();
            clearLocalEditsLocked();
        }
        PlanningData data;
        try {
            data = gateway.restoreSnapshot(snapshotId);
        } catch (PersistenceException e) {
            emitError(e.getError());
            throw e;
        }
        replaceServerView(data);
        return data;
    }

    /**
     * Drops every unconfirmed local edit and emits one {@code delete} per dropped entry.
     * Assignments removed locally come back with an {@code update} carrying the server copy.
     */
    public void rollbackOptimisticUpdates() {
        List<PlanningChange> notices = new ArrayList<>();
        synchronized (lock) {
            Instant now = clock.instant();
            for (OverlayEntry entry : overlay.values()) {
                String id = entry.assignment().id();
                notices.add(new PlanningChange("rollback-" + id + "-" + (++sequence), ChangeType.DELETE,
                        entry.assignment(), now));
            }
            for (String id : tombstones.keySet()) {
                AssignmentDto restored = serverView.get(id);
                if (restored != null) {
                    notices.add(new PlanningChange("rollback-" + id + "-" + (++sequence), ChangeType.UPDATE,
                            restored, now));
                }
            }
            clearLocalEditsLocked();
        }
        logger.info("Rolled back {} optimistic updates", notices.size());
        notices.forEach(this::notifyChange);
    }

    /**
     * Sends whatever is queued now instead of waiting for the debounce window.
     */
    public void forceSyncPendingChanges() {
        synchronized (lock) {
            cancelTimerLocked();
            if (state == SyncState.PENDING) {
                state = SyncState.IDLE;
            }
        }
        flush();
    }

    public void setOnline(boolean value) {
        boolean reconnected;
        synchronized (lock) {
            reconnected = value && !online;
            online = value;
            if (!value) {
                cancelTimerLocked();
                if (state == SyncState.PENDING) {
                    state = SyncState.IDLE;
                }
            }
        }
        if (reconnected) {
            logger.info("Back online with {} queued changes", getPendingChangeCount());
            forceSyncPendingChanges();
        }
    }

    /**
     * Notifies conflict subscribers and returns the configured resolver's answer.
     */
    public ConflictResolution handleConflict(Conflict conflict) {
        notifyConflict(conflict);
        return conflictResolver.resolve(conflict);
    }

    public void setConflictResolver(ConflictResolver resolver) {
        this.conflictResolver = Objects.requireNonNull(resolver, "resolver");
    }

    public ConflictResolutionOutcome resolveConflict(String conflictId, ConflictResolution resolution) {
        ConflictResolutionOutcome outcome;
        try {
            outcome = gateway.resolveConflict(conflictId,
                    new ResolveConflictRequest(resolution, settings.userId(), settings.sessionId()));
        } catch (PersistenceException e) {
            emitError(e.getError());
            throw e;
        }
        AssignmentDto applied = outcome.assignment();
        if (applied != null) {
            PlanningChange notice;
            synchronized (lock) {
                serverView.put(applied.id(), applied);
                overlay.remove(applied.id());
                tombstones.remove(applied.id());
                outbox.remove(applied.id());
                notice = new PlanningChange("resolved-" + conflictId + "-" + (++sequence), ChangeType.UPDATE,
                        applied, clock.instant());
            }
            notifyChange(notice);
        }
        return outcome;
    }

    public Subscription subscribeToChanges(Consumer<PlanningChange> listener) {
        changeListeners.add(listener);
        return () -> changeListeners.remove(listener);
    }

    public Subscription subscribeToErrors(Consumer<PersistenceError> listener) {
        errorListeners.add(listener);
        return () -> errorListeners.remove(listener);
    }

    public Subscription subscribeToConflicts(Consumer<Conflict> listener) {
        conflictListeners.add(listener);
        return () -> conflictListeners.remove(listener);
    }

    public List<AssignmentDto> getOptimisticAssignments() {
        synchronized (lock) {
            return overlay.values().stream().map(OverlayEntry::assignment).toList();
        }
    }

    /**
     * Server view with local edits laid over it.
     */
    public List<AssignmentDto> getAssignments() {
        synchronized (lock) {
            Map<String, AssignmentDto> merged = new LinkedHashMap<>(serverView);
            merged.keySet().removeAll(tombstones.keySet());
            overlay.forEach((id, entry) -> merged.put(id, entry.assignment()));
            return List.copyOf(merged.values());
        }
    }

    public Optional<OverlayEntry> getOverlayEntry(String assignmentId) {
        synchronized (lock) {
            return Optional.ofNullable(overlay.get(assignmentId));
        }
    }

    public int getPendingChangeCount() {
        synchronized (lock) {
            return outbox.size() + inFlight.size();
        }
    }

    public boolean isOnline() {
        synchronized (lock) {
            return online;
        }
    }

    public SyncState getSyncState() {
        synchronized (lock) {
            return state;
        }
    }

    public void dispose() {
        synchronized (lock) {
            if (disposed) {
                return;
            }
            disposed = true;
            clearLocalEditsLocked();
            serverView.clear();
        }
        changeListeners.clear();
        errorListeners.clear();
        conflictListeners.clear();
        if (realtimeLink != null) {
            realtimeLink.close();
        }
    }

    void flush() {
        List<Outgoing> batch;
        synchronized (lock) {
            timer = null;
            if (disposed) {
                return;
            }
            if (state == SyncState.IN_FLIGHT) {
                flushAfterFlight = true;
                return;
            }
            if (!online || outbox.isEmpty()) {
                state = SyncState.IDLE;
                return;
            }
            batch = new ArrayList<>(outbox.values());
            outbox = new LinkedHashMap<>();
            inFlight = batch;
            state = SyncState.IN_FLIGHT;
        }

        SyncResponse response = null;
        PersistenceException failure = null;
        try {
            response = gateway.sync(batch.stream().map(Outgoing::change).toList());
        } catch (PersistenceException e) {
            failure = e;
        } catch (RuntimeException e) {
            logger.error("Unexpected failure while syncing {} changes", batch.size(), e);
            failure = new PersistenceException(new PersistenceError(PersistenceError.Type.SERVER,
                    "Sync failed: " + e.getMessage(), null, true), e);
        }

        List<Runnable> events = new ArrayList<>();
        synchronized (lock) {
            inFlight = List.of();
            state = SyncState.IDLE;
            if (!disposed) {
                if (failure != null) {
                    requeueLocked(batch, failure, events);
                } else {
                    failedAttempts = 0;
                    applyResponseLocked(batch, response, events);
                }
                if (failure != null && failure.isRetryable() && online && !outbox.isEmpty()) {
                    scheduleTimerLocked(retryDelayLocked());
                } else if (flushAfterFlight && online && !outbox.isEmpty()) {
                    scheduleTimerLocked(settings.debounce());
                }
            }
            flushAfterFlight = false;
        }
        events.forEach(Runnable::run);
    }

    private void applyResponseLocked(List<Outgoing> batch, SyncResponse response, List<Runnable> events) {
        Map<String, PlanningChange> sent = new HashMap<>();
        batch.forEach(o -> sent.put(o.change().id(), o.change()));
        List<ChangeResult> results = response == null || response.results() == null ? List.of() : response.results();
        for (ChangeResult result : results) {
            PlanningChange change = sent.get(result.changeId());
            if (change == null) {
                continue;
            }
            if (result.success()) {
                confirmLocked(change, result.assignment());
            } else {
                PersistenceError error = new PersistenceError(PersistenceError.Type.VALIDATION,
                        result.error(), change.assignment(), false);
                events.add(() -> emitError(error));
            }
        }
        List<Conflict> conflicts = response == null || response.conflicts() == null ? List.of() : response.conflicts();
        for (Conflict conflict : conflicts) {
            events.add(() -> notifyConflict(conflict));
        }
        logger.debug("Synced {} changes: {} results, {} conflicts", batch.size(), results.size(), conflicts.size());
    }

    private void confirmLocked(PlanningChange change, AssignmentDto stored) {
        String id = change.assignment().id();
        if (change.type() == ChangeType.DELETE) {
            serverView.remove(id);
            tombstones.remove(id, change.id());
        } else {
            serverView.put(id, stored != null ? stored : change.assignment());
        }
        OverlayEntry entry = overlay.get(id);
        if (entry == null) {
            return;
        }
        if (entry.changeId().equals(change.id())) {
            overlay.remove(id);
        } else if (change.type() == ChangeType.ADD && entry.origin() == ChangeOrigin.ADD) {
            // the record now exists on the server, so the queued save must go out as an update
            overlay.put(id, new OverlayEntry(entry.assignment(), ChangeOrigin.UPDATE, entry.changeId()));
            outbox.computeIfPresent(id, (key, queued) -> queued.change().type() == ChangeType.ADD
                    ? queued.as(ChangeType.UPDATE)
                    : queued);
        }
    }

    private void requeueLocked(List<Outgoing> batch, PersistenceException failure, List<Runnable> events) {
        PersistenceError error = failure.getError();
        events.add(() -> emitError(error));
        if (!failure.isRetryable()) {
            logger.warn("Sync rejected, {} changes not retried: {}", batch.size(), error.message());
            return;
        }
        failedAttempts++;
        LinkedHashMap<String, Outgoing> requeued = new LinkedHashMap<>();
        for (Outgoing outgoing : batch) {
            String id = outgoing.change().assignment().id();
            Outgoing newer = outbox.remove(id);
            if (newer != null) {
                requeued.put(id, newer);
                continue;
            }
            Outgoing retried = outgoing.retried();
            if (retried.attempts() > settings.maxRetries()) {
                logger.warn("Dropping change {} for assignment {} after {} failed attempts",
                        outgoing.change().id(), id, retried.attempts());
                PersistenceError dropped = new PersistenceError(error.type(),
                        "Gave up syncing assignment %s after %d attempts".formatted(id, retried.attempts()),
                        outgoing.change().assignment(), false);
                events.add(() -> emitError(dropped));
            } else {
                requeued.put(id, retried);
            }
        }
        requeued.putAll(outbox);
        outbox = requeued;
        logger.info("Sync failed, {} changes queued for retry: {}", outbox.size(), error.message());
    }

    private void scheduleFlushLocked() {
        if (state == SyncState.IN_FLIGHT) {
            flushAfterFlight = true;
            return;
        }
        if (!online) {
            return;
        }
        scheduleTimerLocked(settings.debounce());
    }

    private void scheduleTimerLocked(Duration delay) {
        cancelTimerLocked();
        timer = scheduler.schedule(this::flush, delay);
        state = SyncState.PENDING;
    }

    /**
     * Doubles with every consecutive failed sync, capped at {@link PersistenceClientSettings#MAX_RETRY_DELAY}.
     */
    private Duration retryDelayLocked() {
        Duration delay = settings.retryDelay();
        for (int i = 1; i < failedAttempts && delay.compareTo(PersistenceClientSettings.MAX_RETRY_DELAY) < 0; i++) {
            delay = delay.multipliedBy(2);
        }
        return delay.compareTo(PersistenceClientSettings.MAX_RETRY_DELAY) > 0
                ? PersistenceClientSettings.MAX_RETRY_DELAY
                : delay;
    }

    private boolean isDeleteInFlightLocked(String assignmentId) {
        return inFlight.stream().anyMatch(o -> o.change().type() == ChangeType.DELETE
                && assignmentId.equals(o.change().assignment().id()));
    }

    private void cancelTimerLocked() {
        if (timer != null) {
            timer.cancel();
            timer = null;
        }
    }

    private void clearLocalEditsLocked() {
        cancelTimerLocked();
        overlay.clear();
        tombstones.clear();
        outbox = new LinkedHashMap<>();
        flushAfterFlight = false;
        failedAttempts = 0;
        if (state == SyncState.PENDING) {
            state = SyncState.IDLE;
        }
    }

    private void replaceServerView(PlanningData data) {
        synchronized (lock) {
            serverView.clear();
            if (data != null && data.assignments() != null) {
                data.assignments().forEach(a -> serverView.put(a.id(), a));
            }
        }
    }

    private void ensureOpen() {
        if (disposed) {
            throw new IllegalStateException("Persistence client has been disposed");
        }
    }

    private String nextChangeId(String assignmentId) {
        return assignmentId + "-" + clock.millis() + "-" + (++sequence);
    }

    private void broadcast(PlanningChange change) {
        if (realtimeLink == null || !realtimeLink.isOpen()) {
            return;
        }
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("type", "assignment_change");
        message.put("changeType", change.type().getCode());
        message.put("changeId", change.id());
        message.put("assignment", change.assignment());
        message.put("timestamp", change.timestamp().toString());
        try {
            realtimeLink.send(message);
        } catch (PersistenceException e) {
            emitError(e.getError());
        }
    }

    void onRealtimeMessage(Map<String, Object> message) {
        Object type = message.get("type");
        try {
            if ("assignment_change".equals(type)) {
                onRemoteChange(message);
            } else if ("conflict_detected".equals(type)) {
                notifyConflict(new Conflict(
                        String.valueOf(message.get("conflictId")),
                        ConflictType.fromCode(String.valueOf(message.get("conflictType"))),
                        toStringList(message.get("affectedAssignments")),
                        (String) message.get("message")));
            } else if ("conflict_resolved".equals(type)) {
                onRemoteResolution(message);
            } else {
                logger.debug("Realtime message {} ignored", type);
            }
        } catch (IllegalArgumentException | ClassCastException e) {
            logger.warn("Malformed realtime {} message: {}", type, e.getMessage());
        }
    }

    private void onRemoteChange(Map<String, Object> message) {
        if (settings.userId().equals(message.get("userId"))) {
            return;
        }
        AssignmentDto assignment = objectMapper.convertValue(message.get("assignment"), AssignmentDto.class);
        if (assignment == null || assignment.id() == null) {
            throw new IllegalArgumentException("assignment is missing");
        }
        ChangeType changeType = ChangeType.fromCode(String.valueOf(message.get("changeType")));
        Object changeId = message.get("changeId");
        PlanningChange change;
        synchronized (lock) {
            change = new PlanningChange(
                    changeId != null ? changeId.toString() : "remote-" + (++sequence),
                    changeType,
                    assignment,
                    parseTimestamp(message.get("timestamp")));
            // local unconfirmed edits stay on top until reload or rollback
            if (!overlay.containsKey(assignment.id()) && !tombstones.containsKey(assignment.id())) {
                if (changeType == ChangeType.DELETE) {
                    serverView.remove(assignment.id());
                } else {
                    serverView.put(assignment.id(), assignment);
                }
            }
        }
        notifyChange(change);
    }

    private void onRemoteResolution(Map<String, Object> message) {
        Object raw = message.get("assignment");
        if (raw == null) {
            return;
        }
        AssignmentDto assignment = objectMapper.convertValue(raw, AssignmentDto.class);
        PlanningChange change;
        synchronized (lock) {
            serverView.put(assignment.id(), assignment);
            change = new PlanningChange("resolved-" + message.get("conflictId") + "-" + (++sequence),
                    ChangeType.UPDATE, assignment, clock.instant());
        }
        notifyChange(change);
    }

    private Instant parseTimestamp(Object value) {
        if (value instanceof String text) {
            try {
                return Instant.parse(text);
            } catch (DateTimeParseException e) {
                logger.debug("Unparsable realtime timestamp {}", text);
            }
        }
        return clock.instant();
    }

    private static List<String> toStringList(Object value) {
        if (!(value instanceof Collection<?> items)) {
            return List.of();
        }
        return items.stream().map(String::valueOf).toList();
    }

    private void notifyChange(PlanningChange change) {
        for (Consumer<PlanningChange> listener : changeListeners) {
            try {
                listener.accept(change);
            } catch (RuntimeException e) {
                logger.warn("Change listener failed for {}", change.id(), e);
            }
        }
    }

    private void notifyConflict(Conflict conflict) {
        for (Consumer<Conflict> listener : conflictListeners) {
            try {
                listener.accept(conflict);
            } catch (RuntimeException e) {
                logger.warn("Conflict listener failed for {}", conflict.id(), e);
            }
        }
    }

    private void emitError(PersistenceError error) {
        logger.debug("Persistence error {}: {}", error.type(), error.message());
        for (Consumer<PersistenceError> listener : errorListeners) {
            try {
                listener.accept(error);
            } catch (RuntimeException e) {
                logger.warn("Error listener failed", e);
            }
        }
    }

    record Outgoing(PlanningChange change, int attempts) {

        Outgoing retried() {
            return new Outgoing(change, attempts + 1);
        }

        Outgoing as(ChangeType type) {
            return new Outgoing(new PlanningChange(change.id(), type, change.assignment(), change.timestamp()), attempts);
        }
    }
}
