package com.example.blockalert.session;

import com.example.blockalert.config.AppProperties;
import com.example.blockalert.dto.AcknowledgmentSummary;
import com.example.blockalert.dto.EntitlementDecision;
import com.example.blockalert.dto.SendAlertResult;
import com.example.blockalert.dto.SessionStatus;
import com.example.blockalert.exception.NetworkUnavailableException;
import com.example.blockalert.exception.PartialFailureException;
import com.example.blockalert.model.Alert;
import com.example.blockalert.util.Constants.ConnectivityState;
import com.example.blockalert.util.Constants.SseEventType;
import com.example.blockalert.util.Constants.UrgencyLevel;
import com.example.blockalert.util.DbTime;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.codec.ServerSentEvent;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One connected client. Owns its deduplicator, acknowledgment tracker, connectivity state, stream
 * subscriptions and the SSE sink the client reads from. Everything it holds is released by {@link #close()}.
 */
@Slf4j
public class AlertSession implements ConnectivityReconciler.RecoveryActions {

    private static final int MAX_BACKOFF_DOUBLINGS = 16;

    @Getter
    private final String sessionId;
    @Getter
    private final String userId;
    private final SessionCollaborators deps;
    private final AppProperties.Connectivity connectivitySettings;

    private final DeliveryDeduplicator deduplicator;
    private final AcknowledgmentTracker tracker;
    private final ConnectivityReconciler reconciler;

    private final Sinks.Many<ServerSentEvent<String>> sseSink = Sinks.many().multicast().onBackpressureBuffer();
    private final Disposable.Swap incomingSubscription = Disposables.swap();
    private final Disposable.Swap outgoingSubscription = Disposables.swap();
    private final Disposable.Swap reconnectTimer = Disposables.swap();
    private final AtomicInteger reconnectAttempts = new AtomicInteger();
    private final AtomicBoolean closed = new AtomicBoolean();

    public AlertSession(String sessionId, String userId, SessionCollaborators deps) {
        this.sessionId = sessionId;
        this.userId = userId;
        this.deps = deps;
        AppProperties props = deps.getAppProperties();
        this.connectivitySettings = props.getConnectivity();
        this.deduplicator = new DeliveryDeduplicator(props.getDelivery().getFreshnessWindow());
        this.tracker = new AcknowledgmentTracker(userId, deps.getMarkerRepository(), deps.getAlertRepository(),
                props.getAcknowledgment(), this::onAlertAnswered);
        this.reconciler = new ConnectivityReconciler(sessionId, this);
    }

    /**
     * Subscribes to both streams and catches up on anything missed while disconnected.
     */
    public void start() {
        emit(deps.getSseEventFactory().createConnectedEvent(sessionId, userId));
        subscribeStreams();
        reconcile();
        refreshSnapshots(false);
        log.info("Session {} started for user {}", sessionId, userId);
    }

    public Flux<ServerSentEvent<String>> events() {
        return sseSink.asFlux();
    }

    /**
     * Sends through this session. Fails fast while offline.
     */
    public SendAlertResult sendAlert(String plateHash, String message, UrgencyLevel urgency) {
        reconciler.ensureOnline();
        ZonedDateTime sentAt = DbTime.now();
        try {
            SendAlertResult result = deps.getAlertService().sendAlert(plateHash, userId, message, urgency);
            result.getAlertIds().forEach(id -> tracker.trackSent(id, sentAt));
            return result;
        } catch (PartialFailureException e) {
            e.getSucceeded().forEach(id -> tracker.trackSent(id, sentAt));
            throw e;
        } catch (DataAccessResourceFailureException e) {
            reconciler.onConnectionLost("store unreachable during send");
            throw new NetworkUnavailableException("Alert store unreachable", e);
        } finally {
            if (reconciler.isOnline()) {
                refreshEntitlementAfterSend();
            }
        }
    }

    @Override
    public void reconcile() {
        reconcileNow();
    }

    /**
     * Runs acknowledgment reconciliation and pushes the new counts to the client.
     *
     * @return number of acknowledgment markers created or changed
     */
    public int reconcileNow() {
        int changes = tracker.reconcile();
        emit(deps.getSseEventFactory().createEvent(SseEventType.ALERT_UPDATED, null, Map.of("acknowledgments", tracker.unacknowledgedCount())));
        return changes;
    }

    public AcknowledgmentSummary acknowledgments() {
        return tracker.unacknowledgedCount();
    }

    /**
     * Applies a connectivity signal reported by the client or the store probe.
     */
    public void reportConnectivity(boolean online, String source) {
        if (online) {
            if (reconciler.onConnectionRestored()) {
                reconnectAttempts.set(0);
                reconnectTimer.update(Disposables.disposed());
            }
        } else {
            reconciler.onConnectionLost(source);
        }
    }

    public boolean isOnline() {
        return reconciler.isOnline();
    }

    public ConnectivityState connectivity() {
        return reconciler.state();
    }

    public SessionStatus status() {
        return SessionStatus.builder()
                .sessionId(sessionId)
                .userId(userId)
                .connectivity(reconciler.state())
                .entitlement(deps.getEntitlementSnapshotCache().getIfPresent(userId))
                .plateHashes(deps.getPlateSnapshotCache().getIfPresent(userId))
                .acknowledgments(tracker.unacknowledgedCount())
                .build();
    }

    public void heartbeat() {
        emit(deps.getSseEventFactory().createHeartbeatEvent());
    }

    public void notifyShutdown() {
        emit(deps.getSseEventFactory().createShutdownEvent());
    }

    public boolean isClosed() {
        return closed.get();
    }

    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        reconnectTimer.dispose();
        incomingSubscription.dispose();
        outgoingSubscription.dispose();
        sseSink.tryEmitComplete();
        log.info("Session {} for user {} closed", sessionId, userId);
    }

    @Override
    public void resubscribe() {
        subscribeStreams();
    }

    @Override
    public void refreshSnapshots() {
        refreshSnapshots(true);
    }

    @Override
    public void connectivityChanged(ConnectivityState state) {
        emit(deps.getSseEventFactory().createEvent(SseEventType.CONNECTIVITY, null, Map.of("state", state.name())));
    }

    void refreshSnapshots(boolean force) {
        refreshEntitlement(force);
        if (force) {
            deps.getPlateSnapshotCache().invalidate(userId);
        }
        deps.getPlateSnapshotCache().get(userId, deps.getPlateRegistrationService()::plateHashes);
    }

    private void refreshEntitlement(boolean force) {
        if (force) {
            deps.getEntitlementSnapshotCache().invalidate(userId);
        }
        EntitlementDecision decision = deps.getEntitlementSnapshotCache().get(userId, deps.getEntitlementGate()::check);
        emit(deps.getSseEventFactory().createEvent(SseEventType.ENTITLEMENT, null, decision));
    }

    private void refreshEntitlementAfterSend() {
        try {
            refreshEntitlement(true);
        } catch (RuntimeException e) {
            log.warn("Could not refresh entitlement for session {} after send: {}", sessionId, e.getMessage());
        }
    }

    boolean isReconnectScheduled() {
        Disposable timer = reconnectTimer.get();
        return timer != null && !timer.isDisposed();
    }

    private void subscribeStreams() {
        incomingSubscription.update(deps.getRealtimeAlertStream().incoming(userId)
                .publishOn(deps.getJdbcScheduler())
                .subscribe(this::onIncoming, this::onStreamError));
        outgoingSubscription.update(deps.getRealtimeAlertStream().outgoing(userId)
                .publishOn(deps.getJdbcScheduler())
                .subscribe(this::onOutgoing, this::onStreamError));
    }

    void onIncoming(Alert alert) {
        if (closed.get()) {
            return;
        }
        SseEventType type = deduplicator.shouldPresent(alert) ? SseEventType.ALERT : SseEventType.ALERT_UPDATED;
        emit(deps.getSseEventFactory().createEvent(type, alert.getId().toString(), deps.getAlertMapper().toView(alert)));
    }

    void onOutgoing(Alert alert) {
        if (closed.get()) {
            return;
        }
        emit(deps.getSseEventFactory().createEvent(SseEventType.ALERT_UPDATED, alert.getId().toString(), deps.getAlertMapper().toView(alert)));
        try {
            tracker.observe(alert);
        } catch (RuntimeException e) {
            log.error("Could not record acknowledgment of alert {} for {}: {}", alert.getId(), userId, e.getMessage());
        }
    }

    private void onAlertAnswered(Alert alert) {
        emit(deps.getSseEventFactory().createEvent(SseEventType.ALERT_ANSWERED, alert.getId().toString(), deps.getAlertMapper().toView(alert)));
        deps.getUserStatsService().recordSituationResolved(userId);
    }

    private void onStreamError(Throwable error) {
        if (closed.get()) {
            return;
        }
        log.warn("Alert stream for session {} failed: {}", sessionId, error.getMessage());
        reconciler.onConnectionLost("stream failure");
        scheduleReconnect();
    }

    private void scheduleReconnect() {
        if (closed.get()) {
            return;
        }
        int attempt = reconnectAttempts.getAndIncrement();
        Duration delay = reconnectDelay(attempt, connectivitySettings.getInitialBackoff(), connectivitySettings.getMaxBackoff());
        log.debug("Session {} reconnect attempt {} in {}", sessionId, attempt + 1, delay);
        reconnectTimer.update(Mono.delay(delay, deps.getJdbcScheduler()).subscribe(tick -> attemptReconnect()));
    }

    private void attemptReconnect() {
        if (closed.get()) {
            return;
        }
        try {
            reconciler.onConnectionRestored();
            reconnectAttempts.set(0);
        } catch (NetworkUnavailableException e) {
            log.warn("Session {} reconnect failed: {}", sessionId, e.getMessage());
            scheduleReconnect();
        }
    }

    /**
     * First retry is immediate, then the delay doubles from {@code initial} up to {@code max}.
     */
    static Duration reconnectDelay(int attempt, Duration initial, Duration max) {
        if (attempt <= 0) {
            return Duration.ZERO;
        }
        Duration delay = initial.multipliedBy(1L << Math.min(attempt - 1, MAX_BACKOFF_DOUBLINGS));
        return delay.compareTo(max) > 0 ? max : delay;
    }

    private void emit(ServerSentEvent<String> event) {
        if (event == null || closed.get()) {
            return;
        }
        Sinks.EmitResult result;
        synchronized (sseSink) {
            result = sseSink.tryEmitNext(event);
        }
        if (result.isFailure()) {
            log.warn("Failed to emit {} to session {}. Result: {}", event.event(), sessionId, result);
        }
    }
}
