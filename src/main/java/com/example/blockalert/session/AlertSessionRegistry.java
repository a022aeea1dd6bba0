package com.example.blockalert.session;

import com.example.blockalert.config.AppProperties;
import com.example.blockalert.config.MonitoringConfig.AlertMetricsCollector;
import com.example.blockalert.dto.AcknowledgmentSummary;
import com.example.blockalert.dto.EntitlementDecision;
import com.example.blockalert.dto.SendAlertRequest;
import com.example.blockalert.dto.SendAlertResult;
import com.example.blockalert.dto.SessionStatus;
import com.example.blockalert.exception.NetworkUnavailableException;
import com.example.blockalert.exception.ResourceNotFoundException;
import com.example.blockalert.exception.ValidationException;
import com.example.blockalert.mapper.AlertMapper;
import com.example.blockalert.model.AlertSessionRecord;
import com.example.blockalert.repository.AcknowledgmentMarkerRepository;
import com.example.blockalert.repository.AlertRepository;
import com.example.blockalert.repository.AlertSessionRepository;
import com.example.blockalert.service.AlertService;
import com.example.blockalert.service.EntitlementGate;
import com.example.blockalert.service.PlateRegistrationService;
import com.example.blockalert.service.RealtimeAlertStream;
import com.example.blockalert.service.SseEventFactory;
import com.example.blockalert.service.UserStatsService;
import com.example.blockalert.util.Constants.ConnectionStatus;
import com.example.blockalert.util.Constants.UrgencyLevel;
import com.example.blockalert.util.DbTime;
import com.example.blockalert.util.PlateFingerprints;
import com.github.benmanes.caffeine.cache.Cache;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.dao.DataAccessException;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live sessions on this pod, plus the presence rows other pods use to decide on push.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AlertSessionRegistry {

    private final Map<String, AlertSession> sessions = new ConcurrentHashMap<>();

    private final AlertService alertService;
    private final RealtimeAlertStream realtimeAlertStream;
    private final EntitlementGate entitlementGate;
    private final PlateRegistrationService plateRegistrationService;
    private final AlertRepository alertRepository;
    private final AcknowledgmentMarkerRepository markerRepository;
    private final AlertSessionRepository alertSessionRepository;
    private final UserStatsService userStatsService;
    private final SseEventFactory sseEventFactory;
    private final AlertMapper alertMapper;
    private final Cache<String, EntitlementDecision> entitlementSnapshotCache;
    private final Cache<String, Set<String>> plateSnapshotCache;
    private final AppProperties appProperties;
    private final Scheduler jdbcScheduler;
    private final AlertMetricsCollector metricsCollector;

    private SessionCollaborators collaborators;
    private Disposable heartbeatSubscription;

    @PostConstruct
    public void init() {
        collaborators = SessionCollaborators.builder()
                .alertService(alertService)
                .realtimeAlertStream(realtimeAlertStream)
                .entitlementGate(entitlementGate)
                .plateRegistrationService(plateRegistrationService)
                .alertRepository(alertRepository)
                .markerRepository(markerRepository)
                .userStatsService(userStatsService)
                .sseEventFactory(sseEventFactory)
                .alertMapper(alertMapper)
                .entitlementSnapshotCache(entitlementSnapshotCache)
                .plateSnapshotCache(plateSnapshotCache)
                .appProperties(appProperties)
                .jdbcScheduler(jdbcScheduler)
                .build();
        heartbeatSubscription = Flux.interval(appProperties.getSse().getHeartbeatInterval(), jdbcScheduler)
                .doOnNext(tick -> sendHeartbeats())
                .subscribe();
    }

    @PreDestroy
    public void shutdown() {
        log.info("Closing {} alert session(s) on shutdown", sessions.size());
        if (heartbeatSubscription != null) {
            heartbeatSubscription.dispose();
        }
        for (AlertSession session : new ArrayList<>(sessions.values())) {
            session.notifyShutdown();
            close(session.getSessionId());
        }
    }

    /**
     * Opens a session and returns its event stream. The session closes when the client goes away.
     */
    public Flux<ServerSentEvent<String>> open(String userId, String sessionId) {
        String id = sessionId == null || sessionId.isBlank() ? UUID.randomUUID().toString() : sessionId;
        return Mono.fromCallable(() -> createSession(userId, id))
                .subscribeOn(jdbcScheduler)
                .flatMapMany(session -> session.events()
                        .doFinally(signal -> jdbcScheduler.schedule(() -> close(session))));
    }

    public void close(String sessionId) {
        AlertSession session = sessions.get(sessionId);
        if (session != null) {
            close(session);
        }
    }

    public AlertSession require(String sessionId) {
        AlertSession session = sessions.get(sessionId);
        if (session == null) {
            throw new ResourceNotFoundException("Session not found: " + sessionId);
        }
        return session;
    }

    /**
     * Sends through the caller's session when one is named, so offline sessions fail fast and the
     * sent alerts are tracked for acknowledgment. Without a session the send goes straight to the service.
     */
    public SendAlertResult sendAlert(SendAlertRequest request) {
        String plateHash = request.getPlateHash() != null && !request.getPlateHash().isBlank()
                ? request.getPlateHash()
                : PlateFingerprints.fingerprint(request.getPlate());
        UrgencyLevel urgency = parseUrgency(request.getUrgency());

        if (request.getSessionId() == null || request.getSessionId().isBlank()) {
            return alertService.sendAlert(plateHash, request.getSenderId(), request.getMessage(), urgency);
        }
        AlertSession session = require(request.getSessionId());
        if (!session.getUserId().equals(request.getSenderId())) {
            throw new ValidationException("Session " + request.getSessionId() + " does not belong to " + request.getSenderId());
        }
        return session.sendAlert(plateHash, request.getMessage(), urgency);
    }

    public SessionStatus reportConnectivity(String sessionId, boolean online) {
        AlertSession session = require(sessionId);
        session.reportConnectivity(online, "client reported " + (online ? "online" : "offline"));
        return session.status();
    }

    public int reconcile(String sessionId) {
        AlertSession session = require(sessionId);
        if (!session.isOnline()) {
            throw new NetworkUnavailableException("Session " + sessionId + " is offline");
        }
        return session.reconcileNow();
    }

    public AcknowledgmentSummary acknowledgments(String sessionId) {
        return require(sessionId).acknowledgments();
    }

    public SessionStatus status(String sessionId) {
        return require(sessionId).status();
    }

    @Scheduled(fixedDelayString = "${block-alert.acknowledgment.reconcile-interval}")
    public void reconcileAll() {
        for (AlertSession session : sessions.values()) {
            if (!session.isOnline() || session.isClosed()) {
                continue;
            }
            try {
                session.reconcileNow();
            } catch (DataAccessException e) {
                log.warn("Scheduled reconcile of session {} failed: {}", session.getSessionId(), e.getMessage());
            }
        }
    }

    /**
     * Marks presence rows of sessions whose pod stopped heartbeating as inactive.
     */
    @Scheduled(fixedDelay = 60000)
    @SchedulerLock(name = "alertSessionCleanup", lockAtMostFor = "PT50S")
    public void cleanupStaleSessions() {
        ZonedDateTime threshold = DbTime.now().minus(appProperties.getSse().getStaleSessionThreshold());
        List<AlertSessionRecord> stale = alertSessionRepository.findStaleSessions(threshold);
        if (stale.isEmpty()) {
            return;
        }
        ZonedDateTime now = DbTime.now();
        stale.forEach(record -> alertSessionRepository.markInactive(record.getSessionId(), now));
        log.info("Marked {} stale session(s) inactive", stale.size());
    }

    /**
     * Fans a store probe result out to every session on this pod.
     */
    public void onStoreReachabilityChanged(boolean reachable) {
        log.warn("Alert store became {}", reachable ? "reachable" : "unreachable");
        for (AlertSession session : sessions.values()) {
            try {
                session.reportConnectivity(reachable, "store probe");
            } catch (NetworkUnavailableException e) {
                log.warn("Session {} stays offline: {}", session.getSessionId(), e.getMessage());
            }
        }
    }

    public boolean isUserConnected(String userId) {
        return sessions.values().stream().anyMatch(s -> s.getUserId().equals(userId));
    }

    public int activeSessionCount() {
        return sessions.size();
    }

    private AlertSession createSession(String userId, String sessionId) {
        AlertSession previous = sessions.get(sessionId);
        if (previous != null) {
            log.info("Session {} reopened. Closing previous instance.", sessionId);
            close(previous);
        }
        AlertSession session = new AlertSession(sessionId, userId, collaborators);
        sessions.put(sessionId, session);
        ZonedDateTime now = DbTime.now();
        alertSessionRepository.save(AlertSessionRecord.builder()
                .sessionId(sessionId)
                .userId(userId)
                .podId(appProperties.getPod().getId())
                .connectionStatus(ConnectionStatus.ACTIVE.name())
                .connectedAt(now)
                .lastHeartbeat(now)
                .build());
        try {
            session.start();
        } catch (RuntimeException e) {
            close(session);
            throw e;
        }
        metricsCollector.setGauge("blockalert.sessions.active", sessions.size());
        return session;
    }

    private void close(AlertSession session) {
        if (!sessions.remove(session.getSessionId(), session) && session.isClosed()) {
            return;
        }
        session.close();
        try {
            alertSessionRepository.markInactive(session.getSessionId(), DbTime.now());
        } catch (DataAccessException e) {
            log.warn("Could not mark session {} inactive: {}", session.getSessionId(), e.getMessage());
        }
        metricsCollector.setGauge("blockalert.sessions.active", sessions.size());
    }

    private void sendHeartbeats() {
        if (sessions.isEmpty()) {
            return;
        }
        try {
            sessions.values().forEach(AlertSession::heartbeat);
            alertSessionRepository.updateHeartbeats(new ArrayList<>(sessions.keySet()), DbTime.now());
        } catch (RuntimeException e) {
            log.error("Heartbeat run failed: {}", e.getMessage());
        }
    }

    private UrgencyLevel parseUrgency(String urgency) {
        try {
            return UrgencyLevel.fromWireValue(urgency);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(e.getMessage());
        }
    }
}
