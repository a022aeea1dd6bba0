package com.example.blockalert.session;

import com.example.blockalert.config.AppProperties;
import com.example.blockalert.dto.EntitlementDecision;
import com.example.blockalert.mapper.AlertMapper;
import com.example.blockalert.repository.AcknowledgmentMarkerRepository;
import com.example.blockalert.repository.AlertRepository;
import com.example.blockalert.service.AlertService;
import com.example.blockalert.service.EntitlementGate;
import com.example.blockalert.service.PlateRegistrationService;
import com.example.blockalert.service.RealtimeAlertStream;
import com.example.blockalert.service.SseEventFactory;
import com.example.blockalert.service.UserStatsService;
import com.github.benmanes.caffeine.cache.Cache;
import lombok.Builder;
import lombok.Value;
import reactor.core.scheduler.Scheduler;

import java.util.Set;

/**
 * Shared singletons every {@link AlertSession} works with.
 */
@Value
@Builder
public class SessionCollaborators {
    AlertService alertService;
    RealtimeAlertStream realtimeAlertStream;
    EntitlementGate entitlementGate;
    PlateRegistrationService plateRegistrationService;
    AlertRepository alertRepository;
    AcknowledgmentMarkerRepository markerRepository;
    UserStatsService userStatsService;
    SseEventFactory sseEventFactory;
    AlertMapper alertMapper;
    Cache<String, EntitlementDecision> entitlementSnapshotCache;
    Cache<String, Set<String>> plateSnapshotCache;
    AppProperties appProperties;
    Scheduler jdbcScheduler;
}
