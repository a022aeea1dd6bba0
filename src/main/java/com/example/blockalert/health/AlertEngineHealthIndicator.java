package com.example.blockalert.health;

import com.example.blockalert.config.AppProperties;
import com.example.blockalert.service.RealtimeAlertStream;
import com.example.blockalert.service.StoreReachabilityMonitor;
import com.example.blockalert.session.AlertSessionRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Sessions and stream subscribers on this pod, and whether the alert store answers.
 */
@Component
@RequiredArgsConstructor
public class AlertEngineHealthIndicator implements HealthIndicator {

    private final AlertSessionRegistry alertSessionRegistry;
    private final RealtimeAlertStream realtimeAlertStream;
    private final StoreReachabilityMonitor storeReachabilityMonitor;
    private final AppProperties appProperties;

    @Override
    public Health health() {
        Map<String, Object> details = new HashMap<>();
        details.put("podId", appProperties.getPod().getId());
        details.put("activeSessions", alertSessionRegistry.activeSessionCount());
        details.put("streamSubscribers", realtimeAlertStream.subscriberCount());

        boolean storeReachable = storeReachabilityMonitor.isReachable();
        details.put("storeStatus", storeReachable ? "UP" : "DOWN");

        Health.Builder builder = storeReachable ? Health.up() : Health.down();
        return builder.withDetails(details).build();
    }
}
