package com.example.blockalert.service;

import com.example.blockalert.config.MonitoringConfig.AlertMetricsCollector;
import com.example.blockalert.model.Alert;
import com.example.blockalert.repository.AlertRepository;
import com.example.blockalert.repository.AlertSessionRepository;
import com.example.blockalert.util.DbTime;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Sends at most one push per alert, and only when the receiver has no live session anywhere.
 * Failures never affect the alert itself.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PushDispatchService {

    private final AlertSessionRepository alertSessionRepository;
    private final AlertRepository alertRepository;
    private final PushGateway pushGateway;
    private final AlertMetricsCollector metricsCollector;

    public void dispatchIfOffline(Alert alert) {
        try {
            if (alertSessionRepository.hasActiveSession(alert.getReceiverId())) {
                log.debug("Receiver {} is connected. No push for alert {}", alert.getReceiverId(), alert.getId());
                return;
            }
            if (alertRepository.claimPush(alert.getId(), DbTime.now()) == 0) {
                log.debug("Push for alert {} already claimed", alert.getId());
                return;
            }
            if (pushGateway.deliver(alert)) {
                metricsCollector.incrementCounter("blockalert.push.sent", "status", "success");
            } else {
                alertRepository.releasePushClaim(alert.getId());
                metricsCollector.incrementCounter("blockalert.push.sent", "status", "failed");
            }
        } catch (DataAccessException e) {
            log.error("Push dispatch for alert {} skipped: {}", alert.getId(), e.getMessage());
        }
    }
}
