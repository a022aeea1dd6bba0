package com.example.blockalert.service;

import com.example.blockalert.aspect.Monitored;
import com.example.blockalert.config.AppProperties;
import com.example.blockalert.config.MonitoringConfig.AlertMetricsCollector;
import com.example.blockalert.dto.EntitlementDecision;
import com.example.blockalert.dto.SendAlertResult;
import com.example.blockalert.exception.ConflictException;
import com.example.blockalert.exception.PartialFailureException;
import com.example.blockalert.exception.PersistenceException;
import com.example.blockalert.exception.RateLimitExceededException;
import com.example.blockalert.exception.ResourceNotFoundException;
import com.example.blockalert.exception.ValidationException;
import com.example.blockalert.model.Alert;
import com.example.blockalert.model.AlertResponse;
import com.example.blockalert.repository.AlertRepository;
import com.example.blockalert.util.Constants.EventType;
import com.example.blockalert.util.Constants.ResponsePolicy;
import com.example.blockalert.util.Constants.UrgencyLevel;
import com.example.blockalert.util.DbTime;
import com.example.blockalert.util.PlateFingerprints;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Creates alerts and applies the receiver's read and response actions.
 */
@Service
@Monitored("service")
@RequiredArgsConstructor
@Slf4j
public class AlertService {

    private final AlertRepository alertRepository;
    private final PlateDirectory plateDirectory;
    private final EntitlementGate entitlementGate;
    private final AlertChangePublisher alertChangePublisher;
    private final UserStatsService userStatsService;
    private final TransactionTemplate transactionTemplate;
    private final AlertMetricsCollector metricsCollector;
    private final AppProperties appProperties;

    /**
     * Fans one alert out to every other owner of the plate. One quota unit is spent per send, not
     * per recipient, and is given back when nothing was written.
     *
     * @throws ValidationException        bad input, or the sender is the plate's only owner
     * @throws RateLimitExceededException the sender's daily quota is used up
     * @throws ResourceNotFoundException  nobody registered the plate
     * @throws PartialFailureException    some owners got the alert and some did not
     * @throws PersistenceException       no owner got the alert
     */
    public SendAlertResult sendAlert(String plateHash, String senderId, String message, UrgencyLevel urgency) {
        validateSend(plateHash, senderId, message);
        UrgencyLevel level = urgency != null ? urgency : UrgencyLevel.NORMAL;

        EntitlementDecision decision = entitlementGate.tryConsume(senderId);
        if (!decision.isAllowed()) {
            metricsCollector.incrementCounter("blockalert.alerts.rejected", "reason", "quota");
            throw new RateLimitExceededException(decision.getReason(), decision.getDailyQuota());
        }

        List<String> receivers = resolveReceivers(plateHash, senderId);

        long start = System.currentTimeMillis();
        List<UUID> written = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        for (String receiverId : receivers) {
            Alert candidate = Alert.builder()
                    .senderId(senderId)
                    .receiverId(receiverId)
                    .plateHash(plateHash)
                    .message(message)
                    .urgency(level)
                    .build();
            try {
                Alert saved = transactionTemplate.execute(status -> {
                    Alert inserted = alertRepository.insert(candidate);
                    alertChangePublisher.publish(inserted, EventType.CREATED);
                    return inserted;
                });
                written.add(Objects.requireNonNull(saved).getId());
            } catch (RuntimeException e) {
                log.error("Failed to write alert from {} to {}: {}", senderId, receiverId, e.getMessage(), e);
                failed.add(receiverId);
            }
        }
        metricsCollector.recordTimer("blockalert.fanout.latency", System.currentTimeMillis() - start);

        if (written.isEmpty()) {
            entitlementGate.release(senderId);
            throw new PersistenceException("Alert could not be stored for any of " + receivers.size() + " owners");
        }

        userStatsService.recordAlertSent(senderId);
        receivers.stream().filter(r -> !failed.contains(r)).forEach(userStatsService::recordAlertReceived);

        if (!failed.isEmpty()) {
            metricsCollector.incrementCounter("blockalert.alerts.sent", "status", "partial");
            log.warn("Alert from {} reached {} of {} owners. Failed receivers: {}", senderId, written.size(), receivers.size(), failed);
            throw new PartialFailureException(written, failed);
        }
        metricsCollector.incrementCounter("blockalert.alerts.sent", "status", "success");
        log.info("Alert from {} sent to {} owner(s) with {} urgency", senderId, written.size(), level.wireValue());
        return SendAlertResult.builder()
                .alertIds(written)
                .recipientCount(written.size())
                .build();
    }

    /**
     * Sets readAt once. Marking an already read alert changes and publishes nothing.
     */
    @Transactional
    public Alert markAlertRead(UUID alertId) {
        int updated = alertRepository.markRead(alertId, DbTime.now());
        Alert alert = alertRepository.findById(alertId)
                .orElseThrow(() -> new ResourceNotFoundException("Alert not found: " + alertId));
        if (updated == 0) {
            log.debug("Alert {} already read", alertId);
            return alert;
        }
        alertChangePublisher.publish(alert, EventType.READ);
        return alert;
    }

    @Transactional
    public Alert sendResponse(UUID alertId, String response, String responseMessage) {
        AlertResponse parsed = AlertResponse.parse(response)
                .orElseThrow(() -> new ValidationException("Invalid response: " + response));
        validateMessage(responseMessage, "Response message");

        Alert existing = alertRepository.findById(alertId)
                .orElseThrow(() -> new ResourceNotFoundException("Alert not found: " + alertId));

        ZonedDateTime now = DbTime.now();
        if (appProperties.getAlert().getResponsePolicy() == ResponsePolicy.FIRST_WRITE_WINS) {
            if (alertRepository.updateResponse(alertId, parsed, responseMessage, now, true) == 0) {
                throw new ConflictException("Alert " + alertId + " has already been answered");
            }
        } else {
            if (existing.getResponse() != null) {
                log.warn("Overwriting response {} of alert {} with {}", existing.getResponse().getWireValue(), alertId, parsed.getWireValue());
            }
            alertRepository.updateResponse(alertId, parsed, responseMessage, now, false);
        }

        Alert updated = alertRepository.findById(alertId)
                .orElseThrow(() -> new ResourceNotFoundException("Alert not found: " + alertId));
        alertChangePublisher.publish(updated, EventType.RESPONDED);
        userStatsService.recordCarFreed(updated.getReceiverId());
        metricsCollector.incrementCounter("blockalert.alerts.responded");
        log.info("Alert {} answered by {}: {}", alertId, updated.getReceiverId(), parsed.getWireValue());
        return updated;
    }

    public List<Alert> incomingAlerts(String userId) {
        return alertRepository.findByReceiver(userId);
    }

    public List<Alert> sentAlerts(String userId) {
        return alertRepository.findBySender(userId);
    }

    public Alert findAlert(UUID alertId) {
        return alertRepository.findById(alertId)
                .orElseThrow(() -> new ResourceNotFoundException("Alert not found: " + alertId));
    }

    private List<String> resolveReceivers(String plateHash, String senderId) {
        List<String> owners;
        try {
            owners = plateDirectory.resolveOwners(plateHash);
        } catch (RuntimeException e) {
            entitlementGate.release(senderId);
            throw e;
        }
        List<String> receivers = owners.stream()
                .distinct()
                .filter(owner -> !owner.equals(senderId))
                .toList();
        if (owners.isEmpty()) {
            entitlementGate.release(senderId);
            metricsCollector.incrementCounter("blockalert.alerts.rejected", "reason", "not_found");
            throw new ResourceNotFoundException("License plate not registered");
        }
        if (receivers.isEmpty()) {
            entitlementGate.release(senderId);
            throw new ValidationException("Cannot alert your own vehicle");
        }
        return receivers;
    }

    private void validateSend(String plateHash, String senderId, String message) {
        if (senderId == null || senderId.isBlank()) {
            throw new ValidationException("Sender id is required");
        }
        PlateFingerprints.requireWellFormed(plateHash);
        validateMessage(message, "Message");
    }

    private void validateMessage(String message, String label) {
        int max = appProperties.getAlert().getMaxMessageLength();
        if (message != null && message.length() > max) {
            throw new ValidationException(label + " exceeds " + max + " characters");
        }
    }
}
