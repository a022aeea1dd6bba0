package com.example.blockalert.session;

import com.example.blockalert.config.AppProperties;
import com.example.blockalert.dto.AcknowledgmentSummary;
import com.example.blockalert.model.Alert;
import com.example.blockalert.repository.AcknowledgmentMarkerRepository;
import com.example.blockalert.repository.AlertRepository;
import com.example.blockalert.util.Constants.MarkerStatus;
import com.example.blockalert.util.DbTime;
import lombok.extern.slf4j.Slf4j;

import java.time.ZonedDateTime;
import java.util.Map;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Tracks which of the owner's sent alerts have had their answer seen. Markers are persisted, so every
 * session of the same user shares them and the "answered" side effect fires once per alert overall.
 */
@Slf4j
public class AcknowledgmentTracker {

    private final String ownerId;
    private final AcknowledgmentMarkerRepository markerRepository;
    private final AlertRepository alertRepository;
    private final AppProperties.Acknowledgment settings;
    private final Consumer<Alert> answeredListener;

    public AcknowledgmentTracker(String ownerId,
                                 AcknowledgmentMarkerRepository markerRepository,
                                 AlertRepository alertRepository,
                                 AppProperties.Acknowledgment settings,
                                 Consumer<Alert> answeredListener) {
        this.ownerId = ownerId;
        this.markerRepository = markerRepository;
        this.alertRepository = alertRepository;
        this.settings = settings;
        this.answeredListener = answeredListener;
    }

    public void trackSent(UUID alertId, ZonedDateTime createdAt) {
        markerRepository.createIfAbsent(ownerId, alertId, MarkerStatus.PENDING, createdAt);
    }

    /**
     * @return true if this call acknowledged the alert
     */
    public boolean observe(Alert alert) {
        if (!ownerId.equals(alert.getSenderId()) || !alert.isResponded()) {
            return false;
        }
        markerRepository.createIfAbsent(ownerId, alert.getId(), MarkerStatus.PENDING, alert.getCreatedAt());
        return acknowledge(alert);
    }

    public AcknowledgmentSummary unacknowledgedCount() {
        Map<MarkerStatus, Long> counts = markerRepository.countByStatus(ownerId);
        return AcknowledgmentSummary.builder()
                .pending(counts.get(MarkerStatus.PENDING))
                .timedOut(counts.get(MarkerStatus.TIMED_OUT))
                .acknowledged(counts.get(MarkerStatus.ACKNOWLEDGED))
                .unansweredReceived(alertRepository.countUnansweredForReceiver(ownerId))
                .build();
    }

    /**
     * Brings markers in line with the stored alerts. Running it again without new responses changes nothing.
     *
     * @return number of markers created or changed
     */
    public int reconcile() {
        ZonedDateTime now = DbTime.now();
        ZonedDateTime backfillHorizon = now.minus(settings.getBackfillHorizon());
        int changes = 0;

        for (Alert alert : alertRepository.findBySender(ownerId)) {
            if (alert.isResponded() && alert.getRespondedAt().isBefore(backfillHorizon)
                    && markerRepository.createIfAbsent(ownerId, alert.getId(), MarkerStatus.ACKNOWLEDGED, alert.getCreatedAt()) == 1) {
                // Answered long ago and never tracked: record it without announcing it.
                changes++;
                continue;
            }
            changes += markerRepository.createIfAbsent(ownerId, alert.getId(), MarkerStatus.PENDING, alert.getCreatedAt());
            if (alert.isResponded() && acknowledge(alert)) {
                changes++;
            }
        }

        changes += markerRepository.markTimedOut(ownerId, now.minus(settings.getTimeout()));
        if (changes > 0) {
            log.debug("Reconciled acknowledgments for {}: {} change(s)", ownerId, changes);
        }
        return changes;
    }

    private boolean acknowledge(Alert alert) {
        if (markerRepository.markAcknowledged(ownerId, alert.getId(), DbTime.now()) == 0) {
            return false;
        }
        log.info("Alert {} from {} acknowledged ({})", alert.getId(), ownerId, alert.getResponse().getWireValue());
        answeredListener.accept(alert);
        return true;
    }
}
