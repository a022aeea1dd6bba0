package com.example.blockalert.service;

import com.example.blockalert.dto.AlertChangeEvent;
import com.example.blockalert.model.Alert;
import com.example.blockalert.repository.AlertRepository;
import com.example.blockalert.util.Constants.EventType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Turns a change notification into stream values on this pod. The row is reloaded so subscribers
 * always see committed state, whatever order notifications arrive in.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AlertChangeDispatcher {

    private final AlertRepository alertRepository;
    private final RealtimeAlertStream realtimeAlertStream;
    private final PushDispatchService pushDispatchService;

    public void dispatch(AlertChangeEvent event) {
        Optional<Alert> current = alertRepository.findById(event.getAlertId());
        if (current.isEmpty()) {
            log.warn("Alert {} from {} event no longer exists. Skipping.", event.getAlertId(), event.getEventType());
            return;
        }
        Alert alert = current.get();
        realtimeAlertStream.publish(alert);
        log.debug("Dispatched {} for alert {} (sender {}, receiver {})", event.getEventType(), alert.getId(), alert.getSenderId(), alert.getReceiverId());

        if (EventType.CREATED.name().equals(event.getEventType())) {
            pushDispatchService.dispatchIfOffline(alert);
        }
    }
}
