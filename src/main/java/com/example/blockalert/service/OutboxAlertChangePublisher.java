package com.example.blockalert.service;

import com.example.blockalert.config.AppProperties;
import com.example.blockalert.dto.AlertChangeEvent;
import com.example.blockalert.model.Alert;
import com.example.blockalert.model.OutboxEvent;
import com.example.blockalert.repository.OutboxRepository;
import com.example.blockalert.util.Constants.EventType;
import com.example.blockalert.util.DbTime;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Multi-pod delivery. The change is written to the outbox in the alert's own transaction and relayed
 * to Kafka by {@link OutboxPollingService}. Keyed by receiver so one user's changes stay on one partition.
 */
@Component
@Profile("kafka")
@RequiredArgsConstructor
@Slf4j
public class OutboxAlertChangePublisher implements AlertChangePublisher {

    private final OutboxRepository outboxRepository;
    private final ObjectMapper objectMapper;
    private final AppProperties appProperties;

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public void publish(Alert alert, EventType eventType) {
        AlertChangeEvent event = AlertChangeEvents.of(alert, eventType, appProperties.getPod().getId());
        try {
            outboxRepository.save(OutboxEvent.builder()
                    .id(UUID.randomUUID())
                    .alertId(alert.getId())
                    .eventType(eventType.name())
                    .topic(appProperties.getKafka().getTopic())
                    .messageKey(alert.getReceiverId())
                    .payload(objectMapper.writeValueAsString(event))
                    .createdAt(DbTime.now())
                    .build());
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize {} event for alert {}", eventType, alert.getId(), e);
            throw new IllegalStateException("Failed to serialize alert change event", e);
        }
    }
}
