package com.example.blockalert.service;

import com.example.blockalert.config.AppProperties;
import com.example.blockalert.model.OutboxEvent;
import com.example.blockalert.repository.OutboxRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.context.annotation.Profile;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Relays committed alert changes from the outbox to Kafka. Only events the broker acknowledged are
 * deleted; the rest stay for the next run.
 */
@Service
@Profile("kafka")
@RequiredArgsConstructor
@Slf4j
public class OutboxPollingService {

    private static final long SEND_TIMEOUT_SECONDS = 5;

    private final OutboxRepository outboxRepository;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final AppProperties appProperties;

    @Scheduled(fixedDelay = 1000)
    @SchedulerLock(name = "alertOutboxRelay", lockAtMostFor = "PT20S")
    @Transactional
    public void relayPendingEvents() {
        List<OutboxEvent> events = outboxRepository.findAndLockUnprocessed(appProperties.getKafka().getOutboxBatchSize());
        if (events.isEmpty()) {
            return;
        }
        List<UUID> sent = new ArrayList<>();
        for (OutboxEvent event : events) {
            try {
                kafkaTemplate.send(event.getTopic(), event.getMessageKey(), event.getPayload())
                        .get(SEND_TIMEOUT_SECONDS, TimeUnit.SECONDS);
                sent.add(event.getId());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Outbox relay interrupted after {} of {} events", sent.size(), events.size());
                break;
            } catch (ExecutionException | TimeoutException e) {
                log.error("Failed to relay outbox event {} for alert {}: {}", event.getId(), event.getAlertId(), e.getMessage());
                break;
            }
        }
        outboxRepository.deleteByIds(sent);
        log.trace("Relayed {} of {} outbox events", sent.size(), events.size());
    }
}
