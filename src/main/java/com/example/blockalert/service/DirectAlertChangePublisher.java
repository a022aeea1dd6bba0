package com.example.blockalert.service;

import com.example.blockalert.config.AppProperties;
import com.example.blockalert.dto.AlertChangeEvent;
import com.example.blockalert.model.Alert;
import com.example.blockalert.util.Constants.EventType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import reactor.core.scheduler.Scheduler;

/**
 * Single-node delivery: hands the change to the local dispatcher once the writing transaction commits.
 * A rolled back write is never seen by a stream. The dispatch runs off the committing thread so its
 * own reads and writes do not touch the finished transaction's connection.
 */
@Component
@Profile("!kafka")
@RequiredArgsConstructor
@Slf4j
public class DirectAlertChangePublisher implements AlertChangePublisher {

    private final AlertChangeDispatcher dispatcher;
    private final AppProperties appProperties;
    private final Scheduler jdbcScheduler;

    @Override
    public void publish(Alert alert, EventType eventType) {
        AlertChangeEvent event = AlertChangeEvents.of(alert, eventType, appProperties.getPod().getId());
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            dispatchQuietly(event);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                jdbcScheduler.schedule(() -> dispatchQuietly(event));
            }
        });
    }

    private void dispatchQuietly(AlertChangeEvent event) {
        try {
            dispatcher.dispatch(event);
        } catch (RuntimeException e) {
            // The row is committed; reconciliation picks the change up on the next pass.
            log.error("Failed to dispatch {} event for alert {}: {}", event.getEventType(), event.getAlertId(), e.getMessage(), e);
        }
    }
}
