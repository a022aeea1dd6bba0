package com.example.blockalert.service;

import com.example.blockalert.exception.NetworkUnavailableException;
import com.example.blockalert.model.Alert;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live per-user alert feeds on this pod. Every value pushed is the full current state of one alert;
 * the same id may arrive more than once and ids are not ordered relative to each other.
 *
 * A subscription that fails is terminated, not retried. The subscriber decides when to come back.
 */
@Service
@Slf4j
public class RealtimeAlertStream {

    private final Map<String, Set<Sinks.Many<Alert>>> incomingSinks = new ConcurrentHashMap<>();
    private final Map<String, Set<Sinks.Many<Alert>>> outgoingSinks = new ConcurrentHashMap<>();

    /**
     * Alerts where the user is the receiver.
     */
    public Flux<Alert> incoming(String userId) {
        return subscribe(incomingSinks, userId);
    }

    /**
     * Alerts the user sent, used to observe responses.
     */
    public Flux<Alert> outgoing(String userId) {
        return subscribe(outgoingSinks, userId);
    }

    public void publish(Alert alert) {
        emit(incomingSinks, alert.getReceiverId(), alert);
        emit(outgoingSinks, alert.getSenderId(), alert);
    }

    /**
     * Ends every live subscription of the user with a {@link NetworkUnavailableException}.
     */
    public void failSubscriptions(String userId, Throwable cause) {
        NetworkUnavailableException error = new NetworkUnavailableException("Alert stream interrupted for user " + userId, cause);
        for (Map<String, Set<Sinks.Many<Alert>>> sinks : List.of(incomingSinks, outgoingSinks)) {
            Set<Sinks.Many<Alert>> userSinks = sinks.get(userId);
            if (userSinks == null) {
                continue;
            }
            for (Sinks.Many<Alert> sink : userSinks) {
                synchronized (sink) {
                    sink.tryEmitError(error);
                }
            }
        }
        log.warn("Terminated alert subscriptions for user {}: {}", userId, cause.getMessage());
    }

    public int subscriberCount() {
        return incomingSinks.values().stream().mapToInt(Set::size).sum()
                + outgoingSinks.values().stream().mapToInt(Set::size).sum();
    }

    private Flux<Alert> subscribe(Map<String, Set<Sinks.Many<Alert>>> sinks, String userId) {
        return Flux.defer(() -> {
            Sinks.Many<Alert> sink = Sinks.many().unicast().onBackpressureBuffer();
            // add inside compute so a concurrent unregister cannot drop the set between lookup and add
            sinks.compute(userId, (k, userSinks) -> {
                Set<Sinks.Many<Alert>> target = userSinks != null ? userSinks : ConcurrentHashMap.newKeySet();
                target.add(sink);
                return target;
            });
            log.debug("Alert subscription opened for user {}", userId);
            return sink.asFlux().doFinally(signal -> unregister(sinks, userId, sink));
        });
    }

    private void emit(Map<String, Set<Sinks.Many<Alert>>> sinks, String userId, Alert alert) {
        Set<Sinks.Many<Alert>> userSinks = sinks.get(userId);
        if (userSinks == null || userSinks.isEmpty()) {
            return;
        }
        for (Sinks.Many<Alert> sink : userSinks) {
            Sinks.EmitResult result;
            synchronized (sink) {
                result = sink.tryEmitNext(alert);
            }
            if (result.isFailure()) {
                log.warn("Failed to push alert {} to a subscription of user {}. Result: {}. Dropping the subscription.", alert.getId(), userId, result);
                unregister(sinks, userId, sink);
            }
        }
    }

    private void unregister(Map<String, Set<Sinks.Many<Alert>>> sinks, String userId, Sinks.Many<Alert> sink) {
        sinks.computeIfPresent(userId, (k, userSinks) -> {
            userSinks.remove(sink);
            return userSinks.isEmpty() ? null : userSinks;
        });
    }
}
