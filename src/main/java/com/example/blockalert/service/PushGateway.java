package com.example.blockalert.service;

import com.example.blockalert.model.Alert;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class PushGateway {

    private final PushNotificationSink pushNotificationSink;

    @CircuitBreaker(name = "pushNotification", fallbackMethod = "deliverFallback")
    public boolean deliver(Alert alert) {
        pushNotificationSink.send(alert);
        return true;
    }

    public boolean deliverFallback(Alert alert, Throwable t) {
        log.warn("Push notification for alert {} not delivered: {}", alert.getId(), t.getMessage());
        return false;
    }
}
