package com.example.blockalert;

import com.example.blockalert.config.AppProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Alert lifecycle and real-time delivery engine for "your car is blocking me" notifications.
 *
 * - Fan-out of one alert to every registered owner of a plate fingerprint
 * - Live SSE sessions with deduplicated presentation and sender-side acknowledgment
 * - Atomic, tier-aware daily quota per sender
 * - Reconciliation after connectivity loss
 * - Optional Kafka relay (profile "kafka") for multi-pod delivery
 */
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(AppProperties.class)
public class BlockAlertApplication {

    public static void main(String[] args) {
        SpringApplication.run(BlockAlertApplication.class, args);
    }
}
