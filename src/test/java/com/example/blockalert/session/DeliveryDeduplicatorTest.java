package com.example.blockalert.session;

import com.example.blockalert.model.Alert;
import com.example.blockalert.model.AlertResponse;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

class DeliveryDeduplicatorTest {

    private final ZonedDateTime now = ZonedDateTime.of(2024, 5, 1, 12, 0, 0, 0, ZoneOffset.UTC);
    private final DeliveryDeduplicator deduplicator = new DeliveryDeduplicator(Duration.ofMinutes(5));

    @Test
    void shouldPresentFreshUnreadAlert() {
        assertThat(deduplicator.shouldPresent(alertCreated(now.minusMinutes(1)), now)).isTrue();
    }

    @Test
    void shouldNotPresentAlertOlderThanFreshnessWindow() {
        Alert stale = alertCreated(now.minusMinutes(6));

        assertThat(deduplicator.shouldPresent(stale, now)).isFalse();
        assertThat(deduplicator.hasSeen(stale.getId())).isTrue();
    }

    @Test
    void shouldPresentEachAlertOnlyOnce() {
        Alert alert = alertCreated(now.minusSeconds(10));

        assertThat(deduplicator.shouldPresent(alert, now)).isTrue();
        assertThat(deduplicator.shouldPresent(alert, now)).isFalse();
        assertThat(deduplicator.shouldPresent(alert.toBuilder().build(), now.plusSeconds(1))).isFalse();
        assertThat(deduplicator.seenCount()).isEqualTo(1);
    }

    @Test
    void shouldNotPresentReadOrAnsweredAlerts() {
        Alert read = alertCreated(now.minusMinutes(1)).toBuilder().readAt(now).build();
        Alert answered = alertCreated(now.minusMinutes(1)).toBuilder()
                .response(AlertResponse.MOVING_NOW)
                .respondedAt(now)
                .readAt(now)
                .build();

        assertThat(deduplicator.shouldPresent(read, now)).isFalse();
        assertThat(deduplicator.shouldPresent(answered, now)).isFalse();
    }

    @Test
    void shouldNotPresentLaterDeliveryOfAlertFirstSeenWhenStale() {
        Alert alert = alertCreated(now.minusMinutes(6));
        deduplicator.shouldPresent(alert, now);

        assertThat(deduplicator.shouldPresent(alert.toBuilder().createdAt(now).build(), now)).isFalse();
    }

    @Test
    void shouldRememberEveryIdWithinTheWindowRegardlessOfCount() {
        List<Alert> alerts = new ArrayList<>();
        for (int i = 0; i < 20_000; i++) {
            Alert alert = alertCreated(now.minusSeconds(30));
            alerts.add(alert);
            deduplicator.shouldPresent(alert, now);
        }

        assertThat(alerts).allSatisfy(alert -> assertThat(deduplicator.shouldPresent(alert, now)).isFalse());
        assertThat(deduplicator.hasSeen(alerts.get(0).getId())).isTrue();
    }

    @Test
    void shouldForgetIdOnlyAfterItHasGoneStale() {
        AtomicLong nanos = new AtomicLong();
        DeliveryDeduplicator timed = new DeliveryDeduplicator(Duration.ofMinutes(5), nanos::get);
        Alert alert = alertCreated(now);

        assertThat(timed.shouldPresent(alert, now)).isTrue();
        nanos.addAndGet(Duration.ofMinutes(4).toNanos());
        assertThat(timed.hasSeen(alert.getId())).isTrue();

        nanos.addAndGet(Duration.ofMinutes(2).toNanos());
        assertThat(timed.hasSeen(alert.getId())).isFalse();
        assertThat(timed.shouldPresent(alert, now.plusMinutes(6))).isFalse();
    }

    private Alert alertCreated(ZonedDateTime createdAt) {
        return Alert.builder()
                .id(UUID.randomUUID())
                .senderId("alice")
                .receiverId("bob")
                .plateHash("a".repeat(64))
                .createdAt(createdAt)
                .build();
    }
}
