package com.example.blockalert.session;

import com.example.blockalert.model.Alert;
import com.example.blockalert.util.DbTime;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.UUID;

/**
 * Decides whether an incoming alert gets the full "new alert" presentation. Each id is presented at
 * most once per session, and only while it is unread, unanswered and fresh.
 *
 * Seen ids are dropped one freshness window after first sight and never by size. By then the alert
 * has aged out of the window, so forgetting its id cannot lead to a second presentation.
 */
public class DeliveryDeduplicator {

    private final Duration freshnessWindow;
    private final Cache<UUID, Boolean> seen;

    public DeliveryDeduplicator(Duration freshnessWindow) {
        this(freshnessWindow, Ticker.systemTicker());
    }

    DeliveryDeduplicator(Duration freshnessWindow, Ticker ticker) {
        this.freshnessWindow = freshnessWindow;
        this.seen = Caffeine.newBuilder()
                .expireAfterWrite(freshnessWindow)
                .ticker(ticker)
                .build();
    }

    public boolean shouldPresent(Alert alert) {
        return shouldPresent(alert, DbTime.now());
    }

    /**
     * Records the id whatever the outcome, so a later redelivery of the same alert is never presented.
     */
    public boolean shouldPresent(Alert alert, ZonedDateTime now) {
        boolean firstSighting = seen.asMap().putIfAbsent(alert.getId(), Boolean.TRUE) == null;
        if (!firstSighting) {
            return false;
        }
        if (alert.getResponse() != null || alert.getReadAt() != null) {
            return false;
        }
        return alert.getCreatedAt() != null
                && Duration.between(alert.getCreatedAt(), now).compareTo(freshnessWindow) < 0;
    }

    public boolean hasSeen(UUID alertId) {
        return seen.getIfPresent(alertId) != null;
    }

    public long seenCount() {
        return seen.estimatedSize();
    }
}
