package com.example.blockalert.service;

import com.example.blockalert.aspect.Monitored;
import com.example.blockalert.config.AppProperties;
import com.example.blockalert.dto.EntitlementDecision;
import com.example.blockalert.model.EntitlementState;
import com.example.blockalert.repository.EntitlementRepository;
import com.example.blockalert.util.Constants.ResetPolicy;
import com.example.blockalert.util.Constants.Tier;
import com.example.blockalert.util.DbTime;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

/**
 * Tier-aware daily alert quota. Consumption is a single conditional update so that two sessions
 * of the same account can never both take the last unit.
 */
@Service
@Monitored("service")
@RequiredArgsConstructor
@Slf4j
public class EntitlementGate {

    private static final Duration ROLLING_WINDOW = Duration.ofHours(24);

    private final EntitlementRepository entitlementRepository;
    private final AppProperties appProperties;

    @Transactional
    public EntitlementDecision tryConsume(String userId) {
        ZonedDateTime now = DbTime.now();
        entitlementRepository.createIfAbsent(userId, now);

        UsageWindow window = currentWindow(now);
        AppProperties.Entitlement settings = appProperties.getEntitlement();
        int consumed = entitlementRepository.tryConsume(userId, window.expiry(), window.start(), now,
                settings.getFreeDailyQuota(), settings.getPremiumDailyQuota());

        EntitlementState state = entitlementRepository.findByUserId(userId)
                .orElseThrow(() -> new IllegalStateException("Entitlement row missing for user " + userId));
        int quota = quotaFor(state.getTier());

        if (consumed == 0) {
            log.info("Alert quota exhausted for user {} ({} of {} used, tier {})", userId, state.getDailyAlertsUsed(), quota, state.getTier());
            return decision(false, 0, quota, state.getTier(), "Daily alert limit reached");
        }
        int remaining = Math.max(0, quota - state.getDailyAlertsUsed());
        log.debug("Consumed one alert for user {}. Remaining: {}", userId, remaining);
        return decision(true, remaining, quota, state.getTier(), null);
    }

    /**
     * Gives back a unit taken by {@link #tryConsume} when the send wrote nothing.
     */
    @Transactional
    public void release(String userId) {
        int updated = entitlementRepository.release(userId, DbTime.now());
        if (updated == 0) {
            log.warn("Nothing to release for user {}", userId);
        }
    }

    /**
     * Read-only answer to "may this user send now?". Does not consume.
     */
    public EntitlementDecision check(String userId) {
        ZonedDateTime now = DbTime.now();
        EntitlementState state = entitlementRepository.findByUserId(userId)
                .orElseGet(() -> EntitlementState.builder()
                        .userId(userId)
                        .tier(Tier.FREE)
                        .dailyAlertsUsed(0)
                        .usageWindowStart(now)
                        .build());
        int quota = quotaFor(state.getTier());
        boolean windowExpired = state.getUsageWindowStart().isBefore(currentWindow(now).expiry());
        int used = windowExpired ? 0 : state.getDailyAlertsUsed();
        int remaining = Math.max(0, quota - used);
        return decision(remaining > 0, remaining, quota, state.getTier(), remaining > 0 ? null : "Daily alert limit reached");
    }

    public boolean isPremium(String userId) {
        return entitlementRepository.findByUserId(userId)
                .map(state -> state.getTier().isPremium())
                .orElse(false);
    }

    public int dailyQuota(String userId) {
        return quotaFor(entitlementRepository.findByUserId(userId).map(EntitlementState::getTier).orElse(Tier.FREE));
    }

    @Transactional
    public EntitlementDecision updateTier(String userId, Tier tier) {
        ZonedDateTime now = DbTime.now();
        entitlementRepository.createIfAbsent(userId, now);
        entitlementRepository.updateTier(userId, tier, now);
        log.info("Tier for user {} set to {}", userId, tier);
        return check(userId);
    }

    int quotaFor(Tier tier) {
        AppProperties.Entitlement settings = appProperties.getEntitlement();
        return tier.isPremium() ? settings.getPremiumDailyQuota() : settings.getFreeDailyQuota();
    }

    /**
     * A window whose start is before {@code expiry} is over. Rolling windows restart at the moment
     * of the first send after expiry; calendar windows restart at local midnight.
     */
    UsageWindow currentWindow(ZonedDateTime now) {
        AppProperties.Entitlement settings = appProperties.getEntitlement();
        if (settings.getResetPolicy() == ResetPolicy.CALENDAR_DAY) {
            ZonedDateTime midnight = now.withZoneSameInstant(settings.getZone())
                    .toLocalDate()
                    .atStartOfDay(settings.getZone())
                    .withZoneSameInstant(ZoneOffset.UTC);
            return new UsageWindow(midnight, midnight);
        }
        return new UsageWindow(now.minus(ROLLING_WINDOW), now);
    }

    private EntitlementDecision decision(boolean allowed, int remaining, int quota, Tier tier, String reason) {
        return EntitlementDecision.builder()
                .allowed(allowed)
                .remaining(remaining)
                .dailyQuota(quota)
                .tier(tier)
                .reason(reason)
                .build();
    }

    record UsageWindow(ZonedDateTime expiry, ZonedDateTime start) {}
}
