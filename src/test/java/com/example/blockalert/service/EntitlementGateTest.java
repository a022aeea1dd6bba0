package com.example.blockalert.service;

import com.example.blockalert.config.AppProperties;
import com.example.blockalert.dto.EntitlementDecision;
import com.example.blockalert.repository.EntitlementRepository;
import com.example.blockalert.util.Constants.ResetPolicy;
import com.example.blockalert.util.Constants.Tier;
import com.example.blockalert.util.DbTime;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.JdbcTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@JdbcTest
class EntitlementGateTest {

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private AppProperties appProperties;
    private EntitlementRepository entitlementRepository;
    private EntitlementGate entitlementGate;

    @BeforeEach
    void setUp() {
        appProperties = new AppProperties();
        entitlementRepository = new EntitlementRepository(jdbcTemplate);
        entitlementGate = new EntitlementGate(entitlementRepository, appProperties);
    }

    @Test
    void shouldBlockFreeUserAfterDailyQuota() {
        assertThat(entitlementGate.tryConsume("alice").getRemaining()).isEqualTo(2);
        assertThat(entitlementGate.tryConsume("alice").getRemaining()).isEqualTo(1);
        assertThat(entitlementGate.tryConsume("alice").getRemaining()).isZero();

        EntitlementDecision fourth = entitlementGate.tryConsume("alice");

        assertThat(fourth.isAllowed()).isFalse();
        assertThat(fourth.getReason()).isEqualTo("Daily alert limit reached");
        assertThat(fourth.getDailyQuota()).isEqualTo(3);
        assertThat(usedBy("alice")).isEqualTo(3);
        assertThat(entitlementGate.check("alice").isAllowed()).isFalse();
    }

    @Test
    void shouldLetPremiumUserPastFreeQuota() {
        entitlementGate.updateTier("alice", Tier.PREMIUM);

        for (int i = 0; i < 10; i++) {
            assertThat(entitlementGate.tryConsume("alice").isAllowed()).isTrue();
        }
        assertThat(entitlementGate.isPremium("alice")).isTrue();
        assertThat(entitlementGate.dailyQuota("alice")).isEqualTo(200);
    }

    @Test
    void shouldRestartRollingWindowAfterTwentyFourHours() {
        exhaust("alice");
        moveWindowStart("alice", DbTime.now().minusHours(25));

        assertThat(entitlementGate.check("alice").isAllowed()).isTrue();
        EntitlementDecision decision = entitlementGate.tryConsume("alice");

        assertThat(decision.isAllowed()).isTrue();
        assertThat(decision.getRemaining()).isEqualTo(2);
        assertThat(usedBy("alice")).isEqualTo(1);
    }

    @Test
    void shouldKeepRollingWindowWithinTwentyFourHours() {
        exhaust("alice");
        moveWindowStart("alice", DbTime.now().minusHours(23));

        assertThat(entitlementGate.tryConsume("alice").isAllowed()).isFalse();
    }

    @Test
    void shouldRestartCalendarWindowAtMidnight() {
        appProperties.getEntitlement().setResetPolicy(ResetPolicy.CALENDAR_DAY);
        exhaust("alice");
        ZonedDateTime midnight = DbTime.now().toLocalDate().atStartOfDay(ZoneOffset.UTC);
        moveWindowStart("alice", midnight.minusMinutes(1));

        assertThat(entitlementGate.tryConsume("alice").isAllowed()).isTrue();
        assertThat(usedBy("alice")).isEqualTo(1);
    }

    @Test
    void shouldGiveBackUnitWithoutGoingNegative() {
        entitlementGate.tryConsume("alice");

        entitlementGate.release("alice");
        entitlementGate.release("alice");

        assertThat(usedBy("alice")).isZero();
    }

    @Test
    void shouldReportFullQuotaForUnknownUser() {
        EntitlementDecision decision = entitlementGate.check("nobody");

        assertThat(decision.isAllowed()).isTrue();
        assertThat(decision.getRemaining()).isEqualTo(3);
        assertThat(decision.getTier()).isEqualTo(Tier.FREE);
    }

    @Test
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    void shouldGrantExactlyTheQuotaToConcurrentFirstSends() throws Exception {
        String userId = "two-devices-" + System.nanoTime();
        int callers = 24;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch go = new CountDownLatch(1);
        try {
            List<Future<EntitlementDecision>> futures = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                Callable<EntitlementDecision> send = () -> {
                    go.await();
                    return entitlementGate.tryConsume(userId);
                };
                futures.add(pool.submit(send));
            }
            go.countDown();

            int allowed = 0;
            for (Future<EntitlementDecision> future : futures) {
                if (future.get(10, TimeUnit.SECONDS).isAllowed()) {
                    allowed++;
                }
            }

            assertThat(allowed).isEqualTo(appProperties.getEntitlement().getFreeDailyQuota());
            assertThat(usedBy(userId)).isEqualTo(3);
        } finally {
            pool.shutdownNow();
            jdbcTemplate.update("DELETE FROM entitlements WHERE user_id = ?", userId);
        }
    }

    private void exhaust(String userId) {
        for (int i = 0; i < 3; i++) {
            entitlementGate.tryConsume(userId);
        }
    }

    private void moveWindowStart(String userId, ZonedDateTime start) {
        jdbcTemplate.update("UPDATE entitlements SET usage_window_start = ? WHERE user_id = ?", DbTime.param(start), userId);
    }

    private int usedBy(String userId) {
        return entitlementRepository.findByUserId(userId).orElseThrow().getDailyAlertsUsed();
    }
}
