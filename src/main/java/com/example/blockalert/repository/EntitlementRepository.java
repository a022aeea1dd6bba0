package com.example.blockalert.repository;

import com.example.blockalert.aspect.Monitored;
import com.example.blockalert.model.EntitlementState;
import com.example.blockalert.util.Constants.Tier;
import com.example.blockalert.util.DbTime;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.ZonedDateTime;
import java.util.Optional;

@Repository
@Slf4j
@Monitored("repository")
public class EntitlementRepository {

    private final JdbcTemplate jdbcTemplate;

    public EntitlementRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    private final RowMapper<EntitlementState> entitlementRowMapper = (rs, rowNum) -> EntitlementState.builder()
            .userId(rs.getString("user_id"))
            .tier(Tier.valueOf(rs.getString("tier")))
            .dailyAlertsUsed(rs.getInt("daily_alerts_used"))
            .usageWindowStart(DbTime.read(rs, "usage_window_start"))
            .updatedAt(DbTime.read(rs, "updated_at"))
            .build();

    public Optional<EntitlementState> findByUserId(String userId) {
        String sql = "SELECT * FROM entitlements WHERE user_id = ?";
        return jdbcTemplate.query(sql, entitlementRowMapper, userId).stream().findFirst();
    }

    /**
     * Creates a free-tier row when the user has none. A concurrent caller that loses the insert
     * race sees the winner's row, so the duplicate key is not an error here.
     */
    public void createIfAbsent(String userId, ZonedDateTime now) {
        String sql = """
            MERGE INTO entitlements AS t
            USING (SELECT CAST(? AS VARCHAR(255)) AS user_id) AS s ON t.user_id = s.user_id
            WHEN NOT MATCHED THEN
                INSERT (user_id, tier, daily_alerts_used, usage_window_start, updated_at)
                VALUES (s.user_id, 'FREE', 0, ?, ?)
            """;
        try {
            jdbcTemplate.update(sql, userId, DbTime.param(now), DbTime.param(now));
        } catch (DuplicateKeyException e) {
            log.debug("Entitlement row for user {} created concurrently", userId);
        }
    }

    /**
     * Check-and-increment as one statement. An expired window (start before {@code windowExpiry})
     * restarts at {@code newWindowStart} with this call as its first use; otherwise the counter
     * grows only while it is below the quota of the row's tier.
     *
     * @return 1 when a unit was consumed, 0 when the quota is exhausted
     */
    public int tryConsume(String userId, ZonedDateTime windowExpiry, ZonedDateTime newWindowStart,
                          ZonedDateTime now, int freeQuota, int premiumQuota) {
        String sql = """
            UPDATE entitlements
            SET daily_alerts_used = CASE WHEN usage_window_start < ? THEN 1 ELSE daily_alerts_used + 1 END,
                usage_window_start = CASE WHEN usage_window_start < ? THEN ? ELSE usage_window_start END,
                updated_at = ?
            WHERE user_id = ?
              AND (usage_window_start < ?
                   OR daily_alerts_used < CASE WHEN tier = 'FREE' THEN ? ELSE ? END)
            """;
        return jdbcTemplate.update(sql,
                DbTime.param(windowExpiry),
                DbTime.param(windowExpiry),
                DbTime.param(newWindowStart),
                DbTime.param(now),
                userId,
                DbTime.param(windowExpiry),
                freeQuota,
                premiumQuota);
    }

    /**
     * Gives back one unit of the current window. Never drops below zero.
     */
    public int release(String userId, ZonedDateTime now) {
        String sql = """
            UPDATE entitlements
            SET daily_alerts_used = daily_alerts_used - 1, updated_at = ?
            WHERE user_id = ? AND daily_alerts_used > 0
            """;
        return jdbcTemplate.update(sql, DbTime.param(now), userId);
    }

    public int updateTier(String userId, Tier tier, ZonedDateTime now) {
        String sql = "UPDATE entitlements SET tier = ?, updated_at = ? WHERE user_id = ?";
        return jdbcTemplate.update(sql, tier.name(), DbTime.param(now), userId);
    }
}
