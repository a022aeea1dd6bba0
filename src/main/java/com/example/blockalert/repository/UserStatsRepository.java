package com.example.blockalert.repository;

import com.example.blockalert.aspect.Monitored;
import com.example.blockalert.model.UserStats;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.Set;

@Repository
@Monitored("repository")
public class UserStatsRepository {

    private static final Set<String> COUNTER_COLUMNS = Set.of(
            "alerts_sent", "alerts_received", "cars_freed", "situations_resolved");

    private final JdbcTemplate jdbcTemplate;

    public UserStatsRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    private final RowMapper<UserStats> statsRowMapper = (rs, rowNum) -> UserStats.builder()
            .userId(rs.getString("user_id"))
            .alertsSent(rs.getLong("alerts_sent"))
            .alertsReceived(rs.getLong("alerts_received"))
            .carsFreed(rs.getLong("cars_freed"))
            .situationsResolved(rs.getLong("situations_resolved"))
            .build();

    public Optional<UserStats> findByUserId(String userId) {
        return jdbcTemplate.query("SELECT * FROM user_stats WHERE user_id = ?", statsRowMapper, userId)
                .stream().findFirst();
    }

    /**
     * Adds one to a counter, creating the row on first use. If a concurrent first use inserted the
     * row in between, the statement runs again and takes the update branch.
     */
    public void increment(String userId, String column) {
        if (!COUNTER_COLUMNS.contains(column)) {
            throw new IllegalArgumentException("Unknown stats column: " + column);
        }
        String sql = """
            MERGE INTO user_stats AS t
            USING (SELECT CAST(? AS VARCHAR(255)) AS user_id) AS s ON t.user_id = s.user_id
            WHEN MATCHED THEN
                UPDATE SET %1$s = t.%1$s + 1
            WHEN NOT MATCHED THEN
                INSERT (user_id, %1$s) VALUES (s.user_id, 1)
            """.formatted(column);
        try {
            jdbcTemplate.update(sql, userId);
        } catch (DuplicateKeyException e) {
            jdbcTemplate.update(sql, userId);
        }
    }
}
