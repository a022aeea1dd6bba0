package com.example.blockalert.repository;

import com.example.blockalert.model.OutboxEvent;
import com.example.blockalert.util.DbTime;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.Collections;
import java.util.List;
import java.util.UUID;

@Repository
public class OutboxRepository {

    private final JdbcTemplate jdbcTemplate;

    public OutboxRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    private final RowMapper<OutboxEvent> outboxRowMapper = (rs, rowNum) -> OutboxEvent.builder()
            .id(rs.getObject("id", UUID.class))
            .alertId(rs.getObject("alert_id", UUID.class))
            .eventType(rs.getString("event_type"))
            .topic(rs.getString("topic"))
            .messageKey(rs.getString("message_key"))
            .payload(rs.getString("payload"))
            .createdAt(DbTime.read(rs, "created_at"))
            .build();

    public void save(OutboxEvent event) {
        String sql = """
            INSERT INTO outbox_events (id, alert_id, event_type, topic, message_key, payload, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """;
        jdbcTemplate.update(sql,
                event.getId(),
                event.getAlertId(),
                event.getEventType(),
                event.getTopic(),
                event.getMessageKey(),
                event.getPayload(),
                DbTime.param(event.getCreatedAt() != null ? event.getCreatedAt() : DbTime.now()));
    }

    /**
     * Oldest first, locked so that a second relay skips rows already being published.
     */
    public List<OutboxEvent> findAndLockUnprocessed(int limit) {
        String sql = """
            SELECT * FROM outbox_events
            ORDER BY created_at
            LIMIT ?
            FOR UPDATE SKIP LOCKED
            """;
        return jdbcTemplate.query(sql, outboxRowMapper, limit);
    }

    public int deleteByIds(List<UUID> ids) {
        if (ids == null || ids.isEmpty()) {
            return 0;
        }
        String sql = String.format("DELETE FROM outbox_events WHERE id IN (%s)",
                String.join(",", Collections.nCopies(ids.size(), "?")));
        return jdbcTemplate.update(sql, ids.toArray());
    }
}
