package com.example.blockalert.repository;

import com.example.blockalert.aspect.Monitored;
import com.example.blockalert.model.Alert;
import com.example.blockalert.model.AlertResponse;
import com.example.blockalert.util.Constants.UrgencyLevel;
import com.example.blockalert.util.DbTime;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable half of the alert store. Change notification lives in
 * {@link com.example.blockalert.service.RealtimeAlertStream}.
 */
@Repository
@Monitored("repository")
public class AlertRepository {

    private final JdbcTemplate jdbcTemplate;

    public AlertRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    private final RowMapper<Alert> alertRowMapper = (rs, rowNum) -> Alert.builder()
            .id(rs.getObject("id", UUID.class))
            .senderId(rs.getString("sender_id"))
            .receiverId(rs.getString("receiver_id"))
            .plateHash(rs.getString("plate_hash"))
            .message(rs.getString("message"))
            .urgency(UrgencyLevel.fromWireValue(rs.getString("urgency_level")))
            .response(AlertResponse.fromWireValue(rs.getString("response")))
            .responseMessage(rs.getString("response_message"))
            .createdAt(DbTime.read(rs, "created_at"))
            .readAt(DbTime.read(rs, "read_at"))
            .respondedAt(DbTime.read(rs, "response_at"))
            .pushSent(rs.getBoolean("push_sent"))
            .pushSentAt(DbTime.read(rs, "push_sent_at"))
            .build();

    /**
     * Assigns id and createdAt when absent and stores the row.
     */
    public Alert insert(Alert alert) {
        Alert toSave = alert.toBuilder()
                .id(alert.getId() != null ? alert.getId() : UUID.randomUUID())
                .createdAt(alert.getCreatedAt() != null ? alert.getCreatedAt() : DbTime.now())
                .build();
        String sql = """
            INSERT INTO alerts (id, sender_id, receiver_id, plate_hash, message, urgency_level, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """;
        jdbcTemplate.update(sql,
                toSave.getId(),
                toSave.getSenderId(),
                toSave.getReceiverId(),
                toSave.getPlateHash(),
                toSave.getMessage(),
                toSave.getUrgency().wireValue(),
                DbTime.param(toSave.getCreatedAt()));
        return toSave;
    }

    public Optional<Alert> findById(UUID id) {
        String sql = "SELECT * FROM alerts WHERE id = ?";
        return jdbcTemplate.query(sql, alertRowMapper, id).stream().findFirst();
    }

    public List<Alert> findByReceiver(String receiverId) {
        String sql = "SELECT * FROM alerts WHERE receiver_id = ? ORDER BY created_at DESC";
        return jdbcTemplate.query(sql, alertRowMapper, receiverId);
    }

    public List<Alert> findBySender(String senderId) {
        String sql = "SELECT * FROM alerts WHERE sender_id = ? ORDER BY created_at DESC";
        return jdbcTemplate.query(sql, alertRowMapper, senderId);
    }

    /**
     * @return 1 if read_at was set by this call, 0 if the alert was already read or does not exist
     */
    public int markRead(UUID id, ZonedDateTime readAt) {
        String sql = "UPDATE alerts SET read_at = ? WHERE id = ? AND read_at IS NULL";
        return jdbcTemplate.update(sql, DbTime.param(readAt), id);
    }

    /**
     * Writes the response and marks the alert read if it was not yet. With {@code onlyIfUnanswered}
     * the update applies only to an alert without a response, making the first answer final.
     *
     * @return number of rows changed
     */
    public int updateResponse(UUID id, AlertResponse response, String responseMessage,
                              ZonedDateTime respondedAt, boolean onlyIfUnanswered) {
        String sql = """
            UPDATE alerts
            SET response = ?, response_message = ?, response_at = ?, read_at = COALESCE(read_at, ?)
            WHERE id = ?
            """ + (onlyIfUnanswered ? " AND response IS NULL" : "");
        return jdbcTemplate.update(sql,
                response.getWireValue(),
                responseMessage,
                DbTime.param(respondedAt),
                DbTime.param(respondedAt),
                id);
    }

    public long countUnansweredForReceiver(String receiverId) {
        String sql = "SELECT COUNT(*) FROM alerts WHERE receiver_id = ? AND response IS NULL";
        Long count = jdbcTemplate.queryForObject(sql, Long.class, receiverId);
        return count != null ? count : 0;
    }

    /**
     * Claims the single push for an alert. Only the caller that gets 1 back may send it.
     */
    public int claimPush(UUID id, ZonedDateTime sentAt) {
        String sql = "UPDATE alerts SET push_sent = TRUE, push_sent_at = ? WHERE id = ? AND push_sent = FALSE";
        return jdbcTemplate.update(sql, DbTime.param(sentAt), id);
    }

    public int releasePushClaim(UUID id) {
        String sql = "UPDATE alerts SET push_sent = FALSE, push_sent_at = NULL WHERE id = ?";
        return jdbcTemplate.update(sql, id);
    }
}
