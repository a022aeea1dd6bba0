package com.example.blockalert.repository;

import com.example.blockalert.aspect.Monitored;
import com.example.blockalert.model.AcknowledgmentMarker;
import com.example.blockalert.util.Constants.MarkerStatus;
import com.example.blockalert.util.DbTime;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.ZonedDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Repository
@Slf4j
@Monitored("repository")
public class AcknowledgmentMarkerRepository {

    private final JdbcTemplate jdbcTemplate;

    public AcknowledgmentMarkerRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    private final RowMapper<AcknowledgmentMarker> markerRowMapper = (rs, rowNum) -> AcknowledgmentMarker.builder()
            .ownerId(rs.getString("owner_id"))
            .alertId(rs.getObject("alert_id", UUID.class))
            .status(MarkerStatus.valueOf(rs.getString("status")))
            .createdAt(DbTime.read(rs, "created_at"))
            .acknowledgedAt(DbTime.read(rs, "acknowledged_at"))
            .build();

    /**
     * Inserts a marker unless one already exists for the pair; an existing marker keeps its status.
     * Losing a concurrent insert of the same pair counts as "already exists".
     *
     * @return 1 if a marker was created
     */
    public int createIfAbsent(String ownerId, UUID alertId, MarkerStatus status, ZonedDateTime createdAt) {
        String sql = """
            MERGE INTO acknowledgment_markers AS t
            USING (SELECT CAST(? AS VARCHAR(255)) AS owner_id, CAST(? AS UUID) AS alert_id) AS s
                ON t.owner_id = s.owner_id AND t.alert_id = s.alert_id
            WHEN NOT MATCHED THEN
                INSERT (owner_id, alert_id, status, created_at, acknowledged_at)
                VALUES (s.owner_id, s.alert_id, ?, ?, ?)
            """;
        ZonedDateTime acknowledgedAt = status == MarkerStatus.ACKNOWLEDGED ? createdAt : null;
        try {
            return jdbcTemplate.update(sql, ownerId, alertId, status.name(),
                    DbTime.param(createdAt), DbTime.param(acknowledgedAt));
        } catch (DuplicateKeyException e) {
            log.debug("Marker for alert {} of {} created concurrently", alertId, ownerId);
            return 0;
        }
    }

    /**
     * Flips a marker to acknowledged. Exactly one caller ever gets 1 back for a given marker.
     */
    public int markAcknowledged(String ownerId, UUID alertId, ZonedDateTime acknowledgedAt) {
        String sql = """
            UPDATE acknowledgment_markers
            SET status = 'ACKNOWLEDGED', acknowledged_at = ?
            WHERE owner_id = ? AND alert_id = ? AND status <> 'ACKNOWLEDGED'
            """;
        return jdbcTemplate.update(sql, DbTime.param(acknowledgedAt), ownerId, alertId);
    }

    /**
     * Moves pending markers created before {@code threshold} to TIMED_OUT.
     */
    public int markTimedOut(String ownerId, ZonedDateTime threshold) {
        String sql = """
            UPDATE acknowledgment_markers
            SET status = 'TIMED_OUT'
            WHERE owner_id = ? AND status = 'PENDING' AND created_at < ?
            """;
        return jdbcTemplate.update(sql, ownerId, DbTime.param(threshold));
    }

    public Optional<AcknowledgmentMarker> find(String ownerId, UUID alertId) {
        String sql = "SELECT * FROM acknowledgment_markers WHERE owner_id = ? AND alert_id = ?";
        return jdbcTemplate.query(sql, markerRowMapper, ownerId, alertId).stream().findFirst();
    }

    public List<AcknowledgmentMarker> findByOwner(String ownerId) {
        String sql = "SELECT * FROM acknowledgment_markers WHERE owner_id = ? ORDER BY created_at";
        return jdbcTemplate.query(sql, markerRowMapper, ownerId);
    }

    public Map<MarkerStatus, Long> countByStatus(String ownerId) {
        String sql = "SELECT status, COUNT(*) AS total FROM acknowledgment_markers WHERE owner_id = ? GROUP BY status";
        Map<MarkerStatus, Long> counts = new EnumMap<>(MarkerStatus.class);
        for (MarkerStatus status : MarkerStatus.values()) {
            counts.put(status, 0L);
        }
        jdbcTemplate.query(sql, rs -> {
            counts.put(MarkerStatus.valueOf(rs.getString("status")), rs.getLong("total"));
        }, ownerId);
        return counts;
    }
}
