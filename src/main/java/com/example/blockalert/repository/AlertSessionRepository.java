package com.example.blockalert.repository;

import com.example.blockalert.aspect.Monitored;
import com.example.blockalert.model.AlertSessionRecord;
import com.example.blockalert.util.DbTime;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.ZonedDateTime;
import java.util.Collections;
import java.util.List;

@Repository
@Monitored("repository")
public class AlertSessionRepository {

    private final JdbcTemplate jdbcTemplate;

    public AlertSessionRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    private final RowMapper<AlertSessionRecord> sessionRowMapper = (rs, rowNum) -> AlertSessionRecord.builder()
            .sessionId(rs.getString("session_id"))
            .userId(rs.getString("user_id"))
            .podId(rs.getString("pod_id"))
            .connectionStatus(rs.getString("connection_status"))
            .connectedAt(DbTime.read(rs, "connected_at"))
            .lastHeartbeat(DbTime.read(rs, "last_heartbeat"))
            .disconnectedAt(DbTime.read(rs, "disconnected_at"))
            .build();

    public void save(AlertSessionRecord session) {
        String sql = """
            MERGE INTO alert_sessions AS t
            USING (
                SELECT
                    CAST(? AS VARCHAR(255)) AS session_id,
                    CAST(? AS VARCHAR(255)) AS user_id,
                    CAST(? AS VARCHAR(255)) AS pod_id,
                    CAST(? AS VARCHAR(20)) AS connection_status,
                    CAST(? AS TIMESTAMP WITH TIME ZONE) AS connected_at,
                    CAST(? AS TIMESTAMP WITH TIME ZONE) AS last_heartbeat
            ) AS s ON t.session_id = s.session_id
            WHEN MATCHED THEN
                UPDATE SET
                    user_id = s.user_id,
                    pod_id = s.pod_id,
                    connection_status = s.connection_status,
                    last_heartbeat = s.last_heartbeat,
                    disconnected_at = NULL
            WHEN NOT MATCHED THEN
                INSERT (session_id, user_id, pod_id, connection_status, connected_at, last_heartbeat)
                VALUES (s.session_id, s.user_id, s.pod_id, s.connection_status, s.connected_at, s.last_heartbeat)
            """;
        jdbcTemplate.update(sql,
                session.getSessionId(),
                session.getUserId(),
                session.getPodId(),
                session.getConnectionStatus(),
                DbTime.param(session.getConnectedAt()),
                DbTime.param(session.getLastHeartbeat()));
    }

    public boolean hasActiveSession(String userId) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM alert_sessions WHERE user_id = ? AND connection_status = 'ACTIVE'",
                Integer.class, userId);
        return count != null && count > 0;
    }

    public int markInactive(String sessionId, ZonedDateTime at) {
        String sql = """
            UPDATE alert_sessions
            SET connection_status = 'INACTIVE', disconnected_at = ?
            WHERE session_id = ? AND connection_status = 'ACTIVE'
            """;
        return jdbcTemplate.update(sql, DbTime.param(at), sessionId);
    }

    public int updateHeartbeats(List<String> sessionIds, ZonedDateTime at) {
        if (sessionIds == null || sessionIds.isEmpty()) {
            return 0;
        }
        String sql = String.format(
                "UPDATE alert_sessions SET last_heartbeat = ? WHERE connection_status = 'ACTIVE' AND session_id IN (%s)",
                String.join(",", Collections.nCopies(sessionIds.size(), "?")));
        Object[] args = new Object[sessionIds.size() + 1];
        args[0] = DbTime.param(at);
        for (int i = 0; i < sessionIds.size(); i++) {
            args[i + 1] = sessionIds.get(i);
        }
        return jdbcTemplate.update(sql, args);
    }

    public List<AlertSessionRecord> findStaleSessions(ZonedDateTime threshold) {
        String sql = "SELECT * FROM alert_sessions WHERE connection_status = 'ACTIVE' AND last_heartbeat < ?";
        return jdbcTemplate.query(sql, sessionRowMapper, DbTime.param(threshold));
    }

    public long countActiveByPod(String podId) {
        Long count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM alert_sessions WHERE pod_id = ? AND connection_status = 'ACTIVE'",
                Long.class, podId);
        return count != null ? count : 0;
    }
}
