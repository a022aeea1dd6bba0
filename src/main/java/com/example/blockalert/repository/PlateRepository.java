package com.example.blockalert.repository;

import com.example.blockalert.aspect.Monitored;
import com.example.blockalert.model.PlateRegistration;
import com.example.blockalert.util.DbTime;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.util.List;
import java.util.Objects;

@Repository
@Monitored("repository")
public class PlateRepository {

    private final JdbcTemplate jdbcTemplate;

    public PlateRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    private final RowMapper<PlateRegistration> plateRowMapper = (rs, rowNum) -> PlateRegistration.builder()
            .id(rs.getLong("id"))
            .userId(rs.getString("user_id"))
            .plateHash(rs.getString("plate_hash"))
            .createdAt(DbTime.read(rs, "created_at"))
            .build();

    public PlateRegistration save(PlateRegistration registration) {
        String sql = "INSERT INTO plates (user_id, plate_hash, created_at) VALUES (?, ?, ?)";
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(sql, new String[]{"id"});
            ps.setString(1, registration.getUserId());
            ps.setString(2, registration.getPlateHash());
            ps.setObject(3, DbTime.param(registration.getCreatedAt()));
            return ps;
        }, keyHolder);
        registration.setId(Objects.requireNonNull(keyHolder.getKey()).longValue());
        return registration;
    }

    /**
     * Distinct owners of a fingerprint, in a stable order.
     */
    public List<String> findDistinctOwners(String plateHash) {
        String sql = "SELECT DISTINCT user_id FROM plates WHERE plate_hash = ? ORDER BY user_id";
        return jdbcTemplate.queryForList(sql, String.class, plateHash);
    }

    public List<PlateRegistration> findByUserId(String userId) {
        String sql = "SELECT * FROM plates WHERE user_id = ? ORDER BY created_at";
        return jdbcTemplate.query(sql, plateRowMapper, userId);
    }

    public int countByUserId(String userId) {
        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM plates WHERE user_id = ?", Integer.class, userId);
        return count != null ? count : 0;
    }

    public boolean existsByUserIdAndPlateHash(String userId, String plateHash) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM plates WHERE user_id = ? AND plate_hash = ?", Integer.class, userId, plateHash);
        return count != null && count > 0;
    }

    public int deleteByIdAndUserId(Long id, String userId) {
        return jdbcTemplate.update("DELETE FROM plates WHERE id = ? AND user_id = ?", id, userId);
    }
}
