package com.chatlive.realtime.auth.repo;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Optional;

@Repository
public class UserAccountRepository {

    /**
     * {@code permissions} is the stored comma separated list, or null when the role decides.
     */
    public record UserRow(String id, String email, String name, String role, String permissions, Instant lastSeen,
                          Instant createdAt) {
    }

    private final JdbcTemplate jdbcTemplate;

    public UserAccountRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<UserRow> findById(String id) {
        var sql = """
                select id, email, name, role, permissions, last_seen, created_at
                from app_user
                where id = ?
                """;
        var list = jdbcTemplate.query(sql, (rs, rowNum) -> mapRow(rs), id);
        return list.stream().findFirst();
    }

    public boolean exists(String id) {
        if (id == null || id.isBlank()) return false;
        var list = jdbcTemplate.queryForList("select 1 from app_user where id = ?", Integer.class, id);
        return !list.isEmpty();
    }

    /**
     * New accounts start with {@code last_seen = createdAt} so they read offline until they connect.
     */
    public void insert(String id, String email, String name, String role, String permissions, Instant createdAt) {
        var sql = """
                insert into app_user(id, email, name, role, permissions, last_seen, created_at)
                values (?, ?, ?, ?, ?, ?, ?)
                """;
        var ts = Timestamp.from(createdAt);
        jdbcTemplate.update(sql, id, email, name, role, permissions, ts, ts);
    }

    /**
     * Null clears the column, which reads as "online".
     */
    public void updateLastSeen(String id, Instant lastSeen) {
        jdbcTemplate.update("update app_user set last_seen = ? where id = ?",
                lastSeen == null ? null : Timestamp.from(lastSeen), id);
    }

    private static UserRow mapRow(ResultSet rs) throws SQLException {
        var lastSeen = rs.getTimestamp("last_seen");
        var createdAt = rs.getTimestamp("created_at");
        return new UserRow(
                rs.getString("id"),
                rs.getString("email"),
                rs.getString("name"),
                rs.getString("role"),
                rs.getString("permissions"),
                lastSeen == null ? null : lastSeen.toInstant(),
                createdAt == null ? null : createdAt.toInstant()
        );
    }
}
