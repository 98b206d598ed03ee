package com.chatlive.realtime.auth.repo;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Optional;

@Repository
public class UserSessionRepository {

    public record SessionRow(String id, String userId, Instant expiresAt) {
    }

    private final JdbcTemplate jdbcTemplate;

    public UserSessionRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<SessionRow> findByTokenHash(String tokenHash) {
        var sql = """
                select id, user_id, expires_at
                from user_session
                where token_hash = ?
                limit 1
                """;
        var list = jdbcTemplate.query(sql, (rs, rowNum) -> new SessionRow(
                rs.getString("id"),
                rs.getString("user_id"),
                rs.getTimestamp("expires_at").toInstant()
        ), tokenHash);
        return list.stream().findFirst();
    }

    public void insert(String id, String tokenHash, String userId, Instant expiresAt) {
        var sql = """
                insert into user_session(id, token_hash, user_id, expires_at, created_at)
                values (?, ?, ?, ?, ?)
                """;
        jdbcTemplate.update(sql, id, tokenHash, userId, Timestamp.from(expiresAt), Timestamp.from(Instant.now()));
    }

    public int deleteExpired(Instant now) {
        return jdbcTemplate.update("delete from user_session where expires_at <= ?", Timestamp.from(now));
    }
}
