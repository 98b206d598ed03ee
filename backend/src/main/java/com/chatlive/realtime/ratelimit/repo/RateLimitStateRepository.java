package com.chatlive.realtime.ratelimit.repo;

import com.chatlive.realtime.ratelimit.RateLimitState;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Optional;

@Repository
public class RateLimitStateRepository {

    private final JdbcTemplate jdbcTemplate;

    public RateLimitStateRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Creates the row if missing. The new row starts with an already-ended window so the
     * first consume opens a fresh one.
     */
    public void ensureRow(String subjectKey, String module, Instant now) {
        var sql = """
                insert into rate_limit_state(subject_key, module, window_start, window_end, count, blocked_until, updated_at)
                values (?, ?, ?, ?, 0, null, ?)
                on conflict do nothing
                """;
        var ts = Timestamp.from(now);
        jdbcTemplate.update(sql, subjectKey, module, ts, ts, ts);
    }

    /**
     * Must run inside a transaction; the row stays locked until it ends.
     */
    public Optional<RateLimitState> lockRow(String subjectKey, String module) {
        var sql = """
                select window_start, window_end, count, blocked_until
                from rate_limit_state
                where subject_key = ? and module = ?
                for update
                """;
        var list = jdbcTemplate.query(sql, (rs, rowNum) -> {
            var blocked = rs.getTimestamp("blocked_until");
            return new RateLimitState(
                    rs.getTimestamp("window_start").toInstant(),
                    rs.getTimestamp("window_end").toInstant(),
                    rs.getInt("count"),
                    blocked == null ? null : blocked.toInstant()
            );
        }, subjectKey, module);
        return list.stream().findFirst();
    }

    public void update(String subjectKey, String module, RateLimitState state, Instant now) {
        var sql = """
                update rate_limit_state
                set window_start = ?, window_end = ?, count = ?, blocked_until = ?, updated_at = ?
                where subject_key = ? and module = ?
                """;
        jdbcTemplate.update(sql,
                Timestamp.from(state.windowStart()),
                Timestamp.from(state.windowEnd()),
                state.count(),
                state.blockedUntil() == null ? null : Timestamp.from(state.blockedUntil()),
                Timestamp.from(now),
                subjectKey,
                module
        );
    }

    public void delete(String subjectKey, String module) {
        jdbcTemplate.update("delete from rate_limit_state where subject_key = ? and module = ?", subjectKey, module);
    }
}
