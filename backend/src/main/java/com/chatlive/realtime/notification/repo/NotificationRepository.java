package com.chatlive.realtime.notification.repo;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

@Repository
public class NotificationRepository {

    public record NotificationRow(
            String id,
            String userId,
            String title,
            String message,
            String type,
            String status,
            String metadataJson,
            Instant createdAt,
            Instant updatedAt,
            Instant readAt
    ) {
    }

    private static final String COLUMNS = "id, user_id, title, message, type, status, metadata, created_at, updated_at, read_at";

    private final JdbcTemplate jdbcTemplate;

    public NotificationRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void insert(NotificationRow row) {
        var sql = """
                insert into notification(id, user_id, title, message, type, status, metadata, created_at, updated_at, read_at)
                values (?, ?, ?, ?, ?, ?, ?, ?, ?, null)
                """;
        jdbcTemplate.update(sql,
                row.id(),
                row.userId(),
                row.title(),
                row.message(),
                row.type(),
                row.status(),
                row.metadataJson(),
                Timestamp.from(row.createdAt()),
                Timestamp.from(row.updatedAt())
        );
    }

    public Optional<NotificationRow> findById(String id) {
        var sql = "select " + COLUMNS + " from notification where id = ?";
        return jdbcTemplate.query(sql, (rs, rowNum) -> mapRow(rs), id).stream().findFirst();
    }

    public List<NotificationRow> listForUser(String userId, int limit) {
        var sql = "select " + COLUMNS + " from notification where user_id = ? order by created_at desc, id desc limit ?";
        return jdbcTemplate.query(sql, (rs, rowNum) -> mapRow(rs), userId, limit);
    }

    /**
     * unread/read -> read. An existing {@code read_at} is kept.
     */
    public int markRead(String id, String userId, Instant now) {
        var sql = """
                update notification
                set status = 'read', read_at = coalesce(read_at, ?), updated_at = ?
                where id = ? and user_id = ? and status in ('unread', 'read')
                """;
        var ts = Timestamp.from(now);
        return jdbcTemplate.update(sql, ts, ts, id, userId);
    }

    /**
     * Locks and returns the caller's unread ids; call inside a transaction before {@link #markAllRead}.
     */
    public List<String> lockUnreadIds(String userId) {
        var sql = """
                select id
                from notification
                where user_id = ? and status = 'unread'
                order by created_at, id
                for update
                """;
        return jdbcTemplate.queryForList(sql, String.class, userId);
    }

    /**
     * Marks exactly {@code ids} read; rows inserted after {@link #lockUnreadIds} stay unread.
     */
    public int markAllRead(String userId, List<String> ids, Instant now) {
        if (ids.isEmpty()) return 0;
        var placeholders = String.join(", ", Collections.nCopies(ids.size(), "?"));
        var sql = """
                update notification
                set status = 'read', read_at = coalesce(read_at, ?), updated_at = ?
                where user_id = ? and status = 'unread' and id in (%s)
                """.formatted(placeholders);
        var ts = Timestamp.from(now);
        var args = new ArrayList<Object>(ids.size() + 3);
        args.add(ts);
        args.add(ts);
        args.add(userId);
        args.addAll(ids);
        return jdbcTemplate.update(sql, args.toArray());
    }

    public int archive(String id, String userId, Instant now) {
        var sql = """
                update notification
                set status = 'archived', updated_at = ?
                where id = ? and user_id = ? and status in ('unread', 'read')
                """;
        return jdbcTemplate.update(sql, Timestamp.from(now), id, userId);
    }

    public int delete(String id, String userId) {
        return jdbcTemplate.update("delete from notification where id = ? and user_id = ?", id, userId);
    }

    private static NotificationRow mapRow(ResultSet rs) throws SQLException {
        var readAt = rs.getTimestamp("read_at");
        return new NotificationRow(
                rs.getString("id"),
                rs.getString("user_id"),
                rs.getString("title"),
                rs.getString("message"),
                rs.getString("type"),
                rs.getString("status"),
                rs.getString("metadata"),
                rs.getTimestamp("created_at").toInstant(),
                rs.getTimestamp("updated_at").toInstant(),
                readAt == null ? null : readAt.toInstant()
        );
    }
}
