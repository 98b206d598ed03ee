package com.chatlive.realtime.chat.repo;

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
import java.util.UUID;

@Repository
public class ChatMessageRepository {

    public record MessageRow(
            String id,
            String roomId,
            String senderId,
            String clientMsgId,
            String content,
            Instant createdAt,
            Instant readAt
    ) {
    }

    public record InsertResult(MessageRow row, boolean inserted) {
    }

    private static final String COLUMNS = "id, room_id, sender_id, client_msg_id, content, created_at, read_at";

    private final JdbcTemplate jdbcTemplate;

    public ChatMessageRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<MessageRow> findById(String id) {
        var sql = "select " + COLUMNS + " from chat_message where id = ?";
        return jdbcTemplate.query(sql, (rs, rowNum) -> mapRow(rs), id).stream().findFirst();
    }

    public Optional<MessageRow> findByClientMsgId(String senderId, String clientMsgId) {
        var sql = "select " + COLUMNS + " from chat_message where sender_id = ? and client_msg_id = ? limit 1";
        return jdbcTemplate.query(sql, (rs, rowNum) -> mapRow(rs), senderId, clientMsgId).stream().findFirst();
    }

    /**
     * A resend with a known {@code clientMsgId} returns the stored row with {@code inserted=false}.
     * The conflict is absorbed by the insert itself so an enclosing transaction stays usable.
     */
    public InsertResult insert(String roomId, String senderId, String clientMsgId, String content, Instant now) {
        var id = "msg_" + UUID.randomUUID();
        var normalizedClientId = (clientMsgId == null || clientMsgId.isBlank()) ? null : clientMsgId;
        var sql = """
                insert into chat_message(id, room_id, sender_id, client_msg_id, content, created_at, read_at)
                values (?, ?, ?, ?, ?, ?, null)
                on conflict do nothing
                """;
        var inserted = jdbcTemplate.update(sql, id, roomId, senderId, normalizedClientId, content, Timestamp.from(now));
        if (inserted == 0) {
            if (normalizedClientId == null) {
                throw new IllegalStateException("chat_message_insert_conflict");
            }
            var existing = findByClientMsgId(senderId, normalizedClientId)
                    .orElseThrow(() -> new IllegalStateException("chat_message_insert_conflict"));
            return new InsertResult(existing, false);
        }
        return new InsertResult(new MessageRow(id, roomId, senderId, normalizedClientId, content, now, null), true);
    }

    /**
     * Latest {@code limit} messages, oldest first.
     */
    public List<MessageRow> listRecent(String roomId, int limit) {
        var sql = """
                select id, room_id, sender_id, client_msg_id, content, created_at, read_at
                from chat_message
                where room_id = ?
                order by created_at desc, id desc
                limit ?
                """;
        var rows = new ArrayList<>(jdbcTemplate.query(sql, (rs, rowNum) -> mapRow(rs), roomId, limit));
        Collections.reverse(rows);
        return rows;
    }

    /**
     * Sets {@code read_at} on every unread message in the room not sent by the reader. Already
     * read messages keep their timestamp.
     */
    public int markRead(String roomId, String readerId, Instant now) {
        var sql = """
                update chat_message
                set read_at = ?
                where room_id = ? and sender_id <> ? and read_at is null
                """;
        return jdbcTemplate.update(sql, Timestamp.from(now), roomId, readerId);
    }

    private static MessageRow mapRow(ResultSet rs) throws SQLException {
        var readAt = rs.getTimestamp("read_at");
        return new MessageRow(
                rs.getString("id"),
                rs.getString("room_id"),
                rs.getString("sender_id"),
                rs.getString("client_msg_id"),
                rs.getString("content"),
                rs.getTimestamp("created_at").toInstant(),
                readAt == null ? null : readAt.toInstant()
        );
    }
}
