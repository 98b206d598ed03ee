package com.chatlive.realtime.chat.repo;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public class ChatRoomRepository {

    public record RoomRow(String id, String user1Id, String user2Id, String pairKey, Instant createdAt, Instant updatedAt) {

        public boolean hasParticipant(String userId) {
            return userId != null && (userId.equals(user1Id) || userId.equals(user2Id));
        }
    }

    private final JdbcTemplate jdbcTemplate;

    public ChatRoomRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Same key for (a, b) and (b, a); the unique index on it keeps one room per pair.
     */
    public static String pairKey(String a, String b) {
        return a.compareTo(b) <= 0 ? a + ":" + b : b + ":" + a;
    }

    public Optional<RoomRow> findByPairKey(String pairKey) {
        var sql = """
                select id, user1_id, user2_id, pair_key, created_at, updated_at
                from chat_room
                where pair_key = ?
                """;
        return jdbcTemplate.query(sql, (rs, rowNum) -> mapRow(rs), pairKey).stream().findFirst();
    }

    public Optional<RoomRow> findById(String roomId) {
        var sql = """
                select id, user1_id, user2_id, pair_key, created_at, updated_at
                from chat_room
                where id = ?
                """;
        return jdbcTemplate.query(sql, (rs, rowNum) -> mapRow(rs), roomId).stream().findFirst();
    }

    /**
     * Throws {@link org.springframework.dao.DuplicateKeyException} when the pair already has a room.
     */
    public RoomRow insert(String id, String user1Id, String user2Id, Instant now) {
        var key = pairKey(user1Id, user2Id);
        var sql = """
                insert into chat_room(id, user1_id, user2_id, pair_key, created_at, updated_at)
                values (?, ?, ?, ?, ?, ?)
                """;
        jdbcTemplate.update(sql, id, user1Id, user2Id, key, Timestamp.from(now), Timestamp.from(now));
        return new RoomRow(id, user1Id, user2Id, key, now, now);
    }

    public void touch(String roomId, Instant now) {
        jdbcTemplate.update("update chat_room set updated_at = ? where id = ?", Timestamp.from(now), roomId);
    }

    public List<String> listRoomIdsForUser(String userId) {
        var sql = """
                select id
                from chat_room
                where user1_id = ? or user2_id = ?
                order by updated_at desc
                """;
        return jdbcTemplate.queryForList(sql, String.class, userId, userId);
    }

    public int countByPairKey(String pairKey) {
        var n = jdbcTemplate.queryForObject("select count(*) from chat_room where pair_key = ?", Integer.class, pairKey);
        return n == null ? 0 : n;
    }

    private static RoomRow mapRow(ResultSet rs) throws SQLException {
        return new RoomRow(
                rs.getString("id"),
                rs.getString("user1_id"),
                rs.getString("user2_id"),
                rs.getString("pair_key"),
                rs.getTimestamp("created_at").toInstant(),
                rs.getTimestamp("updated_at").toInstant()
        );
    }
}
