package com.casebridge.sync.notify.repo;

import com.casebridge.sync.notify.DispatchKind;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public class OutboundDispatchRepository {

    public static final String STATUS_PENDING = "PENDING";
    public static final String STATUS_DELIVERED = "DELIVERED";
    public static final String STATUS_FAILED = "FAILED";

    public record DispatchRow(
            String id,
            String conversationId,
            DispatchKind kind,
            String payloadJson,
            String status,
            int attempts,
            Instant nextAttemptAt,
            String lastError,
            Instant createdAt,
            Instant deliveredAt
    ) {
    }

    private final JdbcTemplate jdbcTemplate;

    public OutboundDispatchRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public boolean exists(String id) {
        var count = jdbcTemplate.queryForObject("select count(*) from outbound_dispatch where id = ?", Integer.class, id);
        return count != null && count > 0;
    }

    public void insert(String id, String conversationId, DispatchKind kind, String payloadJson, Instant now) {
        var sql = """
                insert into outbound_dispatch(id, conversation_id, kind, payload_json, status, attempts, next_attempt_at, created_at)
                values (?, ?, ?, ?, ?, 0, ?, ?)
                """;
        var ts = Timestamp.from(now);
        jdbcTemplate.update(sql, id, conversationId, kind.name(), payloadJson, STATUS_PENDING, ts, ts);
    }

    public Optional<DispatchRow> findById(String id) {
        var sql = """
                select id, conversation_id, kind, payload_json, status, attempts, next_attempt_at, last_error, created_at, delivered_at
                from outbound_dispatch
                where id = ?
                """;
        var list = jdbcTemplate.query(sql, (rs, rowNum) -> mapRow(rs), id);
        return list.stream().findFirst();
    }

    public List<DispatchRow> listByConversation(String conversationId) {
        var sql = """
                select id, conversation_id, kind, payload_json, status, attempts, next_attempt_at, last_error, created_at, delivered_at
                from outbound_dispatch
                where conversation_id = ?
                order by created_at asc, id asc
                """;
        return jdbcTemplate.query(sql, (rs, rowNum) -> mapRow(rs), conversationId);
    }

    public List<String> listDueIds(Instant now, int limit) {
        var sql = """
                select id
                from outbound_dispatch
                where status = ? and next_attempt_at <= ?
                order by next_attempt_at asc, id asc
                limit ?
                """;
        return jdbcTemplate.query(sql, (rs, rowNum) -> rs.getString("id"), STATUS_PENDING, Timestamp.from(now), limit);
    }

    /**
     * Pushes {@code next_attempt_at} forward before sending, so a concurrent sweep does not pick the row up meanwhile.
     */
    public boolean claim(String id, Instant now, Instant leaseUntil) {
        var sql = """
                update outbound_dispatch
                set next_attempt_at = ?
                where id = ? and status = ? and next_attempt_at <= ?
                """;
        return jdbcTemplate.update(sql, Timestamp.from(leaseUntil), id, STATUS_PENDING, Timestamp.from(now)) == 1;
    }

    public void markDelivered(String id, int attempts, Instant at) {
        var sql = """
                update outbound_dispatch
                set status = ?, attempts = ?, delivered_at = ?, last_error = null
                where id = ?
                """;
        jdbcTemplate.update(sql, STATUS_DELIVERED, attempts, Timestamp.from(at), id);
    }

    public void markRetry(String id, int attempts, Instant nextAttemptAt, String error) {
        var sql = """
                update outbound_dispatch
                set attempts = ?, next_attempt_at = ?, last_error = ?
                where id = ? and status = ?
                """;
        jdbcTemplate.update(sql, attempts, Timestamp.from(nextAttemptAt), truncate(error), id, STATUS_PENDING);
    }

    public void markFailed(String id, int attempts, String error) {
        var sql = """
                update outbound_dispatch
                set status = ?, attempts = ?, last_error = ?
                where id = ? and status = ?
                """;
        jdbcTemplate.update(sql, STATUS_FAILED, attempts, truncate(error), id, STATUS_PENDING);
    }

    private static String truncate(String error) {
        if (error == null) return null;
        return error.length() <= 1000 ? error : error.substring(0, 1000);
    }

    private static DispatchRow mapRow(ResultSet rs) throws SQLException {
        var delivered = rs.getTimestamp("delivered_at");
        return new DispatchRow(
                rs.getString("id"),
                rs.getString("conversation_id"),
                DispatchKind.valueOf(rs.getString("kind")),
                rs.getString("payload_json"),
                rs.getString("status"),
                rs.getInt("attempts"),
                rs.getTimestamp("next_attempt_at").toInstant(),
                rs.getString("last_error"),
                rs.getTimestamp("created_at").toInstant(),
                delivered == null ? null : delivered.toInstant()
        );
    }
}
