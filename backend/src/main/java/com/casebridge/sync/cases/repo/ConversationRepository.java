package com.casebridge.sync.cases.repo;

import com.casebridge.sync.cases.model.Conversation;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public class ConversationRepository {

    private static final String COLUMNS = """
            id, account_key, case_id, creator_id, created_at, resolved_at, warned_at, archived, archived_at, archive_reason
            """;

    public record LiveCaseRow(String conversationId, String caseId) {
    }

    public record ResolvedCandidateRow(
            String conversationId,
            String accountKey,
            String caseId,
            Instant resolvedAt,
            Instant warnedAt
    ) {
    }

    private final JdbcTemplate jdbcTemplate;

    public ConversationRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Inserts a live conversation. The unique index on {@code live_case_key} rejects a second live mapping.
     *
     * @throws org.springframework.dao.DuplicateKeyException on conversation id or live case collision
     */
    public void insert(String id, String accountKey, String caseId, String creatorId, Instant createdAt) {
        var sql = """
                insert into conversation(id, account_key, case_id, creator_id, created_at, archived, live_case_key)
                values (?, ?, ?, ?, ?, false, ?)
                """;
        jdbcTemplate.update(sql, id, accountKey, caseId, creatorId, Timestamp.from(createdAt),
                Conversation.liveCaseKey(accountKey, caseId));
    }

    public Optional<Conversation> findById(String id) {
        var sql = "select " + COLUMNS + " from conversation where id = ?";
        var list = jdbcTemplate.query(sql, (rs, rowNum) -> mapRow(rs), id);
        return list.stream().findFirst();
    }

    public Optional<Conversation> findLiveByCase(String accountKey, String caseId) {
        var sql = "select " + COLUMNS + " from conversation where live_case_key = ?";
        var list = jdbcTemplate.query(sql, (rs, rowNum) -> mapRow(rs), Conversation.liveCaseKey(accountKey, caseId));
        return list.stream().findFirst();
    }

    public List<Conversation> listByParticipant(String participantId, int limit) {
        var sql = "select " + COLUMNS + """
                from conversation
                where creator_id = ?
                order by created_at desc, id desc
                limit ?
                """;
        return jdbcTemplate.query(sql, (rs, rowNum) -> mapRow(rs), participantId, limit);
    }

    /**
     * Keyset page of an account's live conversations, ordered by id.
     */
    public List<LiveCaseRow> listLiveByAccount(String accountKey, String afterId, int limit) {
        var sql = """
                select id, case_id
                from conversation
                where account_key = ? and archived = false and id > ?
                order by id asc
                limit ?
                """;
        return jdbcTemplate.query(
                sql,
                (rs, rowNum) -> new LiveCaseRow(rs.getString("id"), rs.getString("case_id")),
                accountKey,
                afterId == null ? "" : afterId,
                limit
        );
    }

    /**
     * Keyset page of live conversations whose case is resolved and whose resolution is at or before {@code cutoff}.
     */
    public List<ResolvedCandidateRow> listResolvedCandidates(Instant cutoff, String afterId, int limit) {
        var sql = """
                select id, account_key, case_id, resolved_at, warned_at
                from conversation
                where archived = false and resolved_at is not null and resolved_at <= ? and id > ?
                order by id asc
                limit ?
                """;
        return jdbcTemplate.query(sql, (rs, rowNum) -> {
            var warned = rs.getTimestamp("warned_at");
            return new ResolvedCandidateRow(
                    rs.getString("id"),
                    rs.getString("account_key"),
                    rs.getString("case_id"),
                    rs.getTimestamp("resolved_at").toInstant(),
                    warned == null ? null : warned.toInstant()
            );
        }, Timestamp.from(cutoff), afterId == null ? "" : afterId, limit);
    }

    /**
     * Sets {@code resolved_at} unless already set. Returns true when this call set it.
     */
    public boolean markResolved(String id, Instant at) {
        var sql = "update conversation set resolved_at = ? where id = ? and archived = false and resolved_at is null";
        return jdbcTemplate.update(sql, Timestamp.from(at), id) == 1;
    }

    public void clearResolution(String id) {
        jdbcTemplate.update("update conversation set resolved_at = null, warned_at = null where id = ? and archived = false", id);
    }

    /**
     * Sets the warning marker for the given resolution only, so a warning is issued once per resolution.
     */
    public boolean markWarned(String id, Instant expectedResolvedAt, Instant at) {
        var sql = """
                update conversation
                set warned_at = ?
                where id = ? and archived = false and warned_at is null and resolved_at = ?
                """;
        return jdbcTemplate.update(sql, Timestamp.from(at), id, Timestamp.from(expectedResolvedAt)) == 1;
    }

    /**
     * Terminal archive. Frees the live case key so a reopened case can get a new conversation.
     */
    public boolean markArchived(String id, String reason, Instant at) {
        var sql = """
                update conversation
                set archived = true, archived_at = ?, archive_reason = ?, live_case_key = null
                where id = ? and archived = false
                """;
        return jdbcTemplate.update(sql, Timestamp.from(at), reason, id) == 1;
    }

    private static Conversation mapRow(ResultSet rs) throws SQLException {
        return new Conversation(
                rs.getString("id"),
                rs.getString("account_key"),
                rs.getString("case_id"),
                rs.getString("creator_id"),
                rs.getTimestamp("created_at").toInstant(),
                toInstant(rs.getTimestamp("resolved_at")),
                toInstant(rs.getTimestamp("warned_at")),
                rs.getBoolean("archived"),
                toInstant(rs.getTimestamp("archived_at")),
                rs.getString("archive_reason")
        );
    }

    private static Instant toInstant(Timestamp ts) {
        return ts == null ? null : ts.toInstant();
    }
}
