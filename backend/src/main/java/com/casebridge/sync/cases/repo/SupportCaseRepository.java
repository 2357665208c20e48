package com.casebridge.sync.cases.repo;

import com.casebridge.sync.cases.model.CaseStatus;
import com.casebridge.sync.cases.model.SupportCase;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Optional;

@Repository
public class SupportCaseRepository {

    private final JdbcTemplate jdbcTemplate;

    public SupportCaseRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<SupportCase> find(String accountKey, String caseId) {
        var sql = """
                select account_key, case_id, display_id, status, status_at, last_communication_at, version
                from support_case
                where account_key = ? and case_id = ?
                """;
        var list = jdbcTemplate.query(sql, (rs, rowNum) -> mapRow(rs), accountKey, caseId);
        return list.stream().findFirst();
    }

    /**
     * Inserts the case as OPEN unless a row already exists. A known case keeps its recorded status.
     * Callers hold the case key lock; a concurrent insert from another instance surfaces as DuplicateKeyException.
     *
     * @return true when a row was inserted
     */
    public boolean insertIfAbsent(String accountKey, String caseId, String displayId, Instant now) {
        if (find(accountKey, caseId).isPresent()) {
            if (displayId != null && !displayId.isBlank()) {
                jdbcTemplate.update(
                        "update support_case set display_id = ? where account_key = ? and case_id = ? and display_id is null",
                        displayId, accountKey, caseId
                );
            }
            return false;
        }
        var sql = """
                insert into support_case(account_key, case_id, display_id, status, status_at, version, created_at, updated_at)
                values (?, ?, ?, ?, ?, 0, ?, ?)
                """;
        var ts = Timestamp.from(now);
        jdbcTemplate.update(sql, accountKey, caseId, displayId, CaseStatus.OPEN.name(), ts, ts, ts);
        return true;
    }

    /**
     * Compare-and-set on the row version.
     *
     * @return false when another writer moved the row since it was read
     */
    public boolean updateStatus(String accountKey, String caseId, CaseStatus status, Instant at, long expectedVersion) {
        var sql = """
                update support_case
                set status = ?, status_at = ?, version = version + 1, updated_at = ?
                where account_key = ? and case_id = ? and version = ?
                """;
        var ts = Timestamp.from(at);
        return jdbcTemplate.update(sql, status.name(), ts, ts, accountKey, caseId, expectedVersion) == 1;
    }

    public void updateDisplayId(String accountKey, String caseId, String displayId) {
        if (displayId == null || displayId.isBlank()) return;
        jdbcTemplate.update(
                "update support_case set display_id = ? where account_key = ? and case_id = ? and (display_id is null or display_id <> ?)",
                displayId, accountKey, caseId, displayId
        );
    }

    /**
     * Moves the communication watermark forward only.
     */
    public void advanceLastCommunicationAt(String accountKey, String caseId, Instant at) {
        var sql = """
                update support_case
                set last_communication_at = ?
                where account_key = ? and case_id = ?
                  and (last_communication_at is null or last_communication_at < ?)
                """;
        var ts = Timestamp.from(at);
        jdbcTemplate.update(sql, ts, accountKey, caseId, ts);
    }

    private static SupportCase mapRow(ResultSet rs) throws SQLException {
        var lastComm = rs.getTimestamp("last_communication_at");
        return new SupportCase(
                rs.getString("account_key"),
                rs.getString("case_id"),
                rs.getString("display_id"),
                CaseStatus.valueOf(rs.getString("status")),
                rs.getTimestamp("status_at").toInstant(),
                lastComm == null ? null : lastComm.toInstant(),
                rs.getLong("version")
        );
    }
}
