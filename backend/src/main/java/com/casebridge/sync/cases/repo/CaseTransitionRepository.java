package com.casebridge.sync.cases.repo;

import com.casebridge.sync.cases.model.CaseStatus;
import com.casebridge.sync.cases.model.TransitionOutcome;
import com.casebridge.sync.cases.model.TransitionSource;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;

@Repository
public class CaseTransitionRepository {

    private final JdbcTemplate jdbcTemplate;

    public CaseTransitionRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * True when the key was recorded at or after {@code since}. Older rows are past retention and no longer count.
     */
    public boolean existsSince(String dedupKey, Instant since) {
        var sql = "select count(*) from case_transition where dedup_key = ? and processed_at >= ?";
        var count = jdbcTemplate.queryForObject(sql, Integer.class, dedupKey, Timestamp.from(since));
        return count != null && count > 0;
    }

    /**
     * Appends the transition. A row with the same key that is past retention but not yet purged is replaced.
     *
     * @return false when the key is already taken by a retained row
     */
    public boolean record(
            String dedupKey,
            String accountKey,
            String caseId,
            TransitionSource source,
            CaseStatus observed,
            CaseStatus previous,
            TransitionOutcome outcome,
            Instant processedAt,
            Instant retainedSince
    ) {
        jdbcTemplate.update(
                "delete from case_transition where dedup_key = ? and processed_at < ?",
                dedupKey, Timestamp.from(retainedSince)
        );
        var sql = """
                insert into case_transition(dedup_key, account_key, case_id, source, observed_status, previous_status, outcome, processed_at)
                values (?, ?, ?, ?, ?, ?, ?, ?)
                """;
        try {
            jdbcTemplate.update(
                    sql,
                    dedupKey,
                    accountKey,
                    caseId,
                    source.name(),
                    observed.name(),
                    previous == null ? null : previous.name(),
                    outcome.name(),
                    Timestamp.from(processedAt)
            );
            return true;
        } catch (DuplicateKeyException e) {
            return false;
        }
    }

    public int purgeOlderThan(Instant cutoff) {
        return jdbcTemplate.update("delete from case_transition where processed_at < ?", Timestamp.from(cutoff));
    }
}
