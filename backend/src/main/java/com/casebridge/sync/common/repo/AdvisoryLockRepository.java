package com.casebridge.sync.common.repo;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Cross-instance guard for scheduler units, backed by PostgreSQL session advisory locks.
 *
 * Lock and unlock must run on the same session, so the unit holds one connection for its whole duration.
 */
@Repository
public class AdvisoryLockRepository {

    private static final Logger log = LoggerFactory.getLogger(AdvisoryLockRepository.class);

    private final DataSource dataSource;

    public AdvisoryLockRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * Runs {@code work} while holding the advisory lock for {@code key}.
     *
     * @return false when another instance holds the lock and the work was skipped
     */
    public boolean runExclusive(String key, Runnable work) {
        Connection connection;
        try {
            connection = dataSource.getConnection();
        } catch (SQLException e) {
            throw new IllegalStateException("lock_connection_unavailable", e);
        }

        try (connection) {
            var locked = tryLock(connection, key);
            if (locked == LockState.BUSY) {
                return false;
            }
            try {
                work.run();
            } finally {
                if (locked == LockState.HELD) {
                    unlock(connection, key);
                }
            }
            return true;
        } catch (SQLException e) {
            log.warn("lock_connection_close_failed key={}", key, e);
            return true;
        }
    }

    private enum LockState { HELD, BUSY, UNSUPPORTED }

    private LockState tryLock(Connection connection, String key) {
        try (var ps = connection.prepareStatement("select pg_try_advisory_lock(hashtext(?)::bigint)")) {
            ps.setString(1, key);
            try (var rs = ps.executeQuery()) {
                return rs.next() && rs.getBoolean(1) ? LockState.HELD : LockState.BUSY;
            }
        } catch (SQLException e) {
            // Non-Postgres (e.g. H2): run unguarded, per-case atomicity still holds in the registry.
            log.debug("advisory_lock_unavailable key={} sqlState={}", key, e.getSQLState());
            return LockState.UNSUPPORTED;
        }
    }

    private void unlock(Connection connection, String key) {
        try (var ps = connection.prepareStatement("select pg_advisory_unlock(hashtext(?)::bigint)")) {
            ps.setString(1, key);
            ps.executeQuery().close();
        } catch (SQLException e) {
            log.warn("advisory_unlock_failed key={}", key, e);
        }
    }
}
