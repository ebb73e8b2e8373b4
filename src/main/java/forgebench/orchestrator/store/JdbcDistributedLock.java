package forgebench.orchestrator.store;

import forgebench.orchestrator.repository.DistributedLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.function.Supplier;

import static forgebench.orchestrator.store.JdbcSupport.isConflict;
import static forgebench.orchestrator.store.JdbcSupport.rollback;

/**
 * Named lease stored in the named_locks table. A lease is taken by inserting
 * the row (the primary key admits one holder) after deleting an expired row,
 * and released by deleting the row only while still owned.
 */
public class JdbcDistributedLock implements DistributedLock {

    private static final Logger log = LoggerFactory.getLogger(JdbcDistributedLock.class);

    private static final long RETRY_DELAY_MS = 50;

    private final Database db;
    private final Duration leaseTimeout;
    private final Duration waitTimeout;
    private final Clock clock;

    public JdbcDistributedLock(Database db, Duration leaseTimeout, Duration waitTimeout) {
        this(db, leaseTimeout, waitTimeout, Clock.systemUTC());
    }

    public JdbcDistributedLock(Database db, Duration leaseTimeout, Duration waitTimeout, Clock clock) {
        this.db = db;
        this.leaseTimeout = leaseTimeout;
        this.waitTimeout = waitTimeout;
        this.clock = clock;
    }

    @Override
    public <T> T withLock(String name, Supplier<T> action) {
        String owner = acquire(name);
        if (owner == null) {
            log.warn("Lock '{}' not acquired within {} ms, proceeding without it", name, waitTimeout.toMillis());
        }
        try {
            return action.get();
        } finally {
            if (owner != null) {
                release(name, owner);
            }
        }
    }

    @Override
    public String tryAcquire(String name) {
        String owner = UUID.randomUUID().toString();
        Instant now = clock.instant();

        String deleteExpiredSql = "DELETE FROM named_locks WHERE name = ? AND expires_at < ?";
        String insertSql = "INSERT INTO named_locks (name, owner, expires_at) VALUES (?, ?, ?)";

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement deletePs = conn.prepareStatement(deleteExpiredSql);
                    PreparedStatement insertPs = conn.prepareStatement(insertSql)) {

                deletePs.setString(1, name);
                deletePs.setTimestamp(2, Timestamp.from(now));
                if (deletePs.executeUpdate() > 0) {
                    log.info("Lock '{}' lease expired, taking over", name);
                }

                insertPs.setString(1, name);
                insertPs.setString(2, owner);
                insertPs.setTimestamp(3, Timestamp.from(now.plus(leaseTimeout)));
                insertPs.executeUpdate();
                conn.commit();
                return owner;
            } catch (SQLException e) {
                rollback(conn);
                if (isConflict(e)) {
                    return null;
                }
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to acquire lock: " + name, e);
        }
    }

    @Override
    public void release(String name, String owner) {
        String sql = "DELETE FROM named_locks WHERE name = ? AND owner = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, name);
            ps.setString(2, owner);
            int deleted = ps.executeUpdate();
            conn.commit();

            if (deleted == 0) {
                log.warn("Lock '{}' was no longer held by {} at release", name, owner);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to release lock: " + name, e);
        }
    }

    private String acquire(String name) {
        long deadline = System.nanoTime() + waitTimeout.toNanos();
        while (true) {
            String owner = tryAcquire(name);
            if (owner != null) {
                return owner;
            }
            if (System.nanoTime() >= deadline) {
                return null;
            }
            try {
                Thread.sleep(RETRY_DELAY_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return null;
            }
        }
    }
}
