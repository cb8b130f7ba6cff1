package junie.email.intel.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Lease-based job lock on a database table.
 * Ensures only one node runs a scheduled job at a time in multi-node deployments.
 */
@Slf4j
@Service
public class DistributedLockService {
    private static final String LOCK_TABLE = "job_locks";

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    public DistributedLockService(JdbcTemplate jdbcTemplate, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
        initializeLockTable();
    }

    private void initializeLockTable() {
        try {
            jdbcTemplate.execute(
                "CREATE TABLE IF NOT EXISTS " + LOCK_TABLE + " (" +
                "lock_name VARCHAR(255) PRIMARY KEY, " +
                "locked_by VARCHAR(255) NOT NULL, " +
                "locked_at TIMESTAMP NOT NULL, " +
                "expires_at TIMESTAMP NOT NULL" +
                ")"
            );
            log.debug("Job lock table initialized");
        } catch (DataAccessException e) {
            log.warn("Could not initialize job lock table (may already exist): {}", e.getMessage());
        }
    }

    /**
     * Attempts to take the named lock for {@code ttl}. An expired lease held by another node is
     * taken over.
     * @return true if this node now holds the lock
     */
    public boolean tryLock(String lockName, String nodeId, Duration ttl) {
        Instant now = Instant.now(clock);
        try {
            // Drop a lease that ran out, whoever held it
            int expired = jdbcTemplate.update(
                "DELETE FROM " + LOCK_TABLE + " WHERE lock_name = ? AND expires_at < ?",
                lockName, Timestamp.from(now));
            if (expired > 0) {
                log.info("Removed expired lock {}", lockName);
            }
            if (insertLock(lockName, nodeId, now, now.plus(ttl))) {
                log.debug("Acquired lock {}", lockName);
                return true;
            }
            log.debug("Could not acquire lock {} (held by another node)", lockName);
            return false;
        } catch (DataAccessException e) {
            log.error("Error acquiring lock {}: {}", lockName, e.getMessage(), e);
            return false;
        }
    }

    public void releaseLock(String lockName, String nodeId) {
        try {
            int rows = jdbcTemplate.update(
                "DELETE FROM " + LOCK_TABLE + " WHERE lock_name = ? AND locked_by = ?",
                lockName, nodeId);
            if (rows > 0) {
                log.debug("Released lock {}", lockName);
            } else {
                log.warn("Attempted to release lock {} but it was not found or is owned by a different node", lockName);
            }
        } catch (DataAccessException e) {
            log.error("Error releasing lock {}: {}", lockName, e.getMessage(), e);
        }
    }

    private boolean insertLock(String lockName, String nodeId, Instant now, Instant expiresAt) {
        try {
            return jdbcTemplate.update(
                "INSERT INTO " + LOCK_TABLE + " (lock_name, locked_by, locked_at, expires_at) VALUES (?, ?, ?, ?)",
                lockName, nodeId, Timestamp.from(now), Timestamp.from(expiresAt)) > 0;
        } catch (DataIntegrityViolationException e) {
            log.debug("Lock {} already held", lockName);
            return false;
        }
    }

    /**
     * Node id for this instance: hostname, or a JVM-derived fallback.
     */
    public String getNodeId() {
        String nodeId = System.getenv("FLY_APP_INSTANCE_ID");
        if (nodeId == null || nodeId.isEmpty()) {
            nodeId = System.getenv("HOSTNAME");
        }
        if (nodeId == null || nodeId.isEmpty()) {
            nodeId = System.getProperty("user.name") + "-" + System.getProperty("java.vm.name");
        }
        return nodeId;
    }
}
