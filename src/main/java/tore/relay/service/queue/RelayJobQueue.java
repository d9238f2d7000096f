package tore.relay.service.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import tore.relay.dto.CanonicalEvent;
import tore.relay.exception.EnqueueException;
import tore.relay.util.LogSanitizer;

/**
 * Durable, at-least-once job queue stored in a relational table.
 *
 * <p>Jobs move {@code WAITING -> ACTIVE -> COMPLETED}, or back to {@code WAITING} with an
 * exponential delay after a failed attempt, or to {@code FAILED} once the attempt cap is reached.
 * Completed rows are pruned beyond a retention cap; failed rows are never deleted.
 * A job whose worker dies stays {@code ACTIVE} until {@link #recoverStalled(Duration)} hands it out
 * again, so the same job can be delivered more than once.
 */
@Slf4j
public class RelayJobQueue {

    private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]{0,63}");
    private static final int MAX_ERROR_LENGTH = 1024;
    private static final int MAX_CLAIM_RACES = 5;

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final String table;
    private final int maxAttempts;
    private final ExponentialBackoff backoff;
    private final int keepCompleted;
    private final Clock clock;
    private final AtomicBoolean schemaReady = new AtomicBoolean(false);

    public RelayJobQueue(
        JdbcTemplate jdbcTemplate,
        ObjectMapper objectMapper,
        String table,
        int maxAttempts,
        ExponentialBackoff backoff,
        int keepCompleted,
        Clock clock
    ) {
        if (table == null || !TABLE_NAME.matcher(table).matches()) {
            throw new IllegalArgumentException("Invalid queue table name: " + table);
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
        }
        if (keepCompleted < 0) {
            throw new IllegalArgumentException("keepCompleted must be >= 0, got: " + keepCompleted);
        }
        this.jdbcTemplate = Objects.requireNonNull(jdbcTemplate, "jdbcTemplate");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.table = table;
        this.maxAttempts = maxAttempts;
        this.backoff = Objects.requireNonNull(backoff, "backoff");
        this.keepCompleted = keepCompleted;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Creates the job table when it does not exist yet. Safe to call repeatedly.
     */
    public void ensureSchema() {
        if (schemaReady.get()) {
            return;
        }
        try {
            jdbcTemplate.execute(
                """
                CREATE TABLE IF NOT EXISTS %s (
                    id BIGINT AUTO_INCREMENT PRIMARY KEY,
                    name VARCHAR(128) NOT NULL,
                    payload TEXT NOT NULL,
                    status VARCHAR(16) NOT NULL,
                    attempts INT NOT NULL,
                    max_attempts INT NOT NULL,
                    available_at TIMESTAMP NOT NULL,
                    locked_at TIMESTAMP NULL,
                    last_error VARCHAR(1024) NULL,
                    created_at TIMESTAMP NOT NULL,
                    finished_at TIMESTAMP NULL
                )
                """.formatted(table)
            );
            schemaReady.set(true);
            log.info("Relay job table '{}' ready", table);
        } catch (DataAccessException e) {
            throw new EnqueueException("Cannot create relay job table " + table + ": " + e.getMessage(), e);
        }
    }

    /**
     * Stores a new job that becomes claimable immediately.
     *
     * @throws EnqueueException when the payload cannot be serialized or the table is unavailable
     */
    public JobHandle enqueue(String name, CanonicalEvent payload) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Job name cannot be null or empty");
        }
        Objects.requireNonNull(payload, "payload");
        String json;
        try {
            json = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new EnqueueException("Cannot serialize payload for " + name + ": " + e.getOriginalMessage(), e);
        }

        Timestamp now = Timestamp.from(clock.instant());
        KeyHolder keyHolder = new GeneratedKeyHolder();
        try {
            jdbcTemplate.update(connection -> {
                PreparedStatement ps = connection.prepareStatement(
                    "INSERT INTO " + table
                        + " (name, payload, status, attempts, max_attempts, available_at, created_at)"
                        + " VALUES (?, ?, ?, ?, ?, ?, ?)",
                    Statement.RETURN_GENERATED_KEYS
                );
                ps.setString(1, name);
                ps.setString(2, json);
                ps.setString(3, JobStatus.WAITING.name());
                ps.setInt(4, 0);
                ps.setInt(5, maxAttempts);
                ps.setTimestamp(6, now);
                ps.setTimestamp(7, now);
                return ps;
            }, keyHolder);
        } catch (DataAccessException e) {
            throw new EnqueueException("Cannot enqueue " + name + ": " + e.getMessage(), e);
        }

        Number key = keyHolder.getKey();
        long id = key != null ? key.longValue() : -1L;
        log.debug("Enqueued job {} '{}' (block={}, logIndex={})",
            id, LogSanitizer.sanitize(name), payload.blockNumber(), payload.logIndex());
        return new JobHandle(id, name);
    }

    /**
     * Moves the oldest due WAITING job to ACTIVE and returns it with its attempt count incremented.
     */
    public Optional<QueueJob> claimNext() {
        try {
            for (int race = 0; race < MAX_CLAIM_RACES; race++) {
                Timestamp now = Timestamp.from(clock.instant());
                Long candidate = jdbcTemplate.query(
                    "SELECT id FROM " + table + " WHERE status = ? AND available_at <= ? ORDER BY id LIMIT 1",
                    rs -> rs.next() ? rs.getLong(1) : null,
                    JobStatus.WAITING.name(),
                    now
                );
                if (candidate == null) {
                    return Optional.empty();
                }
                int claimed = jdbcTemplate.update(
                    "UPDATE " + table + " SET status = ?, attempts = attempts + 1, locked_at = ? WHERE id = ? AND status = ?",
                    JobStatus.ACTIVE.name(),
                    now,
                    candidate,
                    JobStatus.WAITING.name()
                );
                if (claimed == 1) {
                    return find(candidate);
                }
                // another worker won this row
            }
            return Optional.empty();
        } catch (DataAccessException e) {
            throw new EnqueueException("Cannot claim next job: " + e.getMessage(), e);
        }
    }

    /**
     * Marks an ACTIVE job as done and prunes old completed rows.
     */
    public void complete(QueueJob job) {
        try {
            jdbcTemplate.update(
                "UPDATE " + table + " SET status = ?, finished_at = ?, locked_at = NULL, last_error = NULL WHERE id = ? AND status = ?",
                JobStatus.COMPLETED.name(),
                Timestamp.from(clock.instant()),
                job.id(),
                JobStatus.ACTIVE.name()
            );
            pruneCompleted();
        } catch (DataAccessException e) {
            throw new EnqueueException("Cannot complete job " + job.id() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Records a failed attempt. The job is rescheduled after an exponential delay while attempts
     * remain, otherwise it is parked in the failed set.
     *
     * @return the status the job moved to, {@link JobStatus#WAITING} or {@link JobStatus#FAILED}
     */
    public JobStatus fail(QueueJob job, String error) {
        Instant now = clock.instant();
        String message = truncateError(error);
        try {
            if (job.hasAttemptsLeft()) {
                Duration delay = backoff.delayFor(job.attemptCount());
                jdbcTemplate.update(
                    "UPDATE " + table + " SET status = ?, available_at = ?, locked_at = NULL, last_error = ? WHERE id = ? AND status = ?",
                    JobStatus.WAITING.name(),
                    Timestamp.from(now.plus(delay)),
                    message,
                    job.id(),
                    JobStatus.ACTIVE.name()
                );
                log.debug("Job {} attempt {}/{} failed, retrying in {} ms",
                    job.id(), job.attemptCount(), job.maxAttempts(), delay.toMillis());
                return JobStatus.WAITING;
            }
            jdbcTemplate.update(
                "UPDATE " + table + " SET status = ?, finished_at = ?, locked_at = NULL, last_error = ? WHERE id = ? AND status = ?",
                JobStatus.FAILED.name(),
                Timestamp.from(now),
                message,
                job.id(),
                JobStatus.ACTIVE.name()
            );
            return JobStatus.FAILED;
        } catch (DataAccessException e) {
            throw new EnqueueException("Cannot record failure for job " + job.id() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Returns ACTIVE jobs locked before {@code now - timeout} to WAITING.
     *
     * @return number of recovered jobs
     */
    public int recoverStalled(Duration timeout) {
        try {
            int recovered = jdbcTemplate.update(
                "UPDATE " + table + " SET status = ?, locked_at = NULL WHERE status = ? AND locked_at < ?",
                JobStatus.WAITING.name(),
                JobStatus.ACTIVE.name(),
                Timestamp.from(clock.instant().minus(timeout))
            );
            if (recovered > 0) {
                log.warn("Recovered {} stalled relay job(s) locked for more than {}", recovered, timeout);
            }
            return recovered;
        } catch (DataAccessException e) {
            throw new EnqueueException("Cannot recover stalled jobs: " + e.getMessage(), e);
        }
    }

    /**
     * Moves a failed job back to WAITING with a fresh attempt budget.
     *
     * @return false when the job does not exist or is not FAILED
     */
    public boolean retryFailed(long id) {
        try {
            int updated = jdbcTemplate.update(
                "UPDATE " + table + " SET status = ?, attempts = 0, available_at = ?, finished_at = NULL WHERE id = ? AND status = ?",
                JobStatus.WAITING.name(),
                Timestamp.from(clock.instant()),
                id,
                JobStatus.FAILED.name()
            );
            if (updated == 1) {
                log.info("Failed job {} moved back to the queue", id);
            }
            return updated == 1;
        } catch (DataAccessException e) {
            throw new EnqueueException("Cannot retry job " + id + ": " + e.getMessage(), e);
        }
    }

    public List<QueueJob> failedJobs(int limit) {
        try {
            return jdbcTemplate.query(
                "SELECT * FROM " + table + " WHERE status = ? ORDER BY id DESC LIMIT ?",
                (rs, rowNum) -> mapJob(rs),
                JobStatus.FAILED.name(),
                Math.max(1, limit)
            );
        } catch (DataAccessException e) {
            throw new EnqueueException("Cannot list failed jobs: " + e.getMessage(), e);
        }
    }

    public Optional<QueueJob> find(long id) {
        try {
            List<QueueJob> jobs = jdbcTemplate.query(
                "SELECT * FROM " + table + " WHERE id = ?",
                (rs, rowNum) -> mapJob(rs),
                id
            );
            return jobs.stream().findFirst();
        } catch (DataAccessException e) {
            throw new EnqueueException("Cannot load job " + id + ": " + e.getMessage(), e);
        }
    }

    /**
     * All jobs in insertion order; used for inspection and tests.
     */
    public List<QueueJob> jobs(JobStatus status) {
        try {
            return jdbcTemplate.query(
                "SELECT * FROM " + table + " WHERE status = ? ORDER BY id",
                (rs, rowNum) -> mapJob(rs),
                status.name()
            );
        } catch (DataAccessException e) {
            throw new EnqueueException("Cannot list " + status + " jobs: " + e.getMessage(), e);
        }
    }

    public QueueCounts counts() {
        long[] counts = new long[JobStatus.values().length];
        try {
            jdbcTemplate.query(
                "SELECT status, COUNT(*) FROM " + table + " GROUP BY status",
                rs -> {
                    try {
                        counts[JobStatus.valueOf(rs.getString(1)).ordinal()] = rs.getLong(2);
                    } catch (IllegalArgumentException e) {
                        log.warn("Ignoring unknown job status '{}'", LogSanitizer.sanitize(rs.getString(1)));
                    }
                }
            );
        } catch (DataAccessException e) {
            throw new EnqueueException("Cannot count jobs: " + e.getMessage(), e);
        }
        return new QueueCounts(
            counts[JobStatus.WAITING.ordinal()],
            counts[JobStatus.ACTIVE.ordinal()],
            counts[JobStatus.COMPLETED.ordinal()],
            counts[JobStatus.FAILED.ordinal()]
        );
    }

    public String getTable() {
        return table;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    private void pruneCompleted() {
        Long cutoff = jdbcTemplate.query(
            "SELECT id FROM " + table + " WHERE status = ? ORDER BY id DESC LIMIT 1 OFFSET ?",
            rs -> rs.next() ? rs.getLong(1) : null,
            JobStatus.COMPLETED.name(),
            keepCompleted
        );
        if (cutoff == null) {
            return;
        }
        int pruned = jdbcTemplate.update(
            "DELETE FROM " + table + " WHERE status = ? AND id <= ?",
            JobStatus.COMPLETED.name(),
            cutoff
        );
        log.trace("Pruned {} completed job(s)", pruned);
    }

    private QueueJob mapJob(ResultSet rs) throws SQLException {
        long id = rs.getLong("id");
        CanonicalEvent payload = null;
        String json = rs.getString("payload");
        try {
            payload = objectMapper.readValue(json, CanonicalEvent.class);
        } catch (JsonProcessingException e) {
            log.warn("Job {} has an unreadable payload: {}", id, e.getOriginalMessage());
        }
        return new QueueJob(
            id,
            rs.getString("name"),
            payload,
            rs.getInt("attempts"),
            rs.getInt("max_attempts"),
            JobStatus.valueOf(rs.getString("status")),
            toInstant(rs.getTimestamp("available_at")),
            rs.getString("last_error"),
            toInstant(rs.getTimestamp("created_at"))
        );
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }

    private static String truncateError(String error) {
        if (error == null) {
            return null;
        }
        return error.length() <= MAX_ERROR_LENGTH ? error : error.substring(0, MAX_ERROR_LENGTH);
    }
}
