package com.kmg.receipts.repo;

import com.kmg.receipts.model.*;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Queue storage. Every state change is a single conditional UPDATE whose row count tells the
 * caller whether it won the transition.
 */
@Repository
public class JobRepository {
    private static final String ACTIVE_STATUSES = "('PENDING', 'CLAIMED', 'PROCESSING')";
    private static final String HELD_STATUSES = "('CLAIMED', 'PROCESSING')";
    private static final String HELD_BY_DEAD_WORKER = """
            status IN ('CLAIMED', 'PROCESSING')
               AND claimed_by NOT IN (
                   SELECT w.id FROM workers w
                    WHERE w.status <> 'STOPPED' AND w.last_heartbeat >= ?
               )
            """;

    private final JdbcTemplate jdbcTemplate;

    public JobRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    private static final RowMapper<JobRecord> JOB_MAPPER = new RowMapper<>() {
        @Override
        public JobRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new JobRecord(
                    rs.getString("id"),
                    rs.getString("source_type"),
                    rs.getString("source_id"),
                    JobOperation.valueOf(rs.getString("operation")),
                    JobPriority.fromRank(rs.getInt("priority")),
                    JobStatus.valueOf(rs.getString("status")),
                    rs.getInt("retry_count"),
                    rs.getInt("max_retries"),
                    rs.getString("claimed_by"),
                    SqlTime.parse(rs.getString("claimed_at")),
                    SqlTime.parse(rs.getString("available_at")),
                    rs.getString("last_error"),
                    rs.getString("batch_id"),
                    rs.getString("model_preference"),
                    SqlTime.parse(rs.getString("created_at")),
                    SqlTime.parse(rs.getString("updated_at")),
                    SqlTime.parse(rs.getString("ended_at"))
            );
        }
    };

    public boolean insertIfNoActive(JobRecord job) {
        int inserted = jdbcTemplate.update(
                """
                INSERT INTO jobs(id, source_type, source_id, operation, priority, status, retry_count, max_retries,
                                 claimed_by, claimed_at, available_at, last_error, batch_id, model_preference,
                                 created_at, updated_at, ended_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, NULL, NULL, ?, NULL, ?, ?, ?, ?, NULL)
                ON CONFLICT DO NOTHING
                """,
                job.id(),
                job.sourceType(),
                job.sourceId(),
                job.operation().name(),
                job.priority().rank(),
                job.status().name(),
                job.retryCount(),
                job.maxRetries(),
                SqlTime.format(job.availableAt()),
                job.batchId(),
                job.modelPreference(),
                SqlTime.format(job.createdAt()),
                SqlTime.format(job.updatedAt())
        );
        return inserted == 1;
    }

    public Optional<JobRecord> findById(String id) {
        List<JobRecord> rows = jdbcTemplate.query("SELECT * FROM jobs WHERE id = ?", JOB_MAPPER, id);
        return rows.stream().findFirst();
    }

    public Optional<JobRecord> findActiveBySource(String sourceType, String sourceId, JobOperation operation) {
        List<JobRecord> rows = jdbcTemplate.query(
                """
                SELECT * FROM jobs
                 WHERE source_type = ? AND source_id = ? AND operation = ?
                   AND status IN %s
                """.formatted(ACTIVE_STATUSES),
                JOB_MAPPER,
                sourceType,
                sourceId,
                operation.name()
        );
        return rows.stream().findFirst();
    }

    public List<JobRecord> findByBatchId(String batchId) {
        return jdbcTemplate.query(
                "SELECT * FROM jobs WHERE batch_id = ? ORDER BY created_at ASC, rowid ASC",
                JOB_MAPPER,
                batchId
        );
    }

    public List<JobRecord> findClaimCandidates(OffsetDateTime now, OffsetDateTime rateWindowCutoff, int limit) {
        return jdbcTemplate.query(
                """
                SELECT j.* FROM jobs j
                 WHERE j.status = 'PENDING'
                   AND j.available_at <= ?
                   AND (j.batch_id IS NULL OR %s)
                   AND NOT EXISTS (
                       SELECT 1 FROM batch_sessions b
                        WHERE b.id = j.batch_id
                          AND b.window_start > ?
                          AND b.window_requests >= json_extract(b.rate_limit_config, '$.requestsPerMinute')
                   )
                 ORDER BY j.priority DESC, j.created_at ASC, j.rowid ASC
                 LIMIT ?
                """.formatted(batchHasRoom("j")),
                JOB_MAPPER,
                SqlTime.format(now),
                SqlTime.format(rateWindowCutoff),
                limit
        );
    }

    /**
     * PENDING → CLAIMED. Loses (returns false) when another worker got there first, the backoff
     * gate has not opened, or the batch filled up in the meantime.
     */
    public boolean tryClaim(String jobId, String workerId, OffsetDateTime now) {
        String nowText = SqlTime.format(now);
        int updated = jdbcTemplate.update(
                """
                UPDATE jobs
                   SET status = 'CLAIMED',
                       claimed_by = ?,
                       claimed_at = ?,
                       updated_at = ?
                 WHERE id = ?
                   AND status = 'PENDING'
                   AND available_at <= ?
                   AND (batch_id IS NULL OR %s)
                """.formatted(batchHasRoom("jobs")),
                workerId,
                nowText,
                nowText,
                jobId,
                nowText
        );
        return updated == 1;
    }

    public boolean markProcessing(String jobId, String workerId, OffsetDateTime now) {
        int updated = jdbcTemplate.update(
                """
                UPDATE jobs
                   SET status = 'PROCESSING',
                       updated_at = ?
                 WHERE id = ? AND status = 'CLAIMED' AND claimed_by = ?
                """,
                SqlTime.format(now),
                jobId,
                workerId
        );
        return updated == 1;
    }

    public boolean complete(String jobId, String workerId, OffsetDateTime now) {
        String nowText = SqlTime.format(now);
        int updated = jdbcTemplate.update(
                """
                UPDATE jobs
                   SET status = 'COMPLETED',
                       last_error = NULL,
                       updated_at = ?,
                       ended_at = ?
                 WHERE id = ? AND claimed_by = ? AND status IN %s
                """.formatted(HELD_STATUSES),
                nowText,
                nowText,
                jobId,
                workerId
        );
        return updated == 1;
    }

    public boolean failTerminal(String jobId, String workerId, String error, OffsetDateTime now) {
        String nowText = SqlTime.format(now);
        int updated = jdbcTemplate.update(
                """
                UPDATE jobs
                   SET status = 'FAILED',
                       last_error = ?,
                       updated_at = ?,
                       ended_at = ?
                 WHERE id = ? AND claimed_by = ? AND status IN %s
                """.formatted(HELD_STATUSES),
                error,
                nowText,
                nowText,
                jobId,
                workerId
        );
        return updated == 1;
    }

    public boolean requeueForRetry(String jobId, String workerId, String error, OffsetDateTime availableAt, OffsetDateTime now) {
        int updated = jdbcTemplate.update(
                """
                UPDATE jobs
                   SET status = 'PENDING',
                       retry_count = retry_count + 1,
                       claimed_by = NULL,
                       claimed_at = NULL,
                       available_at = ?,
                       last_error = ?,
                       updated_at = ?
                 WHERE id = ? AND claimed_by = ? AND status IN %s
                   AND retry_count < max_retries
                """.formatted(HELD_STATUSES),
                SqlTime.format(availableAt),
                error,
                SqlTime.format(now),
                jobId,
                workerId
        );
        return updated == 1;
    }

    public boolean release(String jobId, String workerId, String reason, OffsetDateTime availableAt, OffsetDateTime now) {
        int updated = jdbcTemplate.update(
                """
                UPDATE jobs
                   SET status = 'PENDING',
                       claimed_by = NULL,
                       claimed_at = NULL,
                       available_at = ?,
                       last_error = ?,
                       updated_at = ?
                 WHERE id = ? AND claimed_by = ? AND status IN %s
                """.formatted(HELD_STATUSES),
                SqlTime.format(availableAt),
                reason,
                SqlTime.format(now),
                jobId,
                workerId
        );
        return updated == 1;
    }

    public List<JobRecord> findHeldByDeadWorkers(OffsetDateTime heartbeatCutoff) {
        return jdbcTemplate.query(
                "SELECT * FROM jobs WHERE " + HELD_BY_DEAD_WORKER,
                JOB_MAPPER,
                SqlTime.format(heartbeatCutoff)
        );
    }

    /**
     * Returns jobs held by workers that are no longer live to PENDING. A worker is live when it has
     * a non-STOPPED row with a heartbeat at or after {@code heartbeatCutoff}.
     */
    public int reclaimFromDeadWorkers(OffsetDateTime heartbeatCutoff, String reason, OffsetDateTime now) {
        String nowText = SqlTime.format(now);
        return jdbcTemplate.update(
                """
                UPDATE jobs
                   SET status = 'PENDING',
                       claimed_by = NULL,
                       claimed_at = NULL,
                       available_at = ?,
                       last_error = ?,
                       updated_at = ?
                 WHERE %s
                """.formatted(HELD_BY_DEAD_WORKER),
                nowText,
                reason,
                nowText,
                SqlTime.format(heartbeatCutoff)
        );
    }

    public int cancelPendingInBatch(String batchId, String reason, OffsetDateTime now) {
        String nowText = SqlTime.format(now);
        return jdbcTemplate.update(
                """
                UPDATE jobs
                   SET status = 'CANCELLED',
                       last_error = ?,
                       updated_at = ?,
                       ended_at = ?
                 WHERE batch_id = ? AND status = 'PENDING'
                """,
                reason,
                nowText,
                nowText,
                batchId
        );
    }

    public int requeueFailed(int maxItems, OffsetDateTime now) {
        String nowText = SqlTime.format(now);
        return jdbcTemplate.update(
                """
                UPDATE OR IGNORE jobs
                   SET status = 'PENDING',
                       retry_count = 0,
                       last_error = NULL,
                       claimed_by = NULL,
                       claimed_at = NULL,
                       available_at = ?,
                       updated_at = ?,
                       ended_at = NULL
                 WHERE id IN (
                       SELECT id FROM jobs
                        WHERE status = 'FAILED' AND batch_id IS NULL
                        ORDER BY updated_at ASC
                        LIMIT ?
                 )
                """,
                nowText,
                nowText,
                maxItems
        );
    }

    public int deleteTerminalBefore(OffsetDateTime cutoff) {
        return jdbcTemplate.update(
                "DELETE FROM jobs WHERE status IN ('COMPLETED', 'FAILED', 'CANCELLED') AND updated_at < ?",
                SqlTime.format(cutoff)
        );
    }

    public Map<JobStatus, Integer> countByStatus() {
        Map<JobStatus, Integer> counts = new EnumMap<>(JobStatus.class);
        for (JobStatus status : JobStatus.values()) {
            counts.put(status, 0);
        }
        jdbcTemplate.query(
                "SELECT status, COUNT(*) AS total FROM jobs GROUP BY status",
                rs -> {
                    counts.put(JobStatus.valueOf(rs.getString("status")), rs.getInt("total"));
                }
        );
        return counts;
    }

    public Map<JobPriority, Integer> countPendingByPriority() {
        Map<JobPriority, Integer> counts = new EnumMap<>(JobPriority.class);
        for (JobPriority priority : JobPriority.values()) {
            counts.put(priority, 0);
        }
        jdbcTemplate.query(
                "SELECT priority, COUNT(*) AS total FROM jobs WHERE status = 'PENDING' GROUP BY priority",
                rs -> {
                    counts.put(JobPriority.fromRank(rs.getInt("priority")), rs.getInt("total"));
                }
        );
        return counts;
    }

    public Optional<OffsetDateTime> oldestPendingCreatedAt() {
        String value = jdbcTemplate.queryForObject(
                "SELECT MIN(created_at) FROM jobs WHERE status = 'PENDING'",
                String.class
        );
        return Optional.ofNullable(SqlTime.parse(value));
    }

    private static String batchHasRoom(String alias) {
        return """
                (SELECT COUNT(*) FROM jobs inflight
                  WHERE inflight.batch_id = %1$s.batch_id AND inflight.status IN %2$s)
                < COALESCE((SELECT b.max_concurrent FROM batch_sessions b WHERE b.id = %1$s.batch_id), 2147483647)
                """.formatted(alias, HELD_STATUSES);
    }
}
