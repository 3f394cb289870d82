package com.kmg.receipts.repo;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kmg.receipts.model.*;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public class BatchSessionRepository {
    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final RowMapper<BatchSessionRecord> mapper;

    public BatchSessionRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.mapper = (rs, rowNum) -> new BatchSessionRecord(
                rs.getString("id"),
                rs.getString("owner"),
                rs.getInt("total_files"),
                rs.getInt("files_completed"),
                rs.getInt("files_failed"),
                rs.getInt("files_pending"),
                rs.getInt("max_concurrent"),
                ProcessingStrategy.valueOf(rs.getString("processing_strategy")),
                BatchStatus.valueOf(rs.getString("status")),
                readConfig(rs.getString("rate_limit_config")),
                rs.getInt("cancel_requested") == 1,
                SqlTime.parse(rs.getString("created_at")),
                SqlTime.parse(rs.getString("updated_at")),
                SqlTime.parse(rs.getString("ended_at"))
        );
    }

    public void insert(BatchSessionRecord session) {
        jdbcTemplate.update(
                """
                INSERT INTO batch_sessions(id, owner, total_files, files_completed, files_failed, files_pending,
                                           max_concurrent, processing_strategy, status, rate_limit_config,
                                           cancel_requested, created_at, updated_at, ended_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """,
                session.id(),
                session.owner(),
                session.totalFiles(),
                session.filesCompleted(),
                session.filesFailed(),
                session.filesPending(),
                session.maxConcurrent(),
                session.processingStrategy().name(),
                session.status().name(),
                writeConfig(session.rateLimitConfig()),
                session.cancelRequested() ? 1 : 0,
                SqlTime.format(session.createdAt()),
                SqlTime.format(session.updatedAt()),
                SqlTime.format(session.endedAt())
        );
    }

    public Optional<BatchSessionRecord> findById(String id) {
        List<BatchSessionRecord> rows = jdbcTemplate.query("SELECT * FROM batch_sessions WHERE id = ?", mapper, id);
        return rows.stream().findFirst();
    }

    public List<BatchSessionRecord> findRecent(int limit) {
        return jdbcTemplate.query(
                "SELECT * FROM batch_sessions ORDER BY created_at DESC LIMIT ?",
                mapper,
                limit
        );
    }

    public boolean applyOutcomes(String id, int completed, int failed, OffsetDateTime now) {
        int settled = completed + failed;
        int updated = jdbcTemplate.update(
                """
                UPDATE batch_sessions
                   SET files_completed = files_completed + ?,
                       files_failed = files_failed + ?,
                       files_pending = files_pending - ?,
                       updated_at = ?
                 WHERE id = ? AND files_pending >= ?
                """,
                completed,
                failed,
                settled,
                SqlTime.format(now),
                id,
                settled
        );
        return updated == 1;
    }

    public boolean finish(String id, BatchStatus status, OffsetDateTime now) {
        String nowText = SqlTime.format(now);
        int updated = jdbcTemplate.update(
                """
                UPDATE batch_sessions
                   SET status = ?,
                       updated_at = ?,
                       ended_at = ?
                 WHERE id = ? AND status = 'RUNNING' AND files_pending = 0
                """,
                status.name(),
                nowText,
                nowText,
                id
        );
        return updated == 1;
    }

    /**
     * Counts one request of {@code tokens} against the session's per-minute window. A window that
     * started at or before {@code windowCutoff} is replaced by a fresh one starting at {@code now};
     * otherwise the row only changes while both the request and token limits in rate_limit_config
     * still have room. Returns false when the window is full.
     */
    public boolean tryConsumeRate(String id, long tokens, OffsetDateTime now, OffsetDateTime windowCutoff) {
        String nowText = SqlTime.format(now);
        String cutoffText = SqlTime.format(windowCutoff);
        int updated = jdbcTemplate.update(
                """
                UPDATE batch_sessions
                   SET window_requests = CASE WHEN window_start IS NULL OR window_start <= ? THEN 1
                                              ELSE window_requests + 1 END,
                       window_tokens = CASE WHEN window_start IS NULL OR window_start <= ? THEN ?
                                            ELSE window_tokens + ? END,
                       window_start = CASE WHEN window_start IS NULL OR window_start <= ? THEN ?
                                           ELSE window_start END
                 WHERE id = ?
                   AND (window_start IS NULL
                        OR window_start <= ?
                        OR (window_requests < json_extract(rate_limit_config, '$.requestsPerMinute')
                            AND window_tokens + ? <= json_extract(rate_limit_config, '$.tokensPerMinute')))
                """,
                cutoffText,
                cutoffText,
                tokens,
                tokens,
                cutoffText,
                nowText,
                id,
                cutoffText,
                tokens
        );
        return updated == 1;
    }

    public boolean requestCancel(String id, OffsetDateTime now) {
        int updated = jdbcTemplate.update(
                "UPDATE batch_sessions SET cancel_requested = 1, updated_at = ? WHERE id = ? AND status = 'RUNNING'",
                SqlTime.format(now),
                id
        );
        return updated == 1;
    }

    private RateLimitConfig readConfig(String json) {
        try {
            return objectMapper.readValue(json, RateLimitConfig.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable rate limit config: " + json, e);
        }
    }

    private String writeConfig(RateLimitConfig config) {
        try {
            return objectMapper.writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize rate limit config", e);
        }
    }
}
