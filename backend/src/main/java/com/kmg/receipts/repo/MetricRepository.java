package com.kmg.receipts.repo;

import com.kmg.receipts.model.*;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.List;

@Repository
public class MetricRepository {
    private final JdbcTemplate jdbcTemplate;

    public MetricRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    private static final RowMapper<MetricRecord> MAPPER = new RowMapper<>() {
        @Override
        public MetricRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
            String errorType = rs.getString("error_type");
            return new MetricRecord(
                    rs.getLong("id"),
                    JobOperation.valueOf(rs.getString("operation_type")),
                    rs.getString("job_id"),
                    rs.getString("source_id"),
                    AttemptStatus.valueOf(rs.getString("status")),
                    rs.getLong("processing_time_ms"),
                    rs.getLong("tokens_used"),
                    rs.getString("provider"),
                    rs.getString("model"),
                    errorType == null ? null : ErrorType.valueOf(errorType),
                    SqlTime.parse(rs.getString("created_at"))
            );
        }
    };

    public record ProviderUsage(String provider, long attempts, long successes, long failures, long tokensUsed) {
    }

    public void insert(MetricRecord record) {
        jdbcTemplate.update(
                """
                INSERT INTO metric_records(operation_type, job_id, source_id, status, processing_time_ms,
                                           tokens_used, provider, model, error_type, created_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """,
                record.operationType().name(),
                record.jobId(),
                record.sourceId(),
                record.status().name(),
                record.processingTimeMs(),
                record.tokensUsed(),
                record.provider(),
                record.model(),
                record.errorType() == null ? null : record.errorType().name(),
                SqlTime.format(record.createdAt())
        );
    }

    public List<MetricRecord> findByJobId(String jobId) {
        return jdbcTemplate.query(
                "SELECT * FROM metric_records WHERE job_id = ? ORDER BY id ASC",
                MAPPER,
                jobId
        );
    }

    public int countByStatusAndErrorType(AttemptStatus status, ErrorType errorType) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM metric_records WHERE status = ? AND error_type = ?",
                Integer.class,
                status.name(),
                errorType.name()
        );
        return count == null ? 0 : count;
    }

    public double averageSuccessTimeSince(OffsetDateTime since) {
        Double average = jdbcTemplate.queryForObject(
                "SELECT AVG(processing_time_ms) FROM metric_records WHERE status = 'SUCCESS' AND created_at >= ?",
                Double.class,
                SqlTime.format(since)
        );
        return average == null ? 0.0 : average;
    }

    public List<ProviderUsage> usageByProviderSince(OffsetDateTime since) {
        return jdbcTemplate.query(
                """
                SELECT provider,
                       COUNT(*) AS attempts,
                       SUM(CASE WHEN status = 'SUCCESS' THEN 1 ELSE 0 END) AS successes,
                       SUM(CASE WHEN status IN ('RETRY', 'FAILURE') THEN 1 ELSE 0 END) AS failures,
                       COALESCE(SUM(tokens_used), 0) AS tokens
                  FROM metric_records
                 WHERE created_at >= ? AND provider IS NOT NULL
                 GROUP BY provider
                 ORDER BY provider ASC
                """,
                (rs, rowNum) -> new ProviderUsage(
                        rs.getString("provider"),
                        rs.getLong("attempts"),
                        rs.getLong("successes"),
                        rs.getLong("failures"),
                        rs.getLong("tokens")
                ),
                SqlTime.format(since)
        );
    }

    public int deleteBefore(OffsetDateTime cutoff) {
        return jdbcTemplate.update("DELETE FROM metric_records WHERE created_at < ?", SqlTime.format(cutoff));
    }
}
