package com.kmg.receipts.repo;

import com.kmg.receipts.model.JobResultRecord;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

@Repository
public class JobResultRepository {
    private final JdbcTemplate jdbcTemplate;

    public JobResultRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    private static final RowMapper<JobResultRecord> MAPPER = new RowMapper<>() {
        @Override
        public JobResultRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new JobResultRecord(
                    rs.getString("job_id"),
                    rs.getString("source_type"),
                    rs.getString("source_id"),
                    rs.getString("model_requested"),
                    rs.getString("model_used"),
                    rs.getString("result_json"),
                    SqlTime.parse(rs.getString("created_at"))
            );
        }
    };

    public void upsert(JobResultRecord result) {
        jdbcTemplate.update(
                """
                INSERT INTO job_results(job_id, source_type, source_id, model_requested, model_used, result_json, created_at)
                VALUES (?, ?, ?, ?, ?, ?, ?)
                ON CONFLICT(job_id) DO UPDATE
                   SET model_requested = excluded.model_requested,
                       model_used = excluded.model_used,
                       result_json = excluded.result_json,
                       created_at = excluded.created_at
                """,
                result.jobId(),
                result.sourceType(),
                result.sourceId(),
                result.modelRequested(),
                result.modelUsed(),
                result.resultJson(),
                SqlTime.format(result.createdAt())
        );
    }

    public Optional<JobResultRecord> findByJobId(String jobId) {
        List<JobResultRecord> rows = jdbcTemplate.query("SELECT * FROM job_results WHERE job_id = ?", MAPPER, jobId);
        return rows.stream().findFirst();
    }

    public Optional<JobResultRecord> findLatestBySource(String sourceType, String sourceId) {
        List<JobResultRecord> rows = jdbcTemplate.query(
                """
                SELECT * FROM job_results
                 WHERE source_type = ? AND source_id = ?
                 ORDER BY created_at DESC
                 LIMIT 1
                """,
                MAPPER,
                sourceType,
                sourceId
        );
        return rows.stream().findFirst();
    }
}
