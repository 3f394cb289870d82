package com.kmg.receipts.repo;

import com.kmg.receipts.model.WorkerRecord;
import com.kmg.receipts.model.WorkerStatus;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public class WorkerRepository {
    private final JdbcTemplate jdbcTemplate;

    public WorkerRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    private static final RowMapper<WorkerRecord> MAPPER = new RowMapper<>() {
        @Override
        public WorkerRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new WorkerRecord(
                    rs.getString("id"),
                    WorkerStatus.valueOf(rs.getString("status")),
                    SqlTime.parse(rs.getString("last_heartbeat")),
                    rs.getString("current_job"),
                    rs.getInt("processed_count"),
                    rs.getInt("error_count"),
                    SqlTime.parse(rs.getString("started_at"))
            );
        }
    };

    public void register(String workerId, OffsetDateTime now) {
        String nowText = SqlTime.format(now);
        jdbcTemplate.update(
                """
                INSERT INTO workers(id, status, last_heartbeat, current_job, processed_count, error_count, started_at)
                VALUES (?, 'IDLE', ?, NULL, 0, 0, ?)
                ON CONFLICT(id) DO UPDATE
                   SET status = 'IDLE',
                       last_heartbeat = excluded.last_heartbeat,
                       current_job = NULL,
                       started_at = excluded.started_at
                """,
                workerId,
                nowText,
                nowText
        );
    }

    public void heartbeat(String workerId, WorkerStatus status, String currentJob, OffsetDateTime now) {
        String nowText = SqlTime.format(now);
        jdbcTemplate.update(
                """
                INSERT INTO workers(id, status, last_heartbeat, current_job, processed_count, error_count, started_at)
                VALUES (?, ?, ?, ?, 0, 0, ?)
                ON CONFLICT(id) DO UPDATE
                   SET status = excluded.status,
                       last_heartbeat = excluded.last_heartbeat,
                       current_job = excluded.current_job
                """,
                workerId,
                status.name(),
                nowText,
                currentJob,
                nowText
        );
    }

    public void incrementProcessed(String workerId) {
        jdbcTemplate.update("UPDATE workers SET processed_count = processed_count + 1 WHERE id = ?", workerId);
    }

    public void incrementErrors(String workerId) {
        jdbcTemplate.update("UPDATE workers SET error_count = error_count + 1 WHERE id = ?", workerId);
    }

    public void markStopped(String workerId, OffsetDateTime now) {
        jdbcTemplate.update(
                "UPDATE workers SET status = 'STOPPED', current_job = NULL, last_heartbeat = ? WHERE id = ?",
                SqlTime.format(now),
                workerId
        );
    }

    public int markStaleStopped(OffsetDateTime heartbeatCutoff) {
        return jdbcTemplate.update(
                "UPDATE workers SET status = 'STOPPED', current_job = NULL WHERE status <> 'STOPPED' AND last_heartbeat < ?",
                SqlTime.format(heartbeatCutoff)
        );
    }

    public int deleteStoppedBefore(OffsetDateTime cutoff) {
        return jdbcTemplate.update(
                "DELETE FROM workers WHERE status = 'STOPPED' AND last_heartbeat < ?",
                SqlTime.format(cutoff)
        );
    }

    public Optional<WorkerRecord> findById(String workerId) {
        List<WorkerRecord> rows = jdbcTemplate.query("SELECT * FROM workers WHERE id = ?", MAPPER, workerId);
        return rows.stream().findFirst();
    }

    public List<WorkerRecord> findAll() {
        return jdbcTemplate.query("SELECT * FROM workers ORDER BY id ASC", MAPPER);
    }
}
