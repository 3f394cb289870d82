package com.kmg.receipts.repo;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

@Component
public class DatabaseSchema {
    private static final Logger log = LoggerFactory.getLogger(DatabaseSchema.class);

    private final JdbcTemplate jdbcTemplate;

    public DatabaseSchema(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void initialize() {
        configureJournal();

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS jobs (
              id TEXT PRIMARY KEY,
              source_type TEXT NOT NULL,
              source_id TEXT NOT NULL,
              operation TEXT NOT NULL,
              priority INTEGER NOT NULL,
              status TEXT NOT NULL,
              retry_count INTEGER NOT NULL DEFAULT 0,
              max_retries INTEGER NOT NULL,
              claimed_by TEXT,
              claimed_at TEXT,
              available_at TEXT NOT NULL,
              last_error TEXT,
              batch_id TEXT,
              model_preference TEXT,
              created_at TEXT NOT NULL,
              updated_at TEXT NOT NULL,
              ended_at TEXT,
              CHECK (retry_count <= max_retries),
              CHECK (status NOT IN ('CLAIMED', 'PROCESSING') OR (claimed_by IS NOT NULL AND claimed_at IS NOT NULL))
            )
            """);

        // One active job per (source, operation); completed or failed rows may repeat.
        jdbcTemplate.execute("""
            CREATE UNIQUE INDEX IF NOT EXISTS ux_jobs_active_source
                ON jobs(source_type, source_id, operation)
             WHERE status IN ('PENDING', 'CLAIMED', 'PROCESSING')
            """);
        jdbcTemplate.execute(
                "CREATE INDEX IF NOT EXISTS ix_jobs_claim ON jobs(status, priority DESC, created_at, available_at)");
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS ix_jobs_batch ON jobs(batch_id, status)");
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS ix_jobs_claimed_by ON jobs(claimed_by, status)");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS workers (
              id TEXT PRIMARY KEY,
              status TEXT NOT NULL,
              last_heartbeat TEXT NOT NULL,
              current_job TEXT,
              processed_count INTEGER NOT NULL DEFAULT 0,
              error_count INTEGER NOT NULL DEFAULT 0,
              started_at TEXT NOT NULL
            )
            """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS batch_sessions (
              id TEXT PRIMARY KEY,
              owner TEXT NOT NULL,
              total_files INTEGER NOT NULL,
              files_completed INTEGER NOT NULL DEFAULT 0,
              files_failed INTEGER NOT NULL DEFAULT 0,
              files_pending INTEGER NOT NULL,
              max_concurrent INTEGER NOT NULL,
              processing_strategy TEXT NOT NULL,
              status TEXT NOT NULL,
              rate_limit_config TEXT NOT NULL,
              cancel_requested INTEGER NOT NULL DEFAULT 0,
              window_start TEXT,
              window_requests INTEGER NOT NULL DEFAULT 0,
              window_tokens INTEGER NOT NULL DEFAULT 0,
              created_at TEXT NOT NULL,
              updated_at TEXT NOT NULL,
              ended_at TEXT,
              CHECK (files_pending >= 0),
              CHECK (files_completed + files_failed + files_pending = total_files)
            )
            """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS quota_state (
              provider TEXT PRIMARY KEY,
              window_start TEXT NOT NULL,
              window_ms INTEGER NOT NULL,
              requests_used INTEGER NOT NULL DEFAULT 0,
              tokens_used INTEGER NOT NULL DEFAULT 0,
              request_limit INTEGER NOT NULL,
              token_limit INTEGER NOT NULL,
              cooldown_until TEXT,
              updated_at TEXT NOT NULL
            )
            """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS metric_records (
              id INTEGER PRIMARY KEY AUTOINCREMENT,
              operation_type TEXT NOT NULL,
              job_id TEXT,
              source_id TEXT,
              status TEXT NOT NULL,
              processing_time_ms INTEGER NOT NULL DEFAULT 0,
              tokens_used INTEGER NOT NULL DEFAULT 0,
              provider TEXT,
              model TEXT,
              error_type TEXT,
              created_at TEXT NOT NULL
            )
            """);
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS ix_metric_records_created ON metric_records(created_at)");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS job_results (
              job_id TEXT PRIMARY KEY,
              source_type TEXT NOT NULL,
              source_id TEXT NOT NULL,
              model_requested TEXT NOT NULL,
              model_used TEXT NOT NULL,
              result_json TEXT NOT NULL,
              created_at TEXT NOT NULL
            )
            """);
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS ix_job_results_source ON job_results(source_type, source_id)");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS embeddings (
              source_type TEXT NOT NULL,
              source_id TEXT NOT NULL,
              model TEXT NOT NULL,
              dimensions INTEGER NOT NULL,
              vector_json TEXT NOT NULL,
              updated_at TEXT NOT NULL,
              PRIMARY KEY (source_type, source_id)
            )
            """);
    }

    private void configureJournal() {
        try {
            jdbcTemplate.queryForObject("PRAGMA journal_mode=WAL", String.class);
        } catch (Exception e) {
            log.warn("Failed to enable WAL journal: {}", e.getMessage());
        }
    }
}
