package com.kmg.receipts.repo;

import com.kmg.receipts.model.QuotaState;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public class QuotaRepository {
    private final JdbcTemplate jdbcTemplate;

    public QuotaRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    private static final RowMapper<QuotaState> MAPPER = new RowMapper<>() {
        @Override
        public QuotaState mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new QuotaState(
                    rs.getString("provider"),
                    SqlTime.parse(rs.getString("window_start")),
                    rs.getLong("window_ms"),
                    rs.getInt("requests_used"),
                    rs.getLong("tokens_used"),
                    rs.getInt("request_limit"),
                    rs.getLong("token_limit"),
                    SqlTime.parse(rs.getString("cooldown_until")),
                    SqlTime.parse(rs.getString("updated_at"))
            );
        }
    };

    public Optional<QuotaState> findByProvider(String provider) {
        List<QuotaState> rows = jdbcTemplate.query("SELECT * FROM quota_state WHERE provider = ?", MAPPER, provider);
        return rows.stream().findFirst();
    }

    public List<QuotaState> findAll() {
        return jdbcTemplate.query("SELECT * FROM quota_state ORDER BY provider ASC", MAPPER);
    }

    public void insertIfAbsent(String provider, long windowMs, int requestLimit, long tokenLimit, OffsetDateTime now) {
        String nowText = SqlTime.format(now);
        jdbcTemplate.update(
                """
                INSERT INTO quota_state(provider, window_start, window_ms, requests_used, tokens_used,
                                        request_limit, token_limit, cooldown_until, updated_at)
                VALUES (?, ?, ?, 0, 0, ?, ?, NULL, ?)
                ON CONFLICT(provider) DO NOTHING
                """,
                provider,
                nowText,
                windowMs,
                requestLimit,
                tokenLimit,
                nowText
        );
    }

    public boolean rollWindow(
            String provider,
            OffsetDateTime expectedWindowStart,
            long windowMs,
            int requestLimit,
            long tokenLimit,
            OffsetDateTime now
    ) {
        String nowText = SqlTime.format(now);
        int updated = jdbcTemplate.update(
                """
                UPDATE quota_state
                   SET window_start = ?,
                       window_ms = ?,
                       requests_used = 0,
                       tokens_used = 0,
                       request_limit = ?,
                       token_limit = ?,
                       updated_at = ?
                 WHERE provider = ? AND window_start = ?
                """,
                nowText,
                windowMs,
                requestLimit,
                tokenLimit,
                nowText,
                provider,
                SqlTime.format(expectedWindowStart)
        );
        return updated == 1;
    }

    /**
     * Takes one request and {@code tokens} tokens from the window in a single statement. Nothing
     * is taken when either budget would be exceeded or the provider is cooling down.
     */
    public boolean tryConsume(String provider, OffsetDateTime windowStart, long tokens, OffsetDateTime now) {
        String nowText = SqlTime.format(now);
        int updated = jdbcTemplate.update(
                """
                UPDATE quota_state
                   SET requests_used = requests_used + 1,
                       tokens_used = tokens_used + ?,
                       updated_at = ?
                 WHERE provider = ?
                   AND window_start = ?
                   AND requests_used < request_limit
                   AND tokens_used + ? <= token_limit
                   AND (cooldown_until IS NULL OR cooldown_until <= ?)
                """,
                tokens,
                nowText,
                provider,
                SqlTime.format(windowStart),
                tokens,
                nowText
        );
        return updated == 1;
    }

    public void adjustTokens(String provider, OffsetDateTime windowStart, long delta, OffsetDateTime now) {
        jdbcTemplate.update(
                """
                UPDATE quota_state
                   SET tokens_used = MAX(0, tokens_used + ?),
                       updated_at = ?
                 WHERE provider = ? AND window_start = ?
                """,
                delta,
                SqlTime.format(now),
                provider,
                SqlTime.format(windowStart)
        );
    }

    public void extendCooldown(String provider, OffsetDateTime until, OffsetDateTime now) {
        String untilText = SqlTime.format(until);
        jdbcTemplate.update(
                """
                UPDATE quota_state
                   SET cooldown_until = CASE
                           WHEN cooldown_until IS NULL OR cooldown_until < ? THEN ?
                           ELSE cooldown_until
                       END,
                       updated_at = ?
                 WHERE provider = ?
                """,
                untilText,
                untilText,
                SqlTime.format(now),
                provider
        );
    }
}
