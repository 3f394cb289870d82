package com.kmg.receipts.repo;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public class EmbeddingRepository {
    private final JdbcTemplate jdbcTemplate;

    public EmbeddingRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public record StoredEmbedding(String sourceType, String sourceId, String model, int dimensions, String vectorJson,
                                  OffsetDateTime updatedAt) {
    }

    public void upsert(String sourceType, String sourceId, String model, int dimensions, String vectorJson, OffsetDateTime now) {
        jdbcTemplate.update(
                """
                INSERT INTO embeddings(source_type, source_id, model, dimensions, vector_json, updated_at)
                VALUES (?, ?, ?, ?, ?, ?)
                ON CONFLICT(source_type, source_id) DO UPDATE
                   SET model = excluded.model,
                       dimensions = excluded.dimensions,
                       vector_json = excluded.vector_json,
                       updated_at = excluded.updated_at
                """,
                sourceType,
                sourceId,
                model,
                dimensions,
                vectorJson,
                SqlTime.format(now)
        );
    }

    public Optional<StoredEmbedding> findBySource(String sourceType, String sourceId) {
        List<StoredEmbedding> rows = jdbcTemplate.query(
                "SELECT * FROM embeddings WHERE source_type = ? AND source_id = ?",
                (rs, rowNum) -> new StoredEmbedding(
                        rs.getString("source_type"),
                        rs.getString("source_id"),
                        rs.getString("model"),
                        rs.getInt("dimensions"),
                        rs.getString("vector_json"),
                        SqlTime.parse(rs.getString("updated_at"))
                ),
                sourceType,
                sourceId
        );
        return rows.stream().findFirst();
    }
}
