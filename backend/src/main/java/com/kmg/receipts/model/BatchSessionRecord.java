package com.kmg.receipts.model;

import java.time.OffsetDateTime;

public record BatchSessionRecord(
        String id,
        String owner,
        int totalFiles,
        int filesCompleted,
        int filesFailed,
        int filesPending,
        int maxConcurrent,
        ProcessingStrategy processingStrategy,
        BatchStatus status,
        RateLimitConfig rateLimitConfig,
        boolean cancelRequested,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt,
        OffsetDateTime endedAt
) {
}
