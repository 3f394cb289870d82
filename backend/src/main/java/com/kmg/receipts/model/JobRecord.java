package com.kmg.receipts.model;

import java.time.OffsetDateTime;

public record JobRecord(
        String id,
        String sourceType,
        String sourceId,
        JobOperation operation,
        JobPriority priority,
        JobStatus status,
        int retryCount,
        int maxRetries,
        String claimedBy,
        OffsetDateTime claimedAt,
        OffsetDateTime availableAt,
        String lastError,
        String batchId,
        String modelPreference,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt,
        OffsetDateTime endedAt
) {
    public static JobRecord pending(String id, NewJob job, int maxRetries, OffsetDateTime now) {
        return new JobRecord(
                id,
                job.sourceType(),
                job.sourceId(),
                job.operation(),
                job.priority(),
                JobStatus.PENDING,
                0,
                maxRetries,
                null,
                null,
                now,
                null,
                job.batchId(),
                job.modelPreference(),
                now,
                now,
                null
        );
    }

    public boolean canRetry() {
        return retryCount < maxRetries;
    }
}
