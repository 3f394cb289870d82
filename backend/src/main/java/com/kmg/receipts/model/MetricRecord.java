package com.kmg.receipts.model;

import java.time.OffsetDateTime;

public record MetricRecord(
        long id,
        JobOperation operationType,
        String jobId,
        String sourceId,
        AttemptStatus status,
        long processingTimeMs,
        long tokensUsed,
        String provider,
        String model,
        ErrorType errorType,
        OffsetDateTime createdAt
) {
}
