package com.kmg.receipts.model;

import java.time.OffsetDateTime;

public record WorkerRecord(
        String id,
        WorkerStatus status,
        OffsetDateTime lastHeartbeat,
        String currentJob,
        int processedCount,
        int errorCount,
        OffsetDateTime startedAt
) {
}
