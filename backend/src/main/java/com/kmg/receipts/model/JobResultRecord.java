package com.kmg.receipts.model;

import java.time.OffsetDateTime;

public record JobResultRecord(
        String jobId,
        String sourceType,
        String sourceId,
        String modelRequested,
        String modelUsed,
        String resultJson,
        OffsetDateTime createdAt
) {
}
