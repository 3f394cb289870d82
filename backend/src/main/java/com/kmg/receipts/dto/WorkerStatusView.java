package com.kmg.receipts.dto;

import com.kmg.receipts.model.WorkerStatus;

public record WorkerStatusView(
        String id,
        WorkerStatus status,
        String lastHeartbeat,
        boolean stale,
        String currentJob,
        int processedCount,
        int errorCount,
        String startedAt
) {
}
