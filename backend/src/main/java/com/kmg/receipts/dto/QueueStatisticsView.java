package com.kmg.receipts.dto;

import java.util.Map;

public record QueueStatisticsView(
        Map<String, Integer> jobsByStatus,
        Map<String, Integer> pendingByPriority,
        String oldestPendingAt,
        int activeWorkers,
        double averageProcessingTimeMs
) {
}
