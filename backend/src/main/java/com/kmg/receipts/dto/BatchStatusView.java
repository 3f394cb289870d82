package com.kmg.receipts.dto;

import com.kmg.receipts.model.BatchSessionRecord;
import com.kmg.receipts.model.BatchStatus;
import com.kmg.receipts.model.ProcessingStrategy;
import com.kmg.receipts.model.RateLimitConfig;

public record BatchStatusView(
        String id,
        String owner,
        BatchStatus status,
        int totalFiles,
        int filesCompleted,
        int filesFailed,
        int filesPending,
        int progressPercent,
        int maxConcurrent,
        ProcessingStrategy processingStrategy,
        RateLimitConfig rateLimitConfig,
        boolean cancelRequested,
        String createdAt,
        String updatedAt,
        String endedAt
) {
    public static BatchStatusView from(BatchSessionRecord session) {
        int settled = session.filesCompleted() + session.filesFailed();
        int percent = session.totalFiles() == 0 ? 100 : settled * 100 / session.totalFiles();
        return new BatchStatusView(
                session.id(),
                session.owner(),
                session.status(),
                session.totalFiles(),
                session.filesCompleted(),
                session.filesFailed(),
                session.filesPending(),
                percent,
                session.maxConcurrent(),
                session.processingStrategy(),
                session.rateLimitConfig(),
                session.cancelRequested(),
                toText(session.createdAt()),
                toText(session.updatedAt()),
                toText(session.endedAt())
        );
    }

    private static String toText(Object value) {
        return value == null ? null : value.toString();
    }
}
