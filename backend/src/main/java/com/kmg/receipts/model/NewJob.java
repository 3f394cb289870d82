package com.kmg.receipts.model;

public record NewJob(
        String sourceType,
        String sourceId,
        JobOperation operation,
        JobPriority priority,
        String batchId,
        String modelPreference
) {
    public NewJob {
        if (sourceType == null || sourceType.isBlank()) {
            throw new IllegalArgumentException("sourceType is required");
        }
        if (sourceId == null || sourceId.isBlank()) {
            throw new IllegalArgumentException("sourceId is required");
        }
        if (operation == null) {
            throw new IllegalArgumentException("operation is required");
        }
        if (priority == null) {
            priority = JobPriority.MEDIUM;
        }
    }

    public static NewJob of(String sourceType, String sourceId, JobOperation operation, JobPriority priority) {
        return new NewJob(sourceType, sourceId, operation, priority, null, null);
    }
}
