package com.kmg.receipts.model;

public enum JobStatus {
    PENDING,
    CLAIMED,
    PROCESSING,
    COMPLETED,
    FAILED,
    CANCELLED
}
