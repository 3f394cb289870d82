package com.kmg.receipts.model;

public enum WorkerStatus {
    ACTIVE,
    IDLE,
    STOPPED
}
