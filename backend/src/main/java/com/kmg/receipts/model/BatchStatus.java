package com.kmg.receipts.model;

public enum BatchStatus {
    RUNNING,
    COMPLETED,
    PARTIAL,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
