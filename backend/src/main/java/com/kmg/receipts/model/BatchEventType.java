package com.kmg.receipts.model;

public enum BatchEventType {
    CREATED("batch-created"),
    PROGRESS("batch-progress"),
    FINISHED("batch-finished");

    private final String eventName;

    BatchEventType(String eventName) {
        this.eventName = eventName;
    }

    public String eventName() {
        return eventName;
    }
}
