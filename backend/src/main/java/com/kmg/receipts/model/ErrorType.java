package com.kmg.receipts.model;

public enum ErrorType {
    VALIDATION_ERROR(false, "The selected model cannot process this input"),
    PROVIDER_RATE_LIMITED(true, "The AI provider is rate limiting requests"),
    PROVIDER_TRANSIENT_ERROR(true, "The AI provider is temporarily unavailable"),
    PROVIDER_MALFORMED_RESPONSE(false, "The AI provider returned an unreadable result"),
    WORKER_CRASH(true, "Processing was interrupted and will be retried"),
    RATE_LIMIT_DEFERRED(true, "Waiting for provider capacity"),
    SOURCE_UNAVAILABLE(false, "The uploaded file could not be read"),
    INTERNAL_ERROR(false, "Processing failed unexpectedly");

    private final boolean retryable;
    private final String publicMessage;

    ErrorType(boolean retryable, String publicMessage) {
        this.retryable = retryable;
        this.publicMessage = publicMessage;
    }

    public boolean retryable() {
        return retryable;
    }

    public String publicMessage() {
        return publicMessage;
    }
}
