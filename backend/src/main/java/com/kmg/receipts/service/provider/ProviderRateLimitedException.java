package com.kmg.receipts.service.provider;

import com.kmg.receipts.model.ErrorType;

import java.time.Duration;

public class ProviderRateLimitedException extends ProviderException {
    private final Duration retryAfter;

    public ProviderRateLimitedException(String provider, Duration retryAfter, String message) {
        super(ErrorType.PROVIDER_RATE_LIMITED, provider, message);
        this.retryAfter = retryAfter;
    }

    public Duration retryAfter() {
        return retryAfter;
    }
}
