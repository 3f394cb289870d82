package com.kmg.receipts.service.provider;

import com.kmg.receipts.model.ErrorType;

public class ProviderException extends RuntimeException {
    private final ErrorType errorType;
    private final String provider;

    public ProviderException(ErrorType errorType, String provider, String message) {
        super(message);
        this.errorType = errorType;
        this.provider = provider;
    }

    public ProviderException(ErrorType errorType, String provider, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
        this.provider = provider;
    }

    public ErrorType errorType() {
        return errorType;
    }

    public String provider() {
        return provider;
    }

    public boolean retryable() {
        return errorType.retryable();
    }
}
