package com.kmg.receipts.service.provider;

import com.kmg.receipts.model.ErrorType;

public class ProviderTransientException extends ProviderException {
    public ProviderTransientException(String provider, String message, Throwable cause) {
        super(ErrorType.PROVIDER_TRANSIENT_ERROR, provider, message, cause);
    }
}
