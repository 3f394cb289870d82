package com.kmg.receipts.service.provider;

import com.kmg.receipts.model.ErrorType;

public class ProviderMalformedResponseException extends ProviderException {
    private final String model;

    public ProviderMalformedResponseException(String provider, String model, String message) {
        super(ErrorType.PROVIDER_MALFORMED_RESPONSE, provider, message);
        this.model = model;
    }

    public String model() {
        return model;
    }
}
