package com.kmg.receipts.service.provider;

import com.kmg.receipts.model.ErrorType;

public class ModelValidationException extends ProviderException {
    public ModelValidationException(String provider, String message) {
        super(ErrorType.VALIDATION_ERROR, provider, message);
    }
}
