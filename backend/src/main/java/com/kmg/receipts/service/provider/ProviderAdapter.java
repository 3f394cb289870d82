package com.kmg.receipts.service.provider;

import com.kmg.receipts.model.ModelDefinition;

public interface ProviderAdapter {

    String providerId();

    ProviderResponse generate(ProviderRequest request);

    default ProviderEmbedding embed(ModelDefinition model, String text) {
        throw new ModelValidationException(providerId(), "Provider does not support embeddings: " + providerId());
    }
}
