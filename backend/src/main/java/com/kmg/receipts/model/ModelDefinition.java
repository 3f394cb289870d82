package com.kmg.receipts.model;

public record ModelDefinition(
        String id,
        String name,
        String provider,
        String providerModel,
        double temperature,
        int maxTokens,
        boolean supportsText,
        boolean supportsVision,
        boolean supportsEmbedding,
        String fallbackModel
) {
    public boolean supports(InputType type) {
        return switch (type) {
            case TEXT -> supportsText;
            case IMAGE -> supportsVision;
        };
    }

    public boolean hasFallback() {
        return fallbackModel != null && !fallbackModel.isBlank() && !fallbackModel.equals(id);
    }
}
