package com.kmg.receipts.service.provider;

public record ProviderResponse(String text, long tokensUsed) {
}
