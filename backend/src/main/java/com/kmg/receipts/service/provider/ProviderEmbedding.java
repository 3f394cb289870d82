package com.kmg.receipts.service.provider;

import java.util.List;

public record ProviderEmbedding(List<Double> values, long tokensUsed) {
}
