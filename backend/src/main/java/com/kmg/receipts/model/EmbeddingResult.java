package com.kmg.receipts.model;

import java.util.List;

public record EmbeddingResult(List<Double> vector, String model, String provider, long tokensUsed) {
    public int dimensions() {
        return vector.size();
    }
}
