package com.kmg.receipts.model;

import java.util.Map;

public record ExtractionResult(
        Map<String, Object> fields,
        String modelRequested,
        String modelUsed,
        String provider,
        long tokensUsed
) {
    public boolean fallbackUsed() {
        return !modelRequested.equals(modelUsed);
    }
}
