package com.kmg.receipts.model;

public record RateLimitConfig(
        int maxConcurrentRequests,
        int requestsPerMinute,
        int tokensPerMinute
) {
}
