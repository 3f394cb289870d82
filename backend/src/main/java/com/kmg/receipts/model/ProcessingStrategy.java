package com.kmg.receipts.model;

public enum ProcessingStrategy {
    CONSERVATIVE(1, 30, 50_000),
    BALANCED(3, 60, 100_000),
    AGGRESSIVE(5, 120, 200_000);

    private final int maxConcurrent;
    private final int requestsPerMinute;
    private final int tokensPerMinute;

    ProcessingStrategy(int maxConcurrent, int requestsPerMinute, int tokensPerMinute) {
        this.maxConcurrent = maxConcurrent;
        this.requestsPerMinute = requestsPerMinute;
        this.tokensPerMinute = tokensPerMinute;
    }

    public RateLimitConfig rateLimitConfig(int maxConcurrentOverride) {
        int concurrent = maxConcurrentOverride > 0 ? maxConcurrentOverride : maxConcurrent;
        return new RateLimitConfig(concurrent, requestsPerMinute, tokensPerMinute);
    }

    public int maxConcurrent() {
        return maxConcurrent;
    }
}
