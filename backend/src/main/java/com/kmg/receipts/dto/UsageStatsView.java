package com.kmg.receipts.dto;

import java.util.List;

public record UsageStatsView(List<ProviderWindow> windows, List<ProviderTotals> totals) {

    public record ProviderWindow(
            String provider,
            String windowStart,
            long windowMs,
            int requestsUsed,
            int requestLimit,
            long tokensUsed,
            long tokenLimit,
            String cooldownUntil
    ) {
    }

    public record ProviderTotals(String provider, long attempts, long successes, long failures, long tokensUsed) {
    }
}
