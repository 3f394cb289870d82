package com.kmg.receipts.service;

import com.kmg.receipts.dto.UsageStatsView;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;

@Service
public class UsageService {
    private static final Duration TOTALS_PERIOD = Duration.ofHours(24);

    private final QuotaService quotaService;
    private final MetricsService metricsService;

    public UsageService(QuotaService quotaService, MetricsService metricsService) {
        this.quotaService = quotaService;
        this.metricsService = metricsService;
    }

    public UsageStatsView usage() {
        List<UsageStatsView.ProviderWindow> windows = quotaService.usage().stream()
                .map(state -> new UsageStatsView.ProviderWindow(
                        state.provider(),
                        state.windowStart().toString(),
                        state.windowMillis(),
                        state.requestsUsed(),
                        state.requestLimit(),
                        state.tokensUsed(),
                        state.tokenLimit(),
                        state.cooldownUntil() == null ? null : state.cooldownUntil().toString()
                ))
                .toList();
        List<UsageStatsView.ProviderTotals> totals = metricsService.providerUsage(TOTALS_PERIOD).stream()
                .map(usage -> new UsageStatsView.ProviderTotals(
                        usage.provider(),
                        usage.attempts(),
                        usage.successes(),
                        usage.failures(),
                        usage.tokensUsed()
                ))
                .toList();
        return new UsageStatsView(windows, totals);
    }
}
