package com.kmg.receipts.service;

import com.kmg.receipts.config.ReceiptsProperties;
import com.kmg.receipts.model.QuotaState;
import com.kmg.receipts.repo.QuotaRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;

@Service
public class QuotaService {
    private static final Logger log = LoggerFactory.getLogger(QuotaService.class);
    private static final long MINUTE_MS = 60_000L;

    private final QuotaRepository quotaRepository;
    private final TimeService timeService;
    private final ReceiptsProperties properties;

    public QuotaService(QuotaRepository quotaRepository, TimeService timeService, ReceiptsProperties properties) {
        this.quotaRepository = quotaRepository;
        this.timeService = timeService;
        this.properties = properties;
    }

    public boolean admit(String provider, long estimatedTokens) {
        OffsetDateTime now = timeService.now();
        QuotaState state = currentWindow(provider, now);
        if (state.coolingDown(now)) {
            return false;
        }
        if (quotaRepository.tryConsume(provider, state.windowStart(), estimatedTokens, now)) {
            return true;
        }
        // Another worker may have rolled the window between our read and the update.
        QuotaState reread = currentWindow(provider, now);
        if (reread.windowStart().equals(state.windowStart())) {
            return false;
        }
        return quotaRepository.tryConsume(provider, reread.windowStart(), estimatedTokens, now);
    }

    public void reconcile(String provider, long estimatedTokens, long actualTokens) {
        if (actualTokens <= 0 || actualTokens == estimatedTokens) {
            return;
        }
        OffsetDateTime now = timeService.now();
        QuotaState state = currentWindow(provider, now);
        quotaRepository.adjustTokens(provider, state.windowStart(), actualTokens - estimatedTokens, now);
    }

    public Duration enterCooldown(String provider, Duration requested) {
        Duration configured = Duration.ofMillis(settings(provider).getCooldownMs());
        Duration cooldown = requested != null && requested.compareTo(configured) > 0 ? requested : configured;
        OffsetDateTime now = timeService.now();
        currentWindow(provider, now);
        quotaRepository.extendCooldown(provider, now.plus(cooldown), now);
        log.warn("Provider '{}' rate limited; pausing admission for {} ms", provider, cooldown.toMillis());
        return cooldown;
    }

    public Duration remainingCooldown(String provider) {
        OffsetDateTime now = timeService.now();
        return quotaRepository.findByProvider(provider)
                .filter(state -> state.coolingDown(now))
                .map(state -> Duration.between(now, state.cooldownUntil()))
                .orElse(Duration.ZERO);
    }

    public List<QuotaState> usage() {
        return quotaRepository.findAll();
    }

    private QuotaState currentWindow(String provider, OffsetDateTime now) {
        ReceiptsProperties.Provider settings = settings(provider);
        long windowMs = settings.getWindowMs();
        int requestLimit = scaleToWindow(settings.getRequestsPerMinute(), windowMs);
        long tokenLimit = scaleToWindow(settings.getTokensPerMinute(), windowMs);

        quotaRepository.insertIfAbsent(provider, windowMs, requestLimit, tokenLimit, now);
        QuotaState state = quotaRepository.findByProvider(provider)
                .orElseThrow(() -> new IllegalStateException("Quota row missing for provider " + provider));
        if (!now.isBefore(state.windowStart().plusNanos(state.windowMillis() * 1_000_000L))) {
            quotaRepository.rollWindow(provider, state.windowStart(), windowMs, requestLimit, tokenLimit, now);
            state = quotaRepository.findByProvider(provider).orElseThrow();
        }
        return state;
    }

    private ReceiptsProperties.Provider settings(String provider) {
        ReceiptsProperties.Provider settings = properties.getProviders().get(provider);
        if (settings == null) {
            throw new IllegalStateException("No quota configuration for provider: " + provider);
        }
        return settings;
    }

    private static int scaleToWindow(int perMinute, long windowMs) {
        return (int) Math.max(1L, Math.round(perMinute * (double) windowMs / MINUTE_MS));
    }

    private static long scaleToWindow(long perMinute, long windowMs) {
        return Math.max(1L, Math.round(perMinute * (double) windowMs / MINUTE_MS));
    }
}
