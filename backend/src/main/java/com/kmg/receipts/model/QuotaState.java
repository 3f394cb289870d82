package com.kmg.receipts.model;

import java.time.OffsetDateTime;

public record QuotaState(
        String provider,
        OffsetDateTime windowStart,
        long windowMillis,
        int requestsUsed,
        long tokensUsed,
        int requestLimit,
        long tokenLimit,
        OffsetDateTime cooldownUntil,
        OffsetDateTime updatedAt
) {
    public boolean coolingDown(OffsetDateTime now) {
        return cooldownUntil != null && cooldownUntil.isAfter(now);
    }
}
