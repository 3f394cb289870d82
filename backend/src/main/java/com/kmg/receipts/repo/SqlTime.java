package com.kmg.receipts.repo;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Timestamps are stored as fixed-width UTC text so that SQL string comparison matches time order.
 */
public final class SqlTime {
    private static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSSSS'Z'");

    private SqlTime() {
    }

    public static String format(OffsetDateTime value) {
        if (value == null) {
            return null;
        }
        return FORMAT.format(value.withOffsetSameInstant(ZoneOffset.UTC));
    }

    public static OffsetDateTime parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return OffsetDateTime.parse(value);
    }
}
