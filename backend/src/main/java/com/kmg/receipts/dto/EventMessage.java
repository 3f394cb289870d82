package com.kmg.receipts.dto;

public record EventMessage(
        String type,
        String batchId,
        String message,
        String timestamp,
        BatchStatusView batch
) {
}
