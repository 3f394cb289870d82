package com.kmg.receipts.dto;

public record EnqueueResponse(String jobId, boolean created) {
}
