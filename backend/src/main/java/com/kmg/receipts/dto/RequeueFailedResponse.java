package com.kmg.receipts.dto;

public record RequeueFailedResponse(int requeued) {
}
