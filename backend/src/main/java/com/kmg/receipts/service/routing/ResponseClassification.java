package com.kmg.receipts.service.routing;

import java.util.Map;

public record ResponseClassification(Outcome outcome, Map<String, Object> fields, String reason) {

    public enum Outcome {
        OK,
        MALFORMED,
        PROVIDER_ERROR
    }

    public static ResponseClassification ok(Map<String, Object> fields) {
        return new ResponseClassification(Outcome.OK, fields, null);
    }

    public static ResponseClassification malformed(String reason) {
        return new ResponseClassification(Outcome.MALFORMED, null, reason);
    }

    public static ResponseClassification providerError(String reason) {
        return new ResponseClassification(Outcome.PROVIDER_ERROR, null, reason);
    }

    public boolean isOk() {
        return outcome == Outcome.OK;
    }
}
