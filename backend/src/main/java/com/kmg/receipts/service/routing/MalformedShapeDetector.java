package com.kmg.receipts.service.routing;

import com.fasterxml.jackson.databind.JsonNode;

public interface MalformedShapeDetector {

    String name();

    boolean matches(JsonNode node);
}
