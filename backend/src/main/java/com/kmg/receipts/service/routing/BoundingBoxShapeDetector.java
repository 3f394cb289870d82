package com.kmg.receipts.service.routing;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

@Component
public class BoundingBoxShapeDetector implements MalformedShapeDetector {
    private static final String BOX_FIELD = "box_2d";

    @Override
    public String name() {
        return "bounding-box";
    }

    @Override
    public boolean matches(JsonNode node) {
        if (node == null) {
            return false;
        }
        if (node.isArray()) {
            for (JsonNode element : node) {
                if (element.isObject() && element.has(BOX_FIELD)) {
                    return true;
                }
            }
            return false;
        }
        return node.isObject() && node.has(BOX_FIELD);
    }
}
