package com.kmg.receipts.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class EmbeddingTextBuilder {
    private static final String[] FIELDS = {"merchant", "date", "total", "currency", "payment_method", "predicted_category"};

    private final ObjectMapper objectMapper;

    public EmbeddingTextBuilder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String build(String resultJson) {
        JsonNode root;
        try {
            root = objectMapper.readTree(resultJson);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored extraction result is not valid JSON", e);
        }

        List<String> lines = new ArrayList<>();
        for (String field : FIELDS) {
            JsonNode value = root.get(field);
            if (value != null && !value.isNull() && !value.asText().isBlank()) {
                lines.add(field + ": " + value.asText());
            }
        }
        JsonNode items = root.get("line_items");
        if (items != null && items.isArray()) {
            for (JsonNode item : items) {
                JsonNode description = item.get("description");
                if (description != null && !description.asText().isBlank()) {
                    JsonNode amount = item.get("amount");
                    lines.add("item: " + description.asText() + (amount == null || amount.isNull() ? "" : " " + amount.asText()));
                }
            }
        }
        return String.join("\n", lines);
    }
}
