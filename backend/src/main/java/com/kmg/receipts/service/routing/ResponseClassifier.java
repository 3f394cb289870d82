package com.kmg.receipts.service.routing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
public class ResponseClassifier {
    private static final Pattern JSON_OBJECT = Pattern.compile("\\{[\\s\\S]*\\}");
    private static final Pattern CODE_FENCE = Pattern.compile("^```[a-zA-Z]*\\s*|\\s*```$");
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final List<MalformedShapeDetector> detectors;

    public ResponseClassifier(ObjectMapper objectMapper, List<MalformedShapeDetector> detectors) {
        this.objectMapper = objectMapper;
        this.detectors = List.copyOf(detectors);
    }

    public ResponseClassification classify(String text) {
        if (!StringUtils.hasText(text)) {
            return ResponseClassification.providerError("Empty response");
        }

        // The whole answer is checked first so that an array of annotations is seen as such.
        String unfenced = CODE_FENCE.matcher(text.trim()).replaceAll("");
        JsonNode whole = readTree(unfenced);
        if (whole != null) {
            String shape = detectShape(whole);
            if (shape != null) {
                return ResponseClassification.malformed("Matched " + shape + " shape");
            }
            if (whole.isObject()) {
                return ResponseClassification.ok(toMap(whole));
            }
        }

        Matcher matcher = JSON_OBJECT.matcher(text);
        if (!matcher.find()) {
            return ResponseClassification.malformed("No JSON object in response");
        }
        JsonNode embedded = readTree(matcher.group());
        if (embedded == null || !embedded.isObject()) {
            return ResponseClassification.malformed("Unparseable JSON object");
        }
        String shape = detectShape(embedded);
        if (shape != null) {
            return ResponseClassification.malformed("Matched " + shape + " shape");
        }
        return ResponseClassification.ok(toMap(embedded));
    }

    private String detectShape(JsonNode node) {
        for (MalformedShapeDetector detector : detectors) {
            if (detector.matches(node)) {
                return detector.name();
            }
        }
        return null;
    }

    private JsonNode readTree(String text) {
        try {
            return objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private Map<String, Object> toMap(JsonNode node) {
        return objectMapper.convertValue(node, MAP_TYPE);
    }
}
