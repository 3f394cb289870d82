package com.kmg.receipts.service.provider;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.kmg.receipts.model.InputType;
import com.kmg.receipts.model.ModelDefinition;
import com.kmg.receipts.model.ReceiptInput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.CollectionUtils;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.stream.Collectors;

public class GeminiProviderAdapter implements ProviderAdapter {
    public static final String PROVIDER_ID = "gemini";

    private static final Logger log = LoggerFactory.getLogger(GeminiProviderAdapter.class);
    private static final double TOP_P = 0.8;
    private static final int TOP_K = 40;

    private final RestClient restClient;
    private final String apiKey;

    public GeminiProviderAdapter(RestClient restClient, String apiKey) {
        this.restClient = restClient;
        this.apiKey = apiKey;
    }

    @Override
    public String providerId() {
        return PROVIDER_ID;
    }

    @Override
    public ProviderResponse generate(ProviderRequest request) {
        ModelDefinition model = request.model();
        log.info("Calling Gemini model '{}' with prompt length {}", model.providerModel(), request.prompt().length());
        GenerateContentRequest payload = buildRequest(request);
        GenerateContentResponse response;
        try {
            response = restClient.post()
                    .uri(uriBuilder -> uriBuilder
                            .path("/models/{model}:generateContent")
                            .queryParam("key", apiKey)
                            .build(model.providerModel()))
                    .body(payload)
                    .retrieve()
                    .body(GenerateContentResponse.class);
        } catch (RestClientException ex) {
            throw ProviderErrors.translate(PROVIDER_ID, ex);
        }
        return new ProviderResponse(extractText(response), totalTokens(response));
    }

    @Override
    public ProviderEmbedding embed(ModelDefinition model, String text) {
        if (!StringUtils.hasText(text)) {
            throw new ModelValidationException(PROVIDER_ID, "Embedding text must not be empty");
        }
        EmbedContentRequest payload = new EmbedContentRequest(
                "models/" + model.providerModel(),
                new Content(null, List.of(Part.ofText(text)))
        );
        EmbedContentResponse response;
        try {
            response = restClient.post()
                    .uri(uriBuilder -> uriBuilder
                            .path("/models/{model}:embedContent")
                            .queryParam("key", apiKey)
                            .build(model.providerModel()))
                    .body(payload)
                    .retrieve()
                    .body(EmbedContentResponse.class);
        } catch (RestClientException ex) {
            throw ProviderErrors.translate(PROVIDER_ID, ex);
        }
        if (response == null || response.embedding() == null || CollectionUtils.isEmpty(response.embedding().values())) {
            throw new ProviderTransientException(PROVIDER_ID, "Gemini returned no embedding values", null);
        }
        // embedContent reports no usage; approximate at four characters per token.
        long tokens = Math.max(1, text.length() / 4);
        return new ProviderEmbedding(response.embedding().values(), tokens);
    }

    private GenerateContentRequest buildRequest(ProviderRequest request) {
        ModelDefinition model = request.model();
        ReceiptInput input = request.input();
        List<Part> parts = new ArrayList<>();
        parts.add(Part.ofText(request.prompt()));
        if (input != null && input.type() == InputType.IMAGE) {
            String encoded = Base64.getEncoder().encodeToString(input.imageData());
            parts.add(new Part(null, new InlineData(input.mimeType(), encoded)));
        }
        GenerationConfig config = new GenerationConfig(model.temperature(), TOP_P, TOP_K, model.maxTokens());
        return new GenerateContentRequest(List.of(new Content("user", parts)), config);
    }

    private String extractText(GenerateContentResponse response) {
        if (response == null || CollectionUtils.isEmpty(response.candidates())) {
            return "";
        }
        Candidate first = response.candidates().get(0);
        if (first == null || first.content() == null || first.content().parts() == null) {
            return "";
        }
        return first.content().parts().stream()
                .map(Part::text)
                .filter(StringUtils::hasText)
                .collect(Collectors.joining());
    }

    private long totalTokens(GenerateContentResponse response) {
        if (response == null || response.usageMetadata() == null || response.usageMetadata().totalTokenCount() == null) {
            return 0L;
        }
        return response.usageMetadata().totalTokenCount();
    }

    record GenerateContentRequest(List<Content> contents, GenerationConfig generationConfig) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    record Content(String role, List<Part> parts) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    record Part(String text, InlineData inlineData) {
        static Part ofText(String text) {
            return new Part(text, null);
        }
    }

    record InlineData(String mimeType, String data) {
    }

    record GenerationConfig(Double temperature, Double topP, Integer topK, Integer maxOutputTokens) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GenerateContentResponse(List<Candidate> candidates, UsageMetadata usageMetadata) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Candidate(Content content, String finishReason) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record UsageMetadata(Long promptTokenCount, Long candidatesTokenCount, Long totalTokenCount) {
    }

    record EmbedContentRequest(String model, Content content) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record EmbedContentResponse(Embedding embedding) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Embedding(List<Double> values) {
    }
}
