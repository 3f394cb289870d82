package com.kmg.receipts.service.provider;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.kmg.receipts.model.InputType;
import com.kmg.receipts.model.ModelDefinition;
import com.kmg.receipts.model.ReceiptInput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.util.CollectionUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

public class OpenRouterProviderAdapter implements ProviderAdapter {
    public static final String PROVIDER_ID = "openrouter";

    private static final Logger log = LoggerFactory.getLogger(OpenRouterProviderAdapter.class);

    private final RestClient restClient;
    private final String apiKey;

    public OpenRouterProviderAdapter(RestClient restClient, String apiKey) {
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
        log.info("Calling OpenRouter model '{}' with prompt length {}", model.providerModel(), request.prompt().length());
        ChatRequest payload = new ChatRequest(
                model.providerModel(),
                List.of(new Message("user", buildContent(request))),
                model.temperature(),
                model.maxTokens()
        );
        ChatResponse response;
        try {
            response = restClient.post()
                    .uri("/chat/completions")
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                    .body(payload)
                    .retrieve()
                    .body(ChatResponse.class);
        } catch (RestClientException ex) {
            throw ProviderErrors.translate(PROVIDER_ID, ex);
        }
        return new ProviderResponse(extractText(response), totalTokens(response));
    }

    private List<ContentPart> buildContent(ProviderRequest request) {
        List<ContentPart> parts = new ArrayList<>();
        parts.add(new ContentPart("text", request.prompt(), null));
        ReceiptInput input = request.input();
        if (input != null && input.type() == InputType.IMAGE) {
            String dataUri = "data:" + input.mimeType() + ";base64," + Base64.getEncoder().encodeToString(input.imageData());
            parts.add(new ContentPart("image_url", null, new ImageUrl(dataUri)));
        }
        return parts;
    }

    private String extractText(ChatResponse response) {
        if (response == null || CollectionUtils.isEmpty(response.choices())) {
            return "";
        }
        Choice first = response.choices().get(0);
        if (first == null || first.message() == null || first.message().content() == null) {
            return "";
        }
        return first.message().content();
    }

    private long totalTokens(ChatResponse response) {
        if (response == null || response.usage() == null || response.usage().totalTokens() == null) {
            return 0L;
        }
        return response.usage().totalTokens();
    }

    record ChatRequest(
            String model,
            List<Message> messages,
            Double temperature,
            @JsonProperty("max_tokens") Integer maxTokens
    ) {
    }

    record Message(String role, List<ContentPart> content) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record ContentPart(String type, String text, @JsonProperty("image_url") ImageUrl imageUrl) {
    }

    record ImageUrl(String url) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ChatResponse(List<Choice> choices, Usage usage) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Choice(ResponseMessage message) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ResponseMessage(String role, String content) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Usage(@JsonProperty("total_tokens") Long totalTokens) {
    }
}
