package com.kmg.receipts.service.provider;

import com.kmg.receipts.model.ErrorType;
import com.kmg.receipts.model.ModelDefinition;
import com.kmg.receipts.model.ReceiptInput;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.test.web.client.match.MockRestRequestMatchers;
import org.springframework.test.web.client.response.MockRestResponseCreators;
import org.springframework.web.client.RestClient;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.containsString;

class GeminiProviderAdapterTest {
    private static final ModelDefinition VISION = new ModelDefinition("gemini-2.0-flash-lite", "Gemini 2.0 Flash Lite",
            "gemini", "gemini-2.0-flash-lite", 0.1, 1500, true, true, false, null);
    private static final ModelDefinition EMBEDDING = new ModelDefinition("text-embedding-004", "Text Embedding 004",
            "gemini", "text-embedding-004", 0.0, 0, true, false, true, null);

    private MockRestServiceServer server;
    private GeminiProviderAdapter adapter;

    @BeforeEach
    void setUp() {
        RestClient.Builder restClientBuilder = RestClient.builder().baseUrl("http://gemini.test/v1beta");
        server = MockRestServiceServer.bindTo(restClientBuilder).build();
        adapter = new GeminiProviderAdapter(restClientBuilder.build(), "test-key");
    }

    @Test
    void sendsPromptAndImageAndReadsTextWithUsage() {
        server.expect(ExpectedCount.once(),
                        MockRestRequestMatchers.requestTo(containsString("/v1beta/models/gemini-2.0-flash-lite:generateContent")))
                .andExpect(MockRestRequestMatchers.method(HttpMethod.POST))
                .andExpect(MockRestRequestMatchers.queryParam("key", "test-key"))
                .andExpect(MockRestRequestMatchers.jsonPath("$.contents[0].parts[0].text").value("Read this receipt"))
                .andExpect(MockRestRequestMatchers.jsonPath("$.contents[0].parts[1].inlineData.mimeType").value("image/png"))
                .andExpect(MockRestRequestMatchers.jsonPath("$.contents[0].parts[1].inlineData.data").value("AQID"))
                .andExpect(MockRestRequestMatchers.jsonPath("$.generationConfig.maxOutputTokens").value(1500))
                .andRespond(MockRestResponseCreators.withSuccess("""
                        {
                          "candidates": [{"content": {"role": "model", "parts": [{"text": "{\\"merchant\\": "}, {"text": "\\"Tesco\\"}"}]}}],
                          "usageMetadata": {"promptTokenCount": 300, "candidatesTokenCount": 42, "totalTokenCount": 342}
                        }
                        """, MediaType.APPLICATION_JSON));

        ProviderResponse response = adapter.generate(new ProviderRequest(VISION, "Read this receipt",
                ReceiptInput.image(new byte[]{1, 2, 3}, "image/png")));

        server.verify();
        assertThat(response.text()).isEqualTo("{\"merchant\": \"Tesco\"}");
        assertThat(response.tokensUsed()).isEqualTo(342);
    }

    @Test
    void answerWithoutCandidatesIsEmptyText() {
        server.expect(MockRestRequestMatchers.requestTo(containsString(":generateContent")))
                .andRespond(MockRestResponseCreators.withSuccess("{\"candidates\": []}", MediaType.APPLICATION_JSON));

        ProviderResponse response = adapter.generate(new ProviderRequest(VISION, "prompt", ReceiptInput.text("TOTAL 5.00")));

        assertThat(response.text()).isEmpty();
        assertThat(response.tokensUsed()).isZero();
    }

    @Test
    void tooManyRequestsCarriesRetryAfter() {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.RETRY_AFTER, "17");
        server.expect(MockRestRequestMatchers.requestTo(containsString(":generateContent")))
                .andRespond(MockRestResponseCreators.withStatus(HttpStatus.TOO_MANY_REQUESTS).headers(headers));

        assertThatThrownBy(() -> adapter.generate(new ProviderRequest(VISION, "prompt", ReceiptInput.text("x"))))
                .isInstanceOfSatisfying(ProviderRateLimitedException.class, ex -> {
                    assertThat(ex.retryAfter()).isEqualTo(Duration.ofSeconds(17));
                    assertThat(ex.provider()).isEqualTo("gemini");
                    assertThat(ex.retryable()).isTrue();
                });
    }

    @Test
    void serverErrorIsTransient() {
        server.expect(MockRestRequestMatchers.requestTo(containsString(":generateContent")))
                .andRespond(MockRestResponseCreators.withStatus(HttpStatus.SERVICE_UNAVAILABLE));

        assertThatThrownBy(() -> adapter.generate(new ProviderRequest(VISION, "prompt", ReceiptInput.text("x"))))
                .isInstanceOfSatisfying(ProviderTransientException.class,
                        ex -> assertThat(ex.errorType()).isEqualTo(ErrorType.PROVIDER_TRANSIENT_ERROR));
    }

    @Test
    void badRequestIsNotRetryable() {
        server.expect(MockRestRequestMatchers.requestTo(containsString(":generateContent")))
                .andRespond(MockRestResponseCreators.withBadRequest());

        assertThatThrownBy(() -> adapter.generate(new ProviderRequest(VISION, "prompt", ReceiptInput.text("x"))))
                .isInstanceOfSatisfying(ProviderException.class, ex -> {
                    assertThat(ex.errorType()).isEqualTo(ErrorType.VALIDATION_ERROR);
                    assertThat(ex.retryable()).isFalse();
                });
    }

    @Test
    void embedsTextAndEstimatesTokens() {
        server.expect(ExpectedCount.once(),
                        MockRestRequestMatchers.requestTo(containsString("/v1beta/models/text-embedding-004:embedContent")))
                .andExpect(MockRestRequestMatchers.queryParam("key", "test-key"))
                .andExpect(MockRestRequestMatchers.jsonPath("$.model").value("models/text-embedding-004"))
                .andExpect(MockRestRequestMatchers.jsonPath("$.content.parts[0].text").value("merchant: Tesco total: 12.50"))
                .andRespond(MockRestResponseCreators.withSuccess(
                        "{\"embedding\": {\"values\": [0.1, -0.2, 0.3]}}", MediaType.APPLICATION_JSON));

        ProviderEmbedding embedding = adapter.embed(EMBEDDING, "merchant: Tesco total: 12.50");

        server.verify();
        assertThat(embedding.values()).containsExactly(0.1, -0.2, 0.3);
        assertThat(embedding.tokensUsed()).isEqualTo(7);
    }

    @Test
    void blankEmbeddingTextIsRejectedWithoutACall() {
        assertThatThrownBy(() -> adapter.embed(EMBEDDING, "  "))
                .isInstanceOf(ModelValidationException.class);
        server.verify();
    }
}
