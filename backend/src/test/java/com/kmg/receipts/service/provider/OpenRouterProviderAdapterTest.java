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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OpenRouterProviderAdapterTest {
    private static final ModelDefinition QWEN = new ModelDefinition("openrouter-qwen-vl", "Qwen VL",
            "openrouter", "qwen/qwen2.5-vl-72b-instruct", 0.2, 1200, true, true, false, null);

    private MockRestServiceServer server;
    private OpenRouterProviderAdapter adapter;

    @BeforeEach
    void setUp() {
        RestClient.Builder restClientBuilder = RestClient.builder().baseUrl("http://openrouter.test/api/v1");
        server = MockRestServiceServer.bindTo(restClientBuilder).build();
        adapter = new OpenRouterProviderAdapter(restClientBuilder.build(), "test-key");
    }

    @Test
    void sendsChatCompletionWithImageDataUri() {
        server.expect(ExpectedCount.once(), MockRestRequestMatchers.requestTo("http://openrouter.test/api/v1/chat/completions"))
                .andExpect(MockRestRequestMatchers.method(HttpMethod.POST))
                .andExpect(MockRestRequestMatchers.header(HttpHeaders.AUTHORIZATION, "Bearer test-key"))
                .andExpect(MockRestRequestMatchers.jsonPath("$.model").value("qwen/qwen2.5-vl-72b-instruct"))
                .andExpect(MockRestRequestMatchers.jsonPath("$.max_tokens").value(1200))
                .andExpect(MockRestRequestMatchers.jsonPath("$.messages[0].content[0].type").value("text"))
                .andExpect(MockRestRequestMatchers.jsonPath("$.messages[0].content[1].image_url.url")
                        .value("data:image/jpeg;base64,AQID"))
                .andRespond(MockRestResponseCreators.withSuccess("""
                        {
                          "choices": [{"message": {"role": "assistant", "content": "{\\"total\\": 12.5}"}}],
                          "usage": {"prompt_tokens": 200, "completion_tokens": 20, "total_tokens": 220}
                        }
                        """, MediaType.APPLICATION_JSON));

        ProviderResponse response = adapter.generate(new ProviderRequest(QWEN, "Read this receipt",
                ReceiptInput.image(new byte[]{1, 2, 3}, null)));

        server.verify();
        assertThat(response.text()).isEqualTo("{\"total\": 12.5}");
        assertThat(response.tokensUsed()).isEqualTo(220);
    }

    @Test
    void textInputSendsOnlyTheTextPart() {
        server.expect(MockRestRequestMatchers.requestTo("http://openrouter.test/api/v1/chat/completions"))
                .andExpect(MockRestRequestMatchers.jsonPath("$.messages[0].content[1]").doesNotExist())
                .andRespond(MockRestResponseCreators.withSuccess("{\"choices\": []}", MediaType.APPLICATION_JSON));

        ProviderResponse response = adapter.generate(new ProviderRequest(QWEN, "prompt", ReceiptInput.text("TOTAL 1.00")));

        server.verify();
        assertThat(response.text()).isEmpty();
    }

    @Test
    void rateLimitWithoutRetryAfterLeavesTheDelayToConfiguration() {
        server.expect(MockRestRequestMatchers.requestTo("http://openrouter.test/api/v1/chat/completions"))
                .andRespond(MockRestResponseCreators.withStatus(HttpStatus.TOO_MANY_REQUESTS));

        assertThatThrownBy(() -> adapter.generate(new ProviderRequest(QWEN, "prompt", ReceiptInput.text("x"))))
                .isInstanceOfSatisfying(ProviderRateLimitedException.class, ex -> {
                    assertThat(ex.retryAfter()).isNull();
                    assertThat(ex.provider()).isEqualTo("openrouter");
                });
    }

    @Test
    void unauthorizedIsAValidationError() {
        server.expect(MockRestRequestMatchers.requestTo("http://openrouter.test/api/v1/chat/completions"))
                .andRespond(MockRestResponseCreators.withUnauthorizedRequest());

        assertThatThrownBy(() -> adapter.generate(new ProviderRequest(QWEN, "prompt", ReceiptInput.text("x"))))
                .isInstanceOfSatisfying(ProviderException.class,
                        ex -> assertThat(ex.errorType()).isEqualTo(ErrorType.VALIDATION_ERROR));
    }

    @Test
    void doesNotEmbed() {
        assertThatThrownBy(() -> adapter.embed(QWEN, "text"))
                .isInstanceOf(ModelValidationException.class);
    }
}
