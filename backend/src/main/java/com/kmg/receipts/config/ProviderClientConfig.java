package com.kmg.receipts.config;

import com.kmg.receipts.service.provider.GeminiProviderAdapter;
import com.kmg.receipts.service.provider.OpenRouterProviderAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

@Configuration
public class ProviderClientConfig {
    private static final Logger log = LoggerFactory.getLogger(ProviderClientConfig.class);

    @Bean
    @ConditionalOnProperty(prefix = "receipts.providers.gemini", name = "base-url")
    public GeminiProviderAdapter geminiProviderAdapter(RestClient.Builder builder, ReceiptsProperties properties) {
        ReceiptsProperties.Provider settings = settings(properties, GeminiProviderAdapter.PROVIDER_ID);
        return new GeminiProviderAdapter(restClient(builder, settings), settings.getApiKey());
    }

    @Bean
    @ConditionalOnProperty(prefix = "receipts.providers.openrouter", name = "base-url")
    public OpenRouterProviderAdapter openRouterProviderAdapter(RestClient.Builder builder, ReceiptsProperties properties) {
        ReceiptsProperties.Provider settings = settings(properties, OpenRouterProviderAdapter.PROVIDER_ID);
        return new OpenRouterProviderAdapter(restClient(builder, settings), settings.getApiKey());
    }

    private ReceiptsProperties.Provider settings(ReceiptsProperties properties, String providerId) {
        ReceiptsProperties.Provider settings = properties.getProviders().get(providerId);
        if (settings == null) {
            throw new IllegalStateException("Missing receipts.providers." + providerId + " configuration");
        }
        if (!StringUtils.hasText(settings.getApiKey())) {
            log.warn("No API key configured for provider '{}'; calls will be rejected by the provider", providerId);
        }
        return settings;
    }

    private RestClient restClient(RestClient.Builder builder, ReceiptsProperties.Provider settings) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(settings.getConnectTimeoutMs());
        requestFactory.setReadTimeout(settings.getReadTimeoutMs());
        return builder.clone()
                .baseUrl(settings.getBaseUrl())
                .requestFactory(requestFactory)
                .build();
    }
}
