package com.kmg.receipts.service.provider;

import com.kmg.receipts.model.ErrorType;
import org.springframework.http.HttpHeaders;
import org.springframework.util.StringUtils;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;

import java.time.Duration;

final class ProviderErrors {

    private ProviderErrors() {
    }

    static ProviderException translate(String provider, RestClientException ex) {
        if (ex instanceof HttpStatusCodeException status) {
            int code = status.getStatusCode().value();
            if (code == 429) {
                return new ProviderRateLimitedException(provider, retryAfter(status.getResponseHeaders()),
                        provider + " returned 429");
            }
            if (code >= 500 || code == 408) {
                return new ProviderTransientException(provider, provider + " returned " + code, ex);
            }
            return new ProviderException(ErrorType.VALIDATION_ERROR, provider, provider + " rejected the request with " + code, ex);
        }
        if (ex instanceof ResourceAccessException) {
            return new ProviderTransientException(provider, provider + " did not answer in time", ex);
        }
        return new ProviderTransientException(provider, provider + " call failed", ex);
    }

    static Duration retryAfter(HttpHeaders headers) {
        if (headers == null) {
            return null;
        }
        String value = headers.getFirst(HttpHeaders.RETRY_AFTER);
        if (!StringUtils.hasText(value)) {
            return null;
        }
        try {
            return Duration.ofSeconds(Long.parseLong(value.trim()));
        } catch (NumberFormatException ex) {
            // HTTP-date form; the configured cool-down applies instead.
            return null;
        }
    }
}
