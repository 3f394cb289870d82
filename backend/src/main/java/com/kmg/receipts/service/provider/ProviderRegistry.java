package com.kmg.receipts.service.provider;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class ProviderRegistry {
    private final Map<String, ProviderAdapter> adapters = new LinkedHashMap<>();

    public ProviderRegistry(List<ProviderAdapter> adapters) {
        for (ProviderAdapter adapter : adapters) {
            ProviderAdapter previous = this.adapters.put(adapter.providerId(), adapter);
            if (previous != null) {
                throw new IllegalStateException("Duplicate provider adapter: " + adapter.providerId());
            }
        }
    }

    public ProviderAdapter get(String providerId) {
        ProviderAdapter adapter = adapters.get(providerId);
        if (adapter == null) {
            throw new IllegalStateException("No adapter registered for provider: " + providerId);
        }
        return adapter;
    }
}
