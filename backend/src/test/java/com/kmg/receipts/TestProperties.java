package com.kmg.receipts;

import com.kmg.receipts.config.ReceiptsProperties;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class TestProperties {
    public static final String VISION_MODEL = "gemini-2.0-flash-lite";
    public static final String PREVIEW_MODEL = "gemini-2.5-flash-lite-preview-06-17";
    public static final String EMBEDDING_MODEL = "text-embedding-004";
    public static final String OPENROUTER_TEXT_MODEL = "openrouter-llama";

    private TestProperties() {
    }

    public static ReceiptsProperties create(Path baseDir) {
        ReceiptsProperties properties = new ReceiptsProperties();
        properties.setBaseDir(baseDir.toString());
        properties.getStorage().setDir(baseDir.resolve("storage").toString());
        properties.getState().setDbPath(baseDir.resolve("receipts.db").toString());
        properties.getLogs().setDir(baseDir.resolve("logs").toString());

        properties.getWorker().setEnabled(false);
        properties.getWorker().setCount(1);
        properties.getWorker().setCapacity(3);
        properties.getWorker().setStaleAfterMs(60_000);
        properties.getWorker().setAdmissionBackoffMs(2_000);

        Map<String, ReceiptsProperties.Provider> providers = new LinkedHashMap<>();
        providers.put("gemini", provider("http://gemini.test/v1beta", 60, 100_000, 60_000));
        providers.put("openrouter", provider("http://openrouter.test/api/v1", 20, 50_000, 30_000));
        properties.setProviders(providers);

        List<ReceiptsProperties.Model> models = new ArrayList<>();
        models.add(model(VISION_MODEL, "gemini", true, false, null));
        models.add(model(PREVIEW_MODEL, "gemini", true, false, VISION_MODEL));
        models.add(model(EMBEDDING_MODEL, "gemini", false, true, null));
        ReceiptsProperties.Model openRouter = model(OPENROUTER_TEXT_MODEL, "openrouter", false, false, null);
        openRouter.setProviderModel("meta-llama/llama-3.3-70b-instruct");
        models.add(openRouter);
        properties.setModels(models);

        properties.getDefaults().setTextModel(VISION_MODEL);
        properties.getDefaults().setVisionModel(VISION_MODEL);
        properties.getDefaults().setEmbeddingModel(EMBEDDING_MODEL);
        return properties;
    }

    private static ReceiptsProperties.Provider provider(String baseUrl, int requestsPerMinute, long tokensPerMinute,
                                                        long cooldownMs) {
        ReceiptsProperties.Provider provider = new ReceiptsProperties.Provider();
        provider.setBaseUrl(baseUrl);
        provider.setApiKey("test-key");
        provider.setRequestsPerMinute(requestsPerMinute);
        provider.setTokensPerMinute(tokensPerMinute);
        provider.setWindowMs(60_000);
        provider.setCooldownMs(cooldownMs);
        return provider;
    }

    private static ReceiptsProperties.Model model(String id, String provider, boolean vision, boolean embedding,
                                                  String fallback) {
        ReceiptsProperties.Model model = new ReceiptsProperties.Model();
        model.setId(id);
        model.setProvider(provider);
        model.setSupportsVision(vision);
        model.setSupportsEmbedding(embedding);
        model.setFallbackModel(fallback);
        return model;
    }
}
