package com.kmg.receipts.service.routing;

import com.kmg.receipts.config.ReceiptsProperties;
import com.kmg.receipts.model.InputType;
import com.kmg.receipts.model.ModelDefinition;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

@Component
public class ModelRegistry {
    private final Map<String, ModelDefinition> models = new LinkedHashMap<>();
    private final ReceiptsProperties.Defaults defaults;

    public ModelRegistry(ReceiptsProperties properties) {
        for (ReceiptsProperties.Model model : properties.getModels()) {
            ModelDefinition definition = new ModelDefinition(
                    model.getId(),
                    StringUtils.hasText(model.getName()) ? model.getName() : model.getId(),
                    model.getProvider(),
                    StringUtils.hasText(model.getProviderModel()) ? model.getProviderModel() : model.getId(),
                    model.getTemperature(),
                    model.getMaxTokens(),
                    model.isSupportsText(),
                    model.isSupportsVision(),
                    model.isSupportsEmbedding(),
                    StringUtils.hasText(model.getFallbackModel()) ? model.getFallbackModel() : null
            );
            if (models.put(definition.id(), definition) != null) {
                throw new IllegalStateException("Duplicate model id: " + definition.id());
            }
        }
        this.defaults = properties.getDefaults();
        validate();
    }

    public Optional<ModelDefinition> find(String id) {
        if (!StringUtils.hasText(id)) {
            return Optional.empty();
        }
        return Optional.ofNullable(models.get(id));
    }

    public ModelDefinition require(String id) {
        return find(id).orElseThrow(() -> new IllegalArgumentException("Unknown model: " + id));
    }

    public ModelDefinition defaultFor(InputType type) {
        return switch (type) {
            case TEXT -> require(defaults.getTextModel());
            case IMAGE -> require(defaults.getVisionModel());
        };
    }

    public ModelDefinition embeddingModel() {
        return require(defaults.getEmbeddingModel());
    }

    private void validate() {
        for (String id : new String[]{defaults.getTextModel(), defaults.getVisionModel(), defaults.getEmbeddingModel()}) {
            if (!models.containsKey(id)) {
                throw new IllegalStateException("Default model is not configured: " + id);
            }
        }
        if (!models.get(defaults.getVisionModel()).supportsVision()) {
            throw new IllegalStateException("Default vision model cannot read images: " + defaults.getVisionModel());
        }
        if (!models.get(defaults.getEmbeddingModel()).supportsEmbedding()) {
            throw new IllegalStateException("Default embedding model cannot embed: " + defaults.getEmbeddingModel());
        }
        for (ModelDefinition model : models.values()) {
            if (model.hasFallback() && !models.containsKey(model.fallbackModel())) {
                throw new IllegalStateException("Model " + model.id() + " falls back to unknown model " + model.fallbackModel());
            }
        }
    }
}
