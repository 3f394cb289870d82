package com.kmg.receipts.service.routing;

import com.kmg.receipts.config.ReceiptsProperties;
import com.kmg.receipts.model.EmbeddingResult;
import com.kmg.receipts.model.ExtractionResult;
import com.kmg.receipts.model.InputType;
import com.kmg.receipts.model.ModelDefinition;
import com.kmg.receipts.model.ReceiptInput;
import com.kmg.receipts.service.provider.ModelValidationException;
import com.kmg.receipts.service.provider.ProviderAdapter;
import com.kmg.receipts.service.provider.ProviderEmbedding;
import com.kmg.receipts.service.provider.ProviderMalformedResponseException;
import com.kmg.receipts.service.provider.ProviderRegistry;
import com.kmg.receipts.service.provider.ProviderRequest;
import com.kmg.receipts.service.provider.ProviderResponse;
import com.kmg.receipts.service.provider.ProviderTransientException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.LinkedHashMap;
import java.util.Map;

@Service
public class ModelFallbackRouter {
    private static final Logger log = LoggerFactory.getLogger(ModelFallbackRouter.class);

    private final ModelRegistry modelRegistry;
    private final ProviderRegistry providerRegistry;
    private final ResponseClassifier classifier;
    private final ReceiptPromptBuilder promptBuilder;
    private final ReceiptsProperties.Extraction extraction;

    public ModelFallbackRouter(
            ModelRegistry modelRegistry,
            ProviderRegistry providerRegistry,
            ResponseClassifier classifier,
            ReceiptPromptBuilder promptBuilder,
            ReceiptsProperties properties
    ) {
        this.modelRegistry = modelRegistry;
        this.providerRegistry = providerRegistry;
        this.classifier = classifier;
        this.promptBuilder = promptBuilder;
        this.extraction = properties.getExtraction();
    }

    public ModelDefinition selectModel(String preference, InputType inputType) {
        ModelDefinition model = modelRegistry.find(preference).orElse(null);
        if (model == null) {
            if (StringUtils.hasText(preference)) {
                log.warn("Unknown model '{}' requested, using default {} model", preference, inputType);
            }
            model = modelRegistry.defaultFor(inputType);
        }
        if (!model.supports(inputType)) {
            throw new ModelValidationException(model.provider(),
                    "Model " + model.id() + " does not support " + inputType + " input");
        }
        return model;
    }

    public ModelDefinition embeddingModel() {
        return modelRegistry.embeddingModel();
    }

    public ExtractionResult extract(ReceiptInput input, ModelDefinition requested, DispatchGate gate) {
        if (!requested.supports(input.type())) {
            throw new ModelValidationException(requested.provider(),
                    "Model " + requested.id() + " does not support " + input.type() + " input");
        }
        String prompt = promptBuilder.build(input);

        ProviderResponse first = dispatch(requested, prompt, input, gate);
        ResponseClassification classification = classifier.classify(first.text());
        switch (classification.outcome()) {
            case OK:
                return result(classification, requested, requested, first.tokensUsed());
            case PROVIDER_ERROR:
                throw new ProviderTransientException(requested.provider(),
                        "Model " + requested.id() + " returned no content", null);
            default:
                break;
        }

        if (!requested.hasFallback()) {
            throw new ProviderMalformedResponseException(requested.provider(), requested.id(),
                    "Model " + requested.id() + " returned malformed output: " + classification.reason());
        }
        ModelDefinition fallback = modelRegistry.require(requested.fallbackModel());
        if (!fallback.supports(input.type())) {
            throw new ProviderMalformedResponseException(requested.provider(), requested.id(),
                    "Fallback " + fallback.id() + " cannot read " + input.type() + " input");
        }
        log.warn("Model {} returned malformed output ({}), retrying with fallback {}",
                requested.id(), classification.reason(), fallback.id());

        ProviderResponse second = dispatch(fallback, prompt, input, gate);
        ResponseClassification retried = classifier.classify(second.text());
        if (!retried.isOk()) {
            throw new ProviderMalformedResponseException(fallback.provider(), fallback.id(),
                    "Fallback " + fallback.id() + " also failed: " + retried.reason());
        }
        return result(retried, requested, fallback, first.tokensUsed() + second.tokensUsed());
    }

    public EmbeddingResult embed(String text, DispatchGate gate) {
        ModelDefinition model = modelRegistry.embeddingModel();
        ProviderAdapter adapter = providerRegistry.get(model.provider());
        if (!gate.admit(model)) {
            throw new AdmissionDeniedException(model);
        }
        ProviderEmbedding embedding = adapter.embed(model, text);
        gate.settle(model, embedding.tokensUsed());
        return new EmbeddingResult(embedding.values(), model.id(), model.provider(), embedding.tokensUsed());
    }

    private ProviderResponse dispatch(ModelDefinition model, String prompt, ReceiptInput input, DispatchGate gate) {
        ProviderAdapter adapter = providerRegistry.get(model.provider());
        if (!gate.admit(model)) {
            throw new AdmissionDeniedException(model);
        }
        ProviderResponse response = adapter.generate(new ProviderRequest(model, prompt, input));
        gate.settle(model, response.tokensUsed());
        return response;
    }

    private ExtractionResult result(
            ResponseClassification classification,
            ModelDefinition requested,
            ModelDefinition used,
            long tokensUsed
    ) {
        Map<String, Object> fields = applyCurrencyDefault(classification.fields());
        return new ExtractionResult(fields, requested.id(), used.id(), used.provider(), tokensUsed);
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> applyCurrencyDefault(Map<String, Object> parsed) {
        Map<String, Object> fields = new LinkedHashMap<>(parsed);
        Object currency = fields.get("currency");
        if (currency instanceof String text && StringUtils.hasText(text)) {
            return fields;
        }
        if (currency != null && !(currency instanceof String)) {
            return fields;
        }
        fields.put("currency", extraction.getDefaultCurrency());
        Map<String, Object> confidence = new LinkedHashMap<>();
        if (fields.get("confidence") instanceof Map<?, ?> existing) {
            confidence.putAll((Map<String, Object>) existing);
        }
        confidence.put("currency", extraction.getDefaultCurrencyConfidence());
        fields.put("confidence", confidence);
        return fields;
    }
}
