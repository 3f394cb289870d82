package com.kmg.receipts.service.routing;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kmg.receipts.TestProperties;
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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentMatcher;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.kmg.receipts.TestProperties.EMBEDDING_MODEL;
import static com.kmg.receipts.TestProperties.OPENROUTER_TEXT_MODEL;
import static com.kmg.receipts.TestProperties.PREVIEW_MODEL;
import static com.kmg.receipts.TestProperties.VISION_MODEL;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ModelFallbackRouterTest {
    private static final ReceiptInput IMAGE = ReceiptInput.image(new byte[]{1, 2, 3}, "image/png");
    private static final ReceiptInput TEXT = ReceiptInput.text("SHELL KLCC\nTOTAL RM 80.00");
    private static final String BOXES = "[{\"box_2d\": [1, 2, 3, 4], \"label\": \"total\"}]";

    @TempDir
    Path tempDir;

    private ProviderAdapter gemini;
    private ProviderAdapter openRouter;
    private ModelRegistry modelRegistry;
    private ModelFallbackRouter router;
    private RecordingGate gate;

    @BeforeEach
    void setUp() {
        ReceiptsProperties properties = TestProperties.create(tempDir);
        gemini = mock(ProviderAdapter.class);
        when(gemini.providerId()).thenReturn("gemini");
        openRouter = mock(ProviderAdapter.class);
        when(openRouter.providerId()).thenReturn("openrouter");
        modelRegistry = new ModelRegistry(properties);
        gate = new RecordingGate(Set.of());
        router = new ModelFallbackRouter(
                modelRegistry,
                new ProviderRegistry(List.of(gemini, openRouter)),
                new ResponseClassifier(new ObjectMapper(), List.of(new BoundingBoxShapeDetector())),
                new ReceiptPromptBuilder(),
                properties
        );
    }

    @Test
    void usesTheRequestedModelWhenItsAnswerIsUsable() {
        when(gemini.generate(any())).thenReturn(new ProviderResponse("{\"merchant\": \"Shell\", \"currency\": \"USD\"}", 50));

        ExtractionResult result = router.extract(IMAGE, modelRegistry.require(PREVIEW_MODEL), gate);

        assertThat(result.modelRequested()).isEqualTo(PREVIEW_MODEL);
        assertThat(result.modelUsed()).isEqualTo(PREVIEW_MODEL);
        assertThat(result.fallbackUsed()).isFalse();
        assertThat(result.fields()).containsEntry("currency", "USD");
    }

    @Test
    void fallsBackOnceWhenTheAnswerHasAKnownWrongShape() {
        when(gemini.generate(argThat(forModel(PREVIEW_MODEL)))).thenReturn(new ProviderResponse(BOXES, 30));
        when(gemini.generate(argThat(forModel(VISION_MODEL))))
                .thenReturn(new ProviderResponse("{\"merchant\": \"Shell\", \"total\": 80}", 70));

        ExtractionResult result = router.extract(IMAGE, modelRegistry.require(PREVIEW_MODEL), gate);

        assertThat(result.fallbackUsed()).isTrue();
        assertThat(result.modelRequested()).isEqualTo(PREVIEW_MODEL);
        assertThat(result.modelUsed()).isEqualTo(VISION_MODEL);
        assertThat(result.tokensUsed()).isEqualTo(100);
        assertThat(result.provider()).isEqualTo("gemini");
        assertThat(gate.admitted).containsExactly(PREVIEW_MODEL, VISION_MODEL);
        assertThat(gate.settled).containsExactly(PREVIEW_MODEL + "=30", VISION_MODEL + "=70");
    }

    @Test
    void fallbackIsNotSentWhenTheGateRefusesIt() {
        gate = new RecordingGate(Set.of(VISION_MODEL));
        when(gemini.generate(any())).thenReturn(new ProviderResponse(BOXES, 30));

        assertThatThrownBy(() -> router.extract(IMAGE, modelRegistry.require(PREVIEW_MODEL), gate))
                .isInstanceOfSatisfying(AdmissionDeniedException.class,
                        ex -> assertThat(ex.model().id()).isEqualTo(VISION_MODEL));
        verify(gemini, times(1)).generate(any());
        assertThat(gate.settled).containsExactly(PREVIEW_MODEL + "=30");
    }

    @Test
    void failsWhenTheFallbackIsAlsoMalformed() {
        when(gemini.generate(any())).thenReturn(new ProviderResponse(BOXES, 30));

        assertThatThrownBy(() -> router.extract(IMAGE, modelRegistry.require(PREVIEW_MODEL), gate))
                .isInstanceOf(ProviderMalformedResponseException.class)
                .satisfies(ex -> assertThat(((ProviderMalformedResponseException) ex).model()).isEqualTo(VISION_MODEL));
    }

    @Test
    void modelWithoutFallbackFailsOnMalformedOutput() {
        when(gemini.generate(any())).thenReturn(new ProviderResponse("no receipt here", 10));

        assertThatThrownBy(() -> router.extract(TEXT, modelRegistry.require(VISION_MODEL), gate))
                .isInstanceOf(ProviderMalformedResponseException.class);
        verify(gemini).generate(any());
    }

    @Test
    void emptyAnswerIsTransientAndSkipsFallback() {
        when(gemini.generate(any())).thenReturn(new ProviderResponse("", 0));

        assertThatThrownBy(() -> router.extract(IMAGE, modelRegistry.require(PREVIEW_MODEL), gate))
                .isInstanceOf(ProviderTransientException.class);
        verify(gemini, never()).generate(argThat(forModel(VISION_MODEL)));
    }

    @Test
    @SuppressWarnings("unchecked")
    void missingCurrencyDefaultsToRinggitWithModerateConfidence() {
        when(gemini.generate(any())).thenReturn(new ProviderResponse(
                "{\"merchant\": \"Mydin\", \"currency\": \"\", \"confidence\": {\"merchant\": 88}}", 20));

        ExtractionResult result = router.extract(TEXT, modelRegistry.require(VISION_MODEL), gate);

        assertThat(result.fields()).containsEntry("currency", "MYR");
        Map<String, Object> confidence = (Map<String, Object>) result.fields().get("confidence");
        assertThat(confidence).containsEntry("currency", 50).containsEntry("merchant", 88);
    }

    @Test
    void unknownPreferenceFallsBackToTheDefaultForTheInput() {
        assertThat(router.selectModel("no-such-model", InputType.IMAGE).id()).isEqualTo(VISION_MODEL);
        assertThat(router.selectModel(null, InputType.TEXT).id()).isEqualTo(VISION_MODEL);
        assertThat(router.selectModel(OPENROUTER_TEXT_MODEL, InputType.TEXT).provider()).isEqualTo("openrouter");
    }

    @Test
    void textOnlyModelCannotTakeImages() {
        assertThatThrownBy(() -> router.selectModel(OPENROUTER_TEXT_MODEL, InputType.IMAGE))
                .isInstanceOf(ModelValidationException.class);
        assertThatThrownBy(() -> router.extract(IMAGE, modelRegistry.require(OPENROUTER_TEXT_MODEL), gate))
                .isInstanceOf(ModelValidationException.class);
    }

    @Test
    void embedsWithTheDefaultEmbeddingModel() {
        ModelDefinition embeddingModel = modelRegistry.require(EMBEDDING_MODEL);
        when(gemini.embed(eq(embeddingModel), eq("merchant: Mydin"))).thenReturn(new ProviderEmbedding(List.of(0.5, 0.25), 4));

        EmbeddingResult result = router.embed("merchant: Mydin", gate);

        assertThat(result.model()).isEqualTo(EMBEDDING_MODEL);
        assertThat(result.dimensions()).isEqualTo(2);
        assertThat(result.tokensUsed()).isEqualTo(4);
    }

    private static final class RecordingGate implements DispatchGate {
        private final Set<String> refused;
        private final List<String> admitted = new ArrayList<>();
        private final List<String> settled = new ArrayList<>();

        private RecordingGate(Set<String> refused) {
            this.refused = refused;
        }

        @Override
        public boolean admit(ModelDefinition model) {
            if (refused.contains(model.id())) {
                return false;
            }
            admitted.add(model.id());
            return true;
        }

        @Override
        public void settle(ModelDefinition model, long tokensUsed) {
            settled.add(model.id() + "=" + tokensUsed);
        }
    }

    private static ArgumentMatcher<ProviderRequest> forModel(String modelId) {
        return request -> request != null && modelId.equals(request.model().id());
    }
}
