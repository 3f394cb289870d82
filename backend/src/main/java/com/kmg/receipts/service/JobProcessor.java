package com.kmg.receipts.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kmg.receipts.config.ReceiptsProperties;
import com.kmg.receipts.model.*;
import com.kmg.receipts.repo.EmbeddingRepository;
import com.kmg.receipts.repo.JobResultRepository;
import com.kmg.receipts.service.provider.ProviderException;
import com.kmg.receipts.service.provider.ProviderRateLimitedException;
import com.kmg.receipts.service.routing.AdmissionDeniedException;
import com.kmg.receipts.service.routing.DispatchGate;
import com.kmg.receipts.service.routing.ModelFallbackRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.OffsetDateTime;

@Service
public class JobProcessor {
    private static final Logger log = LoggerFactory.getLogger(JobProcessor.class);

    private final QueueService queueService;
    private final QuotaService quotaService;
    private final MetricsService metricsService;
    private final ModelFallbackRouter router;
    private final SourceContentResolver sourceContentResolver;
    private final EmbeddingTextBuilder embeddingTextBuilder;
    private final JobResultRepository jobResultRepository;
    private final EmbeddingRepository embeddingRepository;
    private final ObjectMapper objectMapper;
    private final TimeService timeService;
    private final ReceiptsProperties properties;

    public JobProcessor(
            QueueService queueService,
            QuotaService quotaService,
            MetricsService metricsService,
            ModelFallbackRouter router,
            SourceContentResolver sourceContentResolver,
            EmbeddingTextBuilder embeddingTextBuilder,
            JobResultRepository jobResultRepository,
            EmbeddingRepository embeddingRepository,
            ObjectMapper objectMapper,
            TimeService timeService,
            ReceiptsProperties properties
    ) {
        this.queueService = queueService;
        this.quotaService = quotaService;
        this.metricsService = metricsService;
        this.router = router;
        this.sourceContentResolver = sourceContentResolver;
        this.embeddingTextBuilder = embeddingTextBuilder;
        this.jobResultRepository = jobResultRepository;
        this.embeddingRepository = embeddingRepository;
        this.objectMapper = objectMapper;
        this.timeService = timeService;
        this.properties = properties;
    }

    public enum Outcome {
        COMPLETED,
        RETRY_SCHEDULED,
        FAILED,
        DEFERRED,
        LOST
    }

    private record Plan(ModelDefinition model, ReceiptInput input, String embeddingText, long estimatedTokens) {
    }

    public Outcome process(JobRecord job, String workerId) {
        try (WorkerMdc.Context ignored = WorkerMdc.open(workerId, job)) {
            OffsetDateTime startedAt = timeService.now();
            Plan plan;
            try {
                plan = plan(job);
            } catch (ProviderException e) {
                return settleFailure(job, workerId, e.errorType(), null, null, startedAt, e);
            } catch (SourceUnavailableException e) {
                return settleFailure(job, workerId, ErrorType.SOURCE_UNAVAILABLE, null, null, startedAt, e);
            } catch (RuntimeException e) {
                log.error("Failed to prepare job {}: {}", job.id(), e.getMessage(), e);
                return settleFailure(job, workerId, ErrorType.INTERNAL_ERROR, null, null, startedAt, e);
            }

            if (!queueService.markProcessing(job.id(), workerId)) {
                log.warn("Lost claim on job {} before dispatch", job.id());
                return Outcome.LOST;
            }
            DispatchGate gate = new QuotaGate(plan.estimatedTokens());
            try {
                return switch (job.operation()) {
                    case EXTRACT_RECEIPT -> extract(job, workerId, plan, gate, startedAt);
                    case GENERATE_EMBEDDING -> embed(job, workerId, plan, gate, startedAt);
                };
            } catch (AdmissionDeniedException e) {
                return defer(job, workerId, e.model(), startedAt);
            } catch (ProviderRateLimitedException e) {
                String limited = e.provider() != null ? e.provider() : plan.model().provider();
                Duration cooldown = quotaService.enterCooldown(limited, e.retryAfter());
                return settleFailure(job, workerId, ErrorType.PROVIDER_RATE_LIMITED, cooldown, plan.model(), startedAt, e);
            } catch (ProviderException e) {
                return settleFailure(job, workerId, e.errorType(), null, plan.model(), startedAt, e);
            } catch (SourceUnavailableException e) {
                return settleFailure(job, workerId, ErrorType.SOURCE_UNAVAILABLE, null, plan.model(), startedAt, e);
            } catch (RuntimeException e) {
                log.error("Unexpected failure processing job {}: {}", job.id(), e.getMessage(), e);
                return settleFailure(job, workerId, ErrorType.INTERNAL_ERROR, null, plan.model(), startedAt, e);
            }
        }
    }

    private Plan plan(JobRecord job) {
        return switch (job.operation()) {
            case EXTRACT_RECEIPT -> {
                ReceiptInput input = sourceContentResolver.resolve(job.sourceType(), job.sourceId());
                ModelDefinition model = router.selectModel(job.modelPreference(), input.type());
                yield new Plan(model, input, null, properties.getExtraction().getEstimatedTokens());
            }
            case GENERATE_EMBEDDING -> {
                JobResultRecord result = jobResultRepository.findLatestBySource(job.sourceType(), job.sourceId())
                        .orElseThrow(() -> new SourceUnavailableException(
                                "No extraction result for " + job.sourceType() + "/" + job.sourceId()));
                String text = embeddingTextBuilder.build(result.resultJson());
                yield new Plan(router.embeddingModel(), null, text, Math.max(1, text.length() / 4));
            }
        };
    }

    private Outcome extract(JobRecord job, String workerId, Plan plan, DispatchGate gate, OffsetDateTime startedAt) {
        ExtractionResult result = router.extract(plan.input(), plan.model(), gate);
        if (result.fallbackUsed()) {
            log.info("Job {} extracted with fallback model {} (requested {})",
                    job.id(), result.modelUsed(), result.modelRequested());
        }

        jobResultRepository.upsert(new JobResultRecord(
                job.id(),
                job.sourceType(),
                job.sourceId(),
                result.modelRequested(),
                result.modelUsed(),
                toJson(result.fields()),
                timeService.now()
        ));
        // Queued before completion so a crash in between can only repeat work, never drop it.
        queueService.enqueue(new NewJob(job.sourceType(), job.sourceId(), JobOperation.GENERATE_EMBEDDING,
                job.priority(), null, null));

        return settleSuccess(job, workerId, result.provider(), result.modelUsed(), result.tokensUsed(), startedAt);
    }

    private Outcome embed(JobRecord job, String workerId, Plan plan, DispatchGate gate, OffsetDateTime startedAt) {
        EmbeddingResult embedding = router.embed(plan.embeddingText(), gate);
        embeddingRepository.upsert(
                job.sourceType(),
                job.sourceId(),
                embedding.model(),
                embedding.dimensions(),
                toJson(embedding.vector()),
                timeService.now()
        );
        return settleSuccess(job, workerId, embedding.provider(), embedding.model(), embedding.tokensUsed(), startedAt);
    }

    private Outcome settleSuccess(JobRecord job, String workerId, String provider, String model, long tokens,
                                  OffsetDateTime startedAt) {
        QueueService.SettleOutcome settled = queueService.complete(job, workerId);
        long elapsed = timeService.millisSince(startedAt);
        if (settled == QueueService.SettleOutcome.LOST) {
            log.warn("Job {} finished after its claim was lost; result kept, job will be redone", job.id());
            metricsService.recordAttempt(job, AttemptStatus.RETRY, ErrorType.WORKER_CRASH, provider, model, tokens, elapsed);
            return Outcome.LOST;
        }
        metricsService.recordAttempt(job, AttemptStatus.SUCCESS, null, provider, model, tokens, elapsed);
        log.info("Job {} completed in {} ms", job.id(), elapsed);
        return Outcome.COMPLETED;
    }

    private Outcome settleFailure(
            JobRecord job,
            String workerId,
            ErrorType errorType,
            Duration minimumDelay,
            ModelDefinition model,
            OffsetDateTime startedAt,
            RuntimeException cause
    ) {
        log.warn("Job {} attempt failed with {}: {}", job.id(), errorType, cause.getMessage());
        QueueService.SettleOutcome settled = queueService.fail(job, workerId, errorType, minimumDelay);
        AttemptStatus status = settled == QueueService.SettleOutcome.RETRY_SCHEDULED ? AttemptStatus.RETRY : AttemptStatus.FAILURE;
        metricsService.recordAttempt(
                job,
                status,
                errorType,
                model == null ? null : model.provider(),
                model == null ? null : model.id(),
                0L,
                timeService.millisSince(startedAt)
        );
        return switch (settled) {
            case RETRY_SCHEDULED -> Outcome.RETRY_SCHEDULED;
            case FAILED -> Outcome.FAILED;
            default -> Outcome.LOST;
        };
    }

    private Outcome defer(JobRecord job, String workerId, ModelDefinition model, OffsetDateTime startedAt) {
        String provider = model.provider();
        Duration delay = Duration.ofMillis(properties.getWorker().getAdmissionBackoffMs());
        Duration cooldown = quotaService.remainingCooldown(provider);
        if (cooldown.compareTo(delay) > 0) {
            delay = cooldown;
        }
        if (!queueService.release(job, workerId, delay)) {
            return Outcome.LOST;
        }
        log.debug("Admission denied for provider {}; job {} released for {} ms", provider, job.id(), delay.toMillis());
        metricsService.recordAttempt(job, AttemptStatus.DEFERRED, ErrorType.RATE_LIMIT_DEFERRED, provider, model.id(), 0L,
                timeService.millisSince(startedAt));
        return Outcome.DEFERRED;
    }

    private final class QuotaGate implements DispatchGate {
        private final long estimatedTokens;

        private QuotaGate(long estimatedTokens) {
            this.estimatedTokens = estimatedTokens;
        }

        @Override
        public boolean admit(ModelDefinition model) {
            return quotaService.admit(model.provider(), estimatedTokens);
        }

        @Override
        public void settle(ModelDefinition model, long tokensUsed) {
            quotaService.reconcile(model.provider(), estimatedTokens, tokensUsed);
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize job output", e);
        }
    }
}
