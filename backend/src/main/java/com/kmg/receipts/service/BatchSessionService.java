package com.kmg.receipts.service;

import com.kmg.receipts.config.ReceiptsProperties;
import com.kmg.receipts.dto.BatchFileRequest;
import com.kmg.receipts.dto.BatchStatusView;
import com.kmg.receipts.dto.CreateBatchRequest;
import com.kmg.receipts.model.*;
import com.kmg.receipts.repo.BatchSessionRepository;
import com.kmg.receipts.repo.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

@Service
public class BatchSessionService {
    private static final Logger log = LoggerFactory.getLogger(BatchSessionService.class);
    private static final String CANCELLED_REASON = "Cancelled with its batch";
    static final Duration RATE_WINDOW = Duration.ofMinutes(1);

    private final BatchSessionRepository batchSessionRepository;
    private final JobRepository jobRepository;
    private final TransactionTemplate transactionTemplate;
    private final EventService eventService;
    private final TimeService timeService;
    private final ReceiptsProperties properties;

    public BatchSessionService(
            BatchSessionRepository batchSessionRepository,
            JobRepository jobRepository,
            TransactionTemplate transactionTemplate,
            EventService eventService,
            TimeService timeService,
            ReceiptsProperties properties
    ) {
        this.batchSessionRepository = batchSessionRepository;
        this.jobRepository = jobRepository;
        this.transactionTemplate = transactionTemplate;
        this.eventService = eventService;
        this.timeService = timeService;
        this.properties = properties;
    }

    public BatchSessionRecord createSession(CreateBatchRequest request) {
        List<BatchFileRequest> files = request.files();
        if (files == null || files.isEmpty()) {
            throw new IllegalArgumentException("At least one file is required.");
        }
        Set<String> seen = new HashSet<>();
        for (BatchFileRequest file : files) {
            if (!seen.add(file.sourceType() + "/" + file.sourceId())) {
                throw new IllegalArgumentException("File submitted twice: " + file.sourceId());
            }
        }

        ProcessingStrategy strategy = request.processingStrategy() == null
                ? properties.getBatch().getDefaultStrategy()
                : request.processingStrategy();
        int override = request.maxConcurrent() == null ? 0 : request.maxConcurrent();
        RateLimitConfig rateLimitConfig = strategy.rateLimitConfig(override);
        JobPriority priority = request.priority() == null ? JobPriority.MEDIUM : request.priority();
        int maxRetries = properties.getQueue().getMaxRetries();

        BatchSessionRecord created = transactionTemplate.execute(status -> {
            OffsetDateTime now = timeService.now();
            BatchSessionRecord session = new BatchSessionRecord(
                    UUID.randomUUID().toString(),
                    request.owner(),
                    files.size(),
                    0,
                    0,
                    files.size(),
                    rateLimitConfig.maxConcurrentRequests(),
                    strategy,
                    BatchStatus.RUNNING,
                    rateLimitConfig,
                    false,
                    now,
                    now,
                    null
            );
            batchSessionRepository.insert(session);

            for (BatchFileRequest file : files) {
                NewJob job = new NewJob(file.sourceType(), file.sourceId(), JobOperation.EXTRACT_RECEIPT,
                        priority, session.id(), request.modelPreference());
                boolean inserted = jobRepository.insertIfNoActive(
                        JobRecord.pending(UUID.randomUUID().toString(), job, maxRetries, now));
                if (!inserted) {
                    // Rolls back the session row and every job inserted so far.
                    throw new IllegalStateException("File is already queued: " + file.sourceId());
                }
            }
            return session;
        });

        log.info("Created batch {} with {} files ({}, max concurrent {})",
                created.id(), created.totalFiles(), strategy, created.maxConcurrent());
        eventService.publishBatch(BatchEventType.CREATED, created, "Batch created");
        return created;
    }

    public BatchStatusView getBatchStatus(String batchId) {
        return BatchStatusView.from(require(batchId));
    }

    public List<BatchStatusView> listRecent(int limit) {
        return batchSessionRepository.findRecent(limit).stream()
                .map(BatchStatusView::from)
                .toList();
    }

    public BatchStatusView cancel(String batchId) {
        transactionTemplate.executeWithoutResult(status -> {
            BatchSessionRecord session = require(batchId);
            if (session.status().isTerminal()) {
                throw new IllegalStateException("Batch already finished: " + batchId);
            }
            OffsetDateTime now = timeService.now();
            batchSessionRepository.requestCancel(batchId, now);
            int cancelled = jobRepository.cancelPendingInBatch(batchId, CANCELLED_REASON, now);
            log.info("Cancel requested for batch {}: {} pending jobs cancelled", batchId, cancelled);
            applyOutcome(batchId, 0, cancelled);
        });
        return getBatchStatus(batchId);
    }

    boolean tryConsumeRate(String batchId, long estimatedTokens) {
        OffsetDateTime now = timeService.now();
        return batchSessionRepository.tryConsumeRate(batchId, estimatedTokens, now, now.minus(RATE_WINDOW));
    }

    /**
     * Settles {@code completed + failed} files. Callers must be inside the transaction that
     * performed the matching job transitions.
     */
    void applyOutcome(String batchId, int completed, int failed) {
        OffsetDateTime now = timeService.now();
        if (completed + failed > 0 && !batchSessionRepository.applyOutcomes(batchId, completed, failed, now)) {
            throw new IllegalStateException("Batch " + batchId + " has fewer pending files than settled jobs");
        }
        BatchSessionRecord session = require(batchId);
        if (session.filesPending() > 0) {
            eventService.publishBatch(BatchEventType.PROGRESS, session, "Batch progress");
            return;
        }
        BatchStatus finalStatus = resolveFinalStatus(session);
        if (batchSessionRepository.finish(batchId, finalStatus, now)) {
            log.info("Batch {} finished as {} ({} completed, {} failed)",
                    batchId, finalStatus, session.filesCompleted(), session.filesFailed());
            eventService.publishBatch(BatchEventType.FINISHED, require(batchId), "Batch " + finalStatus);
        }
    }

    BatchStatus resolveFinalStatus(BatchSessionRecord session) {
        if (session.cancelRequested()) {
            return BatchStatus.CANCELLED;
        }
        if (session.filesFailed() == 0) {
            return BatchStatus.COMPLETED;
        }
        double failureRatio = (double) session.filesFailed() / session.totalFiles();
        return failureRatio < properties.getBatch().getFailureThreshold() ? BatchStatus.PARTIAL : BatchStatus.FAILED;
    }

    private BatchSessionRecord require(String batchId) {
        return batchSessionRepository.findById(batchId)
                .orElseThrow(() -> new NotFoundException("Batch not found: " + batchId));
    }
}
