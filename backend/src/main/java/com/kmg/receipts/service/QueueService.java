package com.kmg.receipts.service;

import com.kmg.receipts.config.ReceiptsProperties;
import com.kmg.receipts.dto.EnqueueResponse;
import com.kmg.receipts.dto.QueueStatisticsView;
import com.kmg.receipts.dto.WorkerStatusView;
import com.kmg.receipts.model.*;
import com.kmg.receipts.repo.JobRepository;
import com.kmg.receipts.repo.WorkerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Service
public class QueueService {
    private static final Logger log = LoggerFactory.getLogger(QueueService.class);
    private static final String RECLAIMED_REASON = ErrorType.WORKER_CRASH.publicMessage();

    private final JobRepository jobRepository;
    private final WorkerRepository workerRepository;
    private final BatchSessionService batchSessionService;
    private final MetricsService metricsService;
    private final TransactionTemplate transactionTemplate;
    private final TimeService timeService;
    private final ReceiptsProperties properties;

    public QueueService(
            JobRepository jobRepository,
            WorkerRepository workerRepository,
            BatchSessionService batchSessionService,
            MetricsService metricsService,
            TransactionTemplate transactionTemplate,
            TimeService timeService,
            ReceiptsProperties properties
    ) {
        this.jobRepository = jobRepository;
        this.workerRepository = workerRepository;
        this.batchSessionService = batchSessionService;
        this.metricsService = metricsService;
        this.transactionTemplate = transactionTemplate;
        this.timeService = timeService;
        this.properties = properties;
    }

    public enum SettleOutcome {
        COMPLETED,
        RETRY_SCHEDULED,
        FAILED,
        /**
         * The worker no longer held the job (reclaimed or cancelled meanwhile); nothing changed.
         */
        LOST
    }

    public EnqueueResponse enqueue(NewJob job) {
        OffsetDateTime now = timeService.now();
        JobRecord record = JobRecord.pending(UUID.randomUUID().toString(), job, properties.getQueue().getMaxRetries(), now);
        if (jobRepository.insertIfNoActive(record)) {
            log.info("Queued {} job {} for {}/{} ({})", job.operation(), record.id(), job.sourceType(), job.sourceId(), job.priority());
            return new EnqueueResponse(record.id(), true);
        }
        JobRecord existing = jobRepository.findActiveBySource(job.sourceType(), job.sourceId(), job.operation())
                .orElse(null);
        if (existing == null) {
            // The active twin settled between our insert and lookup; the source is free again.
            return enqueue(job);
        }
        return new EnqueueResponse(existing.id(), false);
    }

    public JobRecord getJob(String jobId) {
        return jobRepository.findById(jobId)
                .orElseThrow(() -> new NotFoundException("Job not found: " + jobId));
    }

    public List<JobRecord> claim(String workerId, int capacity) {
        if (capacity <= 0) {
            return List.of();
        }
        OffsetDateTime now = timeService.now();
        List<JobRecord> candidates = jobRepository.findClaimCandidates(
                now, now.minus(BatchSessionService.RATE_WINDOW), capacity * 4);
        List<JobRecord> claimed = new ArrayList<>();
        for (JobRecord candidate : candidates) {
            if (claimed.size() >= capacity) {
                break;
            }
            if (claimOne(candidate, workerId, now)) {
                claimed.add(jobRepository.findById(candidate.id()).orElseThrow());
            }
        }
        return claimed;
    }

    private boolean claimOne(JobRecord candidate, String workerId, OffsetDateTime now) {
        if (candidate.batchId() == null) {
            return jobRepository.tryClaim(candidate.id(), workerId, now);
        }
        Boolean won = transactionTemplate.execute(status -> {
            if (!jobRepository.tryClaim(candidate.id(), workerId, now)) {
                return false;
            }
            if (!batchSessionService.tryConsumeRate(candidate.batchId(), properties.getExtraction().getEstimatedTokens())) {
                // Batch is out of requests or tokens for this minute; the claim is undone.
                status.setRollbackOnly();
                log.debug("Batch {} rate window is full, leaving job {} pending", candidate.batchId(), candidate.id());
                return false;
            }
            return true;
        });
        return Boolean.TRUE.equals(won);
    }

    public boolean markProcessing(String jobId, String workerId) {
        return jobRepository.markProcessing(jobId, workerId, timeService.now());
    }

    public SettleOutcome complete(JobRecord job, String workerId) {
        return transactionTemplate.execute(status -> {
            if (!jobRepository.complete(job.id(), workerId, timeService.now())) {
                return SettleOutcome.LOST;
            }
            if (job.batchId() != null) {
                batchSessionService.applyOutcome(job.batchId(), 1, 0);
            }
            return SettleOutcome.COMPLETED;
        });
    }

    public SettleOutcome fail(JobRecord job, String workerId, ErrorType errorType, Duration minimumDelay) {
        return transactionTemplate.execute(status -> {
            OffsetDateTime now = timeService.now();
            String message = errorType.publicMessage();
            if (errorType.retryable() && job.canRetry()) {
                Duration delay = backoff(job.retryCount());
                if (minimumDelay != null && minimumDelay.compareTo(delay) > 0) {
                    delay = minimumDelay;
                }
                if (jobRepository.requeueForRetry(job.id(), workerId, message, now.plus(delay), now)) {
                    log.info("Job {} failed with {}; retry {}/{} in {} ms",
                            job.id(), errorType, job.retryCount() + 1, job.maxRetries(), delay.toMillis());
                    return SettleOutcome.RETRY_SCHEDULED;
                }
            }
            if (!jobRepository.failTerminal(job.id(), workerId, message, now)) {
                return SettleOutcome.LOST;
            }
            log.warn("Job {} failed permanently with {}", job.id(), errorType);
            if (job.batchId() != null) {
                batchSessionService.applyOutcome(job.batchId(), 0, 1);
            }
            return SettleOutcome.FAILED;
        });
    }

    public boolean release(JobRecord job, String workerId, Duration delay) {
        OffsetDateTime now = timeService.now();
        return jobRepository.release(job.id(), workerId, ErrorType.RATE_LIMIT_DEFERRED.publicMessage(), now.plus(delay), now);
    }

    public int reclaimStale() {
        OffsetDateTime now = timeService.now();
        OffsetDateTime cutoff = now.minus(Duration.ofMillis(properties.getWorker().getStaleAfterMs()));
        Integer reclaimed = transactionTemplate.execute(status -> {
            int stopped = workerRepository.markStaleStopped(cutoff);
            List<JobRecord> held = jobRepository.findHeldByDeadWorkers(cutoff);
            int jobs = jobRepository.reclaimFromDeadWorkers(cutoff, RECLAIMED_REASON, now);
            for (JobRecord job : held) {
                long elapsed = job.claimedAt() == null ? 0L : Duration.between(job.claimedAt(), now).toMillis();
                metricsService.recordAttempt(job, AttemptStatus.RETRY, ErrorType.WORKER_CRASH, null, null, 0L, elapsed);
            }
            if (stopped > 0 || jobs > 0) {
                log.warn("Marked {} stale workers stopped and reclaimed {} jobs", stopped, jobs);
            }
            return jobs;
        });
        return reclaimed == null ? 0 : reclaimed;
    }

    public int requeueFailed(int maxItems) {
        int requeued = jobRepository.requeueFailed(maxItems, timeService.now());
        log.info("Requeued {} failed jobs", requeued);
        return requeued;
    }

    public int cleanup() {
        ReceiptsProperties.Queue queue = properties.getQueue();
        OffsetDateTime now = timeService.now();
        int jobs = jobRepository.deleteTerminalBefore(now.minusDays(queue.getRetentionDays()));
        int metrics = metricsService.deleteOlderThan(Duration.ofDays(queue.getMetricRetentionDays()));
        int workers = workerRepository.deleteStoppedBefore(now.minusDays(queue.getRetentionDays()));
        if (jobs > 0 || metrics > 0 || workers > 0) {
            log.info("Cleanup removed {} jobs, {} metric records, {} stopped workers", jobs, metrics, workers);
        }
        return jobs;
    }

    public Duration backoff(int retryCount) {
        ReceiptsProperties.Queue queue = properties.getQueue();
        double raw = queue.getBackoffBaseMs() * Math.pow(queue.getBackoffMultiplier(), retryCount);
        long capped = (long) Math.min(raw, (double) queue.getBackoffMaxMs());
        return Duration.ofMillis(capped);
    }

    public QueueStatisticsView getQueueStatistics() {
        Map<String, Integer> byStatus = new LinkedHashMap<>();
        jobRepository.countByStatus().forEach((status, count) -> byStatus.put(status.name(), count));
        Map<String, Integer> byPriority = new LinkedHashMap<>();
        jobRepository.countPendingByPriority().forEach((priority, count) -> byPriority.put(priority.name(), count));
        String oldest = jobRepository.oldestPendingCreatedAt().map(OffsetDateTime::toString).orElse(null);
        int activeWorkers = (int) getWorkerStatus().stream()
                .filter(worker -> worker.status() != WorkerStatus.STOPPED && !worker.stale())
                .count();
        double averageMs = metricsService.averageProcessingTimeMs(Duration.ofHours(1));
        return new QueueStatisticsView(byStatus, byPriority, oldest, activeWorkers, averageMs);
    }

    public List<WorkerStatusView> getWorkerStatus() {
        OffsetDateTime cutoff = timeService.now().minus(Duration.ofMillis(properties.getWorker().getStaleAfterMs()));
        return workerRepository.findAll().stream()
                .map(worker -> new WorkerStatusView(
                        worker.id(),
                        worker.status(),
                        worker.lastHeartbeat().toString(),
                        worker.lastHeartbeat().isBefore(cutoff),
                        worker.currentJob(),
                        worker.processedCount(),
                        worker.errorCount(),
                        worker.startedAt().toString()
                ))
                .toList();
    }
}
