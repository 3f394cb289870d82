package com.kmg.receipts.service;

import com.kmg.receipts.model.JobRecord;
import com.kmg.receipts.model.WorkerStatus;
import com.kmg.receipts.repo.WorkerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

public class QueueWorker {
    private static final Logger log = LoggerFactory.getLogger(QueueWorker.class);

    private final String workerId;
    private final int capacity;
    private final QueueService queueService;
    private final JobProcessor jobProcessor;
    private final WorkerRepository workerRepository;
    private final TimeService timeService;
    private final Duration admissionBackoff;
    private final ExecutorService executor;
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    private volatile OffsetDateTime pausedUntil;
    private volatile boolean stopping;

    public QueueWorker(
            String workerId,
            int capacity,
            QueueService queueService,
            JobProcessor jobProcessor,
            WorkerRepository workerRepository,
            TimeService timeService,
            Duration admissionBackoff
    ) {
        this.workerId = workerId;
        this.capacity = capacity;
        this.queueService = queueService;
        this.jobProcessor = jobProcessor;
        this.workerRepository = workerRepository;
        this.timeService = timeService;
        this.admissionBackoff = admissionBackoff;
        AtomicInteger threadIndex = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(capacity, runnable -> {
            Thread thread = new Thread(runnable, workerId + "-job-" + threadIndex.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public void start() {
        workerRepository.register(workerId, timeService.now());
        log.info("Worker {} started with capacity {}", workerId, capacity);
    }

    public void heartbeat() {
        if (stopping) {
            return;
        }
        String currentJob = inFlight.stream().findFirst().orElse(null);
        WorkerStatus status = inFlight.isEmpty() ? WorkerStatus.IDLE : WorkerStatus.ACTIVE;
        workerRepository.heartbeat(workerId, status, currentJob, timeService.now());
    }

    public List<Future<JobProcessor.Outcome>> poll() {
        if (stopping) {
            return List.of();
        }
        heartbeat();
        OffsetDateTime now = timeService.now();
        if (pausedUntil != null && now.isBefore(pausedUntil)) {
            return List.of();
        }
        int free = capacity - inFlight.size();
        if (free <= 0) {
            return List.of();
        }

        List<JobRecord> claimed = queueService.claim(workerId, free);
        List<Future<JobProcessor.Outcome>> futures = new ArrayList<>(claimed.size());
        for (JobRecord job : claimed) {
            inFlight.add(job.id());
            futures.add(executor.submit(() -> handle(job)));
        }
        if (!claimed.isEmpty()) {
            heartbeat();
        }
        return futures;
    }

    public int runOnce() {
        List<Future<JobProcessor.Outcome>> futures = poll();
        for (Future<JobProcessor.Outcome> future : futures) {
            try {
                future.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while waiting for jobs", e);
            } catch (ExecutionException e) {
                throw new IllegalStateException("Job execution failed", e.getCause());
            }
        }
        heartbeat();
        return futures.size();
    }

    public boolean paused() {
        return pausedUntil != null && timeService.now().isBefore(pausedUntil);
    }

    public void stop() {
        stopping = true;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Worker {} still had jobs running at shutdown; they will be reclaimed", workerId);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        workerRepository.markStopped(workerId, timeService.now());
        log.info("Worker {} stopped", workerId);
    }

    private JobProcessor.Outcome handle(JobRecord job) {
        try {
            JobProcessor.Outcome outcome = jobProcessor.process(job, workerId);
            switch (outcome) {
                case COMPLETED -> workerRepository.incrementProcessed(workerId);
                case RETRY_SCHEDULED, FAILED -> workerRepository.incrementErrors(workerId);
                case DEFERRED -> pause();
                default -> {
                }
            }
            return outcome;
        } catch (RuntimeException e) {
            log.error("Worker {} could not settle job {}: {}", workerId, job.id(), e.getMessage(), e);
            try {
                queueService.release(job, workerId, admissionBackoff);
            } catch (RuntimeException releaseError) {
                log.error("Job {} stays claimed until worker {} is reclaimed: {}",
                        job.id(), workerId, releaseError.getMessage());
            }
            throw e;
        } finally {
            inFlight.remove(job.id());
        }
    }

    private void pause() {
        OffsetDateTime until = timeService.now().plus(admissionBackoff);
        if (pausedUntil == null || until.isAfter(pausedUntil)) {
            pausedUntil = until;
        }
    }
}
