package com.kmg.receipts.service;

import com.kmg.receipts.config.ReceiptsProperties;
import com.kmg.receipts.repo.WorkerRepository;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Component
public class WorkerPool {
    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private final QueueService queueService;
    private final JobProcessor jobProcessor;
    private final WorkerRepository workerRepository;
    private final TimeService timeService;
    private final ReceiptsProperties properties;
    private final List<QueueWorker> workers = new ArrayList<>();

    private ScheduledExecutorService scheduler;

    public WorkerPool(
            QueueService queueService,
            JobProcessor jobProcessor,
            WorkerRepository workerRepository,
            TimeService timeService,
            ReceiptsProperties properties
    ) {
        this.queueService = queueService;
        this.jobProcessor = jobProcessor;
        this.workerRepository = workerRepository;
        this.timeService = timeService;
        this.properties = properties;
    }

    public synchronized void start() {
        ReceiptsProperties.Worker config = properties.getWorker();
        if (!config.isEnabled()) {
            log.info("Queue workers disabled");
            return;
        }
        if (scheduler != null) {
            throw new IllegalStateException("Worker pool already started.");
        }

        AtomicInteger threadIndex = new AtomicInteger();
        scheduler = Executors.newScheduledThreadPool(config.getCount() * 2 + 1, runnable -> {
            Thread thread = new Thread(runnable, "queue-scheduler-" + threadIndex.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });

        String instance = UUID.randomUUID().toString().substring(0, 8);
        for (int i = 1; i <= config.getCount(); i++) {
            QueueWorker worker = new QueueWorker(
                    config.getIdPrefix() + "-" + instance + "-" + i,
                    config.getCapacity(),
                    queueService,
                    jobProcessor,
                    workerRepository,
                    timeService,
                    Duration.ofMillis(config.getAdmissionBackoffMs())
            );
            worker.start();
            workers.add(worker);
            scheduler.scheduleWithFixedDelay(() -> guarded("poll", worker::poll),
                    0, config.getPollIntervalMs(), TimeUnit.MILLISECONDS);
            scheduler.scheduleAtFixedRate(() -> guarded("heartbeat", worker::heartbeat),
                    config.getHeartbeatIntervalMs(), config.getHeartbeatIntervalMs(), TimeUnit.MILLISECONDS);
        }
        scheduler.scheduleWithFixedDelay(() -> guarded("maintenance", this::maintenance),
                config.getMaintenanceIntervalMs(), config.getMaintenanceIntervalMs(), TimeUnit.MILLISECONDS);
        log.info("Started {} queue workers (capacity {} each)", config.getCount(), config.getCapacity());
    }

    @PreDestroy
    public synchronized void stop() {
        if (scheduler == null) {
            return;
        }
        scheduler.shutdownNow();
        for (QueueWorker worker : workers) {
            worker.stop();
        }
        workers.clear();
        scheduler = null;
    }

    void maintenance() {
        queueService.reclaimStale();
        queueService.cleanup();
    }

    private void guarded(String task, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            // A throwing task would silently cancel its schedule.
            log.error("Scheduled {} task failed: {}", task, e.getMessage(), e);
        }
    }
}
