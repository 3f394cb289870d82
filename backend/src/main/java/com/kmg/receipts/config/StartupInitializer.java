package com.kmg.receipts.config;

import com.kmg.receipts.repo.DatabaseSchema;
import com.kmg.receipts.service.QueueService;
import com.kmg.receipts.service.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

@Component
public class StartupInitializer implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(StartupInitializer.class);

    private final ReceiptsProperties properties;
    private final DatabaseSchema databaseSchema;
    private final QueueService queueService;
    private final WorkerPool workerPool;

    public StartupInitializer(
            ReceiptsProperties properties,
            DatabaseSchema databaseSchema,
            QueueService queueService,
            WorkerPool workerPool
    ) {
        this.properties = properties;
        this.databaseSchema = databaseSchema;
        this.queueService = queueService;
        this.workerPool = workerPool;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        createDirectories();
        databaseSchema.initialize();
        // Jobs held by workers of a previous run are reclaimed once their heartbeats are stale.
        int reclaimed = queueService.reclaimStale();
        log.info("Receipt pipeline ready (storage {}, reclaimed {} jobs)", properties.getStorage().getDir(), reclaimed);
        workerPool.start();
    }

    private void createDirectories() throws IOException {
        Files.createDirectories(Path.of(properties.getBaseDir()));
        Files.createDirectories(Path.of(properties.getStorage().getDir()));
        Files.createDirectories(Path.of(properties.getLogs().getDir()));
        Path dbPath = Path.of(properties.getState().getDbPath());
        if (dbPath.getParent() != null) {
            Files.createDirectories(dbPath.getParent());
        }
    }
}
