package com.kmg.receipts.service;

import com.kmg.receipts.model.JobRecord;
import org.slf4j.MDC;
import org.springframework.util.StringUtils;

import java.util.Map;

final class WorkerMdc {
    static final String KEY_WORKER_ID = "worker.id";
    static final String KEY_JOB_ID = "job.id";
    static final String KEY_BATCH_ID = "batch.id";

    private WorkerMdc() {
    }

    static Context open(String workerId, JobRecord job) {
        return new Context(workerId, job);
    }

    private static void putIfHasText(String key, String value) {
        if (StringUtils.hasText(value)) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }

    static final class Context implements AutoCloseable {
        private final Map<String, String> previous;

        private Context(String workerId, JobRecord job) {
            this.previous = MDC.getCopyOfContextMap();
            putIfHasText(KEY_WORKER_ID, workerId);
            putIfHasText(KEY_JOB_ID, job.id());
            putIfHasText(KEY_BATCH_ID, job.batchId());
        }

        @Override
        public void close() {
            if (previous == null) {
                MDC.clear();
            } else {
                MDC.setContextMap(previous);
            }
        }
    }
}
