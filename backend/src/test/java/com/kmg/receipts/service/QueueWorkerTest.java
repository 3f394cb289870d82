package com.kmg.receipts.service;

import com.kmg.receipts.model.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class QueueWorkerTest {
    @TempDir
    Path tempDir;

    private TestPipeline pipeline;
    private JobProcessor processor;
    private QueueWorker worker;

    @BeforeEach
    void setUp() {
        pipeline = new TestPipeline(tempDir);
        processor = mock(JobProcessor.class);
        worker = pipeline.worker("w-1", processor);
        worker.start();
    }

    @Test
    void registersAndCountsProcessedJobs() {
        for (int i = 0; i < 2; i++) {
            pipeline.queueService.enqueue(NewJob.of("receipts", "r-" + i, JobOperation.EXTRACT_RECEIPT, JobPriority.MEDIUM));
        }
        when(processor.process(any(), eq("w-1"))).thenReturn(JobProcessor.Outcome.COMPLETED);

        assertThat(worker.runOnce()).isEqualTo(2);

        WorkerRecord record = pipeline.workerRepository.findById("w-1").orElseThrow();
        assertThat(record.processedCount()).isEqualTo(2);
        assertThat(record.errorCount()).isZero();
        assertThat(record.status()).isEqualTo(WorkerStatus.IDLE);
        assertThat(record.currentJob()).isNull();
        worker.stop();
    }

    @Test
    void claimsNoMoreThanItsCapacity() {
        for (int i = 0; i < 5; i++) {
            pipeline.queueService.enqueue(NewJob.of("receipts", "r-" + i, JobOperation.EXTRACT_RECEIPT, JobPriority.MEDIUM));
        }
        when(processor.process(any(), eq("w-1"))).thenReturn(JobProcessor.Outcome.COMPLETED);

        assertThat(worker.runOnce()).isEqualTo(3);
        assertThat(worker.runOnce()).isEqualTo(2);
        worker.stop();
    }

    @Test
    void deniedAdmissionPausesPolling() {
        pipeline.queueService.enqueue(NewJob.of("receipts", "r-1", JobOperation.EXTRACT_RECEIPT, JobPriority.MEDIUM));
        pipeline.queueService.enqueue(NewJob.of("receipts", "r-2", JobOperation.EXTRACT_RECEIPT, JobPriority.MEDIUM));
        when(processor.process(any(), eq("w-1"))).thenReturn(JobProcessor.Outcome.DEFERRED);

        worker.runOnce();
        assertThat(worker.paused()).isTrue();

        pipeline.clock.advance(Duration.ofSeconds(3));
        assertThat(worker.paused()).isFalse();
        worker.stop();
    }

    @Test
    void unexpectedProcessorErrorHandsTheJobBack() {
        String jobId = pipeline.queueService.enqueue(
                NewJob.of("receipts", "r-1", JobOperation.EXTRACT_RECEIPT, JobPriority.MEDIUM)).jobId();
        when(processor.process(any(), eq("w-1"))).thenThrow(new IllegalStateException("database gone"));

        assertThatThrownBy(() -> worker.runOnce()).isInstanceOf(IllegalStateException.class);

        JobRecord job = pipeline.queueService.getJob(jobId);
        assertThat(job.status()).isEqualTo(JobStatus.PENDING);
        assertThat(job.retryCount()).isZero();
        verify(processor, times(1)).process(any(), eq("w-1"));
        worker.stop();
    }

    @Test
    void stopMarksTheWorkerStopped() {
        worker.stop();

        assertThat(pipeline.workerRepository.findById("w-1").orElseThrow().status()).isEqualTo(WorkerStatus.STOPPED);
        assertThat(worker.poll()).isEmpty();
    }
}
