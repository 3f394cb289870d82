package com.kmg.receipts.service;

import com.kmg.receipts.model.*;
import com.kmg.receipts.repo.MetricRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;

@Service
public class MetricsService {
    private static final Logger log = LoggerFactory.getLogger(MetricsService.class);

    private final MetricRepository metricRepository;
    private final TimeService timeService;

    public MetricsService(MetricRepository metricRepository, TimeService timeService) {
        this.metricRepository = metricRepository;
        this.timeService = timeService;
    }

    public void recordAttempt(
            JobRecord job,
            AttemptStatus status,
            ErrorType errorType,
            String provider,
            String model,
            long tokensUsed,
            long processingTimeMs
    ) {
        MetricRecord record = new MetricRecord(
                0L,
                job.operation(),
                job.id(),
                job.sourceId(),
                status,
                processingTimeMs,
                tokensUsed,
                provider,
                model,
                errorType,
                timeService.now()
        );
        metricRepository.insert(record);
        if (errorType != null) {
            log.debug("Recorded {} attempt for job {} ({})", status, job.id(), errorType);
        }
    }

    public List<MetricRecord> attemptsForJob(String jobId) {
        return metricRepository.findByJobId(jobId);
    }

    public int countAttempts(AttemptStatus status, ErrorType errorType) {
        return metricRepository.countByStatusAndErrorType(status, errorType);
    }

    public List<MetricRepository.ProviderUsage> providerUsage(Duration period) {
        return metricRepository.usageByProviderSince(timeService.now().minus(period));
    }

    public double averageProcessingTimeMs(Duration period) {
        return metricRepository.averageSuccessTimeSince(timeService.now().minus(period));
    }

    public int deleteOlderThan(Duration retention) {
        return metricRepository.deleteBefore(timeService.now().minus(retention));
    }
}
