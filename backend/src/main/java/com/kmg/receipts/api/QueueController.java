package com.kmg.receipts.api;

import com.kmg.receipts.dto.*;
import com.kmg.receipts.model.NewJob;
import com.kmg.receipts.service.QueueService;
import com.kmg.receipts.service.UsageService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/queue")
public class QueueController {
    private final QueueService queueService;
    private final UsageService usageService;

    public QueueController(QueueService queueService, UsageService usageService) {
        this.queueService = queueService;
        this.usageService = usageService;
    }

    @PostMapping("/jobs")
    public ResponseEntity<EnqueueResponse> enqueue(@Valid @RequestBody EnqueueRequest request) {
        EnqueueResponse response = queueService.enqueue(new NewJob(
                request.sourceType(),
                request.sourceId(),
                request.operation(),
                request.priority(),
                null,
                request.modelPreference()
        ));
        HttpStatus status = response.created() ? HttpStatus.CREATED : HttpStatus.OK;
        return ResponseEntity.status(status).body(response);
    }

    @GetMapping("/statistics")
    public QueueStatisticsView statistics() {
        return queueService.getQueueStatistics();
    }

    @GetMapping("/workers")
    public List<WorkerStatusView> workers() {
        return queueService.getWorkerStatus();
    }

    @GetMapping("/usage")
    public UsageStatsView usage() {
        return usageService.usage();
    }

    @PostMapping("/requeue-failed")
    public RequeueFailedResponse requeueFailed(@RequestParam(defaultValue = "100") int maxItems) {
        if (maxItems < 1) {
            throw new IllegalArgumentException("maxItems must be positive.");
        }
        return new RequeueFailedResponse(queueService.requeueFailed(maxItems));
    }
}
