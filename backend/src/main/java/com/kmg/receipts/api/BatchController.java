package com.kmg.receipts.api;

import com.kmg.receipts.dto.BatchStatusView;
import com.kmg.receipts.dto.CreateBatchRequest;
import com.kmg.receipts.model.BatchSessionRecord;
import com.kmg.receipts.service.BatchSessionService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/batches")
public class BatchController {
    private final BatchSessionService batchSessionService;

    public BatchController(BatchSessionService batchSessionService) {
        this.batchSessionService = batchSessionService;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public BatchStatusView create(@Valid @RequestBody CreateBatchRequest request) {
        BatchSessionRecord session = batchSessionService.createSession(request);
        return BatchStatusView.from(session);
    }

    @GetMapping
    public List<BatchStatusView> list(@RequestParam(defaultValue = "20") int limit) {
        return batchSessionService.listRecent(Math.max(1, Math.min(limit, 200)));
    }

    @GetMapping("/{id}")
    public BatchStatusView get(@PathVariable String id) {
        return batchSessionService.getBatchStatus(id);
    }

    @PostMapping("/{id}/cancel")
    public BatchStatusView cancel(@PathVariable String id) {
        return batchSessionService.cancel(id);
    }
}
