package com.kmg.receipts.dto;

import com.kmg.receipts.model.JobPriority;
import com.kmg.receipts.model.ProcessingStrategy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record CreateBatchRequest(
        @NotBlank String owner,
        @NotEmpty List<@Valid BatchFileRequest> files,
        ProcessingStrategy processingStrategy,
        @Min(1) @Max(10) Integer maxConcurrent,
        JobPriority priority,
        String modelPreference
) {
}
