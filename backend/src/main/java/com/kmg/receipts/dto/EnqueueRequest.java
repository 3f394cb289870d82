package com.kmg.receipts.dto;

import com.kmg.receipts.model.JobOperation;
import com.kmg.receipts.model.JobPriority;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record EnqueueRequest(
        @NotBlank String sourceType,
        @NotBlank String sourceId,
        @NotNull JobOperation operation,
        JobPriority priority,
        String modelPreference
) {
}
