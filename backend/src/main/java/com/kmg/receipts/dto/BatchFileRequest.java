package com.kmg.receipts.dto;

import jakarta.validation.constraints.NotBlank;

public record BatchFileRequest(
        @NotBlank String sourceType,
        @NotBlank String sourceId
) {
}
