package com.kmg.receipts.service.provider;

import com.kmg.receipts.model.ModelDefinition;
import com.kmg.receipts.model.ReceiptInput;

public record ProviderRequest(ModelDefinition model, String prompt, ReceiptInput input) {
}
