package com.kmg.receipts.service;

import com.kmg.receipts.model.ReceiptInput;

public interface SourceContentResolver {

    ReceiptInput resolve(String sourceType, String sourceId);
}
