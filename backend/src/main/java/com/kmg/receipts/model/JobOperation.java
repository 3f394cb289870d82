package com.kmg.receipts.model;

public enum JobOperation {
    EXTRACT_RECEIPT,
    GENERATE_EMBEDDING
}
