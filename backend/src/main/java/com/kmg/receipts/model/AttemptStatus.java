package com.kmg.receipts.model;

public enum AttemptStatus {
    SUCCESS,
    RETRY,
    FAILURE,
    DEFERRED
}
