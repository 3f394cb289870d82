package com.kmg.receipts.model;

public enum InputType {
    TEXT,
    IMAGE
}
