package com.kmg.receipts.model;

public record ReceiptInput(InputType type, String fullText, byte[] imageData, String mimeType) {

    public static ReceiptInput text(String fullText) {
        return new ReceiptInput(InputType.TEXT, fullText, null, null);
    }

    public static ReceiptInput image(byte[] data, String mimeType) {
        return new ReceiptInput(InputType.IMAGE, null, data, mimeType == null ? "image/jpeg" : mimeType);
    }
}
