package com.kmg.receipts.service.routing;

import com.kmg.receipts.model.InputType;
import com.kmg.receipts.model.ReceiptInput;
import org.springframework.stereotype.Component;

@Component
public class ReceiptPromptBuilder {
    private static final String CATEGORIES =
            "\"Groceries\", \"Dining\", \"Transportation\", \"Utilities\", \"Entertainment\", "
                    + "\"Travel\", \"Shopping\", \"Healthcare\", \"Education\", \"Other\"";

    private static final String RESPONSE_FORMAT = """
            Answer with a single JSON object and nothing else:
            {
              "merchant": "store or business name",
              "date": "purchase date as YYYY-MM-DD",
              "total": 0.00,
              "tax": 0.00,
              "currency": "ISO currency code such as MYR or USD",
              "payment_method": "payment method as printed",
              "predicted_category": "one of the listed categories",
              "line_items": [ { "description": "item text", "amount": 0.00 } ],
              "confidence": {
                "merchant": 0, "date": 0, "total": 0, "tax": 0, "currency": 0,
                "payment_method": 0, "predicted_category": 0, "line_items": 0
              }
            }
            Confidence values are integers from 0 to 100. Omit a field you cannot read instead of guessing.
            """;

    public String build(ReceiptInput input) {
        if (input.type() == InputType.IMAGE) {
            return """
                    You extract structured data from receipt images.
                    Read the attached receipt and report the merchant, purchase date, total, tax, \
                    line items, currency (look for RM, $, MYR, USD), payment method, \
                    and an expense category from: %s.
                    %s""".formatted(CATEGORIES, RESPONSE_FORMAT);
        }
        return """
                You extract structured data from OCR text of a receipt.

                RECEIPT TEXT:
                %s

                Report the merchant, purchase date, total, tax, line items, currency (look for RM, $, MYR, USD), \
                payment method, and an expense category from: %s.
                %s""".formatted(input.fullText(), CATEGORIES, RESPONSE_FORMAT);
    }
}
