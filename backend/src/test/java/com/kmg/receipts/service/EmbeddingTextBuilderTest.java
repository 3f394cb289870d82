package com.kmg.receipts.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EmbeddingTextBuilderTest {
    private final EmbeddingTextBuilder builder = new EmbeddingTextBuilder(new ObjectMapper());

    @Test
    void flattensKnownFieldsAndLineItems() {
        String text = builder.build("""
                {"merchant": "Tesco", "date": "2025-01-05", "total": 41.2, "currency": "MYR",
                 "payment_method": "", "predicted_category": "Groceries", "tax": 2.1,
                 "line_items": [{"description": "Bread", "amount": 4.5}, {"description": "Eggs"}, {"amount": 1}]}
                """);

        assertThat(text).isEqualTo("""
                merchant: Tesco
                date: 2025-01-05
                total: 41.2
                currency: MYR
                predicted_category: Groceries
                item: Bread 4.5
                item: Eggs""");
    }

    @Test
    void rejectsCorruptStoredResults() {
        assertThatThrownBy(() -> builder.build("{not json"))
                .isInstanceOf(IllegalStateException.class);
    }
}
