package com.kmg.receipts.service;

import com.kmg.receipts.dto.EventMessage;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyEmitter;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Keeps the events it is sent instead of writing them to a response. {@code failing} makes every
 * send throw, like a client that went away.
 */
final class RecordingEmitter extends SseEmitter {
    final List<EventMessage> received = new ArrayList<>();
    private final boolean failing;
    int sendAttempts;

    RecordingEmitter(boolean failing) {
        super(0L);
        this.failing = failing;
    }

    RecordingEmitter() {
        this(false);
    }

    @Override
    public void send(SseEventBuilder builder) throws IOException {
        sendAttempts++;
        if (failing) {
            throw new IOException("Broken pipe");
        }
        for (ResponseBodyEmitter.DataWithMediaType part : builder.build()) {
            if (part.getData() instanceof EventMessage) {
                received.add((EventMessage) part.getData());
            }
        }
    }
}
