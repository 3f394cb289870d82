package com.kmg.receipts.service;

import com.kmg.receipts.dto.BatchStatusView;
import com.kmg.receipts.dto.EventMessage;
import com.kmg.receipts.model.BatchEventType;
import com.kmg.receipts.model.BatchSessionRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Pushes batch lifecycle events to dashboards over server-sent events. An event published inside
 * a transaction goes out only after that transaction commits.
 */
@Service
public class EventService {
    private static final Logger log = LoggerFactory.getLogger(EventService.class);
    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();
    private final TimeService timeService;

    public EventService(TimeService timeService) {
        this.timeService = timeService;
    }

    public SseEmitter subscribe(String batchId) {
        return register(new SseEmitter(0L), batchId);
    }

    SseEmitter register(SseEmitter emitter, String batchId) {
        Subscription subscription = new Subscription(emitter, batchId);
        subscriptions.add(subscription);

        emitter.onCompletion(() -> subscriptions.remove(subscription));
        emitter.onTimeout(() -> subscriptions.remove(subscription));
        emitter.onError(ex -> subscriptions.remove(subscription));

        log.debug("Event subscriber added for {} ({} open)", batchId == null ? "all batches" : "batch " + batchId,
                subscriptions.size());
        return emitter;
    }

    public void publishBatch(BatchEventType type, BatchSessionRecord session, String message) {
        EventMessage event = new EventMessage(type.eventName(), session.id(), message, timeService.now().toString(),
                BatchStatusView.from(session));
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            send(event);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                send(event);
            }
        });
    }

    int subscriberCount() {
        return subscriptions.size();
    }

    private void send(EventMessage event) {
        for (Subscription subscription : subscriptions) {
            if (!subscription.wants(event.batchId())) {
                continue;
            }
            try {
                subscription.emitter().send(SseEmitter.event().name(event.type()).data(event));
            } catch (IOException | IllegalStateException e) {
                log.debug("Removing SSE emitter after send failure: {}", e.getMessage());
                subscriptions.remove(subscription);
            }
        }
    }

    private record Subscription(SseEmitter emitter, String batchId) {
        boolean wants(String eventBatchId) {
            return batchId == null || batchId.equals(eventBatchId);
        }
    }
}
