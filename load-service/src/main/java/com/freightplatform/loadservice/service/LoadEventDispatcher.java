package com.freightplatform.loadservice.service;

import com.freightplatform.loadservice.dto.event.LoadEventEnvelope;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Hands load events to the publisher once the surrounding transaction has committed.
 *
 * <p>Nothing is sent for a rolled back transaction. Publish failures are logged and
 * dropped: a committed status change stands whether or not its event got out.</p>
 */
@Component
@Slf4j
public class LoadEventDispatcher {

    private final LoadEventPublisher publisher;
    private final String topic;

    public LoadEventDispatcher(LoadEventPublisher publisher,
                               @Value("${app.events.load-topic:load.events}") String topic) {
        this.publisher = publisher;
        this.topic = topic;
    }

    public void dispatchAfterCommit(LoadEventEnvelope envelope) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            send(envelope);
            return;
        }

        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                send(envelope);
            }
        });
    }

    private void send(LoadEventEnvelope envelope) {
        try {
            publisher.publish(topic, envelope).whenComplete((ignored, ex) -> {
                if (ex != null) {
                    log.error("Event {} ({}) for load {} was not published",
                            envelope.eventId(), envelope.eventType(), envelope.loadId(), ex);
                }
            });
        } catch (RuntimeException e) {
            log.error("Event {} ({}) for load {} was not published",
                    envelope.eventId(), envelope.eventType(), envelope.loadId(), e);
        }
    }
}
