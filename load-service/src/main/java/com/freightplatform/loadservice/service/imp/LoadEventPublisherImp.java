package com.freightplatform.loadservice.service.imp;

import com.freightplatform.loadservice.core.exceptions.EventPublishException;
import com.freightplatform.loadservice.dto.event.LoadEventEnvelope;
import com.freightplatform.loadservice.service.LoadEventPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

@Service
@RequiredArgsConstructor
@Slf4j
public class LoadEventPublisherImp implements LoadEventPublisher {

    private final KafkaTemplate<String, Object> kafkaTemplate;

    @Override
    public CompletableFuture<Void> publish(String topic, LoadEventEnvelope envelope) {
        // Keyed by load so one load's events stay on one partition, in order
        String key = envelope.loadId().toString();

        CompletableFuture<Void> result = new CompletableFuture<>();
        try {
            kafkaTemplate.send(topic, key, envelope).whenComplete((sendResult, ex) -> {
                if (ex == null) {
                    log.info("Published {} {} for load {} (offset {})",
                            envelope.eventType(), envelope.eventId(), key,
                            sendResult.getRecordMetadata().offset());
                    result.complete(null);
                } else {
                    result.completeExceptionally(
                            new EventPublishException(envelope.eventType(), envelope.loadId(), ex));
                }
            });
        } catch (RuntimeException e) {
            result.completeExceptionally(new EventPublishException(envelope.eventType(), envelope.loadId(), e));
        }
        return result;
    }
}
