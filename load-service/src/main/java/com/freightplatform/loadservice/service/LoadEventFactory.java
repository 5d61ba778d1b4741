package com.freightplatform.loadservice.service;

import com.freightplatform.loadservice.dto.event.*;
import com.freightplatform.loadservice.model.Load;
import com.freightplatform.loadservice.model.LoadStatus;
import com.freightplatform.loadservice.model.StatusHistoryRecord;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Component
public class LoadEventFactory {

    private final String producer;
    private final String eventVersion;

    public LoadEventFactory(
            @Value("${app.events.producer:load-service}") String producer,
            @Value("${app.events.version:1.0}") String eventVersion) {
        this.producer = producer;
        this.eventVersion = eventVersion;
    }

    public LoadEventEnvelope loadCreated(Load load, StatusHistoryRecord initialRecord) {
        LoadCreatedPayload payload = new LoadCreatedPayload(
                load.getId(),
                load.getShipperId(),
                load.getReferenceNumber(),
                load.getStatus(),
                load.getCreatedAt()
        );
        return envelope(LoadEventType.LOAD_CREATED, initialRecord.getId(), payload);
    }

    public LoadEventEnvelope statusChanged(LoadStatus previousStatus, StatusHistoryRecord record) {
        Map<String, Object> details = record.getDetails() == null ? Map.of() : record.getDetails();

        LoadStatusChangedPayload payload = new LoadStatusChangedPayload(
                record.getLoadId(),
                previousStatus,
                record.getStatus(),
                details,
                record.getActor(),
                record.getCreatedAt()
        );
        return envelope(LoadEventType.forStatusChange(record.getStatus()), record.getId(), payload);
    }

    public LoadEventEnvelope loadDeleted(UUID loadId) {
        // No ledger entry survives a deletion, so the event correlates to itself
        return envelope(LoadEventType.LOAD_DELETED, UUID.randomUUID(), new LoadDeletedPayload(loadId, Instant.now()));
    }

    private LoadEventEnvelope envelope(LoadEventType type, UUID correlationId, LoadEventPayload payload) {
        return new LoadEventEnvelope(
                UUID.randomUUID(),
                type,
                eventVersion,
                Instant.now(),
                producer,
                correlationId,
                LoadEventEnvelope.CATEGORY,
                payload
        );
    }
}
