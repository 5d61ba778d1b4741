package com.freightplatform.loadservice.dto.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.UUID;

public record LoadEventEnvelope(
        @JsonProperty("event_id") UUID eventId,
        @JsonProperty("event_type") LoadEventType eventType,
        @JsonProperty("event_version") String eventVersion,
        @JsonProperty("event_time") Instant eventTime,
        String producer,
        @JsonProperty("correlation_id") UUID correlationId, // history record that caused the event
        String category,
        LoadEventPayload payload
) {

    public static final String CATEGORY = "LOAD";

    @JsonIgnore
    public UUID loadId() {
        return payload.loadId();
    }
}
