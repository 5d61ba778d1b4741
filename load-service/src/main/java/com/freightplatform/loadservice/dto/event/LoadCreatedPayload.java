package com.freightplatform.loadservice.dto.event;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.freightplatform.loadservice.model.LoadStatus;

import java.time.Instant;
import java.util.UUID;

public record LoadCreatedPayload(
        @JsonProperty("load_id") UUID loadId,
        @JsonProperty("shipper_id") UUID shipperId,
        @JsonProperty("reference_number") String referenceNumber,
        LoadStatus status,
        @JsonProperty("created_at") Instant createdAt
) implements LoadEventPayload {}
