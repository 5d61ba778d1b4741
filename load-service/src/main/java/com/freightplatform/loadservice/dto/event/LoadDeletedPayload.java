package com.freightplatform.loadservice.dto.event;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.UUID;

public record LoadDeletedPayload(
        @JsonProperty("load_id") UUID loadId,
        @JsonProperty("deleted_at") Instant deletedAt
) implements LoadEventPayload {}
