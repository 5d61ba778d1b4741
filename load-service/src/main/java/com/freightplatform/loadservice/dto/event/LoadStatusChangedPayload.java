package com.freightplatform.loadservice.dto.event;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.freightplatform.loadservice.model.LoadStatus;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

public record LoadStatusChangedPayload(
        @JsonProperty("load_id") UUID loadId,
        @JsonProperty("previous_status") LoadStatus previousStatus,
        @JsonProperty("new_status") LoadStatus newStatus,
        @JsonProperty("status_details") Map<String, Object> statusDetails,
        String actor,
        @JsonProperty("changed_at") Instant changedAt
) implements LoadEventPayload {}
