package com.freightplatform.loadservice.core.exceptions;

import com.freightplatform.loadservice.dto.event.LoadEventType;
import lombok.Getter;

import java.util.UUID;

@Getter
public class EventPublishException extends RuntimeException {

    private final LoadEventType eventType;
    private final UUID loadId;

    public EventPublishException(LoadEventType eventType, UUID loadId, Throwable cause) {
        super("Failed to publish " + eventType + " for load: " + loadId, cause);
        this.eventType = eventType;
        this.loadId = loadId;
    }
}
