package com.freightplatform.loadservice.dto.event;

import com.freightplatform.loadservice.model.LoadStatus;

public enum LoadEventType {
    LOAD_CREATED,
    LOAD_STATUS_CHANGED,
    LOAD_COMPLETED,
    LOAD_CANCELLED,
    LOAD_DELETED;

    public static LoadEventType forStatusChange(LoadStatus newStatus) {
        return switch (newStatus) {
            case COMPLETED -> LOAD_COMPLETED;
            case CANCELLED -> LOAD_CANCELLED;
            default -> LOAD_STATUS_CHANGED;
        };
    }
}
