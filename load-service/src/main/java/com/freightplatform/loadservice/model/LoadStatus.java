package com.freightplatform.loadservice.model;

import com.freightplatform.loadservice.core.statemachine.TransitionRuleTable;

public enum LoadStatus {
    CREATED,
    PENDING,
    OPTIMIZING,
    AVAILABLE,
    RESERVED,
    ASSIGNED,
    IN_TRANSIT,
    AT_PICKUP,
    LOADED,
    DELAYED,
    EXCEPTION,
    RESOLVED,
    AT_DROPOFF,
    DELIVERED,
    COMPLETED,
    CANCELLED,
    EXPIRED;

    public boolean isTerminal() {
        return TransitionRuleTable.isTerminal(this);
    }
}
