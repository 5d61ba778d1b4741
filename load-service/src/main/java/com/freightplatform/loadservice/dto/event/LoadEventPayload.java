package com.freightplatform.loadservice.dto.event;

import java.util.UUID;

public interface LoadEventPayload {

    UUID loadId();
}
