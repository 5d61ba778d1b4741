package com.freightplatform.loadservice.dto;

import com.freightplatform.loadservice.model.LoadStatus;

import java.util.UUID;

public record CurrentStatusResponse(UUID loadId, LoadStatus status) {
}
