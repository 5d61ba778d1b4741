package com.freightplatform.loadservice.dto;

import java.util.UUID;

public record StatusCountFilter(UUID shipperId) {
}
