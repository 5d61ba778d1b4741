package com.freightplatform.loadservice.dto;

import com.freightplatform.loadservice.model.EquipmentType;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.util.UUID;

public record CreateLoadRequest(
        @NotNull UUID shipperId,
        @Size(max = 64) String referenceNumber,
        String description,
        EquipmentType equipmentType,
        @Positive BigDecimal weight,
        @Positive BigDecimal offeredRate,
        @Size(max = 100) String createdBy
) {
}
