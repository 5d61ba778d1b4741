package com.freightplatform.loadservice.dto;

import com.freightplatform.loadservice.model.LoadStatus;
import com.freightplatform.loadservice.model.StatusHistoryRecord;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.Map;

public record StatusUpdateRequest(
        @NotNull LoadStatus status,
        Map<String, Object> details,
        @NotBlank @Size(max = StatusHistoryRecord.ACTOR_MAX_LENGTH) String actor,
        @DecimalMin("-90.0") @DecimalMax("90.0") Double latitude,
        @DecimalMin("-180.0") @DecimalMax("180.0") Double longitude
) {

    public StatusUpdateRequest(LoadStatus status, Map<String, Object> details, String actor) {
        this(status, details, actor, null, null);
    }
}
