package com.freightplatform.loadservice.core.exceptions;

import com.freightplatform.loadservice.model.LoadStatus;
import lombok.Getter;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.util.UUID;

@Getter
@ResponseStatus(HttpStatus.CONFLICT)
public class InvalidStatusTransitionException extends RuntimeException {

    private final UUID loadId;
    private final LoadStatus from;
    private final LoadStatus to;

    public InvalidStatusTransitionException(UUID loadId, LoadStatus from, LoadStatus to) {
        super("Invalid status transition from " + from + " to " + to + " for load: " + loadId);
        this.loadId = loadId;
        this.from = from;
        this.to = to;
    }
}
