package com.freightplatform.loadservice.core.exceptions;

import lombok.Getter;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.util.UUID;

@Getter
@ResponseStatus(HttpStatus.NOT_FOUND)
public class LoadNotFoundException extends RuntimeException {

    private final UUID loadId;

    public LoadNotFoundException(UUID loadId) {
        super("Load not found with id: " + loadId);
        this.loadId = loadId;
    }
}
