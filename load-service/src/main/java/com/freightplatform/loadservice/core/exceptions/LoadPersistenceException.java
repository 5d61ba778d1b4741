package com.freightplatform.loadservice.core.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
public class LoadPersistenceException extends RuntimeException {
    public LoadPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
