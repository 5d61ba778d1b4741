package com.freightplatform.loadservice.core.config;

import com.freightplatform.loadservice.core.exceptions.InvalidStatusTransitionException;
import com.freightplatform.loadservice.core.exceptions.LoadNotFoundException;
import com.freightplatform.loadservice.core.exceptions.LoadPersistenceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

import java.time.Instant;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    @ExceptionHandler(LoadNotFoundException.class)
    public ProblemDetail handleNotFound(LoadNotFoundException ex) {
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(HttpStatus.NOT_FOUND, ex.getMessage());
        problemDetail.setTitle("Load Not Found");
        problemDetail.setProperty("loadId", ex.getLoadId());
        problemDetail.setProperty("timestamp", Instant.now());
        return problemDetail;
    }

    @ExceptionHandler(InvalidStatusTransitionException.class)
    public ProblemDetail handleInvalidTransition(InvalidStatusTransitionException ex) {
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(HttpStatus.CONFLICT, ex.getMessage());
        problemDetail.setTitle("Invalid Status Transition");
        problemDetail.setProperty("loadId", ex.getLoadId());
        problemDetail.setProperty("from", ex.getFrom());
        problemDetail.setProperty("to", ex.getTo());
        problemDetail.setProperty("timestamp", Instant.now());
        return problemDetail;
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleBadRequest(IllegalArgumentException ex) {
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
        problemDetail.setTitle("Invalid Request");
        problemDetail.setProperty("timestamp", Instant.now());
        return problemDetail;
    }

    @ExceptionHandler(LoadPersistenceException.class)
    public ProblemDetail handlePersistence(LoadPersistenceException ex) {
        // Storage details stay in the logs
        log.error("Persistence failure surfaced to client", ex);
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(
                HttpStatus.INTERNAL_SERVER_ERROR, "The load store could not complete the request");
        problemDetail.setTitle("Persistence Error");
        problemDetail.setProperty("timestamp", Instant.now());
        return problemDetail;
    }
}
