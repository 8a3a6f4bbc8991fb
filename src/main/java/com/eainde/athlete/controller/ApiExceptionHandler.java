package com.eainde.athlete.controller;

import com.eainde.athlete.exception.AgentException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Clock;
import java.time.Instant;

/**
 * Maps pipeline failures to {@link ApiError} bodies. The error code is passed through; the
 * status is chosen from it.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    private final Clock clock;

    public ApiExceptionHandler(Clock clock) {
        this.clock = clock;
    }

    @ExceptionHandler(AgentException.class)
    public ResponseEntity<ApiError> handleAgentException(AgentException e) {
        HttpStatus status = statusFor(e.getCode());
        if (status.is5xxServerError()) {
            log.error("Request failed [{}]: {}", e.getCode(), e.getMessage(), e);
        } else {
            log.info("Request rejected [{}]: {}", e.getCode(), e.getMessage());
        }
        return ResponseEntity.status(status).body(new ApiError(e.getCode(), e.getMessage(), now()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException e) {
        return ResponseEntity.badRequest().body(new ApiError("INVALID_REQUEST", "Malformed request body", now()));
    }

    static HttpStatus statusFor(String code) {
        switch (code) {
            case "INVALID_REQUEST":
                return HttpStatus.BAD_REQUEST;
            case "GRAPH_TIMEOUT":
            case "REQUEST_TIMEOUT":
                return HttpStatus.GATEWAY_TIMEOUT;
            case "CIRCUIT_OPEN":
                return HttpStatus.SERVICE_UNAVAILABLE;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }

    private Instant now() {
        return clock.instant();
    }
}
