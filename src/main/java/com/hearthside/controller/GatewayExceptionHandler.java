package com.hearthside.controller;

import com.hearthside.model.ServiceError;
import com.hearthside.model.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;

import java.time.Clock;

/**
 * Renders framework-level failures in the same body shape as pipeline errors.
 */
@Slf4j
@RestControllerAdvice
public class GatewayExceptionHandler {

    private final Clock clock;

    public GatewayExceptionHandler(Clock clock) {
        this.clock = clock;
    }

    /**
     * Missing identity headers, unreadable JSON, bad query parameters.
     */
    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorResponse> handleInput(ServerWebInputException ex, ServerWebExchange exchange) {
        log.debug("Rejected malformed request to {}: {}", exchange.getRequest().getPath(), ex.getReason());
        ServiceError error = ServiceError.invalidRequest(ex.getReason() != null ? ex.getReason() : "Invalid request");
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.from(error, exchange.getRequest().getPath().value(), clock.instant()));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleStatus(ResponseStatusException ex, ServerWebExchange exchange) {
        ServiceError error = ServiceError.invalidRequest(ex.getReason() != null ? ex.getReason() : ex.getMessage());
        return ResponseEntity.status(ex.getStatusCode())
                .body(ErrorResponse.from(error, exchange.getRequest().getPath().value(), clock.instant()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, ServerWebExchange exchange) {
        log.error("Unhandled exception on {}", exchange.getRequest().getPath(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.from(ServiceError.unknown(), exchange.getRequest().getPath().value(), clock.instant()));
    }
}
