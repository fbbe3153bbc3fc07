package com.hearthside.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * The single error value produced by the gating pipeline. Carried inside an
 * {@link AiResult}; never thrown.
 */
@Value
@Builder
public class ServiceError {

    public static final String AI_DISABLED = "AI_DISABLED";
    public static final String INVALID_REQUEST = "INVALID_REQUEST";
    public static final String RATE_LIMIT_EXCEEDED = "RATE_LIMIT_EXCEEDED";
    public static final String BUDGET_EXCEEDED = "BUDGET_EXCEEDED";
    public static final String API_AUTH_ERROR = "API_AUTH_ERROR";
    public static final String API_RATE_LIMIT = "API_RATE_LIMIT";
    public static final String API_SERVER_ERROR = "API_SERVER_ERROR";
    public static final String API_REQUEST_FAILED = "API_REQUEST_FAILED";
    public static final String API_INVALID_RESPONSE = "API_INVALID_RESPONSE";
    public static final String NETWORK_ERROR = "NETWORK_ERROR";
    public static final String UNKNOWN_ERROR = "UNKNOWN_ERROR";

    String code;
    String message;
    ErrorKind kind;
    boolean retryable;

    @Singular
    Map<String, Object> details;

    public static ServiceError of(String code, String message, ErrorKind kind, boolean retryable) {
        return ServiceError.builder()
                .code(code)
                .message(message)
                .kind(kind)
                .retryable(retryable)
                .build();
    }

    public static ServiceError disabled() {
        return of(AI_DISABLED, "AI features are disabled, check the gateway configuration",
                ErrorKind.VALIDATION_ERROR, false);
    }

    public static ServiceError invalidRequest(String message) {
        return of(INVALID_REQUEST, message, ErrorKind.VALIDATION_ERROR, false);
    }

    public static ServiceError budgetExceeded(String message) {
        return of(BUDGET_EXCEEDED, message, ErrorKind.BUDGET_EXCEEDED, false);
    }

    public static ServiceError unknown() {
        return of(UNKNOWN_ERROR, "Unexpected error while processing the AI request",
                ErrorKind.API_ERROR, true);
    }
}
