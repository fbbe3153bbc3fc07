package com.hearthside.model.dto;

import com.hearthside.model.ErrorKind;
import com.hearthside.model.ServiceError;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Client-visible failure body.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ErrorResponse {
    private boolean success;
    private String message;
    private String errorCode;
    private ErrorKind errorType;
    private boolean retryable;
    private Instant timestamp;
    private String path;

    public static ErrorResponse from(ServiceError error, String path, Instant timestamp) {
        return ErrorResponse.builder()
                .success(false)
                .message(error.getMessage())
                .errorCode(error.getCode())
                .errorType(error.getKind())
                .retryable(error.isRetryable())
                .timestamp(timestamp)
                .path(path)
                .build();
    }
}
