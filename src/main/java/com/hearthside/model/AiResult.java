package com.hearthside.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;

/**
 * Either an {@link AiResponse} or a {@link ServiceError}, never both.
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class AiResult {

    private final AiResponse response;
    private final ServiceError error;

    public static AiResult success(AiResponse response) {
        return new AiResult(Objects.requireNonNull(response, "response"), null);
    }

    public static AiResult failure(ServiceError error) {
        return new AiResult(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return response != null;
    }
}
