package com.hearthside.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Failure classes of the gating pipeline.
 */
public enum ErrorKind {
    /**
     * Caller or tenant spend ceiling reached. Never retried automatically.
     */
    BUDGET_EXCEEDED("budget_exceeded"),

    /**
     * Local request ceiling or upstream 429. Back off and retry.
     */
    RATE_LIMIT("rate_limit"),

    /**
     * Provider rejected or failed the call.
     */
    API_ERROR("api_error"),

    /**
     * Caller input or configuration problem.
     */
    VALIDATION_ERROR("validation_error"),

    /**
     * Transport failure or timeout talking to the provider.
     */
    NETWORK_ERROR("network_error");

    private final String value;

    ErrorKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
