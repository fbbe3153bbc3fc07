package com.hearthside.provider;

import lombok.Getter;

/**
 * Failure of an upstream model call. Carries the HTTP status when the provider answered,
 * otherwise the transport-level reason.
 */
@Getter
public class ProviderException extends RuntimeException {

    public enum Reason {
        /**
         * Provider answered with a non-2xx status.
         */
        HTTP_STATUS,

        /**
         * No response within the configured timeout.
         */
        TIMEOUT,

        /**
         * Connection refused, reset, DNS failure and the like.
         */
        TRANSPORT,

        /**
         * 2xx response without the fields we need.
         */
        MALFORMED_RESPONSE
    }

    private final Reason reason;
    private final Integer status;

    public ProviderException(Reason reason, Integer status, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.status = status;
    }

    public static ProviderException status(int status, String message, Throwable cause) {
        return new ProviderException(Reason.HTTP_STATUS, status, message, cause);
    }

    public static ProviderException timeout(String message, Throwable cause) {
        return new ProviderException(Reason.TIMEOUT, null, message, cause);
    }

    public static ProviderException transport(String message, Throwable cause) {
        return new ProviderException(Reason.TRANSPORT, null, message, cause);
    }

    public static ProviderException malformed(String message) {
        return new ProviderException(Reason.MALFORMED_RESPONSE, null, message, null);
    }

    public boolean hasStatus() {
        return status != null;
    }
}
