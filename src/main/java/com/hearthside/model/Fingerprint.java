package com.hearthside.model;

import lombok.Value;

/**
 * SHA-256 digest (64 hex chars) of the policy-equivalence fields of an {@link AiRequest}.
 */
@Value
public class Fingerprint {

    String value;

    /**
     * Truncated form for logs and admin listings.
     */
    public String preview() {
        return value.length() > 16 ? value.substring(0, 16) + "..." : value;
    }

    @Override
    public String toString() {
        return value;
    }
}
