package com.hearthside.model;

import lombok.Value;

/**
 * Identity used for every per-caller policy lookup. Maps are keyed by the value itself;
 * {@link #asString()} is for logs and admin listings only, since ids may contain ':'.
 */
@Value
public class CallerKey {

    String tenantId;
    String callerId;

    public static CallerKey of(String tenantId, String callerId) {
        return new CallerKey(tenantId, callerId);
    }

    public String asString() {
        return tenantId + ":" + callerId;
    }

    @Override
    public String toString() {
        return asString();
    }
}
