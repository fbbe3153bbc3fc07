package com.hearthside.model;

/**
 * HTTP headers for caller identity and cache provenance.
 */
public class GatewayHeaders {

    // ========== Request Identity Headers ==========

    /**
     * Authenticated user id, set by the upstream authentication layer.
     */
    public static final String CALLER_ID = "X-Caller-Id";

    /**
     * Family the caller belongs to.
     */
    public static final String TENANT_ID = "X-Tenant-Id";

    // ========== Response Provenance Headers ==========

    /**
     * Whether the response came from cache.
     * Value: "true" or "false"
     */
    public static final String CACHE_HIT = "x-cache-hit";

    /**
     * Provider request id, or a cache-derived id for cache hits.
     */
    public static final String REQUEST_ID = "x-request-id";

    private GatewayHeaders() {
    }
}
