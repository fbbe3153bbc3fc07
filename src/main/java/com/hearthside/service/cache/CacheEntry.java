package com.hearthside.service.cache;

import com.hearthside.model.Fingerprint;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A cached model output. Immutable; a hit produces a copy with updated hit statistics.
 */
@Value
@Builder(toBuilder = true)
public class CacheEntry {
    Fingerprint fingerprint;
    String content;
    int tokenCount;
    Instant createdAt;
    long hitCount;

    /**
     * Null until the first hit.
     */
    Instant lastHit;

    CacheEntry withHit(Instant now) {
        return toBuilder()
                .hitCount(hitCount + 1)
                .lastHit(now)
                .build();
    }
}
