package com.hearthside.service.ratelimit;

import com.hearthside.model.RateTier;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/**
 * Minute/hour/day counters of one caller.
 *
 * Not thread-safe: {@link RateLimiter} only touches a window inside
 * {@code ConcurrentHashMap.compute} for its key.
 */
final class RateWindow {

    private final Map<RateTier, Counter> counters = new EnumMap<>(RateTier.class);

    private RateWindow(Instant now) {
        for (RateTier tier : RateTier.values()) {
            counters.put(tier, new Counter(now.plus(tier.getLength())));
        }
    }

    static RateWindow open(Instant now) {
        return new RateWindow(now);
    }

    /**
     * Zero every tier whose reset time has been reached and start its next period at {@code now}.
     */
    void resetExpired(Instant now) {
        counters.forEach((tier, counter) -> {
            if (!now.isBefore(counter.resetAt)) {
                counter.count = 0;
                counter.resetAt = now.plus(tier.getLength());
            }
        });
    }

    void increment() {
        counters.values().forEach(counter -> counter.count++);
    }

    int count(RateTier tier) {
        return counters.get(tier).count;
    }

    Instant resetAt(RateTier tier) {
        return counters.get(tier).resetAt;
    }

    /**
     * True when every tier is either empty or already past its reset time, i.e. the
     * window carries no state a freshly opened one would not.
     */
    boolean isIdle(Instant now) {
        return counters.values().stream()
                .allMatch(counter -> counter.count == 0 || !now.isBefore(counter.resetAt));
    }

    Instant nextReset() {
        return counters.values().stream()
                .map(counter -> counter.resetAt)
                .min(Instant::compareTo)
                .orElseThrow();
    }

    private static final class Counter {
        private int count;
        private Instant resetAt;

        private Counter(Instant resetAt) {
            this.resetAt = resetAt;
        }
    }
}
