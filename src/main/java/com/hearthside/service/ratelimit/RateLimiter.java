package com.hearthside.service.ratelimit;

import com.hearthside.config.HearthsideProperties;
import com.hearthside.model.CallerKey;
import com.hearthside.model.RateLimitDecision;
import com.hearthside.model.RateLimitStatus;
import com.hearthside.model.RateTier;
import com.hearthside.model.TierStatus;
import com.hearthside.model.dto.RateLimitStatistics;
import com.hearthside.model.dto.RateWindowSummary;
import com.hearthside.service.concurrency.PeriodicSweep;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiConsumer;

/**
 * Per-caller request counters over minute, hour and day windows.
 *
 * {@link #check} and {@link #record} are separate on purpose: a cache hit consumes quota
 * only after the lookup succeeds. Both reset expired tiers lazily on access.
 *
 * Flow:
 * 1. check - reject on the first exhausted tier (minute, then hour, then day)
 * 2. record - +1 on all three tiers once the request has been served
 *
 * Read-only calls never open a window; only {@link #record} does.
 */
@Slf4j
@Service
public class RateLimiter {

    private final ConcurrentMap<CallerKey, RateWindow> windows = new ConcurrentHashMap<>();
    private final HearthsideProperties.RateLimitConfig config;
    private final Clock clock;
    private final PeriodicSweep cleanup;

    public RateLimiter(HearthsideProperties properties, Clock clock) {
        this.config = properties.getRateLimit();
        this.clock = clock;
        this.cleanup = new PeriodicSweep("rate-window-cleanup", config.getCleanupInterval(), this::cleanupExpired);
    }

    @PostConstruct
    public void start() {
        cleanup.start();
    }

    @PreDestroy
    public void stop() {
        cleanup.stop();
    }

    /**
     * Check whether the caller may issue another request. Does not consume quota.
     *
     * @param callerKey caller identity
     * @return decision with the current per-tier status
     */
    public RateLimitDecision check(CallerKey callerKey) {
        return check(callerKey, 0);
    }

    /**
     * Check whether the caller may issue another request while {@code inFlight} of its
     * admitted requests are still unrecorded. In-flight requests count as used.
     *
     * @param callerKey caller identity
     * @param inFlight admitted requests not yet recorded
     * @return decision with the current per-tier status
     */
    public RateLimitDecision check(CallerKey callerKey, int inFlight) {
        RateLimitStatus status = peek(callerKey);

        for (RateTier tier : RateTier.values()) {
            TierStatus tierStatus = status.tier(tier);
            int claimed = tierStatus.getUsed() + Math.max(0, inFlight);
            if (claimed >= tierStatus.getLimit()) {
                String reason = String.format("Request limit exceeded (%s): %d of %d requests used",
                        tier.getLabel(), claimed, tierStatus.getLimit());
                log.debug("Rate limit hit: caller={}, tier={}, used={}, inFlight={}, limit={}",
                        callerKey, tier, tierStatus.getUsed(), inFlight, tierStatus.getLimit());

                return RateLimitDecision.builder()
                        .allowed(false)
                        .reason(reason)
                        .tier(tier)
                        .status(status)
                        .build();
            }
        }

        return RateLimitDecision.builder()
                .allowed(true)
                .status(status)
                .build();
    }

    /**
     * Count one served request against every tier.
     *
     * @param callerKey caller identity
     */
    public void record(CallerKey callerKey) {
        Instant now = clock.instant();
        RateLimitStatus[] status = new RateLimitStatus[1];

        windows.compute(callerKey, (key, window) -> {
            RateWindow current = window != null ? window : RateWindow.open(now);
            current.resetExpired(now);
            current.increment();
            status[0] = snapshot(current);
            return current;
        });

        log.debug("Recorded AI request: caller={}, minute={}, hour={}, day={}",
                callerKey, status[0].getMinute().getUsed(), status[0].getHour().getUsed(), status[0].getDay().getUsed());
    }

    /**
     * Current per-tier status for a caller. A caller without a window gets a fresh one's
     * figures; nothing is stored.
     */
    public RateLimitStatus status(CallerKey callerKey) {
        return peek(callerKey);
    }

    /**
     * Forget a caller's counters.
     */
    public void reset(CallerKey callerKey) {
        windows.remove(callerKey);
        log.info("Reset AI rate limits: caller={}", callerKey);
    }

    /**
     * Forget every caller's counters.
     */
    public void clear() {
        windows.clear();
        log.info("Cleared all AI rate limit windows");
    }

    /**
     * Remove windows whose tiers are all idle.
     *
     * @return number of windows removed
     */
    public int cleanupExpired() {
        Instant now = clock.instant();
        AtomicInteger removed = new AtomicInteger();

        for (CallerKey key : windows.keySet()) {
            windows.computeIfPresent(key, (k, window) -> {
                if (window.isIdle(now)) {
                    removed.incrementAndGet();
                    return null;
                }
                return window;
            });
        }

        if (removed.get() > 0) {
            log.debug("Cleaned up idle rate limit windows: removed={}, remaining={}", removed.get(), windows.size());
        }
        return removed.get();
    }

    /**
     * All tracked callers, busiest (by day count) first.
     */
    public List<RateWindowSummary> windows() {
        List<RateWindowSummary> summaries = new ArrayList<>();
        forEachWindow((key, window) -> summaries.add(RateWindowSummary.builder()
                .key(key.asString())
                .minuteCount(window.count(RateTier.MINUTE))
                .hourCount(window.count(RateTier.HOUR))
                .dayCount(window.count(RateTier.DAY))
                .nextReset(window.nextReset())
                .build()));

        summaries.sort(Comparator.comparingInt(RateWindowSummary::getDayCount).reversed());
        return summaries;
    }

    /**
     * Aggregate counts across callers.
     */
    public RateLimitStatistics statistics() {
        Instant now = clock.instant();
        int[] active = new int[1];
        long[] totals = new long[3];

        forEachWindow((key, window) -> {
            if (window.count(RateTier.HOUR) > 0 && now.isBefore(window.resetAt(RateTier.HOUR))) {
                active[0]++;
            }
            totals[0] += window.count(RateTier.MINUTE);
            totals[1] += window.count(RateTier.HOUR);
            totals[2] += window.count(RateTier.DAY);
        });

        return RateLimitStatistics.builder()
                .totalCallers(windows.size())
                .activeCallers(active[0])
                .minuteRequests(totals[0])
                .hourRequests(totals[1])
                .dayRequests(totals[2])
                .build();
    }

    public int trackedCallers() {
        return windows.size();
    }

    int limitFor(RateTier tier) {
        switch (tier) {
            case MINUTE:
                return config.getRequestsPerMinute();
            case HOUR:
                return config.getRequestsPerHour();
            default:
                return config.getRequestsPerDay();
        }
    }

    /**
     * Refresh the caller's window, if it has one, and return a consistent snapshot.
     */
    private RateLimitStatus peek(CallerKey callerKey) {
        Instant now = clock.instant();
        RateLimitStatus[] snapshot = new RateLimitStatus[1];

        windows.computeIfPresent(callerKey, (key, window) -> {
            window.resetExpired(now);
            snapshot[0] = snapshot(window);
            return window;
        });

        return snapshot[0] != null ? snapshot[0] : snapshot(RateWindow.open(now));
    }

    private RateLimitStatus snapshot(RateWindow window) {
        return RateLimitStatus.builder()
                .minute(tierStatus(window, RateTier.MINUTE))
                .hour(tierStatus(window, RateTier.HOUR))
                .day(tierStatus(window, RateTier.DAY))
                .build();
    }

    private TierStatus tierStatus(RateWindow window, RateTier tier) {
        int used = window.count(tier);
        int limit = limitFor(tier);
        return TierStatus.builder()
                .used(used)
                .limit(limit)
                .remaining(Math.max(0, limit - used))
                .resetAt(window.resetAt(tier))
                .build();
    }

    /**
     * Visit each window under its key's lock so reads are not torn by concurrent records.
     */
    private void forEachWindow(BiConsumer<CallerKey, RateWindow> visitor) {
        for (CallerKey key : windows.keySet()) {
            windows.computeIfPresent(key, (k, window) -> {
                visitor.accept(k, window);
                return window;
            });
        }
    }
}
