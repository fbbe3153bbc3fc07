package com.hearthside.service.cache;

import com.hearthside.config.HearthsideProperties;
import com.hearthside.model.AiRequest;
import com.hearthside.model.Fingerprint;
import com.hearthside.model.dto.CacheEntrySummary;
import com.hearthside.model.dto.CacheStatistics;
import com.hearthside.service.concurrency.PeriodicSweep;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Content-addressed response cache with LRU eviction and a fixed TTL.
 *
 * Entries live in a hash map; recency is a separate insertion-ordered set whose head is
 * the least recently used fingerprint. Both are guarded by this object's monitor and
 * every operation on them is O(1) apart from the admin listings and the sweep.
 */
@Slf4j
@Service
public class ResponseCache {

    private final Map<Fingerprint, CacheEntry> entries = new HashMap<>();
    private final LinkedHashSet<Fingerprint> recency = new LinkedHashSet<>();

    private final RequestFingerprinter fingerprinter;
    private final HearthsideProperties.CacheConfig config;
    private final Clock clock;
    private final PeriodicSweep sweep;

    public ResponseCache(RequestFingerprinter fingerprinter, HearthsideProperties properties, Clock clock) {
        this.fingerprinter = fingerprinter;
        this.config = properties.getCache();
        this.clock = clock;
        this.sweep = new PeriodicSweep("response-cache-sweep", config.getSweepInterval(), this::sweepExpired);
    }

    @PostConstruct
    public void start() {
        if (config.isEnabled()) {
            sweep.start();
        }
    }

    @PreDestroy
    public void stop() {
        sweep.stop();
    }

    public Fingerprint fingerprint(AiRequest request) {
        return fingerprinter.fingerprint(request);
    }

    /**
     * Look up a cached response for an equivalent request, counting a hit when found.
     */
    public Optional<CacheEntry> lookup(AiRequest request) {
        if (!config.isEnabled()) {
            return Optional.empty();
        }
        return lookup(fingerprinter.fingerprint(request));
    }

    public synchronized Optional<CacheEntry> lookup(Fingerprint fingerprint) {
        if (!config.isEnabled()) {
            return Optional.empty();
        }

        CacheEntry entry = entries.get(fingerprint);
        if (entry == null) {
            log.debug("Cache MISS: {}", fingerprint.preview());
            return Optional.empty();
        }

        Instant now = clock.instant();
        if (isExpired(entry, now)) {
            remove(fingerprint);
            log.debug("Cache EXPIRED: {}", fingerprint.preview());
            return Optional.empty();
        }

        CacheEntry hit = entry.withHit(now);
        entries.put(fingerprint, hit);
        promote(fingerprint);

        log.debug("Cache HIT: {} (hits={})", fingerprint.preview(), hit.getHitCount());
        return Optional.of(hit);
    }

    /**
     * Cache a successful response.
     */
    public void store(AiRequest request, String content, int tokenCount) {
        if (!config.isEnabled()) {
            return;
        }
        store(fingerprinter.fingerprint(request), content, tokenCount);
    }

    /**
     * Insert or replace an entry. Replacing keeps the size unchanged; inserting into a full
     * cache evicts exactly the least recently used entry first.
     */
    public synchronized void store(Fingerprint fingerprint, String content, int tokenCount) {
        if (!config.isEnabled()) {
            return;
        }

        if (!entries.containsKey(fingerprint) && entries.size() >= config.getMaxSize()) {
            evictLeastRecentlyUsed();
        }

        entries.put(fingerprint, CacheEntry.builder()
                .fingerprint(fingerprint)
                .content(content)
                .tokenCount(tokenCount)
                .createdAt(clock.instant())
                .hitCount(0)
                .build());
        promote(fingerprint);

        log.debug("Cached response: {} ({} tokens, size={})", fingerprint.preview(), tokenCount, entries.size());
    }

    public synchronized void clear() {
        int removed = entries.size();
        entries.clear();
        recency.clear();
        log.info("Cleared response cache: {} entries removed", removed);
    }

    /**
     * Remove every entry older than the TTL.
     *
     * @return number of entries removed
     */
    public synchronized int sweepExpired() {
        Instant now = clock.instant();
        int removed = 0;

        Iterator<Map.Entry<Fingerprint, CacheEntry>> it = entries.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<Fingerprint, CacheEntry> entry = it.next();
            if (isExpired(entry.getValue(), now)) {
                it.remove();
                recency.remove(entry.getKey());
                removed++;
            }
        }

        if (removed > 0) {
            log.debug("Swept {} expired cache entries, {} remaining", removed, entries.size());
        }
        return removed;
    }

    public synchronized CacheStatistics stats() {
        long totalHits = entries.values().stream().mapToLong(CacheEntry::getHitCount).sum();
        double hitRate = entries.isEmpty() ? 0.0
                : Math.round((double) totalHits / entries.size() * 100.0) / 100.0;

        Instant oldest = entries.values().stream()
                .map(CacheEntry::getCreatedAt)
                .min(Comparator.naturalOrder())
                .orElse(null);
        Instant newest = entries.values().stream()
                .map(CacheEntry::getCreatedAt)
                .max(Comparator.naturalOrder())
                .orElse(null);

        return CacheStatistics.builder()
                .size(entries.size())
                .maxSize(config.getMaxSize())
                .hitRate(hitRate)
                .totalHits(totalHits)
                .oldestEntry(oldest)
                .newestEntry(newest)
                .build();
    }

    /**
     * Most-hit entries first.
     */
    public synchronized List<CacheEntrySummary> entries(int limit) {
        Instant now = clock.instant();
        return entries.values().stream()
                .sorted(Comparator.comparingLong(CacheEntry::getHitCount).reversed())
                .limit(Math.max(0, limit))
                .map(entry -> CacheEntrySummary.builder()
                        .key(entry.getFingerprint().preview())
                        .tokens(entry.getTokenCount())
                        .hitCount(entry.getHitCount())
                        .ageSeconds(Duration.between(entry.getCreatedAt(), now).getSeconds())
                        .createdAt(entry.getCreatedAt())
                        .lastHit(entry.getLastHit())
                        .build())
                .collect(Collectors.toList());
    }

    public synchronized int size() {
        return entries.size();
    }

    /**
     * Fingerprints from least to most recently used.
     */
    synchronized List<Fingerprint> recencyOrder() {
        return new ArrayList<>(recency);
    }

    private boolean isExpired(CacheEntry entry, Instant now) {
        return Duration.between(entry.getCreatedAt(), now).compareTo(config.getTtl()) > 0;
    }

    private void promote(Fingerprint fingerprint) {
        recency.remove(fingerprint);
        recency.add(fingerprint);
    }

    private void remove(Fingerprint fingerprint) {
        entries.remove(fingerprint);
        recency.remove(fingerprint);
    }

    private void evictLeastRecentlyUsed() {
        Iterator<Fingerprint> it = recency.iterator();
        if (it.hasNext()) {
            Fingerprint eldest = it.next();
            it.remove();
            entries.remove(eldest);
            log.debug("Evicted least recently used entry: {}", eldest.preview());
        }
    }
}
