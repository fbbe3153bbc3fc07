package com.hearthside.service.concurrency;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import com.hearthside.model.CallerKey;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One lock per caller key, so a caller's check-then-record sequences never interleave
 * while different callers proceed in parallel. Critical sections are in-memory work only;
 * nothing holds a lock across a provider call.
 *
 * Locks are weakly held: an entry disappears once no thread references its lock, which
 * bounds memory without an explicit cleanup pass.
 */
@Component
public class CallerLocks {

    private final LoadingCache<CallerKey, ReentrantLock> locks = Caffeine.newBuilder()
            .weakValues()
            .build(key -> new ReentrantLock());

    /**
     * Run {@code action} while holding the caller's lock.
     */
    public <T> T withLock(CallerKey callerKey, Supplier<T> action) {
        ReentrantLock lock = locks.get(callerKey);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Whether some thread currently holds the caller's lock.
     */
    public boolean isLocked(CallerKey callerKey) {
        ReentrantLock lock = locks.getIfPresent(callerKey);
        return lock != null && lock.isLocked();
    }
}
