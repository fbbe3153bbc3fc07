package com.hearthside.service.concurrency;

import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;

/**
 * Repeating background task with an explicit cancellation handle.
 *
 * A failing run is logged and the schedule continues. {@link #stop()} disposes the
 * underlying interval so nothing outlives the owning component.
 */
@Slf4j
public class PeriodicSweep {

    private final String name;
    private final Duration interval;
    private final Runnable task;
    private final Scheduler scheduler;

    private Disposable handle;

    public PeriodicSweep(String name, Duration interval, Runnable task) {
        this(name, interval, task, Schedulers.parallel());
    }

    public PeriodicSweep(String name, Duration interval, Runnable task, Scheduler scheduler) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive");
        }
        this.name = name;
        this.interval = interval;
        this.task = task;
        this.scheduler = scheduler;
    }

    /**
     * Start the schedule; the first run happens one interval from now. No-op if running.
     */
    public synchronized void start() {
        if (isRunning()) {
            return;
        }
        handle = Flux.interval(interval, interval, scheduler)
                .subscribe(tick -> runOnce(),
                        error -> log.error("Sweep '{}' terminated unexpectedly", name, error));
        log.debug("Started sweep '{}' every {}", name, interval);
    }

    /**
     * Cancel the schedule. Safe to call repeatedly.
     */
    public synchronized void stop() {
        if (handle != null) {
            handle.dispose();
            handle = null;
            log.debug("Stopped sweep '{}'", name);
        }
    }

    public synchronized boolean isRunning() {
        return handle != null && !handle.isDisposed();
    }

    void runOnce() {
        try {
            task.run();
        } catch (RuntimeException e) {
            log.error("Sweep '{}' failed, will retry in {}", name, interval, e);
        }
    }
}
