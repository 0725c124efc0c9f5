package com.ttlcache.storage;

import com.ttlcache.core.AlertType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Periodic background maintenance for a cache.
 *
 * At most one run is in flight at any time: a trigger arriving while a run
 * is active (timer or manual) is dropped, never queued. A failing run is
 * retried with exponential backoff (base * 2^attempt); once retries are
 * exhausted a critical alert is recorded and the run gives up. Failures
 * never escape to the caller or kill the timer.
 *
 * {@link #shutdown()} also waits for a run started on a caller thread, so
 * nothing touches the cache once it returns.
 */
@Slf4j
public class CleanupScheduler {

    private static final long SHUTDOWN_TIMEOUT_MS = 5000;

    private final String name;
    private final CleanupTask task;
    private final Duration interval;
    private final int maxRetries;
    private final Duration retryBackoffBase;
    private final AlertLog alertLog;
    private final Clock clock;
    private final Counter failedAttempts;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicInteger cleanupErrors = new AtomicInteger();
    private volatile long lastCleanupTime;
    private volatile boolean stopped;
    private volatile Thread runner;
    private ScheduledExecutorService executor;

    public CleanupScheduler(
            String name,
            CleanupTask task,
            Duration interval,
            int maxRetries,
            Duration retryBackoffBase,
            AlertLog alertLog,
            Clock clock,
            MeterRegistry meterRegistry) {

        this.name = name;
        this.task = task;
        this.interval = interval;
        this.maxRetries = maxRetries;
        this.retryBackoffBase = retryBackoffBase;
        this.alertLog = alertLog;
        this.clock = clock;
        this.failedAttempts = Counter.builder("ttlcache.cleanup.failures")
                .description("Failed cleanup attempts")
                .tag("cache", name)
                .register(meterRegistry);
    }

    /**
     * Start the periodic timer. The first run happens one interval from now.
     */
    public synchronized void start() {
        if (executor != null || stopped) {
            return;
        }
        executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "ttlcache-janitor-" + name);
            thread.setDaemon(true);
            return thread;
        });
        long periodMs = interval.toMillis();
        executor.scheduleWithFixedDelay(this::tick, periodMs, periodMs, TimeUnit.MILLISECONDS);
        log.debug("Cleanup scheduled for {} every {}ms", name, periodMs);
    }

    /**
     * Run one cleanup (with retries) on the calling thread.
     *
     * @return false if the run was dropped because another run is in progress
     *         or the scheduler is stopped
     */
    public boolean runCleanup() {
        if (stopped) {
            return false;
        }
        if (!running.compareAndSet(false, true)) {
            log.debug("Cleanup already in progress for {}, dropping trigger", name);
            return false;
        }
        runner = Thread.currentThread();
        try {
            runWithRetry();
        } finally {
            synchronized (this) {
                runner = null;
                running.set(false);
                notifyAll();
            }
        }
        return true;
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Failed attempts since the last successful run
     */
    public int getCleanupErrors() {
        return cleanupErrors.get();
    }

    /**
     * Epoch millis of the last successful run, 0 if none yet
     */
    public long getLastCleanupTime() {
        return lastCleanupTime;
    }

    /**
     * Stop the timer and wait for an in-flight run to finish, whether it runs
     * on the timer thread or on a caller thread.
     * After this returns no run is active and no further run starts.
     */
    public void shutdown() {
        ScheduledExecutorService toStop;
        synchronized (this) {
            stopped = true;
            toStop = executor;
            executor = null;
            // wake a run sleeping between retries
            notifyAll();
        }
        try {
            if (toStop != null) {
                toStop.shutdownNow();
                if (!toStop.awaitTermination(SHUTDOWN_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                    log.warn("Cleanup thread for {} did not stop within {}ms", name, SHUTDOWN_TIMEOUT_MS);
                }
            }
            awaitInFlightRun();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    long backoffDelayMs(int attempt) {
        return retryBackoffBase.toMillis() * (1L << attempt);
    }

    private void tick() {
        try {
            runCleanup();
        } catch (RuntimeException e) {
            // keep the periodic task alive; a thrown exception would cancel it
            log.error("Unexpected error in cleanup timer for {}", name, e);
        }
    }

    private void runWithRetry() {
        Exception lastException = null;

        for (int attempt = 1; attempt <= maxRetries; attempt++) {
            if (stopped) {
                return;
            }
            try {
                task.run();
                lastCleanupTime = clock.millis();
                cleanupErrors.set(0);
                return;
            } catch (Exception e) {
                lastException = e;
                cleanupErrors.incrementAndGet();
                failedAttempts.increment();
                log.warn("Cleanup attempt {}/{} failed for {}: {}",
                        attempt, maxRetries, name, e.getMessage());

                if (attempt < maxRetries && !awaitBackoff(backoffDelayMs(attempt))) {
                    return;
                }
            }
        }

        if (stopped) {
            log.debug("Cleanup for {} stopped before retries were exhausted", name);
            return;
        }
        alertLog.record(AlertType.CRITICAL,
                "Cleanup failed after " + maxRetries + " attempts: " + lastException.getMessage());
    }

    /**
     * Sleep between retries, cut short by {@link #shutdown()}.
     *
     * @return false if the run should give up
     */
    private synchronized boolean awaitBackoff(long delayMs) {
        long deadline = System.currentTimeMillis() + delayMs;
        try {
            long remaining = delayMs;
            while (!stopped && remaining > 0) {
                wait(remaining);
                remaining = deadline - System.currentTimeMillis();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
        return !stopped;
    }

    // A run calling shutdown from inside its own task must not wait for itself
    private synchronized void awaitInFlightRun() throws InterruptedException {
        long deadline = System.currentTimeMillis() + SHUTDOWN_TIMEOUT_MS;
        long remaining = SHUTDOWN_TIMEOUT_MS;
        while (running.get() && runner != Thread.currentThread() && remaining > 0) {
            wait(remaining);
            remaining = deadline - System.currentTimeMillis();
        }
        if (running.get() && runner != Thread.currentThread()) {
            log.warn("Cleanup run for {} did not finish within {}ms", name, SHUTDOWN_TIMEOUT_MS);
        }
    }

    @FunctionalInterface
    public interface CleanupTask {
        void run() throws Exception;
    }
}
