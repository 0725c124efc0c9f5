package com.ttlcache.algorithms;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import com.ttlcache.core.BackoffPolicy;
import com.ttlcache.core.CacheStore;
import com.ttlcache.core.RateLimitConfig;
import com.ttlcache.core.RateLimitRecord;
import com.ttlcache.core.RateLimitResult;
import com.ttlcache.core.RateLimiter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.DoubleSupplier;

/**
 * Fixed window counter with exponential backoff on consecutive failures.
 *
 * How it works:
 * - One record per key, kept in the backing {@link CacheStore} with TTL = window,
 *   so idle keys are forgotten through ordinary expiry or eviction
 * - A window starts on the first request and resets once it has elapsed
 * - Each recorded request bumps the counter; the key is limited once count >= maxRequests
 * - From the second consecutive failure on, the key is blocked for
 *   min(baseDelay * factor^failures, maxDelay) plus 0-10% jitter
 * - A success clears the block and the failure streak
 *
 * The limiter holds no state of its own besides per-key locks that serialize
 * the read-modify-write in {@link #recordRequest(String, boolean)}.
 */
@Slf4j
public class FixedWindowRateLimiter implements RateLimiter {

    static final String KEY_PREFIX = "rate-limit:";
    private static final double MAX_JITTER_RATIO = 0.1;

    private final CacheStore<RateLimitRecord> store;
    private final RateLimitConfig config;
    private final Clock clock;
    private final DoubleSupplier random;

    // Weak values: a lock disappears once no thread holds a reference to it
    private final LoadingCache<String, Lock> keyLocks;

    // Metrics
    private final Counter allowedRequests;
    private final Counter limitedRequests;
    private final Counter blockedRequests;

    public FixedWindowRateLimiter(
            CacheStore<RateLimitRecord> store,
            RateLimitConfig config,
            MeterRegistry meterRegistry) {
        this(store, config, meterRegistry, Clock.systemUTC(), () -> ThreadLocalRandom.current().nextDouble());
    }

    FixedWindowRateLimiter(
            CacheStore<RateLimitRecord> store,
            RateLimitConfig config,
            MeterRegistry meterRegistry,
            Clock clock,
            DoubleSupplier random) {

        config.validate();
        this.store = store;
        this.config = config;
        this.clock = clock;
        this.random = random;

        this.keyLocks = Caffeine.newBuilder()
                .weakValues()
                .build(key -> new ReentrantLock());

        this.allowedRequests = Counter.builder("ratelimiter.requests.allowed")
                .description("Checks that let the request through")
                .tag("limiter", config.getName())
                .register(meterRegistry);

        this.limitedRequests = Counter.builder("ratelimiter.requests.limited")
                .description("Checks rejected because the window budget is used up")
                .tag("limiter", config.getName())
                .register(meterRegistry);

        this.blockedRequests = Counter.builder("ratelimiter.requests.blocked")
                .description("Checks rejected because of failure backoff")
                .tag("limiter", config.getName())
                .register(meterRegistry);

        log.info("Rate limiter {} initialized: maxRequests={}, window={}ms, backoff={}",
                config.getName(), config.getMaxRequests(), config.getWindow().toMillis(),
                config.getExponentialBackoff().isEnabled());
    }

    @Override
    public String generateKey(String identifier) {
        return KEY_PREFIX + identifier;
    }

    @Override
    public RateLimitResult checkRateLimit(String key) {
        long now = clock.millis();
        long windowMs = config.getWindow().toMillis();
        RateLimitRecord record = load(key, now, windowMs);

        // Backoff block wins over the window budget
        if (record.isBlockedAt(now)) {
            blockedRequests.increment();
            long blockedUntil = record.getBlockedUntil();
            return RateLimitResult.builder()
                    .limited(true)
                    .remaining(0)
                    .resetTime(record.getWindowResetAt())
                    .retryAfter((long) Math.ceil((blockedUntil - now) / 1000.0))
                    .blockedUntil(blockedUntil)
                    .build();
        }

        // Evaluated as if reset; the reset itself is only persisted by recordRequest
        if (record.isWindowExpiredAt(now)) {
            record = RateLimitRecord.fresh(now, windowMs);
        }

        long count = record.getCount();
        boolean limited = count >= config.getMaxRequests();
        if (limited) {
            limitedRequests.increment();
        } else {
            allowedRequests.increment();
        }

        log.trace("Rate limit check for {}: count={}, limited={}", key, count, limited);

        return RateLimitResult.builder()
                .limited(limited)
                .remaining(Math.max(0, config.getMaxRequests() - count))
                .resetTime(record.getWindowResetAt())
                .build();
    }

    /**
     * {@inheritDoc}
     *
     * @throws com.ttlcache.core.StoreDestroyedException if the backing store was destroyed
     */
    @Override
    public void recordRequest(String key, boolean success) {
        Lock lock = keyLocks.get(key);
        lock.lock();
        try {
            long now = clock.millis();
            long windowMs = config.getWindow().toMillis();
            RateLimitRecord current = load(key, now, windowMs);
            if (current.isWindowExpiredAt(now)) {
                current = RateLimitRecord.fresh(now, windowMs);
            }

            RateLimitRecord updated = success
                    ? onSuccess(current)
                    : onFailure(key, current, now);

            store.set(key, updated, config.getWindow());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void reset(String key) {
        Lock lock = keyLocks.get(key);
        lock.lock();
        try {
            store.delete(key);
        } finally {
            lock.unlock();
        }
        log.debug("Reset rate limit for key: {}", key);
    }

    @Override
    public RateLimitConfig getConfig() {
        return config;
    }

    /**
     * Backoff delay before jitter: min(baseDelay * factor^failures, maxDelay)
     */
    long backoffDelayMs(long consecutiveFailures) {
        BackoffPolicy backoff = config.getExponentialBackoff();
        double delay = backoff.getBaseDelay().toMillis() * Math.pow(backoff.getFactor(), consecutiveFailures);
        return (long) Math.min(delay, backoff.getMaxDelay().toMillis());
    }

    private RateLimitRecord onSuccess(RateLimitRecord current) {
        RateLimitRecord.RateLimitRecordBuilder next = current.toBuilder()
                .consecutiveFailures(0)
                .blockedUntil(null);
        if (!config.isSkipSuccessfulRequests()) {
            next.count(current.getCount() + 1);
        }
        return next.build();
    }

    private RateLimitRecord onFailure(String key, RateLimitRecord current, long now) {
        long failures = current.getConsecutiveFailures() + 1;
        RateLimitRecord.RateLimitRecordBuilder next = current.toBuilder()
                .consecutiveFailures(failures);
        if (!config.isSkipFailedRequests()) {
            next.count(current.getCount() + 1);
        }

        // The first failure is free; blocking starts with the second in a row
        if (config.getExponentialBackoff().isEnabled() && failures > 1) {
            long delay = backoffDelayMs(failures);
            long jitter = (long) (delay * MAX_JITTER_RATIO * random.getAsDouble());
            if (delay > 0) {
                next.blockedUntil(now + delay + jitter);
                log.debug("Blocking {} for {}ms after {} consecutive failures", key, delay + jitter, failures);
            }
        }
        return next.build();
    }

    private RateLimitRecord load(String key, long now, long windowMs) {
        try {
            return store.get(key).orElseGet(() -> RateLimitRecord.fresh(now, windowMs));
        } catch (RuntimeException e) {
            log.warn("Failed to read rate limit record for {}, treating as fresh: {}", key, e.getMessage());
            return RateLimitRecord.fresh(now, windowMs);
        }
    }
}
