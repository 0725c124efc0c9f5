package com.ttlcache.storage;

import com.ttlcache.core.AlertType;
import com.ttlcache.core.CacheEntry;
import com.ttlcache.core.CacheOptions;
import com.ttlcache.core.CacheStats;
import com.ttlcache.core.CacheStore;
import com.ttlcache.core.CacheWrite;
import com.ttlcache.core.MemoryAlert;
import com.ttlcache.core.MemoryProbe;
import com.ttlcache.core.StoreDestroyedException;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Bounded in-memory cache with per-entry TTL and FIFO eviction.
 *
 * How it works:
 * - Entries live in an insertion-ordered map; an overwrite moves the key to the tail,
 *   so the head is always the entry with the smallest creation stamp
 * - When the map is full, a write evicts the head (oldest insertion, not least recently used)
 * - Reads delete expired entries lazily
 * - A background {@link CleanupScheduler} sweeps expired entries and reacts to memory pressure
 *
 * All map access goes through a single lock. Reads never throw; writes throw
 * {@link StoreDestroyedException} once {@link #destroy()} has been called.
 */
@Slf4j
public class BoundedTtlCache<V> implements CacheStore<V>, AutoCloseable {

    private static final Duration MAX_TTL = Duration.ofMillis(Long.MAX_VALUE);
    private static final Duration MIN_TTL = Duration.ofMillis(Long.MIN_VALUE);

    private final CacheOptions options;
    private final String name;
    private final Clock clock;
    private final MemoryProbe memoryProbe;
    private final ValueSizer valueSizer;
    private final AlertLog alertLog;
    private final CleanupScheduler cleanupScheduler;

    private final ReentrantLock lock = new ReentrantLock();
    private final LinkedHashMap<String, CacheEntry<V>> entries = new LinkedHashMap<>();
    private final AtomicBoolean destroyed = new AtomicBoolean(false);
    private long lastCreationStamp;

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();
    private final AtomicLong expirations = new AtomicLong();

    public BoundedTtlCache(CacheOptions options, MeterRegistry meterRegistry) {
        this(options, meterRegistry, new HeapMemoryProbe(), Clock.systemUTC());
    }

    public BoundedTtlCache(
            CacheOptions options,
            MeterRegistry meterRegistry,
            MemoryProbe memoryProbe,
            Clock clock) {

        options.validate();
        this.options = options;
        this.name = options.getName();
        this.clock = clock;
        this.memoryProbe = memoryProbe;
        this.valueSizer = new ValueSizer();
        this.alertLog = new AlertLog(name, options.getMaxAlerts(), clock, memoryProbe);
        this.cleanupScheduler = new CleanupScheduler(
                name,
                this::performCleanup,
                options.getCleanupInterval(),
                options.getMaxRetries(),
                options.getRetryBackoffBase(),
                alertLog,
                clock,
                meterRegistry);

        registerMetrics(meterRegistry);
        cleanupScheduler.start();

        log.info("Cache {} initialized: maxSize={}, ttl={}ms, cleanupInterval={}ms",
                name, options.getMaxSize(), options.getTtl().toMillis(),
                options.getCleanupInterval().toMillis());
    }

    @Override
    public void set(String key, V value) {
        set(key, value, null);
    }

    @Override
    public void set(String key, V value, Duration ttl) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");

        long now = clock.millis();
        long ttlMs = toMillisSaturated(ttl != null ? ttl : options.getTtl());
        long expiresAt = ttlMs > Long.MAX_VALUE - now ? Long.MAX_VALUE : now + ttlMs;

        lock.lock();
        try {
            if (destroyed.get()) {
                throw new StoreDestroyedException(name);
            }
            // Make room before inserting, even when the key is being overwritten
            if (entries.size() >= options.getMaxSize()) {
                evictOldest();
            }
            entries.remove(key);
            entries.put(key, new CacheEntry<>(value, expiresAt, nextCreationStamp(now), now));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<V> get(String key) {
        if (key == null || destroyed.get()) {
            return Optional.empty();
        }

        long now = clock.millis();
        lock.lock();
        try {
            CacheEntry<V> entry = entries.get(key);
            if (entry == null) {
                misses.incrementAndGet();
                return Optional.empty();
            }
            if (entry.isExpired(now)) {
                entries.remove(key);
                expirations.incrementAndGet();
                misses.incrementAndGet();
                return Optional.empty();
            }
            entry.recordAccess(now);
            hits.incrementAndGet();
            return Optional.of(entry.getValue());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean delete(String key) {
        if (key == null || destroyed.get()) {
            return false;
        }
        lock.lock();
        try {
            return entries.remove(key) != null;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void clear() {
        if (destroyed.get()) {
            return;
        }
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<String> keys(String prefix) {
        if (prefix == null || destroyed.get()) {
            return List.of();
        }
        lock.lock();
        try {
            List<String> matching = new ArrayList<>();
            for (String key : entries.keySet()) {
                if (key.startsWith(prefix)) {
                    matching.add(key);
                }
            }
            return matching;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int deletePattern(String prefix) {
        if (prefix == null || destroyed.get()) {
            return 0;
        }
        lock.lock();
        try {
            int removed = 0;
            Iterator<String> it = entries.keySet().iterator();
            while (it.hasNext()) {
                if (it.next().startsWith(prefix)) {
                    it.remove();
                    removed++;
                }
            }
            log.debug("Deleted {} keys with prefix '{}' from {}", removed, prefix, name);
            return removed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Optional<V>> mget(List<String> keys) {
        List<Optional<V>> values = new ArrayList<>(keys.size());
        for (String key : keys) {
            values.add(get(key));
        }
        return values;
    }

    @Override
    public void mset(Collection<CacheWrite<V>> items) {
        if (destroyed.get()) {
            throw new StoreDestroyedException(name);
        }
        for (CacheWrite<V> item : items) {
            set(item.getKey(), item.getValue(), item.getTtl());
        }
    }

    @Override
    public V getOrCompute(String key, Supplier<? extends V> loader, Duration ttl) {
        Optional<V> cached = get(key);
        if (cached.isPresent()) {
            return cached.get();
        }

        V value = loader.get();
        if (value == null) {
            return null;
        }
        try {
            set(key, value, ttl);
        } catch (StoreDestroyedException e) {
            log.debug("Cache {} is destroyed, serving uncached value for {}", name, key);
        }
        return value;
    }

    @Override
    public CacheStats stats() {
        if (destroyed.get()) {
            return emptyStats();
        }

        long now = clock.millis();
        List<Object> values;
        int size;
        int expiredCount = 0;
        lock.lock();
        try {
            size = entries.size();
            values = new ArrayList<>(size);
            for (CacheEntry<V> entry : entries.values()) {
                if (entry.isExpired(now)) {
                    expiredCount++;
                }
                values.add(entry.getValue());
            }
        } finally {
            lock.unlock();
        }

        // Serialize outside the lock; values are only read
        long totalSize = 0;
        for (Object value : values) {
            OptionalLong itemSize = valueSizer.sizeOf(value);
            if (itemSize.isEmpty()) {
                continue;
            }
            if (totalSize > Long.MAX_VALUE - itemSize.getAsLong()) {
                totalSize = Long.MAX_VALUE;
                break;
            }
            totalSize += itemSize.getAsLong();
        }

        return CacheStats.builder()
                .size(size)
                .maxSize(options.getMaxSize())
                .expiredCount(expiredCount)
                .totalSize(totalSize)
                .hitRate(hitRate())
                .memoryUsageMb(readMemory())
                .cleanupErrors(cleanupScheduler.getCleanupErrors())
                .lastCleanupTime(cleanupScheduler.getLastCleanupTime())
                .build();
    }

    @Override
    public List<MemoryAlert> getAlerts() {
        return alertLog.getAlerts();
    }

    @Override
    public void clearAlerts() {
        alertLog.clear();
    }

    /**
     * Trigger a cleanup run on the calling thread.
     *
     * @return false if another run was already in progress or the cache is destroyed
     */
    public boolean runCleanup() {
        if (destroyed.get()) {
            return false;
        }
        return cleanupScheduler.runCleanup();
    }

    @Override
    public void destroy() {
        if (!destroyed.compareAndSet(false, true)) {
            return;
        }

        cleanupScheduler.shutdown();

        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
        log.info("Cache {} destroyed", name);
    }

    @Override
    public void close() {
        destroy();
    }

    @Override
    public boolean isDestroyed() {
        return destroyed.get();
    }

    @Override
    public String getName() {
        return name;
    }

    public CacheOptions getOptions() {
        return options;
    }

    /**
     * One maintenance pass: sweep expired entries, then check memory pressure.
     * Exceptions propagate to the scheduler, which retries.
     */
    void performCleanup() {
        if (destroyed.get()) {
            return;
        }

        int expired = removeExpired(clock.millis());
        double usageMb = memoryProbe.usedMemoryMb();
        double threshold = options.getMemoryThresholdMb();
        if (destroyed.get()) {
            return;
        }

        if (usageMb > threshold) {
            alertLog.record(AlertType.WARNING,
                    String.format("Memory usage high: %.2fMB", usageMb), usageMb);
        }

        if (usageMb > threshold * 2) {
            alertLog.record(AlertType.CRITICAL,
                    String.format("Memory usage critical: %.2fMB", usageMb), usageMb);
            int evicted = evictOldestHalf();
            log.warn("Aggressive cleanup on {} evicted {} entries", name, evicted);
        }

        log.debug("Cleanup on {} removed {} expired entries, memory={}MB", name, expired, usageMb);
    }

    private int removeExpired(long now) {
        lock.lock();
        try {
            if (destroyed.get()) {
                return 0;
            }
            List<String> expiredKeys = new ArrayList<>();
            for (Map.Entry<String, CacheEntry<V>> e : entries.entrySet()) {
                if (e.getValue().isExpired(now)) {
                    expiredKeys.add(e.getKey());
                }
            }
            for (String key : expiredKeys) {
                entries.remove(key);
            }
            expirations.addAndGet(expiredKeys.size());
            return expiredKeys.size();
        } finally {
            lock.unlock();
        }
    }

    private int evictOldestHalf() {
        lock.lock();
        try {
            if (destroyed.get()) {
                return 0;
            }
            int toRemove = entries.size() / 2;
            Iterator<CacheEntry<V>> it = entries.values().iterator();
            for (int i = 0; i < toRemove; i++) {
                it.next();
                it.remove();
            }
            evictions.addAndGet(toRemove);
            return toRemove;
        } finally {
            lock.unlock();
        }
    }

    // Caller holds the lock
    private void evictOldest() {
        Iterator<Map.Entry<String, CacheEntry<V>>> it = entries.entrySet().iterator();
        if (it.hasNext()) {
            String victim = it.next().getKey();
            it.remove();
            evictions.incrementAndGet();
            log.trace("Evicted {} from {}", victim, name);
        }
    }

    // Caller holds the lock. Wall clock plus sequence: strictly increasing even within one millisecond
    private long nextCreationStamp(long now) {
        lastCreationStamp = Math.max(now, lastCreationStamp + 1);
        return lastCreationStamp;
    }

    private int lockedSize() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    private static long toMillisSaturated(Duration ttl) {
        if (ttl.compareTo(MAX_TTL) >= 0) {
            return Long.MAX_VALUE;
        }
        if (ttl.compareTo(MIN_TTL) <= 0) {
            return Long.MIN_VALUE;
        }
        return ttl.toMillis();
    }

    private double hitRate() {
        long hitCount = hits.get();
        long total = hitCount + misses.get();
        return total == 0 ? 0 : (hitCount * 100.0) / total;
    }

    private double readMemory() {
        try {
            return memoryProbe.usedMemoryMb();
        } catch (RuntimeException e) {
            log.debug("Memory probe failed for {}", name, e);
            return 0;
        }
    }

    private CacheStats emptyStats() {
        return CacheStats.builder()
                .size(0)
                .maxSize(options.getMaxSize())
                .cleanupErrors(cleanupScheduler.getCleanupErrors())
                .lastCleanupTime(cleanupScheduler.getLastCleanupTime())
                .build();
    }

    private void registerMetrics(MeterRegistry meterRegistry) {
        FunctionCounter.builder("ttlcache.hits", hits, AtomicLong::get)
                .description("Reads that found a live entry")
                .tag("cache", name)
                .register(meterRegistry);

        FunctionCounter.builder("ttlcache.misses", misses, AtomicLong::get)
                .description("Reads that found nothing or an expired entry")
                .tag("cache", name)
                .register(meterRegistry);

        FunctionCounter.builder("ttlcache.evictions", evictions, AtomicLong::get)
                .description("Entries removed to enforce the size bound")
                .tag("cache", name)
                .register(meterRegistry);

        FunctionCounter.builder("ttlcache.expirations", expirations, AtomicLong::get)
                .description("Entries removed because their TTL elapsed")
                .tag("cache", name)
                .register(meterRegistry);

        Gauge.builder("ttlcache.size", this, BoundedTtlCache::lockedSize)
                .description("Current number of entries")
                .tag("cache", name)
                .register(meterRegistry);
    }
}
