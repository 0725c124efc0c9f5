package com.ttlcache.config;

import com.ttlcache.algorithms.FixedWindowRateLimiter;
import com.ttlcache.core.BackoffPolicy;
import com.ttlcache.core.CacheOptions;
import com.ttlcache.core.MemoryProbe;
import com.ttlcache.core.RateLimitConfig;
import com.ttlcache.core.RateLimitRecord;
import com.ttlcache.core.RateLimiter;
import com.ttlcache.storage.BoundedTtlCache;
import com.ttlcache.storage.CacheHealthReporter;
import com.ttlcache.storage.HeapMemoryProbe;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Spring configuration for the application caches and rate limiters.
 *
 * Every cache is an explicit bean; Spring closes them on context shutdown,
 * which stops their cleanup timers.
 */
@Slf4j
@Configuration
public class CacheConfiguration {

    @Value("${ttlcache.cleanup-interval-ms:60000}")
    private long cleanupIntervalMs;

    @Value("${ttlcache.max-retries:3}")
    private int maxRetries;

    @Value("${ttlcache.max-alerts:10}")
    private int maxAlerts;

    @Bean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    public MemoryProbe memoryProbe() {
        return new HeapMemoryProbe();
    }

    @Bean
    public BoundedTtlCache<Object> proposalCache(MeterRegistry meterRegistry, MemoryProbe memoryProbe) {
        return cache("proposalCache", Duration.ofMinutes(10), 500, 50, meterRegistry, memoryProbe);
    }

    @Bean
    public BoundedTtlCache<Object> userCache(MeterRegistry meterRegistry, MemoryProbe memoryProbe) {
        return cache("userCache", Duration.ofMinutes(30), 200, 30, meterRegistry, memoryProbe);
    }

    @Bean
    public BoundedTtlCache<Object> marketDataCache(MeterRegistry meterRegistry, MemoryProbe memoryProbe) {
        return cache("marketDataCache", Duration.ofHours(1), 100, 20, meterRegistry, memoryProbe);
    }

    @Bean
    public BoundedTtlCache<Object> calculationCache(MeterRegistry meterRegistry, MemoryProbe memoryProbe) {
        return cache("calculationCache", Duration.ofMinutes(5), 1000, 100, meterRegistry, memoryProbe);
    }

    @Bean
    public BoundedTtlCache<RateLimitRecord> authRateLimitStore(MeterRegistry meterRegistry, MemoryProbe memoryProbe) {
        return cache("authRateLimitStore", Duration.ofMinutes(15), 1000, 100, meterRegistry, memoryProbe);
    }

    @Bean
    public BoundedTtlCache<RateLimitRecord> registrationRateLimitStore(MeterRegistry meterRegistry, MemoryProbe memoryProbe) {
        return cache("registrationRateLimitStore", Duration.ofHours(1), 500, 100, meterRegistry, memoryProbe);
    }

    @Bean
    public BoundedTtlCache<RateLimitRecord> apiRateLimitStore(MeterRegistry meterRegistry, MemoryProbe memoryProbe) {
        return cache("apiRateLimitStore", Duration.ofMinutes(5), 2000, 100, meterRegistry, memoryProbe);
    }

    /**
     * Login attempts: 5 per 15 minutes, backoff from 2s up to 10 minutes
     */
    @Bean(name = "authRateLimiter")
    public RateLimiter authRateLimiter(
            @Qualifier("authRateLimitStore") BoundedTtlCache<RateLimitRecord> store,
            MeterRegistry meterRegistry) {

        RateLimitConfig config = RateLimitConfig.builder()
                .name("auth")
                .window(Duration.ofMinutes(15))
                .maxRequests(5)
                .exponentialBackoff(BackoffPolicy.builder()
                        .baseDelay(Duration.ofSeconds(2))
                        .maxDelay(Duration.ofMinutes(10))
                        .factor(2)
                        .build())
                .build();

        return new FixedWindowRateLimiter(store, config, meterRegistry);
    }

    /**
     * Registrations: 3 per hour, backoff from 5s up to 30 minutes
     */
    @Bean(name = "registrationRateLimiter")
    public RateLimiter registrationRateLimiter(
            @Qualifier("registrationRateLimitStore") BoundedTtlCache<RateLimitRecord> store,
            MeterRegistry meterRegistry) {

        RateLimitConfig config = RateLimitConfig.builder()
                .name("registration")
                .window(Duration.ofHours(1))
                .maxRequests(3)
                .exponentialBackoff(BackoffPolicy.builder()
                        .baseDelay(Duration.ofSeconds(5))
                        .maxDelay(Duration.ofMinutes(30))
                        .factor(3)
                        .build())
                .build();

        return new FixedWindowRateLimiter(store, config, meterRegistry);
    }

    /**
     * General API traffic: 100 per 5 minutes, no backoff
     */
    @Bean(name = "apiRateLimiter")
    public RateLimiter apiRateLimiter(
            @Qualifier("apiRateLimitStore") BoundedTtlCache<RateLimitRecord> store,
            MeterRegistry meterRegistry) {

        RateLimitConfig config = RateLimitConfig.builder()
                .name("api")
                .window(Duration.ofMinutes(5))
                .maxRequests(100)
                .exponentialBackoff(BackoffPolicy.disabled())
                .build();

        return new FixedWindowRateLimiter(store, config, meterRegistry);
    }

    @Bean
    public CacheHealthReporter cacheHealthReporter(
            @Qualifier("proposalCache") BoundedTtlCache<Object> proposalCache,
            @Qualifier("userCache") BoundedTtlCache<Object> userCache,
            @Qualifier("marketDataCache") BoundedTtlCache<Object> marketDataCache,
            @Qualifier("calculationCache") BoundedTtlCache<Object> calculationCache,
            @Qualifier("authRateLimitStore") BoundedTtlCache<RateLimitRecord> authRateLimitStore,
            @Qualifier("registrationRateLimitStore") BoundedTtlCache<RateLimitRecord> registrationRateLimitStore,
            @Qualifier("apiRateLimitStore") BoundedTtlCache<RateLimitRecord> apiRateLimitStore,
            MemoryProbe memoryProbe) {

        Map<String, BoundedTtlCache<?>> caches = new LinkedHashMap<>();
        caches.put(proposalCache.getName(), proposalCache);
        caches.put(userCache.getName(), userCache);
        caches.put(marketDataCache.getName(), marketDataCache);
        caches.put(calculationCache.getName(), calculationCache);
        caches.put(authRateLimitStore.getName(), authRateLimitStore);
        caches.put(registrationRateLimitStore.getName(), registrationRateLimitStore);
        caches.put(apiRateLimitStore.getName(), apiRateLimitStore);
        return new CacheHealthReporter(caches, memoryProbe);
    }

    private <V> BoundedTtlCache<V> cache(
            String name,
            Duration ttl,
            int maxSize,
            double memoryThresholdMb,
            MeterRegistry meterRegistry,
            MemoryProbe memoryProbe) {

        CacheOptions options = CacheOptions.builder()
                .name(name)
                .ttl(ttl)
                .maxSize(maxSize)
                .cleanupInterval(Duration.ofMillis(cleanupIntervalMs))
                .maxRetries(maxRetries)
                .memoryThresholdMb(memoryThresholdMb)
                .maxAlerts(maxAlerts)
                .build();

        log.info("Creating cache {} (ttl={}, maxSize={})", name, ttl, maxSize);
        return new BoundedTtlCache<>(options, meterRegistry, memoryProbe, Clock.systemUTC());
    }
}
