package com.rfpanalytics.infrastructure.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rfpanalytics.config.AnalyticsProperties;
import com.rfpanalytics.domain.model.CacheEntry;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis store for the single analytics summary entry.
 *
 * The entry carries its own expiresAt; the Redis key TTL is set to the same
 * window so stale entries also get evicted server side.
 *
 * Failure Handling:
 * - Any Redis or serialization error is logged and treated as a miss / no-op
 * - Circuit breaker stops hammering Redis while it is down
 */
@Slf4j
@Service
public class SummaryCacheService {

    private final RedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;
    private final String key;

    public SummaryCacheService(RedisTemplate<String, String> redisTemplate,
                               ObjectMapper objectMapper,
                               AnalyticsProperties properties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.key = properties.getCache().getKey();
    }

    @CircuitBreaker(name = "redis", fallbackMethod = "getCacheFallback")
    public Optional<CacheEntry> get() {
        try {
            String cached = redisTemplate.opsForValue().get(key);

            if (cached == null) {
                log.debug("Cache miss for key: {}", key);
                return Optional.empty();
            }

            CacheEntry entry = objectMapper.readValue(cached, CacheEntry.class);
            log.debug("Cache hit for key: {}", key);
            return Optional.of(entry);

        } catch (Exception e) {
            log.error("Error reading from cache: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Overwrites the stored entry unconditionally.
     */
    @CircuitBreaker(name = "redis", fallbackMethod = "putCacheFallback")
    public void put(CacheEntry entry, Duration ttl) {
        try {
            String json = objectMapper.writeValueAsString(entry);
            redisTemplate.opsForValue().set(key, json, ttl);
            log.debug("Cached summary for key: {} (TTL: {}s)", key, ttl.toSeconds());

        } catch (Exception e) {
            log.error("Error writing to cache: {}", e.getMessage());
            // Don't throw - a lost cache write must not fail the summary
        }
    }

    @CircuitBreaker(name = "redis", fallbackMethod = "invalidateCacheFallback")
    public void invalidate() {
        try {
            redisTemplate.delete(key);
            log.debug("Invalidated cache for key: {}", key);

        } catch (Exception e) {
            log.error("Error invalidating cache: {}", e.getMessage());
        }
    }

    // Fallback methods (circuit breaker)

    private Optional<CacheEntry> getCacheFallback(Exception e) {
        log.warn("Redis circuit breaker open, computing summary without cache");
        return Optional.empty();
    }

    private void putCacheFallback(CacheEntry entry, Duration ttl, Exception e) {
        log.warn("Redis circuit breaker open, skipping cache write");
    }

    private void invalidateCacheFallback(Exception e) {
        log.warn("Redis circuit breaker open, skipping cache invalidation");
    }
}
