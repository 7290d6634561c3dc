package com.govcontracts.infrastructure.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Content-addressed cache for query responses and task results.
 *
 * Uses Redis with circuit breaker for resilience.
 *
 * Keys:
 * - {@code <prefix>:<md5>} of the request as canonical JSON
 * - Canonical means properties sorted by name and map entries by key, so
 *   equal requests always hash the same regardless of field order
 *
 * Failure Handling:
 * - Circuit breaker keeps a slow or down Redis out of the query path
 * - Read failures are misses, write failures are skipped
 * - Correctness never depends on the cache
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QueryCacheService {

    private static final ObjectMapper CANONICAL = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    private final RedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;

    /**
     * Get cached result.
     *
     * Circuit breaker prevents Redis failures from blocking queries.
     */
    @CircuitBreaker(name = "redis", fallbackMethod = "getCacheFallback")
    public <T> Optional<T> get(String key, Class<T> type) {
        String cached = redisTemplate.opsForValue().get(key);

        if (cached == null) {
            log.debug("Cache miss for key: {}", key);
            return Optional.empty();
        }

        try {
            T value = objectMapper.readValue(cached, type);
            log.debug("Cache hit for key: {}", key);
            return Optional.of(value);
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable cache entry {}: {}", key, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    /**
     * Store result in cache.
     */
    @CircuitBreaker(name = "redis", fallbackMethod = "setCacheFallback")
    public void set(String key, Object value, long ttlSeconds) {
        String json;
        try {
            json = objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.error("Error serializing cache value for key {}: {}", key, e.getMessage());
            return;
        }
        redisTemplate.opsForValue().set(key, json, ttlSeconds, TimeUnit.SECONDS);
        log.debug("Cached result for key: {} (TTL: {}s)", key, ttlSeconds);
    }

    /**
     * Invalidate cache entry.
     */
    @CircuitBreaker(name = "redis", fallbackMethod = "invalidateCacheFallback")
    public void invalidate(String key) {
        redisTemplate.delete(key);
        log.debug("Invalidated cache for key: {}", key);
    }

    /**
     * Generate cache key from a request object.
     */
    public String generateCacheKey(String prefix, Object request) {
        try {
            byte[] canonical = CANONICAL.writeValueAsString(request).getBytes(StandardCharsets.UTF_8);
            return prefix + ":" + DigestUtils.md5DigestAsHex(canonical);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Request cannot be serialized for caching: " + e.getMessage(), e);
        }
    }

    // Fallback methods (circuit breaker)

    private <T> Optional<T> getCacheFallback(String key, Class<T> type, Exception e) {
        log.warn("Redis unavailable, treating {} as a miss: {}", key, e.getMessage());
        return Optional.empty();
    }

    private void setCacheFallback(String key, Object value, long ttlSeconds, Exception e) {
        log.warn("Redis unavailable, skipping cache write for {}: {}", key, e.getMessage());
    }

    private void invalidateCacheFallback(String key, Exception e) {
        log.warn("Redis unavailable, skipping cache invalidation for {}: {}", key, e.getMessage());
    }
}
