package com.funnelanalytics.infrastructure.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Cache for funnel analysis results.
 *
 * Uses Redis with circuit breaker for resilience.
 *
 * Keys: funnel:{kind}:{funnelId}:{periodStart}:{periodEnd}:{groupBy}
 *
 * TTLs (app.funnel.cache.*):
 * - Overall analysis: 5 minutes
 * - Cohort and segment lists: 1 hour
 *
 * Invalidation:
 * - Funnel definition updated or deleted: every key of that funnel
 * - New events only show up once the TTL expires
 *
 * Failure Handling:
 * - Unreadable or unwritable payloads are logged and treated as a miss
 * - Redis errors propagate to the circuit breaker, whose fallbacks treat them as a miss
 * - While the breaker is open Redis is not called at all
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnalysisCacheService {

    private static final String KEY_PREFIX = "funnel";
    
    private final RedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;
    
    /**
     * Get cached result.
     */
    @CircuitBreaker(name = "redis", fallbackMethod = "getCacheFallback")
    public <T> Optional<T> get(String key, Class<T> type) {
        return read(key, objectMapper.getTypeFactory().constructType(type));
    }
    
    /**
     * Get a cached list of results.
     */
    @CircuitBreaker(name = "redis", fallbackMethod = "getListCacheFallback")
    public <T> Optional<List<T>> getList(String key, Class<T> elementType) {
        return read(key, objectMapper.getTypeFactory().constructCollectionType(List.class, elementType));
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
            log.error("Error serializing cache value for key {}: {}", key, e.getOriginalMessage());
            return;
        }
        
        redisTemplate.opsForValue().set(key, json, ttlSeconds, TimeUnit.SECONDS);
        log.debug("Cached result for key: {} (TTL: {}s)", key, ttlSeconds);
    }
    
    /**
     * Drop every cached result of a funnel.
     */
    @CircuitBreaker(name = "redis", fallbackMethod = "invalidateFunnelFallback")
    public long invalidateFunnel(UUID funnelId) {
        String pattern = KEY_PREFIX + ":*:" + funnelId + ":*";
        
        // SCAN instead of KEYS so invalidation never blocks Redis
        List<String> keys = new ArrayList<>();
        try (Cursor<String> cursor = redisTemplate.scan(ScanOptions.scanOptions().match(pattern).count(500).build())) {
            while (cursor.hasNext()) {
                keys.add(cursor.next());
            }
        }
        
        if (keys.isEmpty()) {
            log.debug("No cached results for funnel {}", funnelId);
            return 0;
        }
        Long deleted = redisTemplate.delete(keys);
        log.debug("Invalidated {} cached results for funnel {}", deleted, funnelId);
        return deleted == null ? 0 : deleted;
    }
    
    /**
     * Generate cache key from analysis parameters.
     */
    public String generateCacheKey(String kind, UUID funnelId, Object... params) {
        StringBuilder key = new StringBuilder(KEY_PREFIX)
                .append(":").append(kind)
                .append(":").append(funnelId);
        for (Object param : params) {
            key.append(":").append(param != null ? param.toString() : "null");
        }
        return key.toString();
    }
    
    private <T> Optional<T> read(String key, JavaType type) {
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
            // Stale shape after a deploy; recompute
            log.error("Error reading cached value for key {}: {}", key, e.getOriginalMessage());
            return Optional.empty();
        }
    }
    
    // Fallback methods (circuit breaker)
    
    private <T> Optional<T> getCacheFallback(String key, Class<T> type, Exception e) {
        log.warn("Redis unavailable ({}), computing analysis without cache", e.getMessage());
        return Optional.empty();
    }
    
    private <T> Optional<List<T>> getListCacheFallback(String key, Class<T> elementType, Exception e) {
        log.warn("Redis unavailable ({}), computing analysis without cache", e.getMessage());
        return Optional.empty();
    }
    
    private void setCacheFallback(String key, Object value, long ttlSeconds, Exception e) {
        log.warn("Redis unavailable ({}), skipping cache write", e.getMessage());
    }
    
    private long invalidateFunnelFallback(UUID funnelId, Exception e) {
        log.warn("Redis unavailable ({}), skipping cache invalidation for funnel {}", e.getMessage(), funnelId);
        return 0;
    }
}
