package com.sqlstage.cache;

import com.sqlstage.service.CacheUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * {@link ResultCache} backed by Redis ({@code SET NX EX} / {@code GET} / {@code DEL}).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisResultCache implements ResultCache {

    private final StringRedisTemplate redisTemplate;

    @Override
    public boolean setIfAbsent(String key, String value, Duration ttl) {
        try {
            // SET NX EX
            Boolean wasSet = redisTemplate.opsForValue().setIfAbsent(key, value, ttl);
            if (Boolean.TRUE.equals(wasSet)) {
                log.debug("Stored {} bytes in Redis for key {} (TTL: {}s)", value.length(), key, ttl.toSeconds());
                return true;
            }
            log.warn("Redis key {} already exists, not overwritten", key);
            return false;
        } catch (DataAccessException e) {
            log.error("Redis set failed for key {}: {}", key, e.getMessage());
            throw new CacheUnavailableException("Failed to store data in result cache", e);
        }
    }

    @Override
    public Optional<String> get(String key) {
        try {
            String data = redisTemplate.opsForValue().get(key);
            if (data == null) {
                log.debug("No data found in Redis for key {}", key);
                return Optional.empty();
            }
            log.debug("Retrieved {} bytes from Redis for key {}", data.length(), key);
            return Optional.of(data);
        } catch (DataAccessException e) {
            log.error("Redis get failed for key {}: {}", key, e.getMessage());
            throw new CacheUnavailableException("Failed to read data from result cache", e);
        }
    }

    @Override
    public boolean delete(String key) {
        try {
            return Boolean.TRUE.equals(redisTemplate.delete(key));
        } catch (DataAccessException e) {
            log.error("Redis delete failed for key {}: {}", key, e.getMessage());
            throw new CacheUnavailableException("Failed to delete data from result cache", e);
        }
    }
}
