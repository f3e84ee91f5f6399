package com.minicall.common.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Redis 上的 JSON 值缓存。
 *
 * <p>缓存只是加速层：任何 Redis 异常都按未命中处理，并在 {@code redisFailFastMillis} 内不再访问 Redis。</p>
 */
@Slf4j
@Component
public class RedisJsonCache {

    private final StringRedisTemplate redis;
    private final ObjectMapper objectMapper;
    private final long failFastMillis;
    private final AtomicLong unavailableUntilMs = new AtomicLong(0);

    public RedisJsonCache(StringRedisTemplate redis, ObjectMapper objectMapper, CacheProperties props) {
        this.redis = redis;
        this.objectMapper = objectMapper;
        this.failFastMillis = Math.max(0, props.getRedisFailFastMillis());
    }

    public <T> Map<String, T> multiGet(List<String> keys, Class<T> type) {
        if (keys == null || keys.isEmpty() || type == null || failingFast()) {
            return Map.of();
        }
        List<String> raws;
        try {
            raws = redis.opsForValue().multiGet(keys);
        } catch (Exception e) {
            log.debug("redis json multiGet failed: size={}, err={}", keys.size(), e.toString());
            markDown();
            return Map.of();
        }
        if (raws == null || raws.isEmpty()) {
            return Map.of();
        }
        Map<String, T> out = new LinkedHashMap<>();
        int n = Math.min(keys.size(), raws.size());
        for (int i = 0; i < n; i++) {
            String raw = raws.get(i);
            if (raw == null || raw.isBlank()) {
                continue;
            }
            try {
                out.put(keys.get(i), objectMapper.readValue(raw, type));
            } catch (Exception e) {
                // 单条脏数据不影响其他 key
                log.debug("redis json multiGet parse failed: key={}, err={}", keys.get(i), e.toString());
            }
        }
        return out;
    }

    public void set(String key, Object value, Duration ttl) {
        if (key == null || key.isBlank() || value == null || failingFast()) {
            return;
        }
        Duration safeTtl = (ttl == null || ttl.toSeconds() <= 0) ? Duration.ofSeconds(60) : ttl;
        try {
            redis.opsForValue().set(key, objectMapper.writeValueAsString(value), safeTtl);
        } catch (Exception e) {
            log.debug("redis json set failed: key={}, err={}", key, e.toString());
            markDown();
        }
    }

    private boolean failingFast() {
        return System.currentTimeMillis() < unavailableUntilMs.get();
    }

    private void markDown() {
        long until = System.currentTimeMillis() + failFastMillis;
        unavailableUntilMs.accumulateAndGet(until, Math::max);
    }
}
