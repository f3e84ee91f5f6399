package com.minicall.domain.cache;

import com.minicall.common.cache.CacheProperties;
import com.minicall.common.cache.RedisJsonCache;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 参与方资料缓存：每次发起/接听都要给通话卡片补全双方资料，避免每次都回源用户表。
 */
@Component
public class UserProfileCache {

    private static final String KEY_PREFIX = "mc:cache:user:profile:";

    private final CacheProperties props;
    private final RedisJsonCache cache;

    public UserProfileCache(CacheProperties props, RedisJsonCache cache) {
        this.props = props;
        this.cache = cache;
    }

    public Map<Long, Value> getBatch(Collection<Long> userIds) {
        if (!props.isEnabled() || userIds == null || userIds.isEmpty()) {
            return new HashMap<>();
        }
        List<Long> ids = userIds.stream().filter(v -> v != null && v > 0).distinct().toList();
        if (ids.isEmpty()) {
            return new HashMap<>();
        }
        Map<String, Value> byKey = cache.multiGet(ids.stream().map(this::key).toList(), Value.class);
        Map<Long, Value> out = new HashMap<>();
        for (Long id : ids) {
            Value v = byKey.get(key(id));
            if (v != null) {
                out.put(id, v);
            }
        }
        return out;
    }

    public void put(long userId, Value value) {
        if (!props.isEnabled() || userId <= 0 || value == null) {
            return;
        }
        cache.set(key(userId), value, Duration.ofSeconds(Math.max(1, props.getUserProfileTtlSeconds())));
    }

    private String key(long userId) {
        return KEY_PREFIX + userId;
    }

    public record Value(
            Long id,
            String name,
            String email,
            String userType
    ) {
    }
}
