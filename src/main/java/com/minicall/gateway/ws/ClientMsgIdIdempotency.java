package com.minicall.gateway.ws;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.minicall.gateway.config.ClientMsgIdCaffeineProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * message:send 重试去重：key 为 (fromUserId, clientMsgId)，value 为首次落库得到的 messageId。
 *
 * <p>只在本机内存中生效；客户端同一连接上的重试会落到同一实例。</p>
 */
@Component
public class ClientMsgIdIdempotency {

    private final boolean enabled;
    private final Cache<String, String> cache;

    public ClientMsgIdIdempotency(ClientMsgIdCaffeineProperties props) {
        this.enabled = props.isEnabled();
        this.cache = Caffeine.newBuilder()
                .initialCapacity(Math.max(1, props.getInitialCapacity()))
                .maximumSize(Math.max(1, props.getMaximumSize()))
                .expireAfterWrite(Duration.ofSeconds(Math.max(1, props.getExpireAfterWriteSeconds())))
                .build();
    }

    public static String key(long fromUserId, String clientMsgId) {
        return fromUserId + "-" + clientMsgId;
    }

    /**
     * @return 已记录的 messageId；未启用或没有记录时为 null
     */
    public String get(String key) {
        if (!enabled || key == null) {
            return null;
        }
        return cache.getIfPresent(key);
    }

    public void put(String key, String messageId) {
        if (!enabled || key == null || messageId == null) {
            return;
        }
        cache.put(key, messageId);
    }
}
