package com.minicall.gateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * message:send 重试去重窗口（本机 Caffeine）。
 */
@ConfigurationProperties(prefix = "mc.caffeine.client-msg-id")
public class ClientMsgIdCaffeineProperties {

    private boolean enabled = true;

    private int initialCapacity = 256;

    private long maximumSize = 100_000;

    /** 同一个 clientMsgId 在多长时间内的重发视为重试。 */
    private long expireAfterWriteSeconds = 600;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getInitialCapacity() {
        return initialCapacity;
    }

    public void setInitialCapacity(int initialCapacity) {
        this.initialCapacity = initialCapacity;
    }

    public long getMaximumSize() {
        return maximumSize;
    }

    public void setMaximumSize(long maximumSize) {
        this.maximumSize = maximumSize;
    }

    public long getExpireAfterWriteSeconds() {
        return expireAfterWriteSeconds;
    }

    public void setExpireAfterWriteSeconds(long expireAfterWriteSeconds) {
        this.expireAfterWriteSeconds = expireAfterWriteSeconds;
    }
}
