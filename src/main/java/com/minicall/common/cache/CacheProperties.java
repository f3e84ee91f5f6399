package com.minicall.common.cache;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "mc.cache")
public class CacheProperties {

    private boolean enabled = true;

    /** 参与者资料（通话卡片上的 name/email/userType）缓存时长。 */
    private long userProfileTtlSeconds = 1800;

    /** Redis 出错后暂停访问的窗口，避免每次读写都卡在连接超时上。 */
    private long redisFailFastMillis = 10_000;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public long getUserProfileTtlSeconds() {
        return userProfileTtlSeconds;
    }

    public void setUserProfileTtlSeconds(long userProfileTtlSeconds) {
        this.userProfileTtlSeconds = userProfileTtlSeconds;
    }

    public long getRedisFailFastMillis() {
        return redisFailFastMillis;
    }

    public void setRedisFailFastMillis(long redisFailFastMillis) {
        this.redisFailFastMillis = redisFailFastMillis;
    }
}
