package com.minicall.gateway.call;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * @param ringTimeoutSeconds         无人接听多久判定为未接
 * @param missedCallsLookbackHours   重连时补推多少小时内的未接来电
 */
@ConfigurationProperties(prefix = "mc.call")
public record CallProperties(
        Integer ringTimeoutSeconds,
        Integer missedCallsLookbackHours
) {

    public Duration ringTimeout() {
        return Duration.ofSeconds(ringTimeoutSeconds == null ? 60 : Math.max(1, ringTimeoutSeconds));
    }

    public Duration missedCallsLookback() {
        return Duration.ofHours(missedCallsLookbackHours == null ? 24 : Math.max(1, missedCallsLookbackHours));
    }
}
