package com.minicall.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 信令链路的阻塞工作线程池（落库、查库、用户资料查询）。
 */
@ConfigurationProperties(prefix = "mc.executors.db")
public record DbExecutorProperties(
        Integer corePoolSize,
        Integer maxPoolSize,
        Integer queueCapacity
) {

    public int corePoolSizeEffective() {
        return corePoolSize == null ? 8 : Math.max(1, corePoolSize);
    }

    public int maxPoolSizeEffective() {
        return maxPoolSize == null ? 32 : Math.max(1, maxPoolSize);
    }

    public int queueCapacityEffective() {
        return queueCapacity == null ? 10_000 : Math.max(0, queueCapacity);
    }
}
