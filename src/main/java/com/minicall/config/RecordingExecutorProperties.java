package com.minicall.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 录制编排线程池：下载、转码、上传都是长耗时 IO，与信令线程池隔离。
 */
@ConfigurationProperties(prefix = "mc.executors.recording")
public record RecordingExecutorProperties(
        Integer corePoolSize,
        Integer maxPoolSize,
        Integer queueCapacity
) {

    public int corePoolSizeEffective() {
        return corePoolSize == null ? 2 : Math.max(1, corePoolSize);
    }

    public int maxPoolSizeEffective() {
        return maxPoolSize == null ? 8 : Math.max(1, maxPoolSize);
    }

    public int queueCapacityEffective() {
        return queueCapacity == null ? 1_000 : Math.max(0, queueCapacity);
    }
}
