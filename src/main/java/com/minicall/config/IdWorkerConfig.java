package com.minicall.config;

import com.baomidou.mybatisplus.core.incrementer.DefaultIdentifierGenerator;
import com.baomidou.mybatisplus.core.incrementer.IdentifierGenerator;
import com.baomidou.mybatisplus.core.toolkit.IdWorker;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 雪花 id 的 workerId/datacenterId。
 *
 * <p>callId、messageId 与主键都由 {@link IdWorker} 生成；多实例部署时每个实例必须配置不同的
 * {@code mc.id.worker-id}，否则不同实例可能生成相同的 callId。</p>
 */
@Slf4j
@Configuration
public class IdWorkerConfig {

    private final long datacenterId;
    private final long workerId;

    public IdWorkerConfig(@Value("${mc.id.datacenter-id:1}") long datacenterId,
                          @Value("${mc.id.worker-id:-1}") long workerId) {
        this.datacenterId = fiveBits(datacenterId);
        this.workerId = workerId;
    }

    @PostConstruct
    public void init() {
        if (workerId < 0) {
            log.info("IdWorker: mc.id.worker-id not set, keep default sequence");
            return;
        }
        IdWorker.initSequence(fiveBits(workerId), datacenterId);
        log.info("IdWorker: initSequence(workerId={}, datacenterId={})", fiveBits(workerId), datacenterId);
    }

    @Bean
    public IdentifierGenerator identifierGenerator() {
        if (workerId < 0) {
            return DefaultIdentifierGenerator.getInstance();
        }
        return new DefaultIdentifierGenerator(fiveBits(workerId), datacenterId);
    }

    private static long fiveBits(long v) {
        long x = v % 32;
        return x < 0 ? x + 32 : x;
    }
}
