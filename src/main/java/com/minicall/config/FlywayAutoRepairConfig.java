package com.minicall.config;

import lombok.extern.slf4j.Slf4j;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.exception.FlywayValidateException;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.flyway.FlywayMigrationStrategy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 开发环境常见情况：改了已执行过的迁移脚本导致 checksum 不一致。validate 失败时先 repair 再 migrate。
 *
 * <p>生产环境可通过 {@code mc.flyway.auto-repair=false} 关闭，恢复 Flyway 默认的严格校验。</p>
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "mc.flyway.auto-repair", havingValue = "true", matchIfMissing = true)
public class FlywayAutoRepairConfig {

    @Bean
    public FlywayMigrationStrategy flywayMigrationStrategy() {
        return flyway -> {
            repairIfInvalid(flyway);
            flyway.migrate();
        };
    }

    private static void repairIfInvalid(Flyway flyway) {
        try {
            flyway.validate();
        } catch (FlywayValidateException e) {
            log.warn("flyway validate failed, repairing before migrate: {}", e.getMessage());
            try {
                flyway.repair();
            } catch (Exception repairError) {
                log.warn("flyway repair failed, continue migrate", repairError);
            }
        } catch (Exception e) {
            log.warn("flyway validate errored, continue migrate", e);
        }
    }
}
