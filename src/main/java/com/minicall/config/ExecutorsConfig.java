package com.minicall.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

@Configuration
@EnableConfigurationProperties({
        DbExecutorProperties.class,
        RecordingExecutorProperties.class
})
public class ExecutorsConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean("mcDbExecutor")
    @Primary
    public Executor mcDbExecutor(DbExecutorProperties props) {
        return newPool("mc-db-", props.corePoolSizeEffective(), props.maxPoolSizeEffective(), props.queueCapacityEffective());
    }

    @Bean("mcRecordingExecutor")
    public Executor mcRecordingExecutor(RecordingExecutorProperties props) {
        return newPool("mc-rec-", props.corePoolSizeEffective(), props.maxPoolSizeEffective(), props.queueCapacityEffective());
    }

    /**
     * 未接听超时的单次定时器。任务体很轻（一次条件更新 + 一次推送），单线程池足够。
     */
    @Bean("mcCallTimeoutScheduler")
    public TaskScheduler mcCallTimeoutScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("mc-call-timer-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setAwaitTerminationSeconds(5);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }

    private static Executor newPool(String prefix, int core, int max, int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix(prefix);
        executor.setCorePoolSize(core);
        executor.setMaxPoolSize(Math.max(max, core));
        executor.setQueueCapacity(queueCapacity);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setAwaitTerminationSeconds(10);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
