package com.minicall.gateway.call;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 每通电话一个单次定时器，按 callId 索引。
 *
 * <p>表项本身就是“谁先处理”的认领：定时器触发与 {@link #cancel} 都先移除表项，
 * 只有拿到表项的一方继续。被取消的定时器即使已经开始调度也不会执行回调。
 * 回调里的状态写入仍是条件更新，所以与 respond / end / 断线的竞争最终只有一个赢家。</p>
 */
@Slf4j
@Component
public class MissedCallTimers {

    private final ConcurrentHashMap<String, ScheduledFuture<?>> timers = new ConcurrentHashMap<>();

    private final TaskScheduler scheduler;
    private final Clock clock;

    public MissedCallTimers(@Qualifier("mcCallTimeoutScheduler") TaskScheduler scheduler, Clock clock) {
        this.scheduler = scheduler;
        this.clock = clock;
    }

    /**
     * 布置定时器；同一 callId 已有定时器时先取消旧的。
     */
    public void arm(String callId, Duration delay, Runnable onFire) {
        AtomicReference<ScheduledFuture<?>> self = new AtomicReference<>();
        Runnable task = () -> {
            // 只认领自己登记的表项，重新布置后已出队的旧任务不会误触发
            AtomicBoolean claimed = new AtomicBoolean();
            timers.computeIfPresent(callId, (k, cur) -> {
                if (cur != self.get()) {
                    return cur;
                }
                claimed.set(true);
                return null;
            });
            if (!claimed.get()) {
                return;
            }
            try {
                onFire.run();
            } catch (Exception e) {
                log.error("call timer callback failed: callId={}", callId, e);
            }
        };
        // compute 内调度：任务的认领会等登记完成，不会出现“先触发、后登记”
        timers.compute(callId, (k, old) -> {
            if (old != null) {
                old.cancel(false);
            }
            ScheduledFuture<?> f = scheduler.schedule(task, clock.instant().plus(delay));
            self.set(f);
            return f;
        });
    }

    /**
     * @return true 表示取消了一个尚未触发的定时器；没有定时器（已触发或从未布置）时为 false
     */
    public boolean cancel(String callId) {
        if (callId == null) {
            return false;
        }
        ScheduledFuture<?> f = timers.remove(callId);
        if (f == null) {
            return false;
        }
        f.cancel(false);
        return true;
    }

    public int pending() {
        return timers.size();
    }
}
