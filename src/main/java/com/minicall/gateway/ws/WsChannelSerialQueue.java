package com.minicall.gateway.ws;

import io.netty.channel.Channel;
import io.netty.util.Attribute;
import io.netty.util.AttributeKey;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * 每个连接一条 Future 链：同一连接的入站帧按到达顺序处理（例如先 call:initiate 再 signal:offer），
 * 任务本身可以切到 DB 线程池执行，不占用 eventLoop。
 *
 * <p>链上会忽略前一个任务的异常以保证后续任务继续执行；返回给调用方的 future 保留异常。</p>
 */
public final class WsChannelSerialQueue {

    private static final AttributeKey<AtomicReference<CompletableFuture<Void>>> ATTR_TAIL =
            AttributeKey.valueOf("mc:ws:serial_queue:tail");

    private static final AttributeKey<AtomicInteger> ATTR_PENDING =
            AttributeKey.valueOf("mc:ws:serial_queue:pending");

    private WsChannelSerialQueue() {
    }

    public static CompletableFuture<Void> enqueue(Channel channel, Supplier<? extends CompletionStage<?>> task) {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(task, "task");

        AtomicReference<CompletableFuture<Void>> tail = attr(channel, ATTR_TAIL, () -> new AtomicReference<>(CompletableFuture.completedFuture(null)));
        AtomicInteger pending = attr(channel, ATTR_PENDING, () -> new AtomicInteger(0));

        while (true) {
            CompletableFuture<Void> prev = tail.get();
            CompletableFuture<Void> run = prev
                    .handle((v, e) -> null)
                    .thenCompose(ignored -> startOnEventLoop(channel, task));
            CompletableFuture<Void> next = run.handle((v, e) -> null);
            if (tail.compareAndSet(prev, next)) {
                pending.incrementAndGet();
                run.whenComplete((v, e) -> pending.decrementAndGet());
                return run;
            }
        }
    }

    /**
     * 积压超过 maxPending 时直接拒绝，防止单个连接刷帧拖垮 DB 线程池。
     */
    public static CompletableFuture<Void> tryEnqueue(Channel channel, Supplier<? extends CompletionStage<?>> task, int maxPending) {
        if (pending(channel) >= Math.max(1, maxPending)) {
            return CompletableFuture.failedFuture(new RejectedExecutionException("ws_serial_queue_full"));
        }
        return enqueue(channel, task);
    }

    public static int pending(Channel channel) {
        return attr(channel, ATTR_PENDING, () -> new AtomicInteger(0)).get();
    }

    private static CompletableFuture<Void> startOnEventLoop(Channel channel, Supplier<? extends CompletionStage<?>> task) {
        CompletableFuture<Void> out = new CompletableFuture<>();
        Runnable start = () -> start(task).whenComplete((v, e) -> {
            if (e != null) {
                out.completeExceptionally(e);
            } else {
                out.complete(null);
            }
        });
        if (channel.eventLoop().inEventLoop()) {
            start.run();
        } else {
            channel.eventLoop().execute(start);
        }
        return out;
    }

    private static CompletableFuture<Void> start(Supplier<? extends CompletionStage<?>> task) {
        try {
            CompletionStage<?> stage = task.get();
            if (stage == null) {
                return CompletableFuture.completedFuture(null);
            }
            return stage.thenRun(() -> {
            }).toCompletableFuture();
        } catch (Throwable t) {
            return CompletableFuture.failedFuture(t);
        }
    }

    private static <T> T attr(Channel channel, AttributeKey<T> key, Supplier<T> init) {
        Attribute<T> attr = channel.attr(key);
        T existing = attr.get();
        if (existing != null) {
            return existing;
        }
        T created = init.get();
        T raced = attr.setIfAbsent(created);
        return raced == null ? created : raced;
    }
}
