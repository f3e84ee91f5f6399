package com.minicall.gateway.ws;

import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WsChannelSerialQueueTest {

    @Test
    void shouldRunTasksSequentially() throws Exception {
        EmbeddedChannel ch = new EmbeddedChannel();

        CountDownLatch firstStarted = new CountDownLatch(1);
        CountDownLatch allowFirstFinish = new CountDownLatch(1);
        AtomicBoolean secondStarted = new AtomicBoolean(false);

        CompletableFuture<Void> f1 = WsChannelSerialQueue.enqueue(ch, () -> CompletableFuture.runAsync(() -> {
            firstStarted.countDown();
            try {
                assertTrue(allowFirstFinish.await(2, TimeUnit.SECONDS));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RuntimeException(e);
            }
        }));

        CompletableFuture<Void> f2 = WsChannelSerialQueue.enqueue(ch, () -> CompletableFuture.runAsync(() -> secondStarted.set(true)));

        pumpUntil(ch, firstStarted, 1000);
        TimeUnit.MILLISECONDS.sleep(80);
        assertFalse(secondStarted.get());

        allowFirstFinish.countDown();
        pumpUntilDone(ch, CompletableFuture.allOf(f1, f2), 2000);
        assertTrue(secondStarted.get());
    }

    @Test
    void shouldKeepArrivalOrderForSignalingFrames() throws Exception {
        EmbeddedChannel ch = new EmbeddedChannel();
        List<String> seen = new CopyOnWriteArrayList<>();

        CompletableFuture<Void> f1 = WsChannelSerialQueue.enqueue(ch, () -> CompletableFuture.runAsync(() -> {
            sleepQuietly(50);
            seen.add("call:initiate");
        }));
        CompletableFuture<Void> f2 = WsChannelSerialQueue.enqueue(ch, () -> CompletableFuture.runAsync(() -> seen.add("signal:offer")));
        CompletableFuture<Void> f3 = WsChannelSerialQueue.enqueue(ch, () -> CompletableFuture.runAsync(() -> seen.add("signal:ice")));

        pumpUntilDone(ch, CompletableFuture.allOf(f1, f2, f3), 2000);
        assertEquals(List.of("call:initiate", "signal:offer", "signal:ice"), seen);
    }

    @Test
    void shouldContinueAfterFailure() throws Exception {
        EmbeddedChannel ch = new EmbeddedChannel();

        AtomicBoolean secondRan = new AtomicBoolean(false);

        CompletableFuture<Void> f1 = WsChannelSerialQueue.enqueue(ch, () -> CompletableFuture.failedFuture(new RuntimeException("boom")));
        CompletableFuture<Void> f2 = WsChannelSerialQueue.enqueue(ch, () -> CompletableFuture.runAsync(() -> secondRan.set(true)));

        pumpUntilDone(ch, f2, 2000);
        assertTrue(secondRan.get());
        assertTrue(f1.isCompletedExceptionally());
    }

    @Test
    void shouldRejectWhenBacklogIsFull() throws Exception {
        EmbeddedChannel ch = new EmbeddedChannel();
        CompletableFuture<Void> gate = new CompletableFuture<>();

        CompletableFuture<Void> first = WsChannelSerialQueue.tryEnqueue(ch, () -> gate, 1);
        assertEquals(1, WsChannelSerialQueue.pending(ch));

        CompletableFuture<Void> rejected = WsChannelSerialQueue.tryEnqueue(ch, () -> CompletableFuture.completedFuture(null), 1);
        ExecutionException e = assertThrows(ExecutionException.class, () -> rejected.get(100, TimeUnit.MILLISECONDS));
        assertInstanceOf(RejectedExecutionException.class, e.getCause());

        gate.complete(null);
        pumpUntilDone(ch, first, 1000);
        assertEquals(0, WsChannelSerialQueue.pending(ch));

        CompletableFuture<Void> accepted = WsChannelSerialQueue.tryEnqueue(ch, () -> CompletableFuture.completedFuture(null), 1);
        pumpUntilDone(ch, accepted, 1000);
    }

    private static void sleepQuietly(long ms) {
        try {
            TimeUnit.MILLISECONDS.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void pumpUntil(EmbeddedChannel ch, CountDownLatch latch, long timeoutMs) throws Exception {
        long deadline = System.currentTimeMillis() + timeoutMs;
        while (latch.getCount() > 0 && System.currentTimeMillis() < deadline) {
            ch.runPendingTasks();
            TimeUnit.MILLISECONDS.sleep(5);
        }
        assertTrue(latch.getCount() == 0);
    }

    private static void pumpUntilDone(EmbeddedChannel ch, CompletableFuture<?> f, long timeoutMs) throws Exception {
        long deadline = System.currentTimeMillis() + timeoutMs;
        while (!f.isDone() && System.currentTimeMillis() < deadline) {
            ch.runPendingTasks();
            TimeUnit.MILLISECONDS.sleep(5);
        }
        f.get(100, TimeUnit.MILLISECONDS);
    }
}
