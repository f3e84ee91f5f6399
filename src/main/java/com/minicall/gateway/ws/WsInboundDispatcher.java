package com.minicall.gateway.ws;

import com.minicall.common.error.InvalidRequestException;
import com.minicall.gateway.config.GatewayProperties;
import io.netty.channel.ChannelHandlerContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * 入站帧的执行入口：按连接串行（{@link WsChannelSerialQueue}），阻塞工作放到 DB 线程池。
 *
 * <p>异常只回给发起方：参数错误回 {@code failureType} + INVALID_DATA，其他异常记 ERROR 并回 error。</p>
 */
@Slf4j
@Component
public class WsInboundDispatcher {

    public static final String SERVER_BUSY = "server_busy";

    private final Executor dbExecutor;
    private final WsWriter wsWriter;
    private final GatewayProperties props;
    private final Clock clock;

    public WsInboundDispatcher(@Qualifier("mcDbExecutor") Executor dbExecutor,
                               WsWriter wsWriter,
                               GatewayProperties props,
                               Clock clock) {
        this.dbExecutor = dbExecutor;
        this.wsWriter = wsWriter;
        this.props = props;
        this.clock = clock;
    }

    /**
     * @param failureType  参数错误时回包的帧类型（call:failed / error）
     * @param failureCode  未预期异常时的错误码，例如 CALL_FAILED
     */
    public CompletableFuture<Void> submit(ChannelHandlerContext ctx, WsEnvelope msg,
                                          String failureType, String failureCode, Runnable task) {
        return WsChannelSerialQueue
                .tryEnqueue(ctx.channel(), () -> CompletableFuture.runAsync(task, dbExecutor), props.inboundMaxPendingEffective())
                .whenComplete((v, e) -> {
                    if (e != null) {
                        onFailure(ctx, msg, failureType, failureCode, unwrap(e));
                    }
                });
    }

    private void onFailure(ChannelHandlerContext ctx, WsEnvelope msg, String failureType, String failureCode, Throwable e) {
        if (e instanceof InvalidRequestException ire) {
            log.info("ws request rejected: type={}, userId={}, code={}, reason={}",
                    msg.getType(), msg.getFrom(), ire.getCode(), ire.getMessage());
            WsEnvelope out = new WsEnvelope();
            out.type = failureType;
            out.code = ire.getCode();
            out.reason = ire.getMessage();
            out.callId = msg.getCallId();
            out.clientMsgId = msg.getClientMsgId();
            out.ts = clock.millis();
            wsWriter.write(ctx, out);
            return;
        }
        if (e instanceof RejectedExecutionException) {
            log.warn("ws request dropped, busy: type={}, userId={}, err={}", msg.getType(), msg.getFrom(), e.toString());
            wsWriter.writeError(ctx, SERVER_BUSY, e.getMessage(), msg.getClientMsgId());
            return;
        }
        log.error("ws request failed: type={}, userId={}, callId={}", msg.getType(), msg.getFrom(), msg.getCallId(), e);
        wsWriter.writeError(ctx, failureCode, e.getMessage(), msg.getClientMsgId());
    }

    private static Throwable unwrap(Throwable e) {
        return (e instanceof CompletionException && e.getCause() != null) ? e.getCause() : e;
    }
}
