package com.minicall.gateway.ws;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelPromise;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * WS 文本协议统一写出器：
 * <ul>
 *   <li>统一序列化与 error 回包</li>
 *   <li>保证 writeAndFlush 在对应 channel 的 eventLoop 上执行（调用方可能在 DB 线程 / 定时器线程）</li>
 * </ul>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WsWriter {

    private final ObjectMapper objectMapper;

    public ChannelFuture write(ChannelHandlerContext ctx, WsEnvelope env) {
        if (ctx == null) {
            throw new IllegalArgumentException("ctx is null");
        }
        return write(ctx.channel(), env);
    }

    public ChannelFuture write(Channel ch, WsEnvelope env) {
        if (ch == null) {
            throw new IllegalArgumentException("channel is null");
        }
        if (!ch.isActive()) {
            return ch.newFailedFuture(new IllegalStateException("ws channel inactive"));
        }
        String json;
        try {
            json = objectMapper.writeValueAsString(env);
        } catch (Exception e) {
            log.error("ws encode failed: type={}", env == null ? null : env.getType(), e);
            return ch.newFailedFuture(e);
        }
        if (ch.eventLoop().inEventLoop()) {
            return ch.writeAndFlush(new TextWebSocketFrame(json));
        }
        ChannelPromise promise = ch.newPromise();
        try {
            ch.eventLoop().execute(() -> ch.writeAndFlush(new TextWebSocketFrame(json)).addListener(f -> {
                if (f.isSuccess()) {
                    promise.setSuccess();
                } else {
                    promise.setFailure(f.cause());
                }
            }));
        } catch (Exception e) {
            promise.setFailure(e);
        }
        return promise;
    }

    public ChannelFuture writeError(ChannelHandlerContext ctx, String code, String reason, String clientMsgId) {
        WsEnvelope err = new WsEnvelope();
        err.type = WsTypes.ERROR;
        err.code = code;
        err.reason = reason;
        err.clientMsgId = clientMsgId;
        err.ts = Instant.now().toEpochMilli();
        return write(ctx, err);
    }
}
