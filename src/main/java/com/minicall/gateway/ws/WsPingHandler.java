package com.minicall.gateway.ws;

import com.minicall.gateway.session.SessionRegistry;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * 心跳：
 * <ul>
 *   <li>客户端 ping -> 服务端 pong，并刷新在线路由 TTL</li>
 *   <li>WRITER_IDLE -> 服务端主动发 WS ping 帧和 JSON ping</li>
 * </ul>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WsPingHandler {

    private final SessionRegistry sessionRegistry;
    private final WsWriter wsWriter;
    private final Clock clock;

    public void handleClientPing(ChannelHandlerContext ctx) {
        sessionRegistry.touch(ctx.channel());
        WsEnvelope pong = new WsEnvelope();
        pong.type = WsTypes.PONG;
        pong.ts = clock.millis();
        wsWriter.write(ctx, pong);
    }

    public void onWriterIdle(ChannelHandlerContext ctx) {
        Channel ch = ctx.channel();
        if (sessionRegistry.isAuthed(ch) && !isExpired(ch)) {
            sessionRegistry.touch(ch);
        }
        // WS 层 ping 让客户端自动回 pong，给 NAT 保活
        ctx.writeAndFlush(new PingWebSocketFrame()).addListener(f -> {
            if (!f.isSuccess()) {
                log.debug("ws ping frame failed: channel={}, err={}", ch.id().asShortText(), String.valueOf(f.cause()));
            }
        });
        WsEnvelope ping = new WsEnvelope();
        ping.type = WsTypes.PING;
        ping.ts = clock.millis();
        wsWriter.write(ctx, ping);
    }

    public boolean isExpired(Channel ch) {
        Long expMs = sessionRegistry.getAccessExpMs(ch);
        return expMs != null && clock.millis() >= expMs;
    }
}
