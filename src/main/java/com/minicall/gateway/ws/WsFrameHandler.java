package com.minicall.gateway.ws;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.minicall.domain.service.UserService;
import com.minicall.gateway.call.CallLifecycleManager;
import com.minicall.gateway.session.SessionRegistry;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.handler.timeout.IdleState;
import io.netty.handler.timeout.IdleStateEvent;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * 每个连接一个实例：握手完成即注册，按 type 分发文本帧，断开时做注销与通话清理。
 */
@Slf4j
public class WsFrameHandler extends SimpleChannelInboundHandler<TextWebSocketFrame> {

    private final ObjectMapper objectMapper;
    private final SessionRegistry sessionRegistry;
    private final WsWriter wsWriter;
    private final WsPingHandler pingHandler;
    private final WsChatHandler chatHandler;
    private final WsCallHandler callHandler;
    private final WsSignalHandler signalHandler;
    private final CallLifecycleManager callLifecycleManager;
    private final UserService userService;
    private final Executor dbExecutor;
    private final Clock clock;

    public WsFrameHandler(ObjectMapper objectMapper,
                          SessionRegistry sessionRegistry,
                          WsWriter wsWriter,
                          WsPingHandler pingHandler,
                          WsChatHandler chatHandler,
                          WsCallHandler callHandler,
                          WsSignalHandler signalHandler,
                          CallLifecycleManager callLifecycleManager,
                          UserService userService,
                          Executor dbExecutor,
                          Clock clock) {
        this.objectMapper = objectMapper;
        this.sessionRegistry = sessionRegistry;
        this.wsWriter = wsWriter;
        this.pingHandler = pingHandler;
        this.chatHandler = chatHandler;
        this.callHandler = callHandler;
        this.signalHandler = signalHandler;
        this.callLifecycleManager = callLifecycleManager;
        this.userService = userService;
        this.dbExecutor = dbExecutor;
        this.clock = clock;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, TextWebSocketFrame frame) {
        WsEnvelope msg;
        try {
            msg = objectMapper.readValue(frame.text(), WsEnvelope.class);
        } catch (Exception e) {
            log.debug("bad ws frame: channel={}, err={}", ctx.channel().id().asShortText(), e.toString());
            wsWriter.writeError(ctx, "bad_json", null, null);
            return;
        }
        if (msg.type == null || msg.type.isBlank()) {
            wsWriter.writeError(ctx, "missing_type", null, msg.getClientMsgId());
            return;
        }

        Long userId = ctx.channel().attr(SessionRegistry.ATTR_USER_ID).get();
        if (userId == null) {
            wsWriter.writeError(ctx, "unauthorized", null, msg.getClientMsgId());
            ctx.close();
            return;
        }
        if (pingHandler.isExpired(ctx.channel())) {
            wsWriter.writeError(ctx, "token_expired", null, msg.getClientMsgId());
            ctx.close();
            return;
        }
        // 发送方身份只认握手绑定的 userId
        msg.from = userId;
        log.debug("received ws frame: type={}, userId={}, to={}, callId={}", msg.type, userId, msg.to, msg.callId);

        switch (msg.type) {
            case WsTypes.PING -> pingHandler.handleClientPing(ctx);
            case WsTypes.MESSAGE_SEND -> chatHandler.handleSend(ctx, userId, msg);
            case WsTypes.MESSAGE_MARK_READ -> chatHandler.handleMarkRead(ctx, userId, msg);
            case WsTypes.TYPING_START, WsTypes.TYPING_STOP -> chatHandler.handleTyping(ctx, userId, msg);
            case WsTypes.CALL_INITIATE -> callHandler.handleInitiate(ctx, userId, msg);
            case WsTypes.CALL_RESPOND -> callHandler.handleRespond(ctx, userId, msg);
            case WsTypes.CALL_END -> callHandler.handleEnd(ctx, userId, msg);
            case WsTypes.SIGNAL_OFFER, WsTypes.SIGNAL_ANSWER, WsTypes.SIGNAL_ICE -> signalHandler.handle(ctx, userId, msg);
            default -> wsWriter.writeError(ctx, "not_implemented", msg.type, msg.getClientMsgId());
        }
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof WebSocketServerProtocolHandler.HandshakeComplete) {
            onConnected(ctx.channel());
        } else if (evt instanceof IdleStateEvent e && e.state() == IdleState.WRITER_IDLE) {
            pingHandler.onWriterIdle(ctx);
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        Channel ch = ctx.channel();
        Long userId = ch.attr(SessionRegistry.ATTR_USER_ID).get();
        // 被替换下来的旧连接断开时 unregister 返回 false，不清理新连接上的通话
        if (userId != null && sessionRegistry.unregister(userId, ch)) {
            Long connectedAt = sessionRegistry.getConnectedAtMs(ch);
            log.info("ws disconnected: userId={}, channel={}, onlineMs={}",
                    userId, ch.id().asShortText(), connectedAt == null ? null : clock.millis() - connectedAt);
            runAsync("disconnect cleanup", userId, () -> callLifecycleManager.onDisconnect(userId));
            runAsync("presence offline", userId, () -> syncPresence(userId, ch, false));
        }
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.warn("ws channel error, closing: channel={}, userId={}, err={}",
                ctx.channel().id().asShortText(), ctx.channel().attr(SessionRegistry.ATTR_USER_ID).get(), cause.toString());
        ctx.close();
    }

    private void onConnected(Channel ch) {
        Long userId = ch.attr(SessionRegistry.ATTR_USER_ID).get();
        if (userId == null) {
            ch.close();
            return;
        }
        Channel orphan = sessionRegistry.register(userId, ch);
        log.info("ws connected: userId={}, channel={}, replaced={}",
                userId, ch.id().asShortText(), orphan == null ? null : orphan.id().asShortText());
        runAsync("presence online", userId, () -> syncPresence(userId, ch, true));
        runAsync("missed calls push", userId, () -> callLifecycleManager.sendMissedCalls(userId));
    }

    /**
     * 上下线写库在 db 线程池里乱序执行，执行时以注册表为准：上线要求 ch 仍是当前连接，下线要求用户已无连接。
     */
    void syncPresence(long userId, Channel ch, boolean online) {
        Channel current = sessionRegistry.lookup(userId);
        boolean applies = online ? current == ch : current == null;
        if (!applies) {
            log.debug("stale presence write skipped: userId={}, online={}, channel={}", userId, online, ch.id().asShortText());
            return;
        }
        userService.updatePresence(userId, online, LocalDateTime.now(clock));
    }

    private void runAsync(String op, long userId, Runnable task) {
        try {
            CompletableFuture.runAsync(task, dbExecutor).whenComplete((v, e) -> {
                if (e != null) {
                    log.error("{} failed: userId={}", op, userId, e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.error("{} rejected, db executor saturated: userId={}", op, userId, e);
        }
    }
}
