package com.minicall.gateway.ws;

import com.minicall.gateway.call.CallLifecycleManager;
import io.netty.channel.ChannelHandlerContext;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 通话控制帧（call:initiate / call:respond / call:end）：转交 {@link CallLifecycleManager}。
 */
@Component
@RequiredArgsConstructor
public class WsCallHandler {

    public static final String CALL_FAILED = "CALL_FAILED";

    private final CallLifecycleManager callLifecycleManager;
    private final WsInboundDispatcher dispatcher;

    public void handleInitiate(ChannelHandlerContext ctx, long userId, WsEnvelope msg) {
        dispatcher.submit(ctx, msg, WsTypes.CALL_FAILED, CALL_FAILED,
                () -> callLifecycleManager.initiateCall(userId, msg.getTo(), msg.getCallType()));
    }

    public void handleRespond(ChannelHandlerContext ctx, long userId, WsEnvelope msg) {
        dispatcher.submit(ctx, msg, WsTypes.CALL_FAILED, CALL_FAILED,
                () -> callLifecycleManager.respond(userId, msg.getCallId(), msg.getResponse()));
    }

    public void handleEnd(ChannelHandlerContext ctx, long userId, WsEnvelope msg) {
        dispatcher.submit(ctx, msg, WsTypes.CALL_FAILED, CALL_FAILED,
                () -> callLifecycleManager.end(userId, msg.getCallId()));
    }
}
