package com.minicall.gateway.ws;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.minicall.common.error.InvalidRequestException;
import com.minicall.gateway.config.GatewayProperties;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WsInboundDispatcherTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Clock clock = Clock.fixed(Instant.parse("2026-03-01T08:00:00Z"), ZoneOffset.UTC);
    private final GatewayProperties props = new GatewayProperties("gw-a", 9001, "/ws", null, null, null);

    private final EmbeddedChannel ch = new EmbeddedChannel(new ChannelInboundHandlerAdapter());
    private final ChannelHandlerContext ctx = ch.pipeline().firstContext();

    private WsInboundDispatcher dispatcher(Executor executor) {
        return new WsInboundDispatcher(executor, new WsWriter(objectMapper), props, clock);
    }

    private static WsEnvelope request(String type) {
        WsEnvelope msg = new WsEnvelope();
        msg.type = type;
        msg.from = 1L;
        msg.callId = "c1";
        msg.clientMsgId = "m-1";
        return msg;
    }

    @Test
    void successfulTaskWritesNothing() throws Exception {
        AtomicBoolean ran = new AtomicBoolean();

        dispatcher(Runnable::run).submit(ctx, request(WsTypes.CALL_END), WsTypes.CALL_FAILED, "CALL_FAILED", () -> ran.set(true));

        assertTrue(ran.get());
        assertNull(ch.readOutbound());
    }

    @Test
    void invalidRequestIsAnsweredWithFailureType() throws Exception {
        dispatcher(Runnable::run).submit(ctx, request(WsTypes.CALL_RESPOND), WsTypes.CALL_FAILED, "CALL_FAILED", () -> {
            throw new InvalidRequestException("only_callee_can_respond");
        });

        JsonNode out = readJson();
        assertEquals("call:failed", out.path("type").asText());
        assertEquals(InvalidRequestException.INVALID_DATA, out.path("code").asText());
        assertEquals("only_callee_can_respond", out.path("reason").asText());
        assertEquals("c1", out.path("callId").asText());
        assertEquals("m-1", out.path("clientMsgId").asText());
        assertEquals(clock.millis(), out.path("ts").asLong());
    }

    @Test
    void unexpectedFailureIsReportedAsError() throws Exception {
        dispatcher(Runnable::run).submit(ctx, request(WsTypes.SIGNAL_OFFER), WsTypes.ERROR, "SIGNAL_FAILED", () -> {
            throw new IllegalStateException("db down");
        });

        JsonNode out = readJson();
        assertEquals("error", out.path("type").asText());
        assertEquals("SIGNAL_FAILED", out.path("code").asText());
        assertEquals("db down", out.path("reason").asText());
    }

    @Test
    void saturatedExecutorAnswersServerBusy() throws Exception {
        Executor rejecting = task -> {
            throw new RejectedExecutionException("pool full");
        };

        dispatcher(rejecting).submit(ctx, request(WsTypes.MESSAGE_SEND), WsTypes.ERROR, "MESSAGE_FAILED", () -> {
        });

        JsonNode out = readJson();
        assertEquals("error", out.path("type").asText());
        assertEquals(WsInboundDispatcher.SERVER_BUSY, out.path("code").asText());
        assertEquals("m-1", out.path("clientMsgId").asText());
    }

    private JsonNode readJson() throws Exception {
        TextWebSocketFrame frame = ch.readOutbound();
        try {
            return objectMapper.readTree(frame.text());
        } finally {
            frame.release();
        }
    }
}
