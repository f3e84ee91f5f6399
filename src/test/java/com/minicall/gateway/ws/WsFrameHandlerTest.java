package com.minicall.gateway.ws;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.minicall.domain.service.UserService;
import com.minicall.gateway.call.CallLifecycleManager;
import com.minicall.gateway.session.SessionRegistry;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WsFrameHandlerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final SessionRegistry sessionRegistry = mock(SessionRegistry.class);
    private final WsPingHandler pingHandler = mock(WsPingHandler.class);
    private final WsChatHandler chatHandler = mock(WsChatHandler.class);
    private final WsCallHandler callHandler = mock(WsCallHandler.class);
    private final WsSignalHandler signalHandler = mock(WsSignalHandler.class);
    private final CallLifecycleManager callLifecycleManager = mock(CallLifecycleManager.class);
    private final UserService userService = mock(UserService.class);

    private EmbeddedChannel channel(Long userId) {
        EmbeddedChannel ch = new EmbeddedChannel(new WsFrameHandler(objectMapper, sessionRegistry, new WsWriter(objectMapper),
                pingHandler, chatHandler, callHandler, signalHandler, callLifecycleManager, userService, Runnable::run,
                Clock.fixed(Instant.parse("2026-03-01T08:00:00Z"), ZoneOffset.UTC)));
        if (userId != null) {
            ch.attr(SessionRegistry.ATTR_USER_ID).set(userId);
        }
        return ch;
    }

    @Test
    void unauthenticatedFrameClosesConnection() throws Exception {
        EmbeddedChannel ch = channel(null);

        ch.writeInbound(new TextWebSocketFrame("{\"type\":\"call:initiate\",\"to\":2}"));

        assertEquals("unauthorized", readJson(ch).path("code").asText());
        assertFalse(ch.isOpen());
        verify(callHandler, never()).handleInitiate(any(), anyLong(), any());
    }

    @Test
    void malformedFramesAreAnsweredWithError() throws Exception {
        EmbeddedChannel ch = channel(7L);

        ch.writeInbound(new TextWebSocketFrame("{not json"));
        assertEquals("bad_json", readJson(ch).path("code").asText());

        ch.writeInbound(new TextWebSocketFrame("{\"to\":2}"));
        assertEquals("missing_type", readJson(ch).path("code").asText());

        ch.writeInbound(new TextWebSocketFrame("{\"type\":\"group:send\"}"));
        assertEquals("not_implemented", readJson(ch).path("code").asText());
        assertTrue(ch.isOpen());
    }

    @Test
    void senderIdentityComesFromHandshake() {
        EmbeddedChannel ch = channel(7L);

        ch.writeInbound(new TextWebSocketFrame("{\"type\":\"call:initiate\",\"from\":99,\"to\":2,\"callType\":\"video\"}"));

        ArgumentCaptor<WsEnvelope> msg = ArgumentCaptor.forClass(WsEnvelope.class);
        verify(callHandler).handleInitiate(any(ChannelHandlerContext.class), eq(7L), msg.capture());
        assertEquals(7L, msg.getValue().from);
        assertEquals(2L, msg.getValue().to);
        assertEquals("video", msg.getValue().callType);
    }

    @Test
    void framesAreDispatchedByType() {
        EmbeddedChannel ch = channel(7L);

        ch.writeInbound(new TextWebSocketFrame("{\"type\":\"signal:ice\",\"callId\":\"c1\",\"iceCandidate\":\"x\"}"));
        ch.writeInbound(new TextWebSocketFrame("{\"type\":\"message:send\",\"to\":2,\"body\":\"hi\"}"));
        ch.writeInbound(new TextWebSocketFrame("{\"type\":\"typing:stop\",\"to\":2}"));
        ch.writeInbound(new TextWebSocketFrame("{\"type\":\"call:end\",\"callId\":\"c1\"}"));
        ch.writeInbound(new TextWebSocketFrame("{\"type\":\"ping\"}"));

        verify(signalHandler).handle(any(ChannelHandlerContext.class), eq(7L), any(WsEnvelope.class));
        verify(chatHandler).handleSend(any(ChannelHandlerContext.class), eq(7L), any(WsEnvelope.class));
        verify(chatHandler).handleTyping(any(ChannelHandlerContext.class), eq(7L), any(WsEnvelope.class));
        verify(callHandler).handleEnd(any(ChannelHandlerContext.class), eq(7L), any(WsEnvelope.class));
        verify(pingHandler).handleClientPing(any(ChannelHandlerContext.class));
    }

    @Test
    void expiredTokenClosesConnection() throws Exception {
        EmbeddedChannel ch = channel(7L);
        when(pingHandler.isExpired(ch)).thenReturn(true);

        ch.writeInbound(new TextWebSocketFrame("{\"type\":\"ping\"}"));

        assertEquals("token_expired", readJson(ch).path("code").asText());
        assertFalse(ch.isOpen());
    }

    @Test
    void handshakeRegistersAndDisconnectCleansUp() {
        EmbeddedChannel ch = channel(7L);
        when(sessionRegistry.unregister(7L, ch)).thenReturn(true);
        when(sessionRegistry.lookup(7L)).thenReturn(ch);

        ch.pipeline().fireUserEventTriggered(
                new WebSocketServerProtocolHandler.HandshakeComplete("/ws", new DefaultHttpHeaders(), null));
        verify(sessionRegistry).register(7L, ch);
        verify(userService).updatePresence(eq(7L), eq(true), any());
        verify(callLifecycleManager).sendMissedCalls(7L);

        when(sessionRegistry.lookup(7L)).thenReturn(null);
        ch.close();
        verify(callLifecycleManager).onDisconnect(7L);
        verify(userService).updatePresence(eq(7L), eq(false), any());
    }

    @Test
    void replacedConnectionCloseDoesNotCleanUp() {
        EmbeddedChannel ch = channel(7L);
        when(sessionRegistry.unregister(7L, ch)).thenReturn(false);

        ch.close();

        verify(callLifecycleManager, never()).onDisconnect(anyLong());
        verify(userService, never()).updatePresence(anyLong(), anyBoolean(), any());
    }

    @Test
    void offlineWriteIsSkippedWhenUserAlreadyReconnected() {
        EmbeddedChannel closed = channel(7L);
        EmbeddedChannel fresh = channel(7L);
        when(sessionRegistry.unregister(7L, closed)).thenReturn(true);
        when(sessionRegistry.lookup(7L)).thenReturn(fresh);

        closed.close();

        verify(callLifecycleManager).onDisconnect(7L);
        verify(userService, never()).updatePresence(anyLong(), anyBoolean(), any());
    }

    @Test
    void onlineWriteIsSkippedWhenConnectionIsNoLongerCurrent() {
        EmbeddedChannel ch = channel(7L);
        EmbeddedChannel newer = channel(7L);
        WsFrameHandler handler = ch.pipeline().get(WsFrameHandler.class);

        when(sessionRegistry.lookup(7L)).thenReturn(null);
        handler.syncPresence(7L, ch, true);
        when(sessionRegistry.lookup(7L)).thenReturn(newer);
        handler.syncPresence(7L, ch, true);
        verify(userService, never()).updatePresence(anyLong(), anyBoolean(), any());

        when(sessionRegistry.lookup(7L)).thenReturn(ch);
        handler.syncPresence(7L, ch, true);
        verify(userService).updatePresence(eq(7L), eq(true), any());
    }

    private JsonNode readJson(EmbeddedChannel ch) throws Exception {
        TextWebSocketFrame frame = ch.readOutbound();
        try {
            return objectMapper.readTree(frame.text());
        } finally {
            frame.release();
        }
    }
}
