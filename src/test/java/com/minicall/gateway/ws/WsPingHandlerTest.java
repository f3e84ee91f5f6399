package com.minicall.gateway.ws;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.minicall.gateway.session.SessionRegistry;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WsPingHandlerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T08:00:00Z");

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final SessionRegistry sessionRegistry = mock(SessionRegistry.class);
    private final WsPingHandler handler = new WsPingHandler(sessionRegistry, new WsWriter(objectMapper), Clock.fixed(NOW, ZoneOffset.UTC));
    private final EmbeddedChannel ch = new EmbeddedChannel(new ChannelInboundHandlerAdapter());

    @Test
    void clientPingIsAnsweredWithPong() throws Exception {
        handler.handleClientPing(ch.pipeline().firstContext());

        verify(sessionRegistry).touch(ch);
        TextWebSocketFrame frame = ch.readOutbound();
        try {
            assertEquals("pong", objectMapper.readTree(frame.text()).path("type").asText());
        } finally {
            frame.release();
        }
    }

    @Test
    void writerIdleSendsProtocolAndJsonPing() {
        when(sessionRegistry.isAuthed(ch)).thenReturn(true);
        when(sessionRegistry.getAccessExpMs(ch)).thenReturn(NOW.toEpochMilli() + 60_000);

        handler.onWriterIdle(ch.pipeline().firstContext());

        verify(sessionRegistry).touch(ch);
        Object first = ch.readOutbound();
        assertInstanceOf(PingWebSocketFrame.class, first);
        ((PingWebSocketFrame) first).release();
        TextWebSocketFrame json = ch.readOutbound();
        assertTrue(json.text().contains("\"type\":\"ping\""));
        json.release();
    }

    @Test
    void sessionWithoutExpiryIsRefreshed() {
        when(sessionRegistry.isAuthed(ch)).thenReturn(true);
        when(sessionRegistry.getAccessExpMs(ch)).thenReturn(null);

        assertFalse(handler.isExpired(ch));
        handler.onWriterIdle(ch.pipeline().firstContext());

        verify(sessionRegistry).touch(ch);
    }

    @Test
    void expiredSessionIsNotRefreshed() {
        when(sessionRegistry.isAuthed(ch)).thenReturn(true);
        when(sessionRegistry.getAccessExpMs(ch)).thenReturn(NOW.toEpochMilli());

        assertTrue(handler.isExpired(ch));
        handler.onWriterIdle(ch.pipeline().firstContext());
        verify(sessionRegistry, never()).touch(ch);

        when(sessionRegistry.getAccessExpMs(ch)).thenReturn(NOW.toEpochMilli() + 1);
        assertFalse(handler.isExpired(ch));
    }
}
