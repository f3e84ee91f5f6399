package com.minicall.gateway.ws;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.minicall.gateway.session.SessionRegistry;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SignalRouterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final SessionRegistry sessionRegistry = mock(SessionRegistry.class);
    private final SignalRouter router = new SignalRouter(sessionRegistry, new WsWriter(objectMapper));

    @Test
    void deliversFrameUnchangedToCurrentConnection() throws Exception {
        EmbeddedChannel ch = new EmbeddedChannel();
        when(sessionRegistry.lookup(2L)).thenReturn(ch);

        WsEnvelope env = new WsEnvelope();
        env.type = WsTypes.SIGNAL_OFFER;
        env.callId = "c1";
        env.from = 1L;
        env.to = 2L;
        env.sdp = "v=0";

        assertTrue(router.route(2L, env));

        TextWebSocketFrame frame = ch.readOutbound();
        try {
            JsonNode json = objectMapper.readTree(frame.text());
            assertEquals("signal:offer", json.path("type").asText());
            assertEquals("c1", json.path("callId").asText());
            assertEquals("v=0", json.path("sdp").asText());
            assertEquals(1L, json.path("from").asLong());
            assertFalse(json.has("body"));
        } finally {
            frame.release();
        }
        assertNull(ch.readOutbound());
    }

    @Test
    void dropsWhenTargetOffline() {
        WsEnvelope env = new WsEnvelope();
        env.type = WsTypes.CALL_INCOMING;

        assertFalse(router.route(3L, env));
        assertFalse(router.route(null, env));
        assertFalse(router.route(3L, null));
        assertFalse(router.isOnline(3L));
    }

    @Test
    void closedConnectionWriteFailsQuietly() {
        EmbeddedChannel ch = new EmbeddedChannel();
        ch.close();
        when(sessionRegistry.lookup(2L)).thenReturn(ch);
        WsEnvelope env = new WsEnvelope();
        env.type = WsTypes.PRESENCE;

        // 已交给连接写出即返回 true，写失败只记日志
        assertTrue(router.route(2L, env));
        assertNull(ch.readOutbound());
    }
}
