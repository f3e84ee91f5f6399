package com.minicall.gateway.ws;

import com.minicall.auth.config.AuthProperties;
import com.minicall.auth.service.JwtService;
import com.minicall.gateway.session.SessionRegistry;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.util.CharsetUtil;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.notNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class WsHandshakeAuthHandlerTest {

    private static final String SECRET = "test-secret-test-secret-test-secret-32";

    private final JwtService jwtService = new JwtService(new AuthProperties("mini-call", SECRET, 3600L));
    private final SessionRegistry sessionRegistry = mock(SessionRegistry.class);

    private EmbeddedChannel channel() {
        return new EmbeddedChannel(new WsHandshakeAuthHandler("/ws", jwtService, sessionRegistry));
    }

    private static FullHttpRequest upgrade(String uri) {
        return new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.GET, uri);
    }

    @Test
    void missingTokenIsRejected() {
        EmbeddedChannel ch = channel();

        ch.writeInbound(upgrade("/ws"));

        assertStatus(ch, HttpResponseStatus.UNAUTHORIZED, "missing_access_token");
        assertFalse(ch.isOpen());
        verify(sessionRegistry, never()).markAuthenticated(any(), anyLong(), any());
    }

    @Test
    void invalidTokenIsRejected() {
        EmbeddedChannel ch = channel();

        ch.writeInbound(upgrade("/ws?token=not-a-jwt"));

        assertStatus(ch, HttpResponseStatus.UNAUTHORIZED, "invalid_access_token");
    }

    @Test
    void otherPathsAreNotFound() {
        EmbeddedChannel ch = channel();

        ch.writeInbound(upgrade("/admin"));

        assertStatus(ch, HttpResponseStatus.NOT_FOUND, "not_found");
    }

    @Test
    void queryTokenBindsIdentityAndPassesRequestOn() {
        EmbeddedChannel ch = channel();
        String token = jwtService.issueAccessToken(42L);

        ch.writeInbound(upgrade("/ws?accessToken=" + token));

        verify(sessionRegistry).markAuthenticated(eq(ch), eq(42L), notNull());
        FullHttpRequest passed = ch.readInbound();
        assertNotNull(passed);
        assertEquals("/ws?accessToken=" + token, passed.uri());
        passed.release();
        assertNull(ch.readOutbound());
    }

    @Test
    void bearerHeaderWinsOverQuery() {
        EmbeddedChannel ch = channel();
        FullHttpRequest req = upgrade("/ws?token=garbage");
        req.headers().set(HttpHeaderNames.AUTHORIZATION, "Bearer " + jwtService.issueAccessToken(7L));

        ch.writeInbound(req);

        verify(sessionRegistry).markAuthenticated(eq(ch), eq(7L), notNull());
        FullHttpRequest passed = ch.readInbound();
        assertSame(req, passed);
        passed.release();
    }

    private static void assertStatus(EmbeddedChannel ch, HttpResponseStatus status, String body) {
        FullHttpResponse resp = ch.readOutbound();
        try {
            assertEquals(status, resp.status());
            assertEquals(body, resp.content().toString(CharsetUtil.UTF_8));
        } finally {
            resp.release();
        }
    }
}
