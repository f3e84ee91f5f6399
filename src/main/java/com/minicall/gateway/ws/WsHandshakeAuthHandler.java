package com.minicall.gateway.ws;

import com.minicall.auth.service.JwtService;
import com.minicall.gateway.session.SessionRegistry;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.JwtException;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.*;
import io.netty.util.CharsetUtil;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;

/**
 * WebSocket 握手阶段（HTTP Upgrade）鉴权：
 * <ul>
 *   <li>从 Authorization: Bearer &lt;token&gt; 或 query 参数 token/accessToken 里取 accessToken</li>
 *   <li>校验 accessToken 并解析 userId/exp</li>
 *   <li>把 userId 与过期时间绑定到 channel；握手完成后才注册为可路由</li>
 * </ul>
 */
@Slf4j
public class WsHandshakeAuthHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private final String wsPath;
    private final JwtService jwtService;
    private final SessionRegistry sessionRegistry;

    public WsHandshakeAuthHandler(String wsPath, JwtService jwtService, SessionRegistry sessionRegistry) {
        this.wsPath = wsPath;
        this.jwtService = jwtService;
        this.sessionRegistry = sessionRegistry;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        String uri = req.uri();
        if (uri == null || !uri.startsWith(wsPath)) {
            writeAndClose(ctx, HttpResponseStatus.NOT_FOUND, "not_found");
            return;
        }

        String token = extractAccessToken(req);
        if (token == null || token.isBlank()) {
            writeAndClose(ctx, HttpResponseStatus.UNAUTHORIZED, "missing_access_token");
            return;
        }

        long userId;
        Long expMs;
        try {
            Jws<Claims> jws = jwtService.parseAccessToken(token);
            Claims claims = jws.getPayload();
            userId = jwtService.getUserId(claims);
            expMs = claims.getExpiration() == null ? null : claims.getExpiration().getTime();
        } catch (JwtException | IllegalArgumentException e) {
            log.info("ws handshake rejected: remote={}, err={}", ctx.channel().remoteAddress(), e.toString());
            writeAndClose(ctx, HttpResponseStatus.UNAUTHORIZED, "invalid_access_token");
            return;
        }

        sessionRegistry.markAuthenticated(ctx.channel(), userId, expMs);
        ctx.fireChannelRead(req.retain());
    }

    private String extractAccessToken(FullHttpRequest req) {
        String auth = req.headers().get(HttpHeaderNames.AUTHORIZATION);
        if (auth != null && auth.startsWith("Bearer ")) {
            return auth.substring("Bearer ".length()).trim();
        }

        Map<String, List<String>> params = new QueryStringDecoder(req.uri()).parameters();
        String fromToken = first(params, "token");
        if (fromToken != null && !fromToken.isBlank()) {
            return fromToken;
        }
        return first(params, "accessToken");
    }

    private static String first(Map<String, List<String>> params, String key) {
        List<String> list = params.get(key);
        if (list == null || list.isEmpty()) {
            return null;
        }
        return list.get(0);
    }

    private static void writeAndClose(ChannelHandlerContext ctx, HttpResponseStatus status, String reason) {
        byte[] bytes = reason.getBytes(CharsetUtil.UTF_8);
        FullHttpResponse resp = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, status, Unpooled.wrappedBuffer(bytes));
        resp.headers().set(HttpHeaderNames.CONTENT_TYPE, "text/plain; charset=UTF-8");
        resp.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
        ctx.writeAndFlush(resp).addListener(ChannelFutureListener.CLOSE);
    }
}
