package com.minicall.gateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * WebSocket 网关监听参数。
 *
 * @param writerIdleSeconds 多久没有写出任何帧就主动下发 ping，并刷新在线路由 TTL
 * @param maxFrameBytes     握手请求与单帧文本的最大字节数（SDP 可能有几 KB）
 * @param inboundMaxPending 单连接排队中的入站帧上限，超出直接回 server_busy
 */
@ConfigurationProperties(prefix = "mc.gateway.ws")
public record GatewayProperties(
        String host,
        int port,
        String path,
        Integer writerIdleSeconds,
        Integer maxFrameBytes,
        Integer inboundMaxPending
) {

    public int writerIdleSecondsEffective() {
        return writerIdleSeconds == null ? 60 : Math.max(5, writerIdleSeconds);
    }

    public int maxFrameBytesEffective() {
        return maxFrameBytes == null ? 65536 : Math.max(4096, maxFrameBytes);
    }

    public int inboundMaxPendingEffective() {
        return inboundMaxPending == null ? 64 : Math.max(1, inboundMaxPending);
    }

    /** 本实例在 Redis 路由表里的标识。 */
    public String instanceId() {
        return host + ":" + port;
    }
}
