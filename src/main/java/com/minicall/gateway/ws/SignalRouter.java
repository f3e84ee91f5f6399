package com.minicall.gateway.ws;

import com.minicall.gateway.session.SessionRegistry;
import io.netty.channel.Channel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 定向投递：按 userId 找到当前连接并原样写出。
 *
 * <p>目标不在线时直接丢弃（不重试、不排队），由调用方根据返回值决定是否降级
 * （例如来电投递失败后由未接听定时器兜底）。</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SignalRouter {

    private final SessionRegistry sessionRegistry;
    private final WsWriter wsWriter;

    /**
     * @return 目标在线且已交给连接写出时为 true
     */
    public boolean route(Long targetUserId, WsEnvelope env) {
        if (targetUserId == null || env == null) {
            return false;
        }
        Channel ch = sessionRegistry.lookup(targetUserId);
        if (ch == null) {
            log.debug("route dropped, target offline: type={}, to={}", env.getType(), targetUserId);
            return false;
        }
        wsWriter.write(ch, env).addListener(f -> {
            if (!f.isSuccess()) {
                log.debug("route write failed: type={}, to={}, err={}", env.getType(), targetUserId, String.valueOf(f.cause()));
            }
        });
        return true;
    }

    public boolean isOnline(Long userId) {
        return userId != null && sessionRegistry.lookup(userId) != null;
    }
}
