package com.minicall.gateway.session;

import com.minicall.gateway.config.GatewayProperties;
import com.minicall.gateway.ws.WsEnvelope;
import com.minicall.gateway.ws.WsTypes;
import com.minicall.gateway.ws.WsWriter;
import io.netty.channel.Channel;
import io.netty.util.AttributeKey;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 连接注册表：userId -> 当前连接（每个用户至多一个可路由的连接）。
 *
 * <p>同一用户再次连接时原子替换旧连接（后到者生效）。旧连接不主动关闭，但不再可路由；
 * 它之后的断开不会注销新连接，见 {@link #unregister(long, Channel)}。</p>
 *
 * <p>Channel 无法放进 Redis，Redis 里只保存路由信息 userId -> 实例标识，Redis 不可用时降级为纯本机映射。</p>
 */
@Slf4j
@Component
public class SessionRegistry {

    public static final AttributeKey<Long> ATTR_USER_ID = AttributeKey.valueOf("uid");
    public static final AttributeKey<Long> ATTR_ACCESS_EXP_MS = AttributeKey.valueOf("aexp");
    public static final AttributeKey<Long> ATTR_CONNECTED_AT_MS = AttributeKey.valueOf("cat");

    private static final String ROUTE_KEY_PREFIX = "mc:gw:route:";
    private static final Duration ROUTE_TTL = Duration.ofSeconds(120);

    private final ConcurrentHashMap<Long, Channel> channels = new ConcurrentHashMap<>();

    private final StringRedisTemplate redis;
    private final WsWriter wsWriter;
    private final Clock clock;
    private final String instanceId;

    public SessionRegistry(StringRedisTemplate redis, GatewayProperties wsProps, WsWriter wsWriter, Clock clock) {
        this.redis = redis;
        this.wsWriter = wsWriter;
        this.clock = clock;
        this.instanceId = wsProps.instanceId();
    }

    /**
     * 握手鉴权通过：把身份绑定到 channel 上，此时还不可路由（等握手完成再 register）。
     */
    public void markAuthenticated(Channel ch, long userId, Long accessExpMs) {
        ch.attr(ATTR_USER_ID).set(userId);
        ch.attr(ATTR_ACCESS_EXP_MS).set(accessExpMs);
    }

    public boolean isAuthed(Channel ch) {
        return ch.attr(ATTR_USER_ID).get() != null;
    }

    public Long getAccessExpMs(Channel ch) {
        return ch.attr(ATTR_ACCESS_EXP_MS).get();
    }

    public Long getConnectedAtMs(Channel ch) {
        return ch.attr(ATTR_CONNECTED_AT_MS).get();
    }

    /**
     * 注册连接并广播上线。
     *
     * @return 被替换下来的旧连接（已成孤儿），没有则为 null
     */
    public Channel register(long userId, Channel ch) {
        AtomicReference<Channel> replaced = new AtomicReference<>();
        channels.compute(userId, (k, old) -> {
            if (old != null && old != ch) {
                replaced.set(old);
            }
            return ch;
        });
        ch.attr(ATTR_USER_ID).set(userId);
        ch.attr(ATTR_CONNECTED_AT_MS).setIfAbsent(clock.millis());
        if (replaced.get() != null) {
            log.info("session replaced: userId={}, old={}, new={}", userId, replaced.get().id().asShortText(), ch.id().asShortText());
        }
        setRoute(userId);
        broadcastPresence(userId, true);
        return replaced.get();
    }

    /**
     * 仅当当前映射仍指向 ch 时才注销。被替换下来的旧连接断开时返回 false，不影响新连接。
     */
    public boolean unregister(long userId, Channel ch) {
        if (ch == null || !channels.remove(userId, ch)) {
            return false;
        }
        afterRemoved(userId);
        return true;
    }

    /**
     * 幂等注销，不存在时什么也不做。
     */
    public void unregister(long userId) {
        if (channels.remove(userId) != null) {
            afterRemoved(userId);
        }
    }

    /**
     * @return 当前可路由的连接，用户不在线时为 null
     */
    public Channel lookup(long userId) {
        Channel ch = channels.get(userId);
        if (ch == null || !ch.isActive()) {
            return null;
        }
        return ch;
    }

    public Set<Long> listOnline() {
        Set<Long> out = new HashSet<>();
        for (Map.Entry<Long, Channel> e : channels.entrySet()) {
            if (e.getValue().isActive()) {
                out.add(e.getKey());
            }
        }
        return out;
    }

    public Collection<Channel> activeChannels() {
        List<Channel> out = new ArrayList<>();
        for (Channel ch : channels.values()) {
            if (ch.isActive()) {
                out.add(ch);
            }
        }
        return out;
    }

    /**
     * 心跳时刷新路由 TTL。
     */
    public void touch(Channel ch) {
        Long userId = ch.attr(ATTR_USER_ID).get();
        if (userId != null && lookup(userId) == ch) {
            setRoute(userId);
        }
    }

    private void afterRemoved(long userId) {
        deleteRouteIfOwned(userId);
        broadcastPresence(userId, false);
    }

    private void broadcastPresence(long userId, boolean online) {
        WsEnvelope env = new WsEnvelope();
        env.type = WsTypes.PRESENCE;
        env.userId = userId;
        env.online = online;
        env.ts = clock.millis();
        broadcast(env);
    }

    /**
     * 推给所有可路由的连接，被替换下来的孤儿连接收不到。
     */
    public void broadcast(WsEnvelope env) {
        for (Channel ch : activeChannels()) {
            wsWriter.write(ch, env).addListener(f -> {
                if (!f.isSuccess()) {
                    log.debug("broadcast push failed: type={}, to={}, err={}",
                            env.getType(), ch.attr(ATTR_USER_ID).get(), String.valueOf(f.cause()));
                }
            });
        }
    }

    private void setRoute(long userId) {
        try {
            redis.opsForValue().set(routeKey(userId), instanceId, ROUTE_TTL);
        } catch (Exception e) {
            // Redis 不可用时只维持本机映射
            log.warn("setRoute failed, redis unavailable? userId={}, instanceId={}, err={}", userId, instanceId, e.toString());
        }
    }

    private void deleteRouteIfOwned(long userId) {
        String key = routeKey(userId);
        try {
            if (instanceId.equals(redis.opsForValue().get(key))) {
                redis.delete(key);
            }
        } catch (Exception e) {
            log.warn("deleteRouteIfOwned failed, redis unavailable? userId={}, instanceId={}, err={}", userId, instanceId, e.toString());
        }
    }

    private String routeKey(long userId) {
        return ROUTE_KEY_PREFIX + userId;
    }
}
