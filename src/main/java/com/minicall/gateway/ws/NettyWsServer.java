package com.minicall.gateway.ws;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.minicall.auth.service.JwtService;
import com.minicall.domain.service.UserService;
import com.minicall.gateway.call.CallLifecycleManager;
import com.minicall.gateway.config.GatewayProperties;
import com.minicall.gateway.session.SessionRegistry;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolConfig;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.handler.timeout.IdleStateHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

@Slf4j
@Component
public class NettyWsServer implements SmartLifecycle {

    private final GatewayProperties props;
    private final ObjectMapper objectMapper;
    private final JwtService jwtService;
    private final SessionRegistry sessionRegistry;
    private final WsWriter wsWriter;
    private final WsPingHandler pingHandler;
    private final WsChatHandler chatHandler;
    private final WsCallHandler callHandler;
    private final WsSignalHandler signalHandler;
    private final CallLifecycleManager callLifecycleManager;
    private final UserService userService;
    private final Executor dbExecutor;
    private final Clock clock;

    private EventLoopGroup boss;
    private EventLoopGroup worker;
    private Channel serverChannel;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public NettyWsServer(GatewayProperties props,
                         ObjectMapper objectMapper,
                         JwtService jwtService,
                         SessionRegistry sessionRegistry,
                         WsWriter wsWriter,
                         WsPingHandler pingHandler,
                         WsChatHandler chatHandler,
                         WsCallHandler callHandler,
                         WsSignalHandler signalHandler,
                         CallLifecycleManager callLifecycleManager,
                         UserService userService,
                         @Qualifier("mcDbExecutor") Executor dbExecutor,
                         Clock clock) {
        this.props = props;
        this.objectMapper = objectMapper;
        this.jwtService = jwtService;
        this.sessionRegistry = sessionRegistry;
        this.wsWriter = wsWriter;
        this.pingHandler = pingHandler;
        this.chatHandler = chatHandler;
        this.callHandler = callHandler;
        this.signalHandler = signalHandler;
        this.callLifecycleManager = callLifecycleManager;
        this.userService = userService;
        this.dbExecutor = dbExecutor;
        this.clock = clock;
    }

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }

        log.info("Starting Netty WS gateway on {}:{}{}", props.host(), props.port(), props.path());

        // boss 负责 accept，worker 负责已建立连接的读写
        boss = new NioEventLoopGroup(1);
        worker = new NioEventLoopGroup();

        ServerBootstrap b = new ServerBootstrap();
        b.group(boss, worker)
                .channel(NioServerSocketChannel.class)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline p = ch.pipeline();

                        p.addLast(new HttpServerCodec());
                        p.addLast(new HttpObjectAggregator(props.maxFrameBytesEffective()));

                        // writerIdle 间隔内没有写出任何数据就触发 WRITER_IDLE，由 WsPingHandler 发心跳
                        p.addLast(new IdleStateHandler(0, props.writerIdleSecondsEffective(), 0));

                        // 握手阶段校验 accessToken，把 userId/exp 绑定到 channel
                        p.addLast(new WsHandshakeAuthHandler(props.path(), jwtService, sessionRegistry));

                        WebSocketServerProtocolConfig wsConfig = WebSocketServerProtocolConfig.newBuilder()
                                .websocketPath(props.path())
                                .checkStartsWith(true)
                                .allowExtensions(true)
                                .maxFramePayloadLength(props.maxFrameBytesEffective())
                                .build();
                        p.addLast(new WebSocketServerProtocolHandler(wsConfig));

                        p.addLast(new WsFrameHandler(objectMapper, sessionRegistry, wsWriter, pingHandler,
                                chatHandler, callHandler, signalHandler, callLifecycleManager, userService, dbExecutor, clock));
                    }
                });

        try {
            serverChannel = b.bind(props.host(), props.port()).syncUninterruptibly().channel();
            log.info("Netty WS gateway started, listening on {}", serverChannel.localAddress());
        } catch (Exception e) {
            log.error("Failed to start Netty WS gateway on {}:{}{}", props.host(), props.port(), props.path(), e);
            stop();
            throw e;
        }
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        log.info("Stopping Netty WS gateway...");
        if (serverChannel != null) {
            serverChannel.close().syncUninterruptibly();
        }
        if (worker != null) {
            worker.shutdownGracefully();
        }
        if (boss != null) {
            boss.shutdownGracefully();
        }
        log.info("Netty WS gateway stopped");
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        // 晚于线程池与 Redis 连接启动，早于它们关闭
        return Integer.MAX_VALUE - 100;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }

    @Override
    public void stop(Runnable callback) {
        stop();
        callback.run();
    }
}
