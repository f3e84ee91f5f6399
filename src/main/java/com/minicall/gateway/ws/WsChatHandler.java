package com.minicall.gateway.ws;

import com.minicall.common.error.InvalidRequestException;
import com.minicall.domain.dto.MessageDto;
import com.minicall.domain.entity.MessageEntity;
import com.minicall.domain.enums.MessageType;
import com.minicall.domain.service.MessageService;
import io.netty.channel.ChannelHandlerContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * 单聊帧：message:send、message:markRead、typing:*。
 *
 * <p>消息先落库再投递；对端不在线只是收不到实时推送，发送方总能收到 message:sent。</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WsChatHandler {

    public static final String MESSAGE_FAILED = "MESSAGE_FAILED";

    static final int MAX_BODY_LEN = 4096;

    private final MessageService messageService;
    private final SignalRouter signalRouter;
    private final ClientMsgIdIdempotency idempotency;
    private final WsInboundDispatcher dispatcher;
    private final WsWriter wsWriter;
    private final Clock clock;

    public void handleSend(ChannelHandlerContext ctx, long userId, WsEnvelope msg) {
        dispatcher.submit(ctx, msg, WsTypes.ERROR, MESSAGE_FAILED, () -> send(ctx, userId, msg));
    }

    public void handleMarkRead(ChannelHandlerContext ctx, long userId, WsEnvelope msg) {
        dispatcher.submit(ctx, msg, WsTypes.ERROR, MESSAGE_FAILED, () -> markRead(ctx, userId, msg));
    }

    /**
     * 输入状态只做透传，不落库，直接在 eventLoop 上完成。
     */
    public void handleTyping(ChannelHandlerContext ctx, long userId, WsEnvelope msg) {
        if (msg.getTo() == null) {
            wsWriter.writeError(ctx, InvalidRequestException.INVALID_DATA, "to is required", msg.getClientMsgId());
            return;
        }
        WsEnvelope out = new WsEnvelope();
        out.type = msg.getType();
        out.from = userId;
        out.to = msg.getTo();
        out.ts = clock.millis();
        signalRouter.route(msg.getTo(), out);
    }

    void send(ChannelHandlerContext ctx, long userId, WsEnvelope msg) {
        Long toUserId = msg.getTo();
        if (toUserId == null || toUserId <= 0) {
            throw new InvalidRequestException("to is required");
        }
        if (toUserId == userId) {
            throw new InvalidRequestException("cannot_send_to_self");
        }
        if (msg.getBody() == null || msg.getBody().isBlank()) {
            throw new InvalidRequestException("body is required");
        }
        if (msg.getBody().length() > MAX_BODY_LEN) {
            throw new InvalidRequestException("body_too_long");
        }
        MessageType msgType = (msg.getMsgType() == null || msg.getMsgType().isBlank())
                ? MessageType.TEXT : MessageType.fromString(msg.getMsgType());
        if (msgType == null) {
            throw new InvalidRequestException("unsupported msgType: " + msg.getMsgType());
        }

        String clientMsgId = msg.getClientMsgId();
        String key = (clientMsgId == null || clientMsgId.isBlank()) ? null : ClientMsgIdIdempotency.key(userId, clientMsgId);
        String existing = idempotency.get(key);
        if (existing != null) {
            log.info("duplicate message:send, re-ack: from={}, clientMsgId={}, messageId={}", userId, clientMsgId, existing);
            WsEnvelope ack = new WsEnvelope();
            ack.type = WsTypes.MESSAGE_SENT;
            ack.clientMsgId = clientMsgId;
            ack.messageId = existing;
            ack.to = toUserId;
            ack.ts = clock.millis();
            wsWriter.write(ctx, ack);
            return;
        }

        MessageEntity saved = messageService.saveDirect(userId, toUserId, msg.getBody(), msgType, clientMsgId);
        idempotency.put(key, saved.getMessageId());
        MessageDto dto = MessageDto.of(saved);

        WsEnvelope received = new WsEnvelope();
        received.type = WsTypes.MESSAGE_RECEIVED;
        received.from = userId;
        received.to = toUserId;
        received.messageId = saved.getMessageId();
        received.message = dto;
        received.ts = clock.millis();
        boolean delivered = signalRouter.route(toUserId, received);

        WsEnvelope sent = new WsEnvelope();
        sent.type = WsTypes.MESSAGE_SENT;
        sent.clientMsgId = clientMsgId;
        sent.messageId = saved.getMessageId();
        sent.to = toUserId;
        sent.message = dto;
        sent.ts = clock.millis();
        wsWriter.write(ctx, sent);
        log.debug("message sent: messageId={}, from={}, to={}, delivered={}", saved.getMessageId(), userId, toUserId, delivered);
    }

    void markRead(ChannelHandlerContext ctx, long userId, WsEnvelope msg) {
        Long withUserId = msg.getWithUserId();
        if (withUserId == null || withUserId <= 0) {
            throw new InvalidRequestException("withUserId is required");
        }
        int updated = messageService.markRead(userId, withUserId, LocalDateTime.now(clock));

        WsEnvelope read = new WsEnvelope();
        read.type = WsTypes.MESSAGE_READ;
        read.from = userId;
        read.to = withUserId;
        read.ts = clock.millis();
        signalRouter.route(withUserId, read);

        WsEnvelope ack = new WsEnvelope();
        ack.type = WsTypes.MESSAGE_MARKED_READ;
        ack.withUserId = withUserId;
        ack.count = updated;
        ack.ts = clock.millis();
        wsWriter.write(ctx, ack);
    }
}
