package com.minicall.domain.controller;

import com.minicall.auth.web.AuthContext;
import com.minicall.common.api.ApiCodes;
import com.minicall.common.api.Result;
import com.minicall.common.error.InvalidRequestException;
import com.minicall.domain.dto.ConversationDto;
import com.minicall.domain.dto.MessageDto;
import com.minicall.domain.dto.SendMessageRequest;
import com.minicall.domain.dto.UserPresenceDto;
import com.minicall.domain.entity.MessageEntity;
import com.minicall.domain.enums.MessageType;
import com.minicall.domain.service.MessageService;
import com.minicall.domain.service.UserService;
import com.minicall.gateway.session.SessionRegistry;
import com.minicall.gateway.ws.SignalRouter;
import com.minicall.gateway.ws.WsEnvelope;
import com.minicall.gateway.ws.WsTypes;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@RequiredArgsConstructor
@RestController
@RequestMapping("/chat")
public class ChatController {

    private final MessageService messageService;
    private final UserService userService;
    private final SessionRegistry sessionRegistry;
    private final SignalRouter signalRouter;
    private final Clock clock;

    /**
     * 与 with 之间的会话历史，按时间正序。
     */
    @GetMapping("/messages")
    public Result<List<MessageDto>> messages(@RequestParam("with") Long withUserId,
                                             @RequestParam(required = false) Long pageNo,
                                             @RequestParam(required = false) Long pageSize) {
        Long userId = AuthContext.getUserId();
        if (userId == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        if (withUserId == null || withUserId <= 0) {
            return Result.fail(ApiCodes.BAD_REQUEST, "missing_with_user_id");
        }
        long safePageNo = pageNo == null ? 1 : Math.max(pageNo, 1);
        long safePageSize = pageSize == null ? 50 : Math.min(Math.max(pageSize, 1), 100);
        return Result.ok(messageService.conversation(userId, withUserId, safePageNo, safePageSize)
                .stream().map(MessageDto::of).toList());
    }

    /**
     * HTTP 发送：落库后对端在线则推送 message:received，不在线只落库。
     */
    @PostMapping("/messages")
    public Result<MessageDto> send(@Valid @RequestBody SendMessageRequest req) {
        Long userId = AuthContext.getUserId();
        if (userId == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        if (req.getToUserId() <= 0 || req.getToUserId().equals(userId)) {
            throw new InvalidRequestException("invalid_to_user_id");
        }
        MessageType msgType = (req.getMsgType() == null || req.getMsgType().isBlank())
                ? MessageType.TEXT : MessageType.fromString(req.getMsgType());
        if (msgType == null) {
            throw new InvalidRequestException("unsupported msgType: " + req.getMsgType());
        }

        MessageEntity saved = messageService.saveDirect(userId, req.getToUserId(), req.getContent(), msgType, req.getClientMsgId());
        MessageDto dto = MessageDto.of(saved);

        WsEnvelope received = new WsEnvelope();
        received.type = WsTypes.MESSAGE_RECEIVED;
        received.from = userId;
        received.to = req.getToUserId();
        received.messageId = saved.getMessageId();
        received.message = dto;
        received.ts = clock.millis();
        signalRouter.route(req.getToUserId(), received);
        return Result.ok(dto);
    }

    @GetMapping("/messages/unread/count")
    public Result<Map<String, Long>> unreadCount() {
        Long userId = AuthContext.getUserId();
        if (userId == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        return Result.ok(Map.of("unreadCount", messageService.countUnread(userId)));
    }

    /**
     * 联系人列表：除自己以外的用户，在线的在前。
     */
    @GetMapping("/users")
    public Result<List<UserPresenceDto>> users(@RequestParam(required = false) Long pageNo,
                                               @RequestParam(required = false) Long pageSize) {
        Long userId = AuthContext.getUserId();
        if (userId == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        long safePageNo = pageNo == null ? 1 : Math.max(pageNo, 1);
        long safePageSize = pageSize == null ? 100 : Math.min(Math.max(pageSize, 1), 200);
        return Result.ok(userService.listOthers(userId, safePageNo, safePageSize)
                .stream().map(UserPresenceDto::of).toList());
    }

    @GetMapping("/conversations")
    public Result<List<ConversationDto>> conversations(@RequestParam(required = false) Integer limit) {
        Long userId = AuthContext.getUserId();
        if (userId == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        int safeLimit = limit == null ? 50 : Math.min(Math.max(limit, 1), 200);
        return Result.ok(messageService.conversations(userId, safeLimit));
    }

    @GetMapping("/online")
    public Result<List<Long>> online() {
        List<Long> ids = new ArrayList<>(sessionRegistry.listOnline());
        ids.sort(null);
        return Result.ok(ids);
    }
}
