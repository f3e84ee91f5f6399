package com.minicall.domain.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.minicall.domain.dto.ConversationDto;
import com.minicall.domain.entity.MessageEntity;
import com.minicall.domain.enums.MessageType;

import java.time.LocalDateTime;
import java.util.List;

public interface MessageService extends IService<MessageEntity> {

    /**
     * 落库一条单聊消息并返回（含生成的 messageId）。
     */
    MessageEntity saveDirect(long fromUserId, long toUserId, String content, MessageType msgType, String clientMsgId);

    /**
     * 把 fromUserId 发给 readerUserId 的未读消息标记为已读，返回更新条数。
     */
    int markRead(long readerUserId, long fromUserId, LocalDateTime readAt);

    /**
     * 两人之间的会话历史，按时间正序返回指定页。
     */
    List<MessageEntity> conversation(long userId, long withUserId, long pageNo, long pageSize);

    long countUnread(long userId);

    /**
     * 会话列表：每个对端一条（最后一条消息 + 未读数），最近的在前。
     */
    List<ConversationDto> conversations(long userId, int limit);
}
