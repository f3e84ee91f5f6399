package com.minicall.domain.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.conditions.update.LambdaUpdateWrapper;
import com.baomidou.mybatisplus.core.toolkit.IdWorker;
import com.baomidou.mybatisplus.extension.plugins.pagination.Page;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.minicall.domain.dto.ConversationDto;
import com.minicall.domain.entity.MessageEntity;
import com.minicall.domain.enums.MessageType;
import com.minicall.domain.mapper.MessageMapper;
import com.minicall.domain.service.MessageService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Service
@RequiredArgsConstructor
public class MessageServiceImpl extends ServiceImpl<MessageMapper, MessageEntity> implements MessageService {

    private final Clock clock;

    @Override
    public MessageEntity saveDirect(long fromUserId, long toUserId, String content, MessageType msgType, String clientMsgId) {
        MessageEntity e = new MessageEntity();
        e.setId(IdWorker.getId());
        e.setMessageId(String.valueOf(e.getId()));
        e.setClientMsgId(clientMsgId);
        e.setFromUserId(fromUserId);
        e.setToUserId(toUserId);
        e.setContent(content);
        e.setMsgType(msgType == null ? MessageType.TEXT : msgType);
        e.setIsRead(false);
        e.setCreatedAt(LocalDateTime.now(clock));
        this.save(e);
        return e;
    }

    @Override
    public int markRead(long readerUserId, long fromUserId, LocalDateTime readAt) {
        return this.getBaseMapper().update(null, new LambdaUpdateWrapper<MessageEntity>()
                .eq(MessageEntity::getToUserId, readerUserId)
                .eq(MessageEntity::getFromUserId, fromUserId)
                .eq(MessageEntity::getIsRead, false)
                .set(MessageEntity::getIsRead, true)
                .set(MessageEntity::getReadAt, readAt));
    }

    @Override
    public List<MessageEntity> conversation(long userId, long withUserId, long pageNo, long pageSize) {
        long safePageNo = pageNo > 0 ? pageNo : 1;
        long safePageSize = Math.min(Math.max(pageSize, 1), 100);

        LambdaQueryWrapper<MessageEntity> wrapper = new LambdaQueryWrapper<MessageEntity>()
                .nested(w -> w
                        .nested(a -> a.eq(MessageEntity::getFromUserId, userId).eq(MessageEntity::getToUserId, withUserId))
                        .or()
                        .nested(b -> b.eq(MessageEntity::getFromUserId, withUserId).eq(MessageEntity::getToUserId, userId)))
                .orderByDesc(MessageEntity::getId);

        Page<MessageEntity> page = this.page(new Page<>(safePageNo, safePageSize, false), wrapper);
        List<MessageEntity> records = new ArrayList<>(page.getRecords());
        // 查询按新到旧分页，返回给前端按旧到新展示
        Collections.reverse(records);
        return records;
    }

    @Override
    public long countUnread(long userId) {
        return this.count(new LambdaQueryWrapper<MessageEntity>()
                .eq(MessageEntity::getToUserId, userId)
                .eq(MessageEntity::getIsRead, false));
    }

    @Override
    public List<ConversationDto> conversations(long userId, int limit) {
        List<MessageEntity> lasts = this.getBaseMapper().selectLastMessagePerPeer(userId, Math.min(Math.max(limit, 1), 200));
        if (lasts == null || lasts.isEmpty()) {
            return new ArrayList<>();
        }
        // 未读只取 from_user_id 一列，在内存里按对端计数
        Map<Long, Long> unread = new HashMap<>();
        for (MessageEntity m : this.list(new LambdaQueryWrapper<MessageEntity>()
                .select(MessageEntity::getFromUserId)
                .eq(MessageEntity::getToUserId, userId)
                .eq(MessageEntity::getIsRead, false))) {
            unread.merge(m.getFromUserId(), 1L, Long::sum);
        }

        List<ConversationDto> out = new ArrayList<>(lasts.size());
        for (MessageEntity m : lasts) {
            long peer = m.getFromUserId() != null && m.getFromUserId() == userId ? m.getToUserId() : m.getFromUserId();
            ConversationDto dto = new ConversationDto();
            dto.setPeerUserId(peer);
            dto.setLastMessage(m.getContent());
            dto.setLastMessageTime(m.getCreatedAt());
            dto.setLastMessageType(m.getMsgType() == null ? null : m.getMsgType().getDesc());
            dto.setUnreadCount(unread.getOrDefault(peer, 0L));
            out.add(dto);
        }
        return out;
    }
}
