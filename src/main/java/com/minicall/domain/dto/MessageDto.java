package com.minicall.domain.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.minicall.domain.entity.MessageEntity;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MessageDto {
    private String messageId;
    private String clientMsgId;
    private Long fromUserId;
    private Long toUserId;
    private String content;
    private String msgType;
    private Boolean isRead;
    private LocalDateTime readAt;
    private LocalDateTime createdAt;

    public static MessageDto of(MessageEntity e) {
        MessageDto dto = new MessageDto();
        dto.setMessageId(e.getMessageId());
        dto.setClientMsgId(e.getClientMsgId());
        dto.setFromUserId(e.getFromUserId());
        dto.setToUserId(e.getToUserId());
        dto.setContent(e.getContent());
        dto.setMsgType(e.getMsgType() == null ? null : e.getMsgType().getDesc());
        dto.setIsRead(e.getIsRead());
        dto.setReadAt(e.getReadAt());
        dto.setCreatedAt(e.getCreatedAt());
        return dto;
    }
}
