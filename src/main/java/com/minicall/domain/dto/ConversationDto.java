package com.minicall.domain.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ConversationDto {

    private Long peerUserId;

    private String lastMessage;

    private LocalDateTime lastMessageTime;

    private String lastMessageType;

    /** 对端发给我、我还没读的条数。 */
    private Long unreadCount;
}
