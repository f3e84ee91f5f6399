package com.minicall.domain.entity;

import com.baomidou.mybatisplus.annotation.FieldFill;
import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.minicall.domain.enums.MessageType;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@TableName("t_message")
public class MessageEntity {

    @TableId(value = "id", type = IdType.ASSIGN_ID)
    private Long id;

    /** 对外消息 id（字符串），作为 message:sent 的回执 id。 */
    private String messageId;

    /** 发送方在客户端生成的 id，用于重试去重，可为空。 */
    private String clientMsgId;

    private Long fromUserId;

    private Long toUserId;

    private String content;

    private MessageType msgType;

    private Boolean isRead;

    private LocalDateTime deliveredAt;

    private LocalDateTime readAt;

    @TableField(fill = FieldFill.INSERT)
    private LocalDateTime createdAt;

    @TableField(fill = FieldFill.INSERT_UPDATE)
    private LocalDateTime updatedAt;
}
