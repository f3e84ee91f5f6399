package com.minicall.domain.entity;

import com.baomidou.mybatisplus.annotation.FieldFill;
import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@TableName("t_call_ice_candidate")
public class CallIceCandidateEntity {

    @TableId(value = "id", type = IdType.ASSIGN_ID)
    private Long id;

    private String callId;

    private Long fromUserId;

    private String candidate;

    private String sdpMid;

    private Integer sdpMLineIndex;

    @TableField(fill = FieldFill.INSERT)
    private LocalDateTime createdAt;
}
