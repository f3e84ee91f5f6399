package com.minicall.domain.entity;

import com.baomidou.mybatisplus.annotation.FieldFill;
import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.minicall.domain.enums.CallStatus;
import com.minicall.domain.enums.CallType;
import com.minicall.domain.enums.RecordingStatus;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 一次通话（含录制子记录）。只追加、不删除，所有状态字段都用条件更新推进。
 */
@Data
@TableName("t_call_record")
public class CallRecordEntity {

    @TableId(value = "id", type = IdType.ASSIGN_ID)
    private Long id;

    /** 对外的通话 id（雪花 id 字符串），唯一。 */
    private String callId;

    private Long fromUserId;

    private Long toUserId;

    private CallType callType;

    private CallStatus status;

    /** call_{min}_{max}_{createdAtMs}，与发起方向无关。 */
    private String roomId;

    /** 接听时间。 */
    private LocalDateTime startTime;

    private LocalDateTime endTime;

    private Integer durationSeconds;

    private String sdpOffer;

    private String sdpAnswer;

    /** 媒体服务器上的 streamId（call_{callId}），为空说明从未开始录制。 */
    private String remoteStreamId;

    private RecordingStatus recordingStatus;

    private String recordingUrl;

    private String recordingStorageKey;

    private Long recordingSizeBytes;

    private String recordingError;

    @TableField(fill = FieldFill.INSERT)
    private LocalDateTime createdAt;

    @TableField(fill = FieldFill.INSERT_UPDATE)
    private LocalDateTime updatedAt;

    public boolean isParticipant(long userId) {
        return (fromUserId != null && fromUserId == userId) || (toUserId != null && toUserId == userId);
    }

    /**
     * 另一方 userId；userId 不是参与方时返回 null。
     */
    public Long peerOf(long userId) {
        if (fromUserId != null && fromUserId == userId) {
            return toUserId;
        }
        if (toUserId != null && toUserId == userId) {
            return fromUserId;
        }
        return null;
    }
}
