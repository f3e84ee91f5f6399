package com.minicall.domain.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.minicall.domain.entity.CallRecordEntity;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 信令帧里携带的通话快照（call:incoming / call:initiated / call:response ...）。
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CallDto {
    private String callId;
    private Long fromUserId;
    private Long toUserId;
    private String callType;
    private String status;
    private String roomId;
    private LocalDateTime startTime;
    private LocalDateTime endTime;
    private Integer durationSeconds;
    private String recordingStatus;
    private String recordingUrl;
    private LocalDateTime createdAt;
    private UserBriefDto fromUser;
    private UserBriefDto toUser;

    public static CallDto of(CallRecordEntity e) {
        CallDto dto = new CallDto();
        dto.setCallId(e.getCallId());
        dto.setFromUserId(e.getFromUserId());
        dto.setToUserId(e.getToUserId());
        dto.setCallType(e.getCallType() == null ? null : e.getCallType().getDesc());
        dto.setStatus(e.getStatus() == null ? null : e.getStatus().getDesc());
        dto.setRoomId(e.getRoomId());
        dto.setStartTime(e.getStartTime());
        dto.setEndTime(e.getEndTime());
        dto.setDurationSeconds(e.getDurationSeconds());
        dto.setRecordingStatus(e.getRecordingStatus() == null ? null : e.getRecordingStatus().getDesc());
        dto.setRecordingUrl(e.getRecordingUrl());
        dto.setCreatedAt(e.getCreatedAt());
        return dto;
    }
}
