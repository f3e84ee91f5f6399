package com.minicall.domain.dto;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 通话历史列表项（从当前用户视角）。
 */
@Data
public class CallRecordDto {
    private Long id;
    private String callId;
    private Long peerUserId;
    private String direction; // IN/OUT
    private String callType;
    private String status;
    private LocalDateTime startTime;
    private LocalDateTime endTime;
    private Integer durationSeconds;
    private String recordingStatus;
    private String recordingUrl;
    private LocalDateTime createdAt;
}
