package com.minicall.recording;

import com.minicall.domain.enums.CallType;

/**
 * 开始录制时需要的通话信息（用于命名媒体流与存储路径）。
 */
public record RecordingMetadata(
        CallType callType,
        long fromUserId,
        long toUserId
) {
}
