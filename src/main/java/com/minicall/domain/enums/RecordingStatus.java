package com.minicall.domain.enums;

import com.baomidou.mybatisplus.annotation.EnumValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 通话录制状态：pending -> recording -> processing -> completed | failed | no_recording。
 *
 * <p>{@code no_recording} 表示媒体服务器上没有产物（例如未开启 MP4 录制），属于正常结局。</p>
 */
@Getter
@RequiredArgsConstructor
public enum RecordingStatus {

    PENDING(0, "pending"),

    RECORDING(1, "recording"),

    PROCESSING(2, "processing"),

    COMPLETED(3, "completed"),

    FAILED(4, "failed"),

    NO_RECORDING(5, "no_recording");

    @EnumValue
    private final Integer code;

    private final String desc;
}
