package com.minicall.recording;

import com.minicall.domain.enums.CallType;

/**
 * 录制文件后处理（降噪、响度归一）。尽力而为：失败时编排器上传原始文件。
 */
public interface RecordingEnhancer {

    byte[] enhance(byte[] input, CallType callType);
}
