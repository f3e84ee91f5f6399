package com.minicall.recording;

/**
 * 媒体服务器控制面。失败一律抛 {@link com.minicall.common.error.RemoteServiceException}，
 * 由 {@link RecordingOrchestrator} 决定哪些失败可以忽略。
 */
public interface MediaControlClient {

    /** 创建开启 MP4 录制的推流。 */
    void createStream(String streamId, String streamName);

    void stopStream(String streamId);

    void deleteStream(String streamId);

    /**
     * 下载录制产物。
     *
     * @return 文件内容；文件不存在时为 null
     */
    byte[] downloadArtifact(String streamId, String fileName);
}
