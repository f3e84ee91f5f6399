package com.minicall.recording;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;

/**
 * 录制编排参数。
 *
 * @param enabled        关闭后 accept 不再创建媒体流，录制状态保持 pending
 * @param settleSeconds  停止推流后等待媒体服务器写完 MP4 的时间
 * @param artifactNames  依次探测的产物文件名模板，{streamId} 会被替换；先命中者为准
 * @param storagePrefix  对象存储 key 前缀
 */
@ConfigurationProperties(prefix = "mc.recording")
public record RecordingProperties(
        Boolean enabled,
        Integer settleSeconds,
        List<String> artifactNames,
        String storagePrefix,
        Enhance enhance
) {

    /**
     * 媒体服务器在不同码率配置下的文件命名：原始流、按分辨率、按分辨率+码率、自适应。
     */
    public static final List<String> DEFAULT_ARTIFACT_NAMES = List.of(
            "{streamId}.mp4",
            "{streamId}_240p.mp4",
            "{streamId}_360p.mp4",
            "{streamId}_480p.mp4",
            "{streamId}_720p.mp4",
            "{streamId}_1080p.mp4",
            "{streamId}_240p500kbps.mp4",
            "{streamId}_360p800kbps.mp4",
            "{streamId}_480p1000kbps.mp4",
            "{streamId}_720p2000kbps.mp4",
            "{streamId}_Adaptive.mp4"
    );

    public boolean enabledEffective() {
        return enabled == null || enabled;
    }

    public Duration settleInterval() {
        return Duration.ofSeconds(settleSeconds == null ? 30 : Math.max(0, settleSeconds));
    }

    public List<String> artifactNamesEffective() {
        return (artifactNames == null || artifactNames.isEmpty()) ? DEFAULT_ARTIFACT_NAMES : artifactNames;
    }

    public String storagePrefixEffective() {
        return (storagePrefix == null || storagePrefix.isBlank()) ? "recordings" : storagePrefix;
    }

    /**
     * 音频增强（FFmpeg）。
     *
     * @param enabled        是否启用（需要本机安装 ffmpeg）
     * @param ffmpegPath     ffmpeg 可执行文件
     * @param timeoutSeconds 单次转码超时
     */
    public record Enhance(
            Boolean enabled,
            String ffmpegPath,
            Integer timeoutSeconds
    ) {

        public String ffmpegPathEffective() {
            return (ffmpegPath == null || ffmpegPath.isBlank()) ? "ffmpeg" : ffmpegPath;
        }

        public Duration timeout() {
            return Duration.ofSeconds(timeoutSeconds == null ? 300 : Math.max(10, timeoutSeconds));
        }
    }
}
