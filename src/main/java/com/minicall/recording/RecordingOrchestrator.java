package com.minicall.recording;

import com.minicall.domain.entity.CallRecordEntity;
import com.minicall.domain.enums.CallType;
import com.minicall.domain.service.CallRecordService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * 通话录制编排：pending -> recording -> processing -> completed | failed | no_recording。
 *
 * <p>对外的两个操作都在录制线程池上异步执行，返回的 future 总是正常完成；
 * 所有失败只体现在通话记录的录制状态上，不会反向影响通话信令。</p>
 */
@Slf4j
@Component
public class RecordingOrchestrator {

    static final String NO_RECORDING_MESSAGE =
            "Recording file not found on media server. Please enable MP4 recording for the streaming application.";

    private static final String CONTENT_TYPE_MP4 = "video/mp4";

    private final CallRecordService callRecordService;
    private final MediaControlClient mediaControlClient;
    private final ObjectStorage objectStorage;
    private final Optional<RecordingEnhancer> enhancer;
    private final RecordingProperties props;
    private final Executor executor;
    private final Clock clock;

    public RecordingOrchestrator(CallRecordService callRecordService,
                                 MediaControlClient mediaControlClient,
                                 ObjectStorage objectStorage,
                                 Optional<RecordingEnhancer> enhancer,
                                 RecordingProperties props,
                                 @Qualifier("mcRecordingExecutor") Executor executor,
                                 Clock clock) {
        this.callRecordService = callRecordService;
        this.mediaControlClient = mediaControlClient;
        this.objectStorage = objectStorage;
        this.enhancer = enhancer;
        this.props = props;
        this.executor = executor;
        this.clock = clock;
    }

    public static String streamId(String callId) {
        return "call_" + callId;
    }

    /**
     * 通话接通后开始录制。通话在创建推流期间已经结束时，顺带执行停止流程。
     */
    public CompletableFuture<Void> start(String callId, RecordingMetadata meta) {
        if (!props.enabledEffective()) {
            log.debug("recording disabled, skip start: callId={}", callId);
            return CompletableFuture.completedFuture(null);
        }
        return guard("start", callId, () -> CompletableFuture
                .supplyAsync(() -> doStart(callId, meta), executor)
                .thenCompose(needStop -> needStop ? stop(callId) : CompletableFuture.completedFuture(null)));
    }

    /**
     * 停止录制并归档。同一通话只会有一个调用方通过 recording -> processing 的认领，其余直接返回。
     */
    public CompletableFuture<Void> stop(String callId) {
        return guard("stop", callId, () -> CompletableFuture
                .supplyAsync(() -> claimAndStopStream(callId), executor)
                .thenCompose(call -> {
                    if (call == null) {
                        return CompletableFuture.completedFuture(null);
                    }
                    long settleMs = props.settleInterval().toMillis();
                    Executor settled = CompletableFuture.delayedExecutor(settleMs, TimeUnit.MILLISECONDS, executor);
                    return CompletableFuture.runAsync(() -> archive(call), settled);
                }));
    }

    /**
     * @return true 表示需要立刻执行停止流程（通话已是终态）
     */
    private boolean doStart(String callId, RecordingMetadata meta) {
        String streamId = streamId(callId);
        String streamName = "Call_" + meta.callType().getDesc() + "_" + meta.fromUserId() + "_to_" + meta.toUserId();
        try {
            mediaControlClient.createStream(streamId, streamName);
        } catch (Exception e) {
            // 媒体服务器会在第一次 WebRTC 推流时自动建流
            log.warn("create stream failed, continue: callId={}, streamId={}, err={}", callId, streamId, e.toString());
        }
        if (!callRecordService.markRecordingStarted(callId, streamId)) {
            log.info("recording start skipped, recording not pending: callId={}", callId);
            return false;
        }
        log.info("recording started: callId={}, streamId={}", callId, streamId);
        CallRecordEntity call = callRecordService.getByCallId(callId);
        if (call != null && call.getStatus() != null && call.getStatus().isTerminal()) {
            log.info("call finished while recording was starting, stopping now: callId={}, status={}", callId, call.getStatus());
            return true;
        }
        return false;
    }

    private CallRecordEntity claimAndStopStream(String callId) {
        CallRecordEntity call = callRecordService.getByCallId(callId);
        if (call == null || call.getRemoteStreamId() == null) {
            log.info("recording stop skipped, no stream: callId={}", callId);
            return null;
        }
        if (!callRecordService.claimRecordingStop(callId)) {
            log.debug("recording stop skipped, already claimed: callId={}, status={}", callId, call.getRecordingStatus());
            return null;
        }
        try {
            mediaControlClient.stopStream(call.getRemoteStreamId());
        } catch (Exception e) {
            log.warn("stop stream failed, continue: callId={}, streamId={}, err={}", callId, call.getRemoteStreamId(), e.toString());
        }
        return call;
    }

    private void archive(CallRecordEntity call) {
        String callId = call.getCallId();
        String streamId = call.getRemoteStreamId();

        Artifact artifact = locateArtifact(streamId);
        if (artifact == null) {
            log.warn("no recording artifact found: callId={}, streamId={}", callId, streamId);
            callRecordService.markRecordingNoRecording(callId, NO_RECORDING_MESSAGE);
            return;
        }

        byte[] bytes = enhance(callId, artifact.bytes(), call.getCallType());
        String key = storageKey(call);
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("callId", callId);
        metadata.put("callType", call.getCallType() == null ? "" : call.getCallType().getDesc());
        metadata.put("sourceFile", artifact.name());
        metadata.put("uploadedAt", clock.instant().toString());
        String url = objectStorage.put(key, bytes, CONTENT_TYPE_MP4, metadata);

        callRecordService.markRecordingCompleted(callId, url, key, bytes.length);
        log.info("recording completed: callId={}, source={}, key={}, sizeBytes={}", callId, artifact.name(), key, bytes.length);

        try {
            mediaControlClient.deleteStream(streamId);
        } catch (Exception e) {
            log.warn("delete stream failed, ignore: callId={}, streamId={}, err={}", callId, streamId, e.toString());
        }
    }

    private Artifact locateArtifact(String streamId) {
        for (String pattern : props.artifactNamesEffective()) {
            String name = pattern.replace("{streamId}", streamId);
            try {
                byte[] bytes = mediaControlClient.downloadArtifact(streamId, name);
                if (bytes != null && bytes.length > 0) {
                    return new Artifact(name, bytes);
                }
            } catch (Exception e) {
                log.debug("artifact lookup failed: name={}, err={}", name, e.toString());
            }
        }
        return null;
    }

    private byte[] enhance(String callId, byte[] original, CallType callType) {
        if (enhancer.isEmpty()) {
            return original;
        }
        try {
            byte[] out = enhancer.get().enhance(original, callType);
            if (out != null && out.length > 0) {
                return out;
            }
            log.warn("enhancer returned empty output, using original: callId={}", callId);
        } catch (Exception e) {
            log.warn("enhance failed, using original: callId={}, err={}", callId, e.toString());
        }
        return original;
    }

    String storageKey(CallRecordEntity call) {
        String type = call.getCallType() == null ? "unknown" : call.getCallType().getDesc();
        String ts = clock.instant().toString().replace(':', '-').replace('.', '-');
        return props.storagePrefixEffective() + "/" + type + "/" + call.getCallId() + "_" + ts + ".mp4";
    }

    /**
     * 任何未预期异常（包括线程池拒绝）都落为 failed，对外返回正常完成的 future。
     */
    private CompletableFuture<Void> guard(String op, String callId, Supplier<CompletableFuture<Void>> body) {
        CompletableFuture<Void> f;
        try {
            f = body.get();
        } catch (Exception e) {
            f = CompletableFuture.failedFuture(e);
        }
        return f.exceptionally(e -> {
            log.error("recording {} failed: callId={}", op, callId, e);
            markFailed(callId, e);
            return null;
        });
    }

    private void markFailed(String callId, Throwable e) {
        Throwable cause = (e instanceof CompletionException && e.getCause() != null) ? e.getCause() : e;
        String error = cause.getMessage() == null ? cause.toString() : cause.getMessage();
        try {
            callRecordService.markRecordingFailed(callId, error);
        } catch (Exception dbError) {
            log.error("mark recording failed errored: callId={}, err={}", callId, dbError.toString());
        }
    }

    private record Artifact(String name, byte[] bytes) {
    }
}
