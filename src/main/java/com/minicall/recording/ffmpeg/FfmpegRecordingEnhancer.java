package com.minicall.recording.ffmpeg;

import com.minicall.common.error.RemoteServiceException;
import com.minicall.domain.enums.CallType;
import com.minicall.recording.RecordingEnhancer;
import com.minicall.recording.RecordingProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * 调用本机 ffmpeg 做人声增强：滤掉低频和高频噪声、降噪、提升中频、响度归一、轻压缩。视频轨直接拷贝。
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "mc.recording.enhance", name = "enabled", havingValue = "true")
public class FfmpegRecordingEnhancer implements RecordingEnhancer {

    private static final String SERVICE = "ffmpeg";

    static final String AUDIO_FILTERS = String.join(",",
            "highpass=f=200",
            "lowpass=f=3500",
            "afftdn=nf=-25:tn=1",
            "equalizer=f=1000:t=q:w=1:g=3",
            "equalizer=f=2000:t=q:w=1:g=2",
            "loudnorm=I=-16:TP=-1.5:LRA=11",
            "compand=attacks=0.3:decays=0.8:points=-80/-80|-45/-45|-27/-25|-5/-5:soft-knee=6:gain=5");

    private final RecordingProperties.Enhance props;

    public FfmpegRecordingEnhancer(RecordingProperties recordingProperties) {
        RecordingProperties.Enhance enhance = recordingProperties.enhance();
        this.props = enhance == null ? new RecordingProperties.Enhance(true, null, null) : enhance;
    }

    @Override
    public byte[] enhance(byte[] input, CallType callType) {
        Path dir = null;
        try {
            dir = Files.createTempDirectory("mc-enhance-");
            Path in = dir.resolve("input.mp4");
            Path out = dir.resolve("output.mp4");
            Files.write(in, input);

            Process process = new ProcessBuilder(command(in, out))
                    .redirectErrorStream(true)
                    .redirectOutput(dir.resolve("ffmpeg.log").toFile())
                    .start();
            if (!process.waitFor(props.timeout().toSeconds(), TimeUnit.SECONDS)) {
                process.destroyForcibly();
                throw new RemoteServiceException(SERVICE, "timeout after " + props.timeout().toSeconds() + "s");
            }
            if (process.exitValue() != 0) {
                throw new RemoteServiceException(SERVICE, "exit code " + process.exitValue());
            }
            byte[] enhanced = Files.readAllBytes(out);
            log.info("recording enhanced: callType={}, inBytes={}, outBytes={}", callType, input.length, enhanced.length);
            return enhanced;
        } catch (IOException e) {
            throw new RemoteServiceException(SERVICE, "io error: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteServiceException(SERVICE, "interrupted", e);
        } finally {
            deleteQuietly(dir);
        }
    }

    List<String> command(Path in, Path out) {
        List<String> cmd = new ArrayList<>();
        cmd.add(props.ffmpegPathEffective());
        cmd.add("-y");
        cmd.add("-i");
        cmd.add(in.toString());
        cmd.add("-af");
        cmd.add(AUDIO_FILTERS);
        cmd.add("-c:a");
        cmd.add("aac");
        cmd.add("-b:a");
        cmd.add("192k");
        cmd.add("-ar");
        cmd.add("48000");
        cmd.add("-ac");
        cmd.add("1");
        cmd.add("-c:v");
        cmd.add("copy");
        cmd.add(out.toString());
        return cmd;
    }

    private static void deleteQuietly(Path dir) {
        if (dir == null) {
            return;
        }
        try (Stream<Path> files = Files.list(dir)) {
            for (Path p : files.toList()) {
                Files.deleteIfExists(p);
            }
            Files.deleteIfExists(dir);
        } catch (IOException e) {
            log.warn("cleanup temp dir failed: dir={}, err={}", dir, e.toString());
        }
    }
}
