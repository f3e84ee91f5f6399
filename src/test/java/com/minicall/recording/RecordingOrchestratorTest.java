package com.minicall.recording;

import com.minicall.common.error.RemoteServiceException;
import com.minicall.domain.entity.CallRecordEntity;
import com.minicall.domain.enums.CallStatus;
import com.minicall.domain.enums.CallType;
import com.minicall.domain.enums.RecordingStatus;
import com.minicall.domain.service.InMemoryCallRecords;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RecordingOrchestratorTest {

    private static final String CALL_ID = "1790000000000000001";
    private static final String STREAM_ID = "call_" + CALL_ID;
    private static final RecordingMetadata META = new RecordingMetadata(CallType.VOICE, 11L, 22L);
    private static final byte[] MP4 = "mp4-bytes".getBytes(StandardCharsets.UTF_8);

    private final Clock clock = Clock.fixed(Instant.parse("2026-03-01T08:00:00.123Z"), ZoneOffset.UTC);
    private final InMemoryCallRecords records = new InMemoryCallRecords();
    private final MediaControlClient media = mock(MediaControlClient.class);
    private final ObjectStorage storage = mock(ObjectStorage.class);

    @BeforeEach
    void setUp() {
        CallRecordEntity call = new CallRecordEntity();
        call.setCallId(CALL_ID);
        call.setFromUserId(11L);
        call.setToUserId(22L);
        call.setCallType(CallType.VOICE);
        call.setStatus(CallStatus.ACCEPTED);
        call.setRecordingStatus(RecordingStatus.PENDING);
        records.insert(call);
        when(storage.put(anyString(), any(), anyString(), anyMap())).thenAnswer(inv -> "https://bucket.oss/" + inv.getArgument(0));
    }

    private RecordingOrchestrator orchestrator(Boolean enabled, RecordingEnhancer enhancer) {
        RecordingProperties props = new RecordingProperties(enabled, 0, null, null, null);
        return new RecordingOrchestrator(records.service(), media, storage, Optional.ofNullable(enhancer), props, Runnable::run, clock);
    }

    @Test
    void firstArtifactInCandidateOrderIsUploaded() throws Exception {
        when(media.downloadArtifact(STREAM_ID, STREAM_ID + "_360p.mp4")).thenReturn(MP4);
        when(media.downloadArtifact(STREAM_ID, STREAM_ID + "_480p.mp4")).thenReturn("other".getBytes(StandardCharsets.UTF_8));
        RecordingOrchestrator o = orchestrator(true, null);

        o.start(CALL_ID, META).get(5, TimeUnit.SECONDS);
        verify(media).createStream(STREAM_ID, "Call_voice_11_to_22");
        assertEquals(RecordingStatus.RECORDING, records.get(CALL_ID).getRecordingStatus());
        assertEquals(STREAM_ID, records.get(CALL_ID).getRemoteStreamId());

        o.stop(CALL_ID).get(5, TimeUnit.SECONDS);

        InOrder order = inOrder(media);
        order.verify(media).stopStream(STREAM_ID);
        order.verify(media).downloadArtifact(STREAM_ID, STREAM_ID + ".mp4");
        order.verify(media).downloadArtifact(STREAM_ID, STREAM_ID + "_240p.mp4");
        order.verify(media).downloadArtifact(STREAM_ID, STREAM_ID + "_360p.mp4");
        order.verify(media).deleteStream(STREAM_ID);
        verify(media, never()).downloadArtifact(STREAM_ID, STREAM_ID + "_480p.mp4");

        CallRecordEntity row = records.get(CALL_ID);
        assertEquals(RecordingStatus.COMPLETED, row.getRecordingStatus());
        assertEquals("recordings/voice/" + CALL_ID + "_2026-03-01T08-00-00-123Z.mp4", row.getRecordingStorageKey());
        assertEquals("https://bucket.oss/" + row.getRecordingStorageKey(), row.getRecordingUrl());
        assertEquals(MP4.length, row.getRecordingSizeBytes());
        verify(storage).put(eq(row.getRecordingStorageKey()), eq(MP4), eq("video/mp4"), anyMap());
    }

    @Test
    void missingArtifactEndsAsNoRecording() throws Exception {
        RecordingOrchestrator o = orchestrator(true, null);
        o.start(CALL_ID, META).get(5, TimeUnit.SECONDS);

        o.stop(CALL_ID).get(5, TimeUnit.SECONDS);

        CallRecordEntity row = records.get(CALL_ID);
        assertEquals(RecordingStatus.NO_RECORDING, row.getRecordingStatus());
        assertEquals(RecordingOrchestrator.NO_RECORDING_MESSAGE, row.getRecordingError());
        verify(media, times(RecordingProperties.DEFAULT_ARTIFACT_NAMES.size())).downloadArtifact(eq(STREAM_ID), anyString());
        verify(storage, never()).put(anyString(), any(), anyString(), anyMap());
    }

    @Test
    void lookupErrorsMoveOnToNextName() throws Exception {
        when(media.downloadArtifact(STREAM_ID, STREAM_ID + ".mp4")).thenThrow(new RemoteServiceException("ant-media", "timeout"));
        when(media.downloadArtifact(STREAM_ID, STREAM_ID + "_240p.mp4")).thenReturn(MP4);
        RecordingOrchestrator o = orchestrator(true, null);
        o.start(CALL_ID, META).get(5, TimeUnit.SECONDS);

        o.stop(CALL_ID).get(5, TimeUnit.SECONDS);

        assertEquals(RecordingStatus.COMPLETED, records.get(CALL_ID).getRecordingStatus());
    }

    @Test
    void enhancedBytesAreUploadedAndFailuresFallBackToOriginal() throws Exception {
        byte[] enhanced = "louder".getBytes(StandardCharsets.UTF_8);
        RecordingEnhancer enhancer = mock(RecordingEnhancer.class);
        when(enhancer.enhance(MP4, CallType.VOICE)).thenReturn(enhanced);
        when(media.downloadArtifact(STREAM_ID, STREAM_ID + ".mp4")).thenReturn(MP4);

        RecordingOrchestrator o = orchestrator(true, enhancer);
        o.start(CALL_ID, META).get(5, TimeUnit.SECONDS);
        o.stop(CALL_ID).get(5, TimeUnit.SECONDS);
        verify(storage).put(anyString(), eq(enhanced), eq("video/mp4"), anyMap());
        assertEquals(enhanced.length, records.get(CALL_ID).getRecordingSizeBytes());

        records.update(CALL_ID, r -> r.setRecordingStatus(RecordingStatus.RECORDING));
        when(enhancer.enhance(MP4, CallType.VOICE)).thenThrow(new RemoteServiceException("ffmpeg", "exit 1"));
        o.stop(CALL_ID).get(5, TimeUnit.SECONDS);
        verify(storage).put(anyString(), eq(MP4), eq("video/mp4"), anyMap());
        assertEquals(RecordingStatus.COMPLETED, records.get(CALL_ID).getRecordingStatus());
    }

    @Test
    void uploadFailureMarksFailed() throws Exception {
        when(media.downloadArtifact(STREAM_ID, STREAM_ID + ".mp4")).thenReturn(MP4);
        when(storage.put(anyString(), any(), anyString(), anyMap())).thenThrow(new RemoteServiceException("oss", "bucket gone"));
        RecordingOrchestrator o = orchestrator(true, null);
        o.start(CALL_ID, META).get(5, TimeUnit.SECONDS);

        o.stop(CALL_ID).get(5, TimeUnit.SECONDS);

        CallRecordEntity row = records.get(CALL_ID);
        assertEquals(RecordingStatus.FAILED, row.getRecordingStatus());
        assertEquals("oss: bucket gone", row.getRecordingError());
        assertNull(row.getRecordingUrl());
        verify(media, never()).deleteStream(anyString());
    }

    @Test
    void stopIsClaimedOnce() throws Exception {
        when(media.downloadArtifact(STREAM_ID, STREAM_ID + ".mp4")).thenReturn(MP4);
        RecordingOrchestrator o = orchestrator(true, null);
        o.start(CALL_ID, META).get(5, TimeUnit.SECONDS);

        o.stop(CALL_ID).get(5, TimeUnit.SECONDS);
        o.stop(CALL_ID).get(5, TimeUnit.SECONDS);

        verify(media, times(1)).stopStream(STREAM_ID);
        verify(storage, times(1)).put(anyString(), any(), anyString(), anyMap());
    }

    @Test
    void stopWithoutStreamDoesNothing() throws Exception {
        orchestrator(true, null).stop(CALL_ID).get(5, TimeUnit.SECONDS);

        assertEquals(RecordingStatus.PENDING, records.get(CALL_ID).getRecordingStatus());
        verify(media, never()).stopStream(anyString());
    }

    @Test
    void createStreamFailureStillRecords() throws Exception {
        doThrow(new RemoteServiceException("ant-media", "503")).when(media).createStream(anyString(), anyString());

        orchestrator(true, null).start(CALL_ID, META).get(5, TimeUnit.SECONDS);

        assertEquals(RecordingStatus.RECORDING, records.get(CALL_ID).getRecordingStatus());
    }

    @Test
    void callEndedDuringStartIsStoppedImmediately() throws Exception {
        records.update(CALL_ID, r -> r.setStatus(CallStatus.ENDED));
        RecordingOrchestrator o = orchestrator(true, null);

        o.start(CALL_ID, META).get(5, TimeUnit.SECONDS);

        verify(media).stopStream(STREAM_ID);
        assertEquals(RecordingStatus.NO_RECORDING, records.get(CALL_ID).getRecordingStatus());
    }

    @Test
    void disabledRecordingSkipsMediaServer() throws Exception {
        orchestrator(false, null).start(CALL_ID, META).get(5, TimeUnit.SECONDS);

        verify(media, never()).createStream(anyString(), anyString());
        assertEquals(RecordingStatus.PENDING, records.get(CALL_ID).getRecordingStatus());
    }

    @Test
    void defaultCandidateOrderStartsWithOriginalAndEndsWithAdaptive() {
        List<String> names = RecordingProperties.DEFAULT_ARTIFACT_NAMES;
        assertEquals("{streamId}.mp4", names.get(0));
        assertEquals("{streamId}_Adaptive.mp4", names.get(names.size() - 1));
        assertTrue(names.contains("{streamId}_720p2000kbps.mp4"));
    }
}
