package com.minicall.domain.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.conditions.update.LambdaUpdateWrapper;
import com.baomidou.mybatisplus.extension.plugins.pagination.Page;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.minicall.domain.dto.CallRecordDto;
import com.minicall.domain.entity.CallIceCandidateEntity;
import com.minicall.domain.entity.CallRecordEntity;
import com.minicall.domain.enums.CallStatus;
import com.minicall.domain.enums.RecordingStatus;
import com.minicall.domain.mapper.CallIceCandidateMapper;
import com.minicall.domain.mapper.CallRecordMapper;
import com.minicall.domain.service.CallRecordService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Service
@RequiredArgsConstructor
public class CallRecordServiceImpl extends ServiceImpl<CallRecordMapper, CallRecordEntity> implements CallRecordService {

    private static final int MAX_ERROR_LEN = 1000;

    private final CallIceCandidateMapper iceCandidateMapper;
    private final Clock clock;

    @Override
    public CallRecordEntity getByCallId(String callId) {
        if (callId == null || callId.isBlank()) {
            return null;
        }
        return this.getOne(new LambdaQueryWrapper<CallRecordEntity>()
                .eq(CallRecordEntity::getCallId, callId)
                .last("limit 1"));
    }

    @Override
    public boolean markRinging(String callId) {
        return this.update(statusUpdate(callId)
                .eq(CallRecordEntity::getStatus, CallStatus.INITIATED)
                .set(CallRecordEntity::getStatus, CallStatus.RINGING));
    }

    @Override
    public boolean markAccepted(String callId, LocalDateTime startTime) {
        return this.update(statusUpdate(callId)
                .in(CallRecordEntity::getStatus, CallStatus.UNANSWERED)
                .set(CallRecordEntity::getStatus, CallStatus.ACCEPTED)
                .set(CallRecordEntity::getStartTime, startTime));
    }

    @Override
    public boolean markRejected(String callId, LocalDateTime endTime) {
        return this.update(statusUpdate(callId)
                .in(CallRecordEntity::getStatus, CallStatus.UNANSWERED)
                .set(CallRecordEntity::getStatus, CallStatus.REJECTED)
                .set(CallRecordEntity::getEndTime, endTime));
    }

    @Override
    public boolean markMissed(String callId, LocalDateTime endTime) {
        return this.update(statusUpdate(callId)
                .in(CallRecordEntity::getStatus, CallStatus.UNANSWERED)
                .set(CallRecordEntity::getStatus, CallStatus.MISSED)
                .set(CallRecordEntity::getEndTime, endTime));
    }

    @Override
    public boolean markEnded(String callId, CallStatus expected, LocalDateTime endTime, Integer durationSeconds) {
        if (expected == null || expected.isTerminal()) {
            return false;
        }
        return this.update(statusUpdate(callId)
                .eq(CallRecordEntity::getStatus, expected)
                .set(CallRecordEntity::getStatus, CallStatus.ENDED)
                .set(CallRecordEntity::getEndTime, endTime)
                .set(CallRecordEntity::getDurationSeconds, durationSeconds));
    }

    @Override
    public List<CallRecordEntity> listActiveRecordedByUser(long userId) {
        return this.list(new LambdaQueryWrapper<CallRecordEntity>()
                .nested(w -> w.eq(CallRecordEntity::getFromUserId, userId).or().eq(CallRecordEntity::getToUserId, userId))
                .in(CallRecordEntity::getStatus, CallStatus.ACTIVE)
                .isNotNull(CallRecordEntity::getRemoteStreamId));
    }

    @Override
    public List<CallRecordEntity> listMissedForCallee(long userId, LocalDateTime since) {
        return this.list(new LambdaQueryWrapper<CallRecordEntity>()
                .eq(CallRecordEntity::getToUserId, userId)
                .eq(CallRecordEntity::getStatus, CallStatus.MISSED)
                .ge(CallRecordEntity::getCreatedAt, since)
                .orderByDesc(CallRecordEntity::getCreatedAt)
                .last("limit 100"));
    }

    @Override
    public boolean markRecordingStarted(String callId, String remoteStreamId) {
        return this.update(statusUpdate(callId)
                .eq(CallRecordEntity::getRecordingStatus, RecordingStatus.PENDING)
                .set(CallRecordEntity::getRecordingStatus, RecordingStatus.RECORDING)
                .set(CallRecordEntity::getRemoteStreamId, remoteStreamId));
    }

    @Override
    public boolean claimRecordingStop(String callId) {
        return this.update(statusUpdate(callId)
                .eq(CallRecordEntity::getRecordingStatus, RecordingStatus.RECORDING)
                .set(CallRecordEntity::getRecordingStatus, RecordingStatus.PROCESSING));
    }

    @Override
    public boolean markRecordingCompleted(String callId, String url, String storageKey, long sizeBytes) {
        return this.update(statusUpdate(callId)
                .eq(CallRecordEntity::getRecordingStatus, RecordingStatus.PROCESSING)
                .set(CallRecordEntity::getRecordingStatus, RecordingStatus.COMPLETED)
                .set(CallRecordEntity::getRecordingUrl, url)
                .set(CallRecordEntity::getRecordingStorageKey, storageKey)
                .set(CallRecordEntity::getRecordingSizeBytes, sizeBytes)
                .set(CallRecordEntity::getRecordingError, null));
    }

    @Override
    public boolean markRecordingNoRecording(String callId, String reason) {
        return this.update(statusUpdate(callId)
                .eq(CallRecordEntity::getRecordingStatus, RecordingStatus.PROCESSING)
                .set(CallRecordEntity::getRecordingStatus, RecordingStatus.NO_RECORDING)
                .set(CallRecordEntity::getRecordingError, truncate(reason)));
    }

    @Override
    public boolean markRecordingFailed(String callId, String error) {
        return this.update(statusUpdate(callId)
                .in(CallRecordEntity::getRecordingStatus,
                        RecordingStatus.PENDING, RecordingStatus.RECORDING, RecordingStatus.PROCESSING)
                .set(CallRecordEntity::getRecordingStatus, RecordingStatus.FAILED)
                .set(CallRecordEntity::getRecordingError, truncate(error)));
    }

    @Override
    public void saveSdpOffer(String callId, String sdp) {
        this.update(statusUpdate(callId).set(CallRecordEntity::getSdpOffer, sdp));
    }

    @Override
    public void saveSdpAnswer(String callId, String sdp) {
        this.update(statusUpdate(callId).set(CallRecordEntity::getSdpAnswer, sdp));
    }

    @Override
    public void appendIceCandidate(String callId, long fromUserId, String candidate, String sdpMid, Integer sdpMLineIndex) {
        CallIceCandidateEntity e = new CallIceCandidateEntity();
        e.setCallId(callId);
        e.setFromUserId(fromUserId);
        e.setCandidate(candidate);
        e.setSdpMid(sdpMid);
        e.setSdpMLineIndex(sdpMLineIndex);
        iceCandidateMapper.insert(e);
    }

    @Override
    public List<CallRecordDto> cursorByUserId(long userId, long limit, Long lastId) {
        long safeLimit = Math.min(Math.max(limit, 1), 100);

        LambdaQueryWrapper<CallRecordEntity> wrapper = new LambdaQueryWrapper<CallRecordEntity>()
                .nested(w -> w.eq(CallRecordEntity::getFromUserId, userId).or().eq(CallRecordEntity::getToUserId, userId))
                .orderByDesc(CallRecordEntity::getId)
                .last("limit " + safeLimit);
        if (lastId != null && lastId > 0) {
            wrapper.lt(CallRecordEntity::getId, lastId);
        }
        return mapDtos(userId, this.list(wrapper));
    }

    @Override
    public Page<CallRecordDto> pageByUserId(long userId, long pageNo, long pageSize) {
        long safePageNo = pageNo > 0 ? pageNo : 1;
        long safePageSize = Math.min(Math.max(pageSize, 1), 100);

        LambdaQueryWrapper<CallRecordEntity> wrapper = new LambdaQueryWrapper<CallRecordEntity>()
                .nested(w -> w.eq(CallRecordEntity::getFromUserId, userId).or().eq(CallRecordEntity::getToUserId, userId))
                .orderByDesc(CallRecordEntity::getId);

        Page<CallRecordEntity> p = this.page(new Page<>(safePageNo, safePageSize), wrapper);
        Page<CallRecordDto> out = new Page<>(p.getCurrent(), p.getSize(), p.getTotal());
        out.setRecords(mapDtos(userId, p.getRecords()));
        return out;
    }

    private LambdaUpdateWrapper<CallRecordEntity> statusUpdate(String callId) {
        return new LambdaUpdateWrapper<CallRecordEntity>()
                .eq(CallRecordEntity::getCallId, callId)
                .set(CallRecordEntity::getUpdatedAt, LocalDateTime.now(clock));
    }

    private static String truncate(String s) {
        if (s == null || s.length() <= MAX_ERROR_LEN) {
            return s;
        }
        return s.substring(0, MAX_ERROR_LEN);
    }

    private static List<CallRecordDto> mapDtos(long userId, List<CallRecordEntity> list) {
        List<CallRecordDto> out = new ArrayList<>();
        if (list == null) {
            return out;
        }
        for (CallRecordEntity e : list) {
            if (e == null) continue;
            CallRecordDto dto = new CallRecordDto();
            dto.setId(e.getId());
            dto.setCallId(e.getCallId());
            dto.setCallType(e.getCallType() == null ? null : e.getCallType().getDesc());
            dto.setStatus(e.getStatus() == null ? null : e.getStatus().getDesc());
            dto.setStartTime(e.getStartTime());
            dto.setEndTime(e.getEndTime());
            dto.setDurationSeconds(e.getDurationSeconds());
            dto.setRecordingStatus(e.getRecordingStatus() == null ? null : e.getRecordingStatus().getDesc());
            dto.setRecordingUrl(e.getRecordingUrl());
            dto.setCreatedAt(e.getCreatedAt());

            boolean outgoing = e.getFromUserId() != null && e.getFromUserId() == userId;
            dto.setDirection(outgoing ? "OUT" : "IN");
            dto.setPeerUserId(outgoing ? e.getToUserId() : e.getFromUserId());
            out.add(dto);
        }
        return out;
    }
}
