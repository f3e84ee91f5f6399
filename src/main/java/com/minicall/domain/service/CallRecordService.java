package com.minicall.domain.service;

import com.baomidou.mybatisplus.extension.plugins.pagination.Page;
import com.baomidou.mybatisplus.extension.service.IService;
import com.minicall.domain.dto.CallRecordDto;
import com.minicall.domain.entity.CallRecordEntity;
import com.minicall.domain.enums.CallStatus;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 通话记录存储。
 *
 * <p>所有 mark* 方法都是单行条件更新（{@code where call_id = ? and status in (...)}），
 * 返回 true 表示本次调用赢得了这次状态推进；false 表示记录已被其他触发方推进（或不存在）。</p>
 */
public interface CallRecordService extends IService<CallRecordEntity> {

    CallRecordEntity getByCallId(String callId);

    /** initiated -> ringing */
    boolean markRinging(String callId);

    /** initiated|ringing -> accepted，写 startTime。 */
    boolean markAccepted(String callId, LocalDateTime startTime);

    /** initiated|ringing -> rejected，写 endTime。 */
    boolean markRejected(String callId, LocalDateTime endTime);

    /** initiated|ringing -> missed，写 endTime。 */
    boolean markMissed(String callId, LocalDateTime endTime);

    /**
     * expected -> ended，写 endTime 与 durationSeconds（可为 null）。
     *
     * <p>以读到的具体状态做 CAS，保证时长是基于真正被替换的那个状态算出来的。</p>
     */
    boolean markEnded(String callId, CallStatus expected, LocalDateTime endTime, Integer durationSeconds);

    /** 参与方为 userId、未结束、且已有录制 stream 的通话。 */
    List<CallRecordEntity> listActiveRecordedByUser(long userId);

    /** userId 作为被叫、since 之后的未接来电，新的在前。 */
    List<CallRecordEntity> listMissedForCallee(long userId, LocalDateTime since);

    /** recording: pending -> recording，写 remoteStreamId。 */
    boolean markRecordingStarted(String callId, String remoteStreamId);

    /** recording -> processing：停止录制的唯一认领。 */
    boolean claimRecordingStop(String callId);

    boolean markRecordingCompleted(String callId, String url, String storageKey, long sizeBytes);

    boolean markRecordingNoRecording(String callId, String reason);

    /** pending|recording|processing -> failed。 */
    boolean markRecordingFailed(String callId, String error);

    void saveSdpOffer(String callId, String sdp);

    void saveSdpAnswer(String callId, String sdp);

    void appendIceCandidate(String callId, long fromUserId, String candidate, String sdpMid, Integer sdpMLineIndex);

    List<CallRecordDto> cursorByUserId(long userId, long limit, Long lastId);

    Page<CallRecordDto> pageByUserId(long userId, long pageNo, long pageSize);
}
