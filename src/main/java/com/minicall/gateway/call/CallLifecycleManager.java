package com.minicall.gateway.call;

import com.baomidou.mybatisplus.core.toolkit.IdWorker;
import com.minicall.common.error.InvalidRequestException;
import com.minicall.domain.dto.CallDto;
import com.minicall.domain.dto.UserBriefDto;
import com.minicall.domain.entity.CallRecordEntity;
import com.minicall.domain.enums.CallStatus;
import com.minicall.domain.enums.CallType;
import com.minicall.domain.enums.RecordingStatus;
import com.minicall.domain.service.CallRecordService;
import com.minicall.domain.service.UserService;
import com.minicall.gateway.ws.SignalRouter;
import com.minicall.gateway.ws.WsEnvelope;
import com.minicall.gateway.ws.WsTypes;
import com.minicall.recording.RecordingMetadata;
import com.minicall.recording.RecordingOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 通话生命周期：发起、应答、挂断、未接超时、断线清理。
 *
 * <p>所有方法都是同步阻塞的（落库 + 推送），由 WS 层放到 DB 线程池执行。
 * 状态推进一律走条件更新：timeout / respond / end / 断线之间的竞争只有一个赢家，
 * 只有赢家才会推送终态通知、触发停止录制。输掉的一方仍然给请求方回执（幂等确认）。</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CallLifecycleManager {

    static final String NO_ANSWER_REASON = "Call was not answered";
    static final String PEER_DISCONNECT_REASON = "peer_disconnect";

    /** 状态最多再前进两步（initiated -> ringing -> accepted），三次 CAS 足够。 */
    private static final int END_CAS_ATTEMPTS = 3;

    private final CallRecordService callRecordService;
    private final UserService userService;
    private final SignalRouter signalRouter;
    private final RecordingOrchestrator recordingOrchestrator;
    private final MissedCallTimers missedCallTimers;
    private final CallProperties props;
    private final Clock clock;

    /**
     * 发起通话。被叫不在线时仍然进入 ringing，由未接听定时器兜底为 missed。
     */
    public CallDto initiateCall(long fromUserId, Long toUserId, String callTypeRaw) {
        if (toUserId == null || toUserId <= 0) {
            throw new InvalidRequestException("toUserId is required");
        }
        if (toUserId == fromUserId) {
            throw new InvalidRequestException("cannot_call_self");
        }
        CallType callType = (callTypeRaw == null || callTypeRaw.isBlank()) ? CallType.VOICE : CallType.fromString(callTypeRaw);
        if (callType == null) {
            throw new InvalidRequestException("unsupported callType: " + callTypeRaw);
        }

        CallRecordEntity call = new CallRecordEntity();
        call.setCallId(IdWorker.getIdStr());
        call.setFromUserId(fromUserId);
        call.setToUserId(toUserId);
        call.setCallType(callType);
        call.setStatus(CallStatus.INITIATED);
        call.setRoomId(roomId(fromUserId, toUserId, clock.millis()));
        call.setRecordingStatus(RecordingStatus.PENDING);
        call.setCreatedAt(LocalDateTime.now(clock));
        callRecordService.save(call);

        String callId = call.getCallId();
        missedCallTimers.arm(callId, props.ringTimeout(), () -> handleRingTimeout(callId));

        CallDto dto = enrich(call);
        dto.setStatus(CallStatus.RINGING.getDesc());
        WsEnvelope incoming = callEnvelope(WsTypes.CALL_INCOMING, callId, dto);
        incoming.from = fromUserId;
        if (!signalRouter.route(toUserId, incoming)) {
            log.info("call invite not delivered, callee offline: callId={}, from={}, to={}", callId, fromUserId, toUserId);
        }

        if (callRecordService.markRinging(callId)) {
            call.setStatus(CallStatus.RINGING);
        } else {
            // 被叫在 ringing 落库前就已应答（拒接）
            CallRecordEntity current = callRecordService.getByCallId(callId);
            if (current != null) {
                dto.setStatus(current.getStatus().getDesc());
            }
        }

        WsEnvelope initiated = callEnvelope(WsTypes.CALL_INITIATED, callId, dto);
        initiated.to = toUserId;
        signalRouter.route(fromUserId, initiated);
        log.info("call initiated: callId={}, from={}, to={}, type={}", callId, fromUserId, toUserId, callType.getDesc());
        return dto;
    }

    /**
     * 被叫应答（accept / reject）。
     */
    public void respond(long responderUserId, String callId, String response) {
        if (callId == null || callId.isBlank()) {
            throw new InvalidRequestException("callId is required");
        }
        boolean accept = parseResponse(response);
        CallRecordEntity call = callRecordService.getByCallId(callId);
        if (call == null) {
            throw new InvalidRequestException("call_not_found");
        }
        if (call.getToUserId() == null || call.getToUserId() != responderUserId) {
            throw new InvalidRequestException("only_callee_can_respond");
        }

        missedCallTimers.cancel(callId);

        LocalDateTime now = LocalDateTime.now(clock);
        boolean won = accept ? callRecordService.markAccepted(callId, now) : callRecordService.markRejected(callId, now);
        String responseDesc = accept ? "accept" : "reject";
        if (!won) {
            CallRecordEntity current = callRecordService.getByCallId(callId);
            log.info("call respond ignored, already {}: callId={}, responder={}, response={}",
                    current == null ? null : current.getStatus(), callId, responderUserId, responseDesc);
            WsEnvelope ack = callEnvelope(WsTypes.CALL_RESPONDED, callId, current == null ? null : CallDto.of(current));
            ack.response = responseDesc;
            signalRouter.route(responderUserId, ack);
            return;
        }

        if (accept) {
            call.setStatus(CallStatus.ACCEPTED);
            call.setStartTime(now);
            recordingOrchestrator.start(callId, new RecordingMetadata(call.getCallType(), call.getFromUserId(), call.getToUserId()));
        } else {
            call.setStatus(CallStatus.REJECTED);
            call.setEndTime(now);
        }
        log.info("call {}: callId={}, from={}, to={}", call.getStatus().getDesc(), callId, call.getFromUserId(), responderUserId);

        CallDto dto = enrich(call);
        WsEnvelope toCaller = callEnvelope(WsTypes.CALL_RESPONSE, callId, dto);
        toCaller.response = responseDesc;
        toCaller.from = responderUserId;
        signalRouter.route(call.getFromUserId(), toCaller);

        WsEnvelope toResponder = callEnvelope(WsTypes.CALL_RESPONDED, callId, dto);
        toResponder.response = responseDesc;
        signalRouter.route(responderUserId, toResponder);
    }

    /**
     * 任一方挂断。通话不存在或已是终态时只给请求方回执，对端只从通话记录里取，不信任客户端声明的 to。
     */
    public void end(long requesterUserId, String callId) {
        if (callId == null || callId.isBlank()) {
            throw new InvalidRequestException("callId is required");
        }
        missedCallTimers.cancel(callId);

        CallRecordEntity call = callRecordService.getByCallId(callId);
        if (call == null) {
            log.warn("call end for unknown call: callId={}, requester={}", callId, requesterUserId);
            signalRouter.route(requesterUserId, callEnvelope(WsTypes.CALL_ENDED, callId, null));
            return;
        }
        if (!call.isParticipant(requesterUserId)) {
            throw new InvalidRequestException("not_call_participant");
        }

        CallRecordEntity ended = finish(call);
        if (ended == null) {
            CallRecordEntity current = callRecordService.getByCallId(callId);
            signalRouter.route(requesterUserId, callEnvelope(WsTypes.CALL_ENDED, callId, current == null ? null : CallDto.of(current)));
            return;
        }
        log.info("call ended: callId={}, by={}, durationSeconds={}", callId, requesterUserId, ended.getDurationSeconds());

        CallDto dto = CallDto.of(ended);
        WsEnvelope toPeer = callEnvelope(WsTypes.CALL_ENDED, callId, dto);
        toPeer.from = requesterUserId;
        signalRouter.route(ended.peerOf(requesterUserId), toPeer);
        signalRouter.route(requesterUserId, callEnvelope(WsTypes.CALL_ENDED, callId, dto));
    }

    /**
     * 连接断开（且断开的是该用户当前连接）：强制结束其所有已开始录制、未结束的通话。
     */
    public void onDisconnect(long userId) {
        List<CallRecordEntity> calls = callRecordService.listActiveRecordedByUser(userId);
        for (CallRecordEntity call : calls) {
            String callId = call.getCallId();
            try {
                missedCallTimers.cancel(callId);
                CallRecordEntity ended = finish(call);
                if (ended == null) {
                    continue;
                }
                log.info("call ended by disconnect: callId={}, userId={}, durationSeconds={}", callId, userId, ended.getDurationSeconds());
                WsEnvelope toPeer = callEnvelope(WsTypes.CALL_ENDED, callId, CallDto.of(ended));
                toPeer.from = userId;
                toPeer.reason = PEER_DISCONNECT_REASON;
                signalRouter.route(ended.peerOf(userId), toPeer);
            } catch (Exception e) {
                log.error("disconnect cleanup failed: callId={}, userId={}", callId, userId, e);
            }
        }
    }

    /**
     * 重连后补推最近的未接来电（没有则不推）。
     */
    public void sendMissedCalls(long userId) {
        LocalDateTime since = LocalDateTime.now(clock).minus(props.missedCallsLookback());
        List<CallRecordEntity> missed = callRecordService.listMissedForCallee(userId, since);
        if (missed == null || missed.isEmpty()) {
            return;
        }
        Set<Long> callerIds = new HashSet<>();
        for (CallRecordEntity c : missed) {
            callerIds.add(c.getFromUserId());
        }
        Map<Long, UserBriefDto> briefs = lookupBriefs(callerIds);
        List<CallDto> calls = new ArrayList<>();
        for (CallRecordEntity c : missed) {
            CallDto dto = CallDto.of(c);
            dto.setFromUser(briefs.get(c.getFromUserId()));
            calls.add(dto);
        }
        WsEnvelope env = callEnvelope(WsTypes.CALL_MISSED_CALLS, null, null);
        env.calls = calls;
        env.count = calls.size();
        signalRouter.route(userId, env);
    }

    /**
     * 未接听定时器回调：仍未应答则置为 missed，并通知主叫一次。
     */
    void handleRingTimeout(String callId) {
        if (!callRecordService.markMissed(callId, LocalDateTime.now(clock))) {
            log.debug("ring timeout ignored, call already answered or ended: callId={}", callId);
            return;
        }
        CallRecordEntity call = callRecordService.getByCallId(callId);
        if (call == null) {
            return;
        }
        log.info("call missed: callId={}, from={}, to={}", callId, call.getFromUserId(), call.getToUserId());
        WsEnvelope env = callEnvelope(WsTypes.CALL_NO_ANSWER, callId, CallDto.of(call));
        env.reason = NO_ANSWER_REASON;
        signalRouter.route(call.getFromUserId(), env);
    }

    /**
     * 房间号与主叫/被叫方向无关：call_{较小id}_{较大id}_{创建毫秒}。
     */
    public static String roomId(long a, long b, long createdAtMs) {
        return "call_" + Math.min(a, b) + "_" + Math.max(a, b) + "_" + createdAtMs;
    }

    static Integer durationSeconds(LocalDateTime startTime, LocalDateTime endTime) {
        if (startTime == null || endTime == null) {
            return null;
        }
        return (int) Math.max(0, Duration.between(startTime, endTime).getSeconds());
    }

    /**
     * 以读到的状态做 CAS 结束通话，冲突时重读重算。赢得写入后重读一次，拿到最新的 remoteStreamId 决定是否停止录制。
     *
     * @return 结束后的记录；已是终态（被别的触发方抢先）时为 null
     */
    private CallRecordEntity finish(CallRecordEntity snapshot) {
        String callId = snapshot.getCallId();
        CallRecordEntity cur = snapshot;
        for (int i = 0; i < END_CAS_ATTEMPTS && cur != null && !cur.getStatus().isTerminal(); i++) {
            LocalDateTime endTime = LocalDateTime.now(clock);
            Integer duration = durationSeconds(cur.getStartTime(), endTime);
            if (callRecordService.markEnded(callId, cur.getStatus(), endTime, duration)) {
                CallRecordEntity fresh = callRecordService.getByCallId(callId);
                if (fresh == null) {
                    fresh = cur;
                    fresh.setStatus(CallStatus.ENDED);
                    fresh.setEndTime(endTime);
                    fresh.setDurationSeconds(duration);
                }
                if (fresh.getRemoteStreamId() != null) {
                    recordingOrchestrator.stop(callId);
                }
                return fresh;
            }
            cur = callRecordService.getByCallId(callId);
        }
        return null;
    }

    private CallDto enrich(CallRecordEntity call) {
        CallDto dto = CallDto.of(call);
        Map<Long, UserBriefDto> briefs = lookupBriefs(Set.of(call.getFromUserId(), call.getToUserId()));
        dto.setFromUser(briefs.get(call.getFromUserId()));
        dto.setToUser(briefs.get(call.getToUserId()));
        return dto;
    }

    private Map<Long, UserBriefDto> lookupBriefs(Set<Long> userIds) {
        try {
            return userService.briefs(userIds);
        } catch (Exception e) {
            // 资料只用于展示，查不到不影响通话本身
            log.warn("participant lookup failed: userIds={}, err={}", userIds, e.toString());
            return Map.of();
        }
    }

    private WsEnvelope callEnvelope(String type, String callId, CallDto call) {
        WsEnvelope env = new WsEnvelope();
        env.type = type;
        env.callId = callId;
        env.call = call;
        env.ts = clock.millis();
        return env;
    }

    private static boolean parseResponse(String response) {
        if (response == null) {
            throw new InvalidRequestException("response is required");
        }
        switch (response.trim().toLowerCase(Locale.ROOT)) {
            case "accept":
            case "accepted":
                return true;
            case "reject":
            case "rejected":
                return false;
            default:
                throw new InvalidRequestException("unsupported response: " + response);
        }
    }
}
