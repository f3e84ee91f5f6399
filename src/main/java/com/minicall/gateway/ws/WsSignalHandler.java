package com.minicall.gateway.ws;

import com.minicall.common.error.InvalidRequestException;
import com.minicall.domain.entity.CallRecordEntity;
import com.minicall.domain.service.CallRecordService;
import io.netty.channel.ChannelHandlerContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * WebRTC 信令中继（signal:offer / signal:answer / signal:ice）。
 *
 * <p>只做透传：发送方必须是通话参与方，帧原样转给另一方，对端不在线就丢弃。
 * SDP 与 ICE 顺带落库，落库失败不影响转发。</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WsSignalHandler {

    public static final String SIGNAL_FAILED = "SIGNAL_FAILED";

    static final int MAX_SDP_LEN = 120_000;
    static final int MAX_ICE_LEN = 4096;

    private final CallRecordService callRecordService;
    private final SignalRouter signalRouter;
    private final WsInboundDispatcher dispatcher;
    private final Clock clock;

    public void handle(ChannelHandlerContext ctx, long userId, WsEnvelope msg) {
        dispatcher.submit(ctx, msg, WsTypes.ERROR, SIGNAL_FAILED, () -> relay(userId, msg));
    }

    void relay(long userId, WsEnvelope msg) {
        validate(msg);
        CallRecordEntity call = callRecordService.getByCallId(msg.getCallId());
        if (call == null) {
            throw new InvalidRequestException("call_not_found");
        }
        if (!call.isParticipant(userId)) {
            throw new InvalidRequestException("not_call_participant");
        }
        long peer = call.peerOf(userId);

        WsEnvelope out = new WsEnvelope();
        out.type = msg.getType();
        out.callId = msg.getCallId();
        out.from = userId;
        out.to = peer;
        out.sdp = msg.getSdp();
        out.iceCandidate = msg.getIceCandidate();
        out.iceSdpMid = msg.getIceSdpMid();
        out.iceSdpMLineIndex = msg.getIceSdpMLineIndex();
        out.ts = clock.millis();
        if (!signalRouter.route(peer, out)) {
            log.debug("signal dropped, peer offline: type={}, callId={}, to={}", msg.getType(), msg.getCallId(), peer);
        }

        persist(userId, msg);
    }

    private void validate(WsEnvelope msg) {
        if (msg.getCallId() == null || msg.getCallId().isBlank()) {
            throw new InvalidRequestException("callId is required");
        }
        if (WsTypes.SIGNAL_ICE.equals(msg.getType())) {
            if (msg.getIceCandidate() == null || msg.getIceCandidate().isBlank()) {
                throw new InvalidRequestException("iceCandidate is required");
            }
            if (msg.getIceCandidate().length() > MAX_ICE_LEN) {
                throw new InvalidRequestException("iceCandidate too long");
            }
            return;
        }
        if (msg.getSdp() == null || msg.getSdp().isBlank()) {
            throw new InvalidRequestException("sdp is required");
        }
        if (msg.getSdp().length() > MAX_SDP_LEN) {
            throw new InvalidRequestException("sdp too long");
        }
    }

    private void persist(long userId, WsEnvelope msg) {
        try {
            switch (msg.getType()) {
                case WsTypes.SIGNAL_OFFER -> callRecordService.saveSdpOffer(msg.getCallId(), msg.getSdp());
                case WsTypes.SIGNAL_ANSWER -> callRecordService.saveSdpAnswer(msg.getCallId(), msg.getSdp());
                case WsTypes.SIGNAL_ICE -> callRecordService.appendIceCandidate(msg.getCallId(), userId,
                        msg.getIceCandidate(), msg.getIceSdpMid(), msg.getIceSdpMLineIndex());
                default -> log.debug("signal not persisted: type={}", msg.getType());
            }
        } catch (Exception e) {
            log.warn("persist signal failed: type={}, callId={}, err={}", msg.getType(), msg.getCallId(), e.toString());
        }
    }
}
