package com.minicall.gateway.ws;

/**
 * WS 帧类型。
 */
public final class WsTypes {

    private WsTypes() {
    }

    public static final String PING = "ping";
    public static final String PONG = "pong";
    public static final String ERROR = "error";

    public static final String PRESENCE = "presence";

    public static final String MESSAGE_SEND = "message:send";
    public static final String MESSAGE_SENT = "message:sent";
    public static final String MESSAGE_RECEIVED = "message:received";
    public static final String MESSAGE_MARK_READ = "message:markRead";
    public static final String MESSAGE_MARKED_READ = "message:markedRead";
    public static final String MESSAGE_READ = "message:read";
    public static final String TYPING_START = "typing:start";
    public static final String TYPING_STOP = "typing:stop";

    public static final String CALL_INITIATE = "call:initiate";
    public static final String CALL_INITIATED = "call:initiated";
    public static final String CALL_INCOMING = "call:incoming";
    public static final String CALL_RESPOND = "call:respond";
    public static final String CALL_RESPONSE = "call:response";
    public static final String CALL_RESPONDED = "call:responded";
    public static final String CALL_END = "call:end";
    public static final String CALL_ENDED = "call:ended";
    public static final String CALL_NO_ANSWER = "call:no-answer";
    public static final String CALL_MISSED_CALLS = "call:missed-calls";
    public static final String CALL_FAILED = "call:failed";

    public static final String SIGNAL_OFFER = "signal:offer";
    public static final String SIGNAL_ANSWER = "signal:answer";
    public static final String SIGNAL_ICE = "signal:ice";
}
