package com.minicall.gateway.ws;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.minicall.domain.dto.CallDto;
import com.minicall.domain.dto.MessageDto;
import lombok.Data;

import java.util.List;

/**
 * WS 文本帧的唯一结构。入站/出站共用，按 {@link #type} 路由（取值见 {@link WsTypes}）。
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class WsEnvelope {

    public String type;

    /** 客户端生成的消息 id，用于 message:send 重试去重。 */
    public String clientMsgId;

    /** 服务端生成的消息 id。 */
    public String messageId;

    /** 发送方 userId。入站时忽略客户端填写的值，以握手鉴权绑定的身份为准。 */
    public Long from;

    /** 目标 userId。 */
    public Long to;

    /** presence 帧：状态变化的用户。 */
    public Long userId;

    /** presence 帧：是否在线。 */
    public Boolean online;

    /** message:markRead：对端 userId。 */
    public Long withUserId;

    /** 消息正文。 */
    public String body;

    /** text / image / audio / video / file。 */
    public String msgType;

    public MessageDto message;

    public String callId;

    /** voice / video，缺省 voice。 */
    public String callType;

    /** call:respond：accept / reject。 */
    public String response;

    public CallDto call;

    /** call:missed-calls。 */
    public List<CallDto> calls;

    public Integer count;

    /** WebRTC SDP（offer/answer）。 */
    public String sdp;

    public String iceCandidate;

    public String iceSdpMid;

    public Integer iceSdpMLineIndex;

    /** error / call:failed 的错误码，例如 INVALID_DATA。 */
    public String code;

    /** 原因说明（错误信息、结束原因）。 */
    public String reason;

    /** 时间戳（毫秒）。 */
    public Long ts;
}
