package com.minicall.domain.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * 下发给客户端的 ICE 服务器。
 *
 * @param stunUrls       STUN 地址，缺省使用公共 STUN
 * @param turnUrl        TURN 地址，为空时不下发
 * @param turnUsername   TURN 用户名
 * @param turnCredential TURN 密码
 */
@ConfigurationProperties(prefix = "mc.webrtc")
public record WebRtcProperties(
        List<String> stunUrls,
        String turnUrl,
        String turnUsername,
        String turnCredential
) {

    public static final List<String> DEFAULT_STUN_URLS = List.of(
            "stun:stun.l.google.com:19302",
            "stun:stun1.l.google.com:19302"
    );

    public List<String> stunUrlsEffective() {
        return (stunUrls == null || stunUrls.isEmpty()) ? DEFAULT_STUN_URLS : stunUrls;
    }

    public boolean turnEnabled() {
        return turnUrl != null && !turnUrl.isBlank();
    }
}
