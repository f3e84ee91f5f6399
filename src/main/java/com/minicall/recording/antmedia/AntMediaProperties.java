package com.minicall.recording.antmedia;

import cn.hutool.core.util.StrUtil;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 媒体服务器（Ant Media）连接参数。
 *
 * @param restUrl            REST 根地址，例如 http://media:5080/WebRTCAppEE/rest/v2
 * @param serverUrl          应用根地址，录制文件位于 {serverUrl}/streams/{file}
 * @param email              REST 登录账号；为空时不做认证
 * @param password           REST 登录密码
 * @param connectTimeoutMs   连接超时
 * @param readTimeoutSeconds 读超时（下载大文件时需要足够长）
 */
@ConfigurationProperties(prefix = "mc.media")
public record AntMediaProperties(
        String restUrl,
        String serverUrl,
        String email,
        String password,
        Integer connectTimeoutMs,
        Integer readTimeoutSeconds
) {

    public String restUrlEffective() {
        return trimSlash(StrUtil.isBlank(restUrl) ? "http://localhost:5080/WebRTCAppEE/rest/v2" : restUrl);
    }

    public String serverUrlEffective() {
        return trimSlash(StrUtil.isBlank(serverUrl) ? "http://localhost:5080/WebRTCAppEE" : serverUrl);
    }

    public boolean authEnabled() {
        return StrUtil.isNotBlank(email) && StrUtil.isNotBlank(password);
    }

    public Duration connectTimeout() {
        return Duration.ofMillis(connectTimeoutMs == null || connectTimeoutMs <= 0 ? 5000 : connectTimeoutMs);
    }

    public Duration readTimeout() {
        return Duration.ofSeconds(readTimeoutSeconds == null || readTimeoutSeconds <= 0 ? 300 : readTimeoutSeconds);
    }

    private static String trimSlash(String url) {
        return StrUtil.removeSuffix(url.trim(), "/");
    }
}
