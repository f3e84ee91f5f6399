package com.minicall.auth.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * accessToken 校验参数。token 由身份服务签发，这里只做校验（共享 HMAC 密钥 + issuer）。
 *
 * <p>{@code accessTokenTtlSeconds} 仅用于测试/联调时本地签发 token。</p>
 */
@ConfigurationProperties(prefix = "mc.auth")
public record AuthProperties(
        String issuer,
        String jwtSecret,
        long accessTokenTtlSeconds
) {
}
