package com.minicall.recording.oss;

import cn.hutool.core.util.StrUtil;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 阿里云 OSS 参数。
 */
@ConfigurationProperties(prefix = "mc.oss")
public record OssProperties(
        String endpoint,
        String bucket,
        String accessKeyId,
        String accessKeySecret
) {

    public boolean configured() {
        return StrUtil.isNotBlank(endpoint) && StrUtil.isNotBlank(bucket)
                && StrUtil.isNotBlank(accessKeyId) && StrUtil.isNotBlank(accessKeySecret);
    }

    /** 访问路径规则 https://{bucket}.{endpoint}/{key} */
    public String objectUrl(String key) {
        String host = StrUtil.removePrefix(StrUtil.removePrefix(endpoint, "https://"), "http://");
        return "https://" + bucket + "." + host + "/" + key;
    }
}
