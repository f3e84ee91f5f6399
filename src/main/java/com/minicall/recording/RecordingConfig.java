package com.minicall.recording;

import com.minicall.recording.antmedia.AntMediaProperties;
import com.minicall.recording.oss.OssProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

@Configuration
@EnableConfigurationProperties({
        RecordingProperties.class,
        AntMediaProperties.class,
        OssProperties.class
})
public class RecordingConfig {

    /**
     * 媒体服务器专用：读超时覆盖整段录制文件下载。
     */
    @Bean("mcMediaRestTemplate")
    public RestTemplate mcMediaRestTemplate(RestTemplateBuilder builder, AntMediaProperties props) {
        return builder
                .setConnectTimeout(props.connectTimeout())
                .setReadTimeout(props.readTimeout())
                .build();
    }
}
