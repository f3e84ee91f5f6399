package com.minicall.gateway.config;

import com.minicall.gateway.call.CallProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({
        GatewayProperties.class,
        ClientMsgIdCaffeineProperties.class,
        CallProperties.class
})
public class GatewayConfig {
}
