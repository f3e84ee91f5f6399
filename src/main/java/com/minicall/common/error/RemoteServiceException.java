package com.minicall.common.error;

import lombok.Getter;

/**
 * 外部服务（媒体服务器、对象存储、转码进程）调用失败。
 *
 * <p>只在录制编排内部被捕获，最终体现为录制状态，不向信令链路传播。</p>
 */
@Getter
public class RemoteServiceException extends RuntimeException {

    /** 下游服务名，例如 ant-media / oss / ffmpeg。 */
    private final String service;

    public RemoteServiceException(String service, String message) {
        super(service + ": " + message);
        this.service = service;
    }

    public RemoteServiceException(String service, String message, Throwable cause) {
        super(service + ": " + message, cause);
        this.service = service;
    }
}
