package com.minicall.common.error;

import lombok.Getter;

/**
 * 请求参数/业务前置条件不满足。
 *
 * <p>信令链路上只回给发起方（{@code INVALID_DATA}），HTTP 链路上映射为 400。</p>
 */
@Getter
public class InvalidRequestException extends RuntimeException {

    public static final String INVALID_DATA = "INVALID_DATA";

    private final String code;

    public InvalidRequestException(String message) {
        this(INVALID_DATA, message);
    }

    public InvalidRequestException(String code, String message) {
        super(message);
        this.code = code;
    }
}
