package com.minicall.common.api;

/**
 * 统一错误码定义（HTTP Result.code 与 WS error 帧共用）。
 */
public final class ApiCodes {

    private ApiCodes() {
    }

    /** 参数不合法 / 业务校验失败 */
    public static final int BAD_REQUEST = 40000;

    /** 未登录 / token 无效 */
    public static final int UNAUTHORIZED = 40100;

    /** 无权访问该资源（例如查询不属于自己的通话录音） */
    public static final int FORBIDDEN = 40300;

    /** 资源不存在 */
    public static final int NOT_FOUND = 40400;

    /** 服务端未预期异常 */
    public static final int INTERNAL_ERROR = 50000;

    /** 下游服务（媒体服务器 / 对象存储）调用失败 */
    public static final int REMOTE_ERROR = 50200;
}
