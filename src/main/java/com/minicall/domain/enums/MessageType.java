package com.minicall.domain.enums;

import com.baomidou.mybatisplus.annotation.EnumValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 消息内容类型（t_message.msg_type）。
 */
@Getter
@RequiredArgsConstructor
public enum MessageType {

    TEXT(1, "text"),

    IMAGE(2, "image"),

    AUDIO(3, "audio"),

    VIDEO(4, "video"),

    FILE(5, "file");

    @EnumValue
    private final Integer code;

    private final String desc;

    /**
     * 协议层字符串（"TEXT" / "text"）转枚举，无法识别时返回 null。
     */
    public static MessageType fromString(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String v = value.trim();
        for (MessageType t : values()) {
            if (t.name().equalsIgnoreCase(v) || t.desc.equalsIgnoreCase(v)) {
                return t;
            }
        }
        return null;
    }
}
