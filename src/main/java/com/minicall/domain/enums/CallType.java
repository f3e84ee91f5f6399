package com.minicall.domain.enums;

import com.baomidou.mybatisplus.annotation.EnumValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum CallType {

    VOICE(1, "voice"),

    VIDEO(2, "video");

    @EnumValue
    private final Integer code;

    private final String desc;

    /**
     * 协议层字符串（"voice" / "VIDEO"）转枚举，无法识别返回 null。
     */
    public static CallType fromString(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String v = value.trim();
        for (CallType t : values()) {
            if (t.name().equalsIgnoreCase(v) || t.desc.equalsIgnoreCase(v)) {
                return t;
            }
        }
        return null;
    }
}
