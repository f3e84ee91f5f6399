package com.minicall.domain.enums;

import com.baomidou.mybatisplus.annotation.EnumValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.EnumSet;
import java.util.Set;

/**
 * 通话状态（t_call_record.status）。
 *
 * <pre>
 * initiated -> ringing -> accepted -> ended
 *                      -> rejected
 *                      -> missed
 * </pre>
 * 终态（rejected/ended/missed/failed）不会再变化。
 */
@Getter
@RequiredArgsConstructor
public enum CallStatus {

    INITIATED(0, "initiated"),

    RINGING(1, "ringing"),

    ACCEPTED(2, "accepted"),

    REJECTED(3, "rejected"),

    ENDED(5, "ended"),

    MISSED(6, "missed"),

    FAILED(7, "failed");

    /** 尚未接听，可被 accept/reject/timeout 推进。 */
    public static final Set<CallStatus> UNANSWERED = EnumSet.of(INITIATED, RINGING);

    /** 可被 end / 断线强制结束。 */
    public static final Set<CallStatus> ACTIVE = EnumSet.of(INITIATED, RINGING, ACCEPTED);

    @EnumValue
    private final Integer code;

    private final String desc;

    public boolean isTerminal() {
        return !ACTIVE.contains(this);
    }
}
