package com.minicall.domain.dto;

import com.minicall.domain.entity.UserEntity;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 联系人列表项：资料加在线状态。
 */
@Data
public class UserPresenceDto {
    private Long userId;
    private String uid;
    private String email;
    private String name;
    private String userType;
    private Boolean isOnline;
    private LocalDateTime lastSeen;

    public static UserPresenceDto of(UserEntity u) {
        UserPresenceDto dto = new UserPresenceDto();
        dto.setUserId(u.getId());
        dto.setUid(u.getUid());
        dto.setEmail(u.getEmail());
        dto.setName(u.getName());
        dto.setUserType(u.getUserType());
        dto.setIsOnline(Boolean.TRUE.equals(u.getOnline()));
        dto.setLastSeen(u.getLastSeen());
        return dto;
    }
}
