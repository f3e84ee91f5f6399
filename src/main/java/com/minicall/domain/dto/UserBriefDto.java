package com.minicall.domain.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 通话卡片上展示的参与方资料。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UserBriefDto {
    private Long userId;
    private String name;
    private String email;
    private String userType;
}
