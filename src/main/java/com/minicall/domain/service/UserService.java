package com.minicall.domain.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.minicall.domain.dto.UserBriefDto;
import com.minicall.domain.entity.UserEntity;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Map;

public interface UserService extends IService<UserEntity> {

    /**
     * 批量查询参与方资料（先读缓存，未命中回源 DB 并回填）。查不到的 id 不出现在结果里。
     */
    Map<Long, UserBriefDto> briefs(Collection<Long> userIds);

    void updatePresence(long userId, boolean online, LocalDateTime at);

    /**
     * 除自己以外的用户，在线的在前，其次按最后在线时间倒序。
     */
    List<UserEntity> listOthers(long userId, long pageNo, long pageSize);
}
