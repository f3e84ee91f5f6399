package com.minicall.domain.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.conditions.update.LambdaUpdateWrapper;
import com.baomidou.mybatisplus.extension.plugins.pagination.Page;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.minicall.domain.cache.UserProfileCache;
import com.minicall.domain.dto.UserBriefDto;
import com.minicall.domain.entity.UserEntity;
import com.minicall.domain.mapper.UserMapper;
import com.minicall.domain.service.UserService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Service
@RequiredArgsConstructor
public class UserServiceImpl extends ServiceImpl<UserMapper, UserEntity> implements UserService {

    private final UserProfileCache userProfileCache;

    @Override
    public Map<Long, UserBriefDto> briefs(Collection<Long> userIds) {
        if (userIds == null || userIds.isEmpty()) {
            return new HashMap<>();
        }
        List<Long> ids = userIds.stream().filter(v -> v != null && v > 0).distinct().toList();
        Map<Long, UserBriefDto> out = new HashMap<>();
        for (Map.Entry<Long, UserProfileCache.Value> e : userProfileCache.getBatch(ids).entrySet()) {
            out.put(e.getKey(), toBrief(e.getValue()));
        }
        List<Long> missing = ids.stream().filter(id -> !out.containsKey(id)).toList();
        if (missing.isEmpty()) {
            return out;
        }
        for (UserEntity u : this.listByIds(missing)) {
            UserProfileCache.Value v = new UserProfileCache.Value(u.getId(), u.getName(), u.getEmail(), u.getUserType());
            userProfileCache.put(u.getId(), v);
            out.put(u.getId(), toBrief(v));
        }
        return out;
    }

    @Override
    public void updatePresence(long userId, boolean online, LocalDateTime at) {
        this.update(new LambdaUpdateWrapper<UserEntity>()
                .eq(UserEntity::getId, userId)
                .set(UserEntity::getOnline, online)
                .set(UserEntity::getLastSeen, at));
    }

    @Override
    public List<UserEntity> listOthers(long userId, long pageNo, long pageSize) {
        long safePageNo = pageNo > 0 ? pageNo : 1;
        long safePageSize = Math.min(Math.max(pageSize, 1), 200);
        LambdaQueryWrapper<UserEntity> wrapper = new LambdaQueryWrapper<UserEntity>()
                .ne(UserEntity::getId, userId)
                .orderByDesc(UserEntity::getOnline)
                .orderByDesc(UserEntity::getLastSeen)
                .orderByAsc(UserEntity::getId);
        return this.page(new Page<>(safePageNo, safePageSize, false), wrapper).getRecords();
    }

    private static UserBriefDto toBrief(UserProfileCache.Value v) {
        return new UserBriefDto(v.id(), v.name(), v.email(), v.userType());
    }
}
