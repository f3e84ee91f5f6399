package com.minicall.domain.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.minicall.domain.entity.CallIceCandidateEntity;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface CallIceCandidateMapper extends BaseMapper<CallIceCandidateEntity> {
}
