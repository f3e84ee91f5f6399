package com.minicall.domain.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.minicall.domain.entity.CallRecordEntity;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface CallRecordMapper extends BaseMapper<CallRecordEntity> {
}
