package com.minicall.domain.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.minicall.domain.entity.MessageEntity;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

@Mapper
public interface MessageMapper extends BaseMapper<MessageEntity> {

    /**
     * 与每个对端的最后一条消息（id 为雪花 id，单调递增），按时间倒序。
     */
    @Select("""
            select m.*
            from t_message m
            join (
              select if(from_user_id = #{userId}, to_user_id, from_user_id) as peer_user_id, max(id) as max_id
              from t_message
              where from_user_id = #{userId}
                 or to_user_id = #{userId}
              group by peer_user_id
            ) x
              on m.id = x.max_id
            order by m.id desc
            limit #{limit}
            """)
    List<MessageEntity> selectLastMessagePerPeer(@Param("userId") long userId, @Param("limit") int limit);
}
