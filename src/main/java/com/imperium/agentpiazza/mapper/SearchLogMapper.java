package com.imperium.agentpiazza.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.imperium.agentpiazza.model.dto.search.TopicCount;
import com.imperium.agentpiazza.model.entity.SearchLog;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.time.LocalDateTime;
import java.util.List;

@Mapper
public interface SearchLogMapper extends BaseMapper<SearchLog> {

    @Select("""
            SELECT topic_hint AS topic, COUNT(*) AS total
            FROM search_logs
            WHERE topic_hint IS NOT NULL
              AND created_at >= #{since}
            GROUP BY topic_hint
            ORDER BY COUNT(*) DESC, topic_hint
            LIMIT #{limit}
            """)
    List<TopicCount> countTopicHintsSince(@Param("since") LocalDateTime since, @Param("limit") int limit);
}
