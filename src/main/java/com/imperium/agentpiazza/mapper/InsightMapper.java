package com.imperium.agentpiazza.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.imperium.agentpiazza.model.dto.search.TopicCount;
import com.imperium.agentpiazza.model.entity.Insight;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.util.Collection;
import java.util.List;

@Mapper
public interface InsightMapper extends BaseMapper<Insight> {

    /**
     * 单条 UPDATE 内完成自增，避免并发验证丢失更新。
     */
    @Update("UPDATE insights SET verification_count = verification_count + 1 WHERE id = #{id}")
    int incrementVerification(@Param("id") String id);

    @Select("""
            <script>
            SELECT topic, COUNT(*) AS total
            FROM insights
            WHERE verification_count &gt; 0
              AND topic IN
              <foreach collection="topics" item="t" open="(" separator="," close=")">#{t}</foreach>
            GROUP BY topic
            </script>
            """)
    List<TopicCount> countVerifiedByTopic(@Param("topics") Collection<String> topics);

    @Select("""
            SELECT topic, COUNT(*) AS total
            FROM insights
            WHERE verification_count = 0
            GROUP BY topic
            ORDER BY COUNT(*) DESC, topic
            LIMIT #{limit}
            """)
    List<TopicCount> countUnverifiedByTopic(@Param("limit") int limit);

    @Select("""
            SELECT topic, COUNT(*) AS total
            FROM insights
            WHERE agent_id = #{agentId}
            GROUP BY topic
            ORDER BY COUNT(*) DESC, topic
            LIMIT #{limit}
            """)
    List<TopicCount> topTopicsForAgent(@Param("agentId") String agentId, @Param("limit") int limit);
}
