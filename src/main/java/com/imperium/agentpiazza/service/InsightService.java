package com.imperium.agentpiazza.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.imperium.agentpiazza.model.dto.search.TopicCount;
import com.imperium.agentpiazza.model.entity.Insight;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Insight 存取与聚合查询。
 */
public interface InsightService extends IService<Insight> {

    /**
     * agent 自己的 insight，按 verification_count 降序、created_at 降序。
     */
    List<Insight> topForAgent(String agentId, int limit);

    /**
     * 最新优先，topic/phase 为大小写不敏感的包含匹配（可为空）。
     */
    List<Insight> listRecent(int limit, int offset, String topic, String phase);

    /**
     * 一次批量查询，按 id 建索引；不存在的 id 不出现在结果中。
     */
    Map<String, Insight> mapByIds(Collection<String> ids);

    /**
     * verification_count 原子加一并读回，单独一个事务。
     *
     * @return 更新后的行；id 不存在时为 null
     */
    Insight incrementVerification(String insightId);

    /** topic -> 已验证（verification_count > 0）insight 数 */
    Map<String, Long> countVerifiedByTopic(Collection<String> topics);

    /** 未验证 insight 按 topic 计数，数量降序 */
    List<TopicCount> countUnverifiedByTopic(int limit);

    List<TopicCount> topTopicsForAgent(String agentId, int limit);

    long countByAgent(String agentId);
}
