package com.imperium.agentpiazza.service.impl;

import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.imperium.agentpiazza.mapper.InsightMapper;
import com.imperium.agentpiazza.model.dto.search.TopicCount;
import com.imperium.agentpiazza.model.entity.Insight;
import com.imperium.agentpiazza.service.InsightService;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
public class InsightServiceImpl extends ServiceImpl<InsightMapper, Insight> implements InsightService {

    @Override
    public List<Insight> topForAgent(String agentId, int limit) {
        return lambdaQuery()
                .eq(Insight::getAgentId, agentId)
                .orderByDesc(Insight::getVerificationCount)
                .orderByDesc(Insight::getCreatedAt)
                .last("LIMIT " + Math.max(1, limit))
                .list();
    }

    @Override
    public List<Insight> listRecent(int limit, int offset, String topic, String phase) {
        boolean hasTopic = topic != null && !topic.isBlank();
        boolean hasPhase = phase != null && !phase.isBlank();
        return lambdaQuery()
                .apply(hasTopic, "LOWER(topic) LIKE {0}", containsPattern(topic))
                .apply(hasPhase, "LOWER(phase) LIKE {0}", containsPattern(phase))
                .orderByDesc(Insight::getCreatedAt)
                .last("LIMIT " + Math.max(1, limit) + " OFFSET " + Math.max(0, offset))
                .list();
    }

    @Override
    public Map<String, Insight> mapByIds(Collection<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return Map.of();
        }
        return listByIds(ids).stream()
                .collect(Collectors.toMap(Insight::getId, Function.identity(), (a, b) -> a));
    }

    @Override
    @Transactional
    public Insight incrementVerification(String insightId) {
        if (baseMapper.incrementVerification(insightId) == 0) {
            return null;
        }
        return getById(insightId);
    }

    @Override
    public Map<String, Long> countVerifiedByTopic(Collection<String> topics) {
        if (topics == null || topics.isEmpty()) {
            return Map.of();
        }
        Map<String, Long> counts = new HashMap<>();
        for (TopicCount row : baseMapper.countVerifiedByTopic(topics)) {
            counts.put(row.getTopic(), row.getTotal() != null ? row.getTotal() : 0L);
        }
        return counts;
    }

    @Override
    public List<TopicCount> countUnverifiedByTopic(int limit) {
        return baseMapper.countUnverifiedByTopic(Math.max(1, limit));
    }

    @Override
    public List<TopicCount> topTopicsForAgent(String agentId, int limit) {
        return baseMapper.topTopicsForAgent(agentId, Math.max(1, limit));
    }

    @Override
    public long countByAgent(String agentId) {
        Long count = lambdaQuery().eq(Insight::getAgentId, agentId).count();
        return count != null ? count : 0L;
    }

    private static String containsPattern(String value) {
        return value == null ? "%" : "%" + value.trim().toLowerCase(Locale.ROOT) + "%";
    }
}
