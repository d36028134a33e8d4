package com.imperium.agentpiazza.service.impl;

import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.imperium.agentpiazza.mapper.SearchLogMapper;
import com.imperium.agentpiazza.model.dto.search.TopicCount;
import com.imperium.agentpiazza.model.entity.SearchLog;
import com.imperium.agentpiazza.service.SearchLogService;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Service
public class SearchLogServiceImpl extends ServiceImpl<SearchLogMapper, SearchLog> implements SearchLogService {

    @Override
    public SearchLog record(String query, String topicHint, int resultCount) {
        SearchLog entry = new SearchLog();
        entry.setId("sl_" + UUID.randomUUID().toString().replace("-", "").substring(0, 16));
        entry.setQuery(query);
        entry.setTopicHint(topicHint);
        entry.setResultCount(resultCount);
        entry.setCreatedAt(LocalDateTime.now());
        save(entry);
        return entry;
    }

    @Override
    public List<TopicCount> countTopicHintsSince(LocalDateTime since, int limit) {
        return baseMapper.countTopicHintsSince(since, Math.max(1, limit));
    }
}
