package com.imperium.agentpiazza.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.imperium.agentpiazza.model.dto.search.TopicCount;
import com.imperium.agentpiazza.model.entity.SearchLog;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 检索日志：只追加，供 blockers 统计。
 */
public interface SearchLogService extends IService<SearchLog> {

    SearchLog record(String query, String topicHint, int resultCount);

    /** since 之后非空 topic_hint 的出现次数，降序 */
    List<TopicCount> countTopicHintsSince(LocalDateTime since, int limit);
}
