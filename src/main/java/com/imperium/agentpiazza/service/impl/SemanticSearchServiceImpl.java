package com.imperium.agentpiazza.service.impl;

import com.imperium.agentpiazza.exception.UpstreamUnavailableException;
import com.imperium.agentpiazza.model.dto.response.InsightResponse;
import com.imperium.agentpiazza.model.dto.response.SearchResultDto;
import com.imperium.agentpiazza.model.dto.response.SemanticSearchResponse;
import com.imperium.agentpiazza.model.dto.search.VectorMatch;
import com.imperium.agentpiazza.model.entity.Insight;
import com.imperium.agentpiazza.service.EmbeddingService;
import com.imperium.agentpiazza.service.InsightService;
import com.imperium.agentpiazza.service.SearchLogService;
import com.imperium.agentpiazza.service.SemanticSearchService;
import com.imperium.agentpiazza.service.VectorIndexService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class SemanticSearchServiceImpl implements SemanticSearchService {

    private static final Logger log = LoggerFactory.getLogger(SemanticSearchServiceImpl.class);

    private final EmbeddingService embeddingService;
    private final VectorIndexService vectorIndexService;
    private final InsightService insightService;
    private final SearchLogService searchLogService;

    public SemanticSearchServiceImpl(EmbeddingService embeddingService,
                                     VectorIndexService vectorIndexService,
                                     InsightService insightService,
                                     SearchLogService searchLogService) {
        this.embeddingService = embeddingService;
        this.vectorIndexService = vectorIndexService;
        this.insightService = insightService;
        this.searchLogService = searchLogService;
    }

    @Override
    public SemanticSearchResponse search(String agentId, String query, int topK) {
        float[] vector = embeddingService.embed(query);

        List<VectorMatch> matches;
        try {
            matches = vectorIndexService.query(vector, topK);
        } catch (RuntimeException e) {
            log.warn("Vector query failed: {}", e.getMessage());
            throw new UpstreamUnavailableException("Vector index is unavailable, retry later", e);
        }

        Map<String, Insight> byId = insightService.mapByIds(matches.stream().map(VectorMatch::id).toList());
        List<SearchResultDto> results = new ArrayList<>(matches.size());
        for (VectorMatch match : matches) {
            Insight insight = byId.get(match.id());
            if (insight == null) {
                // 索引领先于关系库或记录已删除
                continue;
            }
            results.add(new SearchResultDto(InsightResponse.from(insight), match.score()));
        }

        String topicHint = results.isEmpty() ? null : results.get(0).getInsight().getTopic();
        searchLogService.record(query, topicHint, results.size());
        log.debug("Search by {} '{}' -> {} of {} matches", agentId, query, results.size(), matches.size());

        return SemanticSearchResponse.builder()
                .query(query)
                .results(results)
                .total(results.size())
                .build();
    }
}
