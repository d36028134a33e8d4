package com.imperium.agentpiazza.service.impl;

import com.imperium.agentpiazza.model.dto.response.BlockerDto;
import com.imperium.agentpiazza.model.dto.search.TopicCount;
import com.imperium.agentpiazza.policy.BlockerPolicy;
import com.imperium.agentpiazza.service.BlockerService;
import com.imperium.agentpiazza.service.InsightService;
import com.imperium.agentpiazza.service.SearchLogService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * blocker 排名。有检索日志时按 query_count / (verified + 1) 打分；
 * 窗口内没有带 topic 的日志时，退化为各话题未验证 insight 的数量（score_kind=count）。
 */
@Service
public class BlockerServiceImpl implements BlockerService {

    private final SearchLogService searchLogService;
    private final InsightService insightService;
    private final int windowDays;

    public BlockerServiceImpl(SearchLogService searchLogService,
                              InsightService insightService,
                              @Value("${app.blockers.window-days:7}") int windowDays) {
        this.searchLogService = searchLogService;
        this.insightService = insightService;
        this.windowDays = windowDays;
    }

    @Override
    public List<BlockerDto> blockers(int limit) {
        LocalDateTime since = LocalDateTime.now().minusDays(windowDays);
        List<TopicCount> demand = searchLogService.countTopicHintsSince(since, BlockerPolicy.CANDIDATE_TOPICS);

        List<BlockerDto> blockers = demand.isEmpty() ? fromUnverified() : fromDemand(demand);
        // List.sort 是稳定排序，同分保持查询顺序
        blockers.sort(Comparator.comparingDouble(BlockerDto::getBlockerScore).reversed());
        return blockers.size() > limit ? new ArrayList<>(blockers.subList(0, limit)) : blockers;
    }

    private List<BlockerDto> fromDemand(List<TopicCount> demand) {
        Map<String, Long> verified = insightService.countVerifiedByTopic(
                demand.stream().map(TopicCount::getTopic).toList());
        List<BlockerDto> out = new ArrayList<>(demand.size());
        for (TopicCount row : demand) {
            long queries = row.getTotal() != null ? row.getTotal() : 0L;
            long verifiedCount = verified.getOrDefault(row.getTopic(), 0L);
            out.add(BlockerDto.builder()
                    .topic(row.getTopic())
                    .queryCount(queries)
                    .verifiedInsightCount(verifiedCount)
                    .blockerScore(BlockerPolicy.ratioScore(queries, verifiedCount))
                    .scoreKind(BlockerDto.KIND_RATIO)
                    .build());
        }
        return out;
    }

    private List<BlockerDto> fromUnverified() {
        List<BlockerDto> out = new ArrayList<>();
        for (TopicCount row : insightService.countUnverifiedByTopic(BlockerPolicy.CANDIDATE_TOPICS)) {
            out.add(BlockerDto.builder()
                    .topic(row.getTopic())
                    .queryCount(0)
                    .verifiedInsightCount(0)
                    .blockerScore(row.getTotal() != null ? row.getTotal() : 0L)
                    .scoreKind(BlockerDto.KIND_COUNT)
                    .build());
        }
        return out;
    }
}
