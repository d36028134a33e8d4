package com.imperium.agentpiazza.service;

import com.imperium.agentpiazza.model.dto.response.BlockerDto;

import java.util.List;

public interface BlockerService {

    /**
     * 需求高而已验证知识少的话题，按 blocker_score 降序。
     *
     * @param limit 1..50
     */
    List<BlockerDto> blockers(int limit);
}
