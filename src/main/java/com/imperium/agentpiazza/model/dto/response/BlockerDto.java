package com.imperium.agentpiazza.model.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 知识缺口（blocker）条目。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BlockerDto {

    public static final String KIND_RATIO = "ratio";
    public static final String KIND_COUNT = "count";

    private String topic;
    private long queryCount;
    private long verifiedInsightCount;

    /** 越高越紧急 */
    private double blockerScore;

    /**
     * ratio：query_count / (verified + 1)；
     * count：冷启动回退，未验证 insight 的数量。
     */
    private String scoreKind;
}
