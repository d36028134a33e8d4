package com.imperium.agentpiazza.model.dto.search;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 按 topic 分组计数的聚合行（mapper 查询结果）。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TopicCount {

    private String topic;
    private Long total;
}
