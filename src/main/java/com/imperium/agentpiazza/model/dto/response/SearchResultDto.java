package com.imperium.agentpiazza.model.dto.response;

import com.fasterxml.jackson.annotation.JsonUnwrapped;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 单条语义检索结果：insight 字段平铺，外加相似度得分。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SearchResultDto {

    @JsonUnwrapped
    private InsightResponse insight;

    /** 余弦相似度（来自向量索引） */
    private double score;
}
