package com.imperium.agentpiazza.model.entity;

import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 语义检索日志，对应 search_logs 表。只追加，供 blockers 统计使用。
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
@TableName("search_logs")
public class SearchLog {

    @TableId
    private String id;

    /** 原始查询文本 */
    private String query;

    /** 排名第一的结果的 topic，无结果时为 null */
    @TableField("topic_hint")
    private String topicHint;

    @TableField("result_count")
    private Integer resultCount;

    @TableField("created_at")
    private LocalDateTime createdAt;
}
