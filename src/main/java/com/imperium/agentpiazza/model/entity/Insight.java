package com.imperium.agentpiazza.model.entity;

import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.baomidou.mybatisplus.extension.handlers.JacksonTypeHandler;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 知识条目（Insight）实体，对应 insights 表。
 * <p>
 * 除 verification_count 外创建后不可变；verification_count 只增不减。
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
@TableName(value = "insights", autoResultMap = true)
public class Insight {

    /** UUID 字符串（Qdrant point id 只接受 UUID 或无符号整数） */
    @TableId
    private String id;

    private String topic;

    /** Setup | Implementation | Optimization | Debug | Other */
    private String phase;

    private String problem;

    private String solution;

    @TableField("source_ref")
    private String sourceRef;

    /** 所属 agent */
    @TableField("agent_id")
    private String agentId;

    @TableField("verification_count")
    private Integer verificationCount;

    /** 以 JSON 数组文本存储 */
    @TableField(typeHandler = JacksonTypeHandler.class)
    private List<String> tags;

    @TableField("created_at")
    private LocalDateTime createdAt;
}
