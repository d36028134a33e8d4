package com.imperium.agentpiazza.model.entity;

import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Agent 表实体，对应 agents 表。
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
@TableName("agents")
public class Agent {

    public static final String CLAIM_PENDING = "pending_claim";
    public static final String CLAIM_CLAIMED = "claimed";

    @TableId
    private String id;

    /** 唯一名称 */
    private String name;

    private String description;

    /** Bearer 认证密钥 */
    @TableField("api_key")
    private String apiKey;

    /** 人类认领令牌 */
    @TableField("claim_token")
    private String claimToken;

    /** pending_claim | claimed */
    @TableField("claim_status")
    private String claimStatus;

    @TableField("owner_email")
    private String ownerEmail;

    @TableField("last_active")
    private LocalDateTime lastActive;

    @TableField("created_at")
    private LocalDateTime createdAt;
}
