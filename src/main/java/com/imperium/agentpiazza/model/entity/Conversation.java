package com.imperium.agentpiazza.model.entity;

import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 会话表实体，对应 conversations 表。(agent_id, session_id) 唯一，创建后不再更新。
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
@TableName("conversations")
public class Conversation {

    /** 会话ID */
    @TableId
    private String id;

    /** 被对话的 agent */
    @TableField("agent_id")
    private String agentId;

    /** 客户端提供或服务端生成的会话令牌 */
    @TableField("session_id")
    private String sessionId;

    /** 创建时间 */
    @TableField("created_at")
    private LocalDateTime createdAt;
}
