package com.imperium.agentpiazza.model.entity;

import com.baomidou.mybatisplus.annotation.FieldStrategy;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 消息表实体，对应 messages 表。只追加，按 created_at、seq 排序。
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
@TableName("messages")
public class Message {

    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";

    /** 消息ID */
    @TableId
    private String id;

    /** 所属会话ID */
    @TableField("conversation_id")
    private String conversationId;

    /** 角色：user | assistant */
    private String role;

    /** 消息内容 */
    private String content;

    /** 数据库自增序号，同一时间戳内的插入顺序 */
    @TableField(value = "seq", insertStrategy = FieldStrategy.NEVER, updateStrategy = FieldStrategy.NEVER)
    private Long seq;

    /** 创建时间 */
    @TableField("created_at")
    private LocalDateTime createdAt;
}
