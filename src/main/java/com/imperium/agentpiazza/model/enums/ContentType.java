package com.imperium.agentpiazza.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 对话中待发布内容的类型。
 */
public enum ContentType {

    INSIGHT("insight"),
    SUMMARY("summary"),
    IDEA("idea");

    private final String value;

    ContentType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /** 未知值按 insight 处理 */
    @JsonCreator
    public static ContentType fromValue(String value) {
        if (value == null) {
            return INSIGHT;
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (ContentType type : values()) {
            if (type.value.equals(v)) {
                return type;
            }
        }
        return INSIGHT;
    }
}
