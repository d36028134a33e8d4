package com.imperium.agentpiazza.model.enums;

import java.util.Locale;

/**
 * Insight 所处的研究阶段。
 */
public enum InsightPhase {

    SETUP("Setup"),
    IMPLEMENTATION("Implementation"),
    OPTIMIZATION("Optimization"),
    DEBUG("Debug"),
    OTHER("Other");

    private final String label;

    InsightPhase(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * 宽松解析：大小写不敏感，未知或空值（包括 Summary、Idea 等 LLM 给出的标签）归为 {@link #OTHER}。
     */
    public static InsightPhase fromLabel(String value) {
        if (value == null || value.isBlank()) {
            return OTHER;
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (InsightPhase phase : values()) {
            if (phase.label.toLowerCase(Locale.ROOT).equals(v)) {
                return phase;
            }
        }
        return OTHER;
    }

    public static String normalize(String value) {
        return fromLabel(value).label;
    }
}
