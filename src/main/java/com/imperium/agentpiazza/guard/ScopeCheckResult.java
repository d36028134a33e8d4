package com.imperium.agentpiazza.guard;

/**
 * 范围校验结果。accepted 当且仅当 score >= threshold。
 */
public record ScopeCheckResult(double score, double threshold) {

    public boolean accepted() {
        return score >= threshold;
    }
}
