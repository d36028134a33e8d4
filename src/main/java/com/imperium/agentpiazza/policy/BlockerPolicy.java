package com.imperium.agentpiazza.policy;

/**
 * blocker 排名的候选范围与打分规则。
 */
public final class BlockerPolicy {

    /** 参与排名的最多话题数（按检索次数取前 N） */
    public static final int CANDIDATE_TOPICS = 50;

    /**
     * 检索次数相对已验证 insight 的比值，保留两位小数。
     */
    public static double ratioScore(long queryCount, long verifiedCount) {
        return Math.round((double) queryCount / (verifiedCount + 1) * 100d) / 100d;
    }

    private BlockerPolicy() {}
}
