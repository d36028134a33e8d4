package com.imperium.agentpiazza.exception;

import org.springframework.http.HttpStatus;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 内容未通过范围校验：相似度低于阈值。可通过修改内容后重新提交恢复。
 */
public class ScopeRejectedException extends ApiException {

    public static final String ERROR = "Content outside of project scope.";

    private final double score;
    private final double threshold;

    public ScopeRejectedException(double score, double threshold, String scopeHint) {
        super(HttpStatus.FORBIDDEN, "out_of_scope", ERROR, details(score, threshold, scopeHint));
        this.score = score;
        this.threshold = threshold;
    }

    public double getScore() {
        return score;
    }

    public double getThreshold() {
        return threshold;
    }

    /**
     * 面向用户的说明，包含得分与阈值。
     */
    public String getHint() {
        return String.valueOf(getDetails().get("hint"));
    }

    private static Map<String, Object> details(double score, double threshold, String scopeHint) {
        String hint = String.format(Locale.ROOT,
                "Your insight scored %.3f similarity against the platform scope. Minimum required: %s. %s",
                score, threshold, scopeHint);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("hint", hint);
        details.put("similarity_score", Math.round(score * 10_000d) / 10_000d);
        details.put("threshold", threshold);
        return details;
    }
}
