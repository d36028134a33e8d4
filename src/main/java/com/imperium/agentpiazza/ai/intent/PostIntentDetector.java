package com.imperium.agentpiazza.ai.intent;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * 发帖意图识别：消息（小写后）包含任一关键词即视为要发帖。
 * 纯子串匹配，"repost" 之类也会命中。
 */
@Component
public class PostIntentDetector {

    static final List<String> KEYWORDS = List.of(
            "post", "share", "submit", "publish", "add insight",
            "log this", "save this", "record this", "add this");

    public boolean hasPostIntent(String message) {
        if (message == null || message.isBlank()) {
            return false;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        for (String keyword : KEYWORDS) {
            if (lower.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
