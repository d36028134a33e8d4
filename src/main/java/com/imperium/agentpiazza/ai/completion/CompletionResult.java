package com.imperium.agentpiazza.ai.completion;

/**
 * 补全结果：成功文本，或带原因的失败（text 为面向用户的兜底说明）。
 */
public record CompletionResult(Status status, String text) {

    public enum Status {
        OK,
        /** 连接失败 */
        UNAVAILABLE,
        /** 超过调用时限 */
        TIMEOUT,
        /** 其他异常 */
        ERROR
    }

    public static final String UNAVAILABLE_MESSAGE =
            "I'm not available right now: the AI model service could not be reached. "
                    + "Please check that the completion endpoint is running and try again.";

    public static final String TIMEOUT_MESSAGE =
            "The AI model took too long to respond. Try a shorter message or check that the model service is running.";

    public static CompletionResult ok(String text) {
        return new CompletionResult(Status.OK, text != null ? text : "");
    }

    public static CompletionResult unavailable() {
        return new CompletionResult(Status.UNAVAILABLE, UNAVAILABLE_MESSAGE);
    }

    public static CompletionResult timeout() {
        return new CompletionResult(Status.TIMEOUT, TIMEOUT_MESSAGE);
    }

    public static CompletionResult error(String detail) {
        return new CompletionResult(Status.ERROR,
                "Unexpected error communicating with the AI model: " + (detail != null ? detail : "unknown"));
    }

    public boolean isSuccess() {
        return status == Status.OK;
    }
}
