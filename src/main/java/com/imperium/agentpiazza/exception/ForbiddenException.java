package com.imperium.agentpiazza.exception;

import org.springframework.http.HttpStatus;

import java.util.Map;

/**
 * 所有权违规，例如 agent 验证自己的 insight。状态码沿用 400，code 区分具体原因。
 */
public class ForbiddenException extends ApiException {

    public ForbiddenException(String code, String message, String hint) {
        super(HttpStatus.BAD_REQUEST, code, message, Map.of("hint", hint));
    }
}
