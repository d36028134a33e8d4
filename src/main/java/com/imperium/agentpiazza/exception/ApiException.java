package com.imperium.agentpiazza.exception;

import org.springframework.http.HttpStatus;

import java.util.Map;

/**
 * 业务异常基类，由 {@link com.imperium.agentpiazza.controller.GlobalExceptionHandler}
 * 统一渲染为 {@code {"error": {code, message, requestId, details}}}。
 */
public class ApiException extends RuntimeException {

    private final HttpStatus status;
    private final String code;
    private final Map<String, Object> details;

    public ApiException(HttpStatus status, String code, String message) {
        this(status, code, message, Map.of());
    }

    public ApiException(HttpStatus status, String code, String message, Map<String, Object> details) {
        super(message);
        this.status = status;
        this.code = code;
        this.details = details != null ? details : Map.of();
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getCode() {
        return code;
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
