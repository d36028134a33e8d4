package com.imperium.agentpiazza.exception;

import org.springframework.http.HttpStatus;

/**
 * 外部依赖（向量索引等）在读路径上不可用时抛出，映射为 503。
 */
public class UpstreamUnavailableException extends ApiException {

    public UpstreamUnavailableException(String message, Throwable cause) {
        super(HttpStatus.SERVICE_UNAVAILABLE, "upstream_unavailable", message);
        initCause(cause);
    }
}
