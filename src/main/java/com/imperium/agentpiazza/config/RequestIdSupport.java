package com.imperium.agentpiazza.config;

import jakarta.servlet.http.HttpServletRequest;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * 请求 ID 的生成与解析。客户端传入的 X-Request-Id 仅在格式合法时沿用。
 */
public final class RequestIdSupport {

    public static final String HEADER_REQUEST_ID = "X-Request-Id";
    public static final String ATTR_REQUEST_ID = "requestId";

    private static final Pattern ACCEPTED = Pattern.compile("^[A-Za-z0-9_\\-]{1,64}$");

    private RequestIdSupport() {
    }

    public static String newRequestId() {
        return "req_" + UUID.randomUUID().toString().replace("-", "").substring(0, 16);
    }

    /**
     * 客户端值合法则沿用，否则新生成。
     */
    public static String accept(String clientValue) {
        if (clientValue != null && ACCEPTED.matcher(clientValue).matches()) {
            return clientValue;
        }
        return newRequestId();
    }

    /**
     * 取当前请求已分配的 ID（由 {@link RequestIdFilter} 写入）；未经过过滤器时现场分配。
     */
    public static String resolve(HttpServletRequest request) {
        if (request == null) {
            return newRequestId();
        }
        if (request.getAttribute(ATTR_REQUEST_ID) instanceof String value && !value.isBlank()) {
            return value;
        }
        String assigned = accept(request.getHeader(HEADER_REQUEST_ID));
        request.setAttribute(ATTR_REQUEST_ID, assigned);
        return assigned;
    }
}
