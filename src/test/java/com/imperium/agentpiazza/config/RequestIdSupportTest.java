package com.imperium.agentpiazza.config;

import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

import static org.junit.jupiter.api.Assertions.*;

class RequestIdSupportTest {

    @Test
    void wellFormedClientIdIsKept() {
        assertEquals("trace-42_ab", RequestIdSupport.accept("trace-42_ab"));
    }

    @Test
    void malformedClientIdIsReplaced() {
        String id = RequestIdSupport.accept("bad id\nwith newline");
        assertTrue(id.startsWith("req_"));
        assertEquals(20, id.length());
        assertTrue(RequestIdSupport.accept(null).startsWith("req_"));
    }

    @Test
    void resolveIsStablePerRequest() {
        MockHttpServletRequest request = new MockHttpServletRequest();

        String first = RequestIdSupport.resolve(request);
        String second = RequestIdSupport.resolve(request);

        assertEquals(first, second);
        assertEquals(first, request.getAttribute(RequestIdSupport.ATTR_REQUEST_ID));
    }
}
