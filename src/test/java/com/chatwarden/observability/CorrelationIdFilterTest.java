package com.chatwarden.observability;

import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CorrelationIdFilterTest {

    private final CorrelationIdFilter filter = new CorrelationIdFilter();

    @Test
    void adminPathSetsChatInMdc() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/admin/chats/-1001234/members/5/pardon");
        request.addHeader(CorrelationIdFilter.REQUEST_ID_HEADER, "req-1");
        MockHttpServletResponse response = new MockHttpServletResponse();

        Map<String, String> seen = run(request, response);

        assertEquals("-1001234", seen.get("chatId"));
        assertEquals("req-1", seen.get("requestId"));
        assertEquals("req-1", response.getHeader(CorrelationIdFilter.REQUEST_ID_HEADER));
        assertNull(MDC.get("chatId"));
        assertNull(MDC.get("requestId"));
    }

    @Test
    void eventsUseChatHeader() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/moderation/events");
        request.addHeader(CorrelationIdFilter.CHAT_ID_HEADER, "-42");

        assertEquals("-42", run(request, new MockHttpServletResponse()).get("chatId"));
    }

    @Test
    void oversizedRequestIdIsReplaced() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/actuator/health");
        request.addHeader(CorrelationIdFilter.REQUEST_ID_HEADER, "x".repeat(200));
        MockHttpServletResponse response = new MockHttpServletResponse();

        Map<String, String> seen = run(request, response);

        assertEquals(8, seen.get("requestId").length());
        assertNull(seen.get("chatId"));
    }

    private Map<String, String> run(MockHttpServletRequest request, MockHttpServletResponse response) throws Exception {
        Map<String, String> seen = new HashMap<>();
        filter.doFilter(request, response, (req, res) -> {
            seen.put("requestId", MDC.get("requestId"));
            seen.put("chatId", MDC.get("chatId"));
        });
        return seen;
    }
}
