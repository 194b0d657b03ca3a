package com.chatwarden.observability;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Puts {@code requestId} and {@code chatId} into the MDC. The chat comes from the
 * admin URL when there is one, otherwise from the adapter's {@code X-Chat-ID} header.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String CHAT_ID_HEADER = "X-Chat-ID";

    private static final Pattern ADMIN_CHAT_PATH = Pattern.compile("^/api/admin/chats/(-?\\d+)(?:/.*)?$");
    private static final int MAX_REQUEST_ID_LENGTH = 64;

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                   HttpServletResponse response,
                                   FilterChain filterChain) throws ServletException, IOException {
        String requestId = request.getHeader(REQUEST_ID_HEADER);
        if (requestId == null || requestId.isBlank() || requestId.length() > MAX_REQUEST_ID_LENGTH) {
            requestId = UUID.randomUUID().toString().substring(0, 8);
        }
        MDC.put("requestId", requestId);
        response.setHeader(REQUEST_ID_HEADER, requestId);

        String chatId = chatIdOf(request);
        if (chatId != null) {
            MDC.put("chatId", chatId);
        }

        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove("requestId");
            MDC.remove("chatId");
        }
    }

    static String chatIdOf(HttpServletRequest request) {
        Matcher matcher = ADMIN_CHAT_PATH.matcher(request.getRequestURI());
        if (matcher.matches()) {
            return matcher.group(1);
        }
        String header = request.getHeader(CHAT_ID_HEADER);
        return header != null && !header.isBlank() ? header.trim() : null;
    }
}
