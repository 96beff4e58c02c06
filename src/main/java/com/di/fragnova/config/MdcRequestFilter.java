package com.di.fragnova.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Tags planning and residency calls in the MDC so their logs, including transport completions that inherit
 * the context, can be traced back to the call that caused them.
 * <p>
 * {@code requestId} comes from the {@value #REQUEST_ID_HEADER} header when the caller sends one and is echoed
 * back on the response. {@code requestPath} feeds error responses. {@code operation} names the API call as
 * {@code area.action} (for example {@code residency.epochs}) and stays unset outside {@code /api}. The residency
 * controller adds {@code epoch}.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcRequestFilter extends OncePerRequestFilter {

    static final String REQUEST_ID_HEADER = "X-Request-Id";
    static final String REQUEST_ID = "requestId";
    static final String REQUEST_PATH = "requestPath";
    static final String OPERATION = "operation";

    private static final String API_PREFIX = "/api/";
    private static final int MAX_REQUEST_ID_LENGTH = 64;

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        String requestId = requestId(request.getHeader(REQUEST_ID_HEADER));
        MDC.put(REQUEST_ID, requestId);
        response.setHeader(REQUEST_ID_HEADER, requestId);
        String path = request.getRequestURI();
        MDC.put(REQUEST_PATH, path != null ? path : "");
        String operation = operation(path);
        if (operation != null) {
            MDC.put(OPERATION, operation);
        }
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(REQUEST_ID);
            MDC.remove(REQUEST_PATH);
            MDC.remove(OPERATION);
        }
    }

    static String requestId(String header) {
        if (StringUtils.hasText(header) && header.length() <= MAX_REQUEST_ID_LENGTH) {
            return header.trim();
        }
        return "req-" + UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * {@code /api/placement/plan} becomes {@code placement.plan}; a bare {@code /api/residency} becomes
     * {@code residency}. Anything outside {@code /api} yields null.
     */
    static String operation(String uri) {
        if (uri == null || !uri.startsWith(API_PREFIX)) {
            return null;
        }
        String[] segments = uri.substring(API_PREFIX.length()).split("/");
        if (segments.length == 0 || segments[0].isEmpty()) {
            return null;
        }
        if (segments.length == 1 || segments[1].isEmpty()) {
            return segments[0];
        }
        return segments[0] + "." + segments[1];
    }
}
