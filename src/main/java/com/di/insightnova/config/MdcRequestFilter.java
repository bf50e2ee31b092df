package com.di.insightnova.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Sets MDC for every HTTP request so API logs (ingestion, status callbacks, policy writes) can be
 * correlated. Cleared in {@code finally} so pooled servlet threads never leak a request id.
 * <p>
 * Sets:
 * <ul>
 *   <li>{@code requestId} – unique per request</li>
 *   <li>{@code requestPath} – request URI, echoed in error responses by GlobalExceptionHandler</li>
 * </ul>
 * Scheduled jobs use {@code jobId}/{@code runId} instead (see JobRunner).
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcRequestFilter extends OncePerRequestFilter {

    public static final String REQUEST_ID = "requestId";
    public static final String REQUEST_PATH = "requestPath";

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        String requestId = "req-" + UUID.randomUUID().toString().substring(0, 8);
        String path = request.getRequestURI();
        MDC.put(REQUEST_ID, requestId);
        MDC.put(REQUEST_PATH, path != null ? path : "");
        response.setHeader("X-Request-Id", requestId);
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(REQUEST_ID);
            MDC.remove(REQUEST_PATH);
        }
    }
}
