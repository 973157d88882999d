package com.phillippitts.lossguard.config.logging;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.CloseableThreadContext;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Scopes Log4j2's ThreadContext to the training run that reports through the monitor API.
 *
 * <p>Keys, for requests under {@code /api/} only:
 * <ul>
 *   <li>{@code requestId}: X-Request-ID header or a generated UUID; echoed back in the response</li>
 *   <li>{@code runId}: X-Run-ID header, when the reporting job sends one</li>
 *   <li>{@code endpoint}: method and path, e.g. {@code POST /api/v1/monitor/steps}</li>
 * </ul>
 *
 * <p>The controller adds {@code step} for step reports. Values are removed when the request
 * completes; keys set by outer code are restored.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RunContextFilter extends OncePerRequestFilter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String RUN_ID_HEADER = "X-Run-ID";
    static final String API_PREFIX = "/api/";

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String uri = request.getRequestURI();
        return uri == null || !uri.startsWith(API_PREFIX);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String requestId = trimmedHeader(request, REQUEST_ID_HEADER);
        if (requestId == null) {
            requestId = UUID.randomUUID().toString();
        }
        response.setHeader(REQUEST_ID_HEADER, requestId);

        Map<String, String> context = new LinkedHashMap<>();
        context.put("requestId", requestId);
        context.put("endpoint", request.getMethod() + " " + request.getRequestURI());
        String runId = trimmedHeader(request, RUN_ID_HEADER);
        if (runId != null) {
            context.put("runId", runId);
        }

        try (CloseableThreadContext.Instance ignored = CloseableThreadContext.putAll(context)) {
            chain.doFilter(request, response);
        }
    }

    private static String trimmedHeader(HttpServletRequest request, String name) {
        String value = request.getHeader(name);
        return value == null || value.isBlank() ? null : value.strip();
    }
}
