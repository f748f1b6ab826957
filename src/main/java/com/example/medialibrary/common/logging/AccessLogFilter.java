package com.example.medialibrary.common.logging;

import java.io.IOException;
import java.util.UUID;
import javax.servlet.FilterChain;
import javax.servlet.ServletException;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Stamps every API request with a request id and writes one {@code ACCESS} line per request. Scan event
 * polling is logged at DEBUG unless it fails.
 */
public class AccessLogFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(AccessLogFilter.class);

    public static final String HEADER_REQUEST_ID = "X-Request-Id";
    public static final String MDC_REQUEST_ID = "requestId";

    static final String POLLING_SUFFIX = "/scans/current/events";

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        long start = System.currentTimeMillis();
        String requestId = request.getHeader(HEADER_REQUEST_ID);
        if (requestId == null || requestId.trim().isEmpty() || requestId.length() > 64) {
            requestId = UUID.randomUUID().toString().replace("-", "");
        }
        response.setHeader(HEADER_REQUEST_ID, requestId);

        MDC.put(MDC_REQUEST_ID, requestId);
        try {
            filterChain.doFilter(request, response);
        } finally {
            long cost = System.currentTimeMillis() - start;
            int status = response.getStatus();
            String uri = request.getRequestURI();
            if (status >= 500) {
                log.warn("ACCESS method={} uri={} status={} costMs={}", request.getMethod(), uri, status, cost);
            } else if (uri != null && uri.endsWith(POLLING_SUFFIX)) {
                log.debug("ACCESS method={} uri={} status={} costMs={}", request.getMethod(), uri, status, cost);
            } else {
                log.info("ACCESS method={} uri={} status={} costMs={}", request.getMethod(), uri, status, cost);
            }
            MDC.remove(MDC_REQUEST_ID);
        }
    }
}
