package com.flagship.smart_sync.observability;

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

/**
 * Extracts or generates the correlation ID for every API and webhook request.
 *
 * This filter:
 * 1. Takes the ID from the X-Correlation-ID header, or generates one
 * 2. Sets it in MDC and echoes it on the response
 * 3. Cleans up thread-local and MDC state after the request, including
 *    sync keys left by a synchronous manual trigger
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain)
            throws ServletException, IOException {

        try {
            // Take the caller's ID, or start a new one
            String correlationId = request.getHeader(CorrelationContext.CORRELATION_ID_HEADER);
            if (correlationId == null || correlationId.isBlank()) {
                correlationId = CorrelationContext.generateCorrelationId();
            }

            // Thread-local for code that triggers syncs from this request
            CorrelationContext.setCorrelationId(correlationId);

            // Set in MDC for logging
            MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, correlationId);

            // Echo it so callers and rails can quote it back
            response.setHeader(CorrelationContext.CORRELATION_ID_HEADER, correlationId);

            filterChain.doFilter(request, response);

        } finally {
            // Manual triggers run on this thread and leave sync keys in MDC
            CorrelationContext.clear();
            MDC.remove(CorrelationContext.CORRELATION_ID_MDC_KEY);
            MDC.remove(CorrelationContext.TENANT_ID_MDC_KEY);
            MDC.remove(CorrelationContext.RAIL_MDC_KEY);
            MDC.remove(CorrelationContext.ENTITY_TYPE_MDC_KEY);
            MDC.remove(CorrelationContext.RUN_ID_MDC_KEY);
        }
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        // Don't filter actuator endpoints to reduce noise
        return request.getRequestURI().startsWith("/actuator");
    }
}
