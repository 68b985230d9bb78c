package com.flagship.pos_core.observability;

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
 * Servlet filter that gives every HTTP request a correlation id.
 *
 * For each request it:
 * 1. takes X-Correlation-ID from the request, or generates one when absent
 * 2. exposes it through {@link CorrelationContext} and the MDC
 * 3. echoes it on the response
 * 4. clears the correlation id and the sale MDC keys when the request ends
 *
 * Runs first so that log lines of every later filter carry the id.
 * Actuator calls are skipped.
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
            // blank headers fall back to a generated id
            String correlationId = request.getHeader(CorrelationContext.CORRELATION_ID_HEADER);
            CorrelationContext.setCorrelationId(correlationId);

            String effective = CorrelationContext.getCorrelationId();
            MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, effective);
            response.setHeader(CorrelationContext.CORRELATION_ID_HEADER, effective);

            filterChain.doFilter(request, response);
        } finally {
            // includes the sale keys set through putSale
            CorrelationContext.clear();
            CorrelationContext.clearSale();
            MDC.remove(CorrelationContext.CORRELATION_ID_MDC_KEY);
        }
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return request.getRequestURI().startsWith("/actuator");
    }
}
