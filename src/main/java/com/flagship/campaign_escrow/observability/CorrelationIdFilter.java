package com.flagship.campaign_escrow.observability;

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
 * Opens the logging context of every API request.
 *
 * Takes the correlation id from X-Correlation-ID or makes one up, echoes it on the
 * response, and puts it into the MDC together with the X-Caller-Id identity, so that
 * rejections logged before any campaign is resolved still name the caller.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain)
            throws ServletException, IOException {

        String correlationId = request.getHeader(CorrelationContext.CORRELATION_ID_HEADER);
        if (correlationId == null || correlationId.isBlank()) {
            correlationId = CorrelationContext.newCorrelationId();
        }
        String caller = request.getHeader(CorrelationContext.CALLER_HEADER);

        MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, correlationId);
        if (caller != null && !caller.isBlank()) {
            MDC.put(CorrelationContext.CALLER_MDC_KEY, caller);
        }
        response.setHeader(CorrelationContext.CORRELATION_ID_HEADER, correlationId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            CorrelationContext.clearRequestContext();
        }
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith("/api/");
    }
}
