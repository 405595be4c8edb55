package com.bastion.identity.infrastructure.web;

import com.bastion.observability.CorrelationContext;
import com.bastion.observability.CorrelationContextHolder;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * First filter of every HTTP request: opens an anonymous {@link CorrelationContext} that the
 * bearer filters later bind the caller into.
 *
 * <p>The effective IDs are echoed as response headers before the chain runs, so they are
 * present on rejections written by the auth filters too. An inbound correlation ID that is
 * unsafe to log is replaced, and the replacement is what the client sees.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String REQUEST_ID_HEADER = "X-Request-ID";
    public static final String TRACE_ID_HEADER = "X-Trace-ID";

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        CorrelationContext context = open(request.getHeader(CORRELATION_ID_HEADER));
        CorrelationContextHolder.set(context);

        response.setHeader(CORRELATION_ID_HEADER, context.correlationId());
        response.setHeader(REQUEST_ID_HEADER, context.requestId());
        if (context.traceId() != null) {
            response.setHeader(TRACE_ID_HEADER, context.traceId());
        }

        try {
            filterChain.doFilter(request, response);
        } finally {
            CorrelationContextHolder.clear();
        }
    }

    private static CorrelationContext open(String inboundCorrelationId) {
        var context = CorrelationContext.forRequest(inboundCorrelationId);
        SpanContext span = Span.current().getSpanContext();
        return span.isValid() ? context.withTraceId(span.getTraceId()) : context;
    }
}
