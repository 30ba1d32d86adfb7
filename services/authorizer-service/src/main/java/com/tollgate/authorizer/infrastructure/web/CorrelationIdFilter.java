package com.tollgate.authorizer.infrastructure.web;

import com.tollgate.observability.CorrelationContext;
import com.tollgate.observability.CorrelationContextHolder;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Opens the {@link CorrelationContext} for each HTTP request and echoes its correlation id in
 * {@value #CORRELATION_ID_HEADER}.
 *
 * <p>A caller id that is not acceptable to {@link CorrelationContext#forInboundCall(String)} is
 * replaced, and the replacement is what gets echoed. Runs ahead of {@link
 * AuthorizationGateFilter}, so denials are logged with the id.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {

        CorrelationContext context =
                CorrelationContext.forInboundCall(request.getHeader(CORRELATION_ID_HEADER));
        CorrelationContextHolder.set(context);
        response.setHeader(CORRELATION_ID_HEADER, context.correlationId());
        try {
            chain.doFilter(request, response);
        } finally {
            // Tomcat reuses threads
            CorrelationContextHolder.clear();
        }
    }
}
