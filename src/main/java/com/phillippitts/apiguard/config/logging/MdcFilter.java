package com.phillippitts.apiguard.config.logging;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.UUID;

/**
 * Adds request-scoped values to Log4j2's MDC (ThreadContext) so governance logs written while
 * serving the dashboard endpoints can be correlated.
 *
 * <p>Values added:</p>
 * <ul>
 *   <li>requestId: from X-Request-ID header, or generated UUID; echoed back on the response</li>
 *   <li>method: HTTP method</li>
 *   <li>uri: request URI</li>
 * </ul>
 *
 * <p>The context is always cleared after the request.</p>
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter implements Filter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        try {
            if (request instanceof HttpServletRequest http) {
                String requestId = headerOrGenerate(http);
                ThreadContext.put("requestId", requestId);
                ThreadContext.put("method", http.getMethod());
                ThreadContext.put("uri", http.getRequestURI());
                if (response instanceof HttpServletResponse httpResponse) {
                    httpResponse.setHeader(REQUEST_ID_HEADER, requestId);
                }
            }
            chain.doFilter(request, response);
        } finally {
            ThreadContext.clearAll();
        }
    }

    private static String headerOrGenerate(HttpServletRequest req) {
        String v = req.getHeader(REQUEST_ID_HEADER);
        return (v == null || v.isBlank()) ? UUID.randomUUID().toString() : v;
    }
}
