package com.phillippitts.modelelector.config.logging;

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
 * Correlates every log line of one election through Log4j2's MDC (ThreadContext).
 *
 * <p>Keys, and who sets them:</p>
 * <ul>
 *   <li>{@value #MDC_REQUEST_ID}: this filter, from X-Request-ID or a generated UUID. The value
 *       is echoed back in the X-Request-ID response header so callers can quote it.</li>
 *   <li>{@value #MDC_METHOD} and {@value #MDC_URI}: this filter.</li>
 *   <li>{@value #MDC_BACKEND}: the backend call executor, on the worker thread for the duration
 *       of one backend call.</li>
 *   <li>{@value #MDC_ELECTED_BACKEND}: the prediction endpoint, once a backend has been elected.</li>
 * </ul>
 *
 * <p>The backend call pool copies the request's context onto its workers, so per-backend lines
 * carry the requestId of their election. The request thread's context is cleared afterwards.</p>
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter implements Filter {

    public static final String REQUEST_ID_HEADER = "X-Request-ID";

    public static final String MDC_REQUEST_ID = "requestId";
    public static final String MDC_METHOD = "method";
    public static final String MDC_URI = "uri";
    public static final String MDC_BACKEND = "backend";
    public static final String MDC_ELECTED_BACKEND = "electedBackend";

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        if (!(request instanceof HttpServletRequest http)) {
            chain.doFilter(request, response);
            return;
        }
        String requestId = requestIdOf(http);
        try {
            ThreadContext.put(MDC_REQUEST_ID, requestId);
            ThreadContext.put(MDC_METHOD, http.getMethod());
            ThreadContext.put(MDC_URI, http.getRequestURI());
            if (response instanceof HttpServletResponse httpResponse) {
                httpResponse.setHeader(REQUEST_ID_HEADER, requestId);
            }
            chain.doFilter(request, response);
        } finally {
            ThreadContext.clearAll();
        }
    }

    private static String requestIdOf(HttpServletRequest req) {
        String v = req.getHeader(REQUEST_ID_HEADER);
        return (v == null || v.isBlank()) ? UUID.randomUUID().toString() : v.trim();
    }
}
