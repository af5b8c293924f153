package com.phillippitts.alarmblock.config.logging;

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
 * Puts request-scoped values into Log4j2's ThreadContext for every API call.
 *
 * <ul>
 *   <li>requestId: from the X-Request-ID header, or a generated UUID; echoed on the response</li>
 *   <li>method: HTTP method</li>
 *   <li>uri: request URI</li>
 * </ul>
 *
 * <p>Only these keys are removed afterwards; context set by an outer caller survives.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestContextFilter implements Filter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String KEY_REQUEST_ID = "requestId";
    static final String KEY_METHOD = "method";
    static final String KEY_URI = "uri";

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        try {
            if (request instanceof HttpServletRequest http) {
                String requestId = http.getHeader(REQUEST_ID_HEADER);
                if (requestId == null || requestId.isBlank()) {
                    requestId = UUID.randomUUID().toString();
                }
                ThreadContext.put(KEY_REQUEST_ID, requestId);
                ThreadContext.put(KEY_METHOD, http.getMethod());
                ThreadContext.put(KEY_URI, http.getRequestURI());
                if (response instanceof HttpServletResponse httpResponse) {
                    httpResponse.setHeader(REQUEST_ID_HEADER, requestId);
                }
            }
            chain.doFilter(request, response);
        } finally {
            ThreadContext.remove(KEY_REQUEST_ID);
            ThreadContext.remove(KEY_METHOD);
            ThreadContext.remove(KEY_URI);
        }
    }
}
