/**
 * Request logging and timing filter for HTTP requests
 *
 * Features:
 * - Logs incoming HTTP requests with method, URI, and source IP
 * - Measures and logs request processing duration
 * - Records HTTP response status codes
 * - Skips actuator probes to reduce log noise
 */
package net.activitynotification;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;

@Component
@Slf4j
public class RequestLoggingFilter implements Filter {

    private static final String ACTUATOR_PREFIX = "/actuator";

    /**
     * Processes HTTP request through the filter chain with logging
     * - Logs request details before processing
     * - Tracks request processing time
     * - Logs completion status and duration, including failed requests
     *
     * @param request The incoming servlet request
     * @param response The servlet response
     * @param chain The filter processing chain
     * @throws IOException If an I/O error occurs during request processing
     * @throws ServletException If a servlet error occurs during processing
     */
    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        HttpServletRequest req = (HttpServletRequest) request;
        String uri = req.getRequestURI();
        if (uri.startsWith(ACTUATOR_PREFIX)) {
            chain.doFilter(request, response);
            return;
        }
        long startTime = System.currentTimeMillis();
        log.info("Incoming request: {} {} from {}", req.getMethod(), uri, req.getRemoteAddr());
        try {
            chain.doFilter(request, response);
        } finally {
            long duration = System.currentTimeMillis() - startTime;
            int status = response instanceof HttpServletResponse ? ((HttpServletResponse) response).getStatus() : 0;
            log.info("Completed request: {} {} with status {} in {} ms", req.getMethod(), uri, status, duration);
        }
    }
}
