/**
 * Request logging and timing filter for HTTP requests
 *
 * Features:
 * - Logs incoming requests with method, URI, query string and source IP
 * - Measures and logs request processing duration and response status
 * - Skips the health check to keep logs focused on API traffic
 */
package net.tvcatalog;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;

@Component
public class RequestLoggingFilter implements Filter {
    private static final Logger logger = LoggerFactory.getLogger(RequestLoggingFilter.class);

    private static final String HEALTH_PATH = "/health";

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        HttpServletRequest req = (HttpServletRequest) request;
        String uri = req.getRequestURI();
        if (HEALTH_PATH.equals(uri)) {
            chain.doFilter(request, response);
            return;
        }
        String query = req.getQueryString();
        String target = query == null ? uri : uri + "?" + query;

        long startTime = System.currentTimeMillis();
        logger.info("Incoming request: {} {} from {}", req.getMethod(), target, req.getRemoteAddr());
        try {
            chain.doFilter(request, response);
        } finally {
            long duration = System.currentTimeMillis() - startTime;
            int status = response instanceof HttpServletResponse ? ((HttpServletResponse) response).getStatus() : 0;
            logger.info("Completed request: {} {} with status {} in {} ms", req.getMethod(), uri, status, duration);
        }
    }
}
