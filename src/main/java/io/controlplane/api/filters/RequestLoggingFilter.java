package io.controlplane.api.filters;

import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.web.filter.OncePerRequestFilter;

import javax.servlet.FilterChain;
import javax.servlet.ServletException;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import java.io.IOException;

/**
 * Logs every API request on arrival and on completion with its status and latency.
 * Header values are never logged.
 */
@Slf4j
public class RequestLoggingFilter extends OncePerRequestFilter {

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        long startNanos = System.nanoTime();
        String method = request.getMethod();
        String uri = request.getRequestURI();
        log.info("[REQUEST] {} {}", method, uri);
        try {
            filterChain.doFilter(request, response);
        } finally {
            long elapsedMillis = (System.nanoTime() - startNanos) / 1_000_000;
            log.info("[RESPONSE] {} {} status={} latency={}ms", method, uri, response.getStatus(), elapsedMillis);
        }
    }
}
