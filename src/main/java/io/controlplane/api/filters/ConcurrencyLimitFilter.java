package io.controlplane.api.filters;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.controlplane.api.models.responses.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.web.filter.OncePerRequestFilter;

import javax.servlet.FilterChain;
import javax.servlet.ServletException;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.concurrent.Semaphore;

/**
 * Bounds the number of requests in flight on this node. Excess requests are answered 429
 * instead of queueing.
 */
@Slf4j
public class ConcurrencyLimitFilter extends OncePerRequestFilter {

    private final Semaphore permits;
    private final ObjectMapper objectMapper;

    public ConcurrencyLimitFilter(int maxConcurrent, ObjectMapper objectMapper) {
        this.permits = new Semaphore(maxConcurrent);
        this.objectMapper = objectMapper;
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        if (!permits.tryAcquire()) {
            log.warn("Concurrency limit reached, rejecting {} {}", request.getMethod(), request.getRequestURI());
            ErrorResponseWriter.write(response, objectMapper, ErrorResponse.tooManyRequests("too many concurrent requests"));
            return;
        }
        try {
            filterChain.doFilter(request, response);
        } finally {
            permits.release();
        }
    }

    int availablePermits() {
        return permits.availablePermits();
    }
}
