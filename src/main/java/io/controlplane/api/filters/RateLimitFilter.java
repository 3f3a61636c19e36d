package io.controlplane.api.filters;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.util.concurrent.RateLimiter;
import io.controlplane.api.models.responses.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.web.filter.OncePerRequestFilter;

import javax.servlet.FilterChain;
import javax.servlet.ServletException;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import java.io.IOException;

/**
 * Node-wide token bucket: a request that finds no token is answered 429 immediately.
 */
@Slf4j
public class RateLimitFilter extends OncePerRequestFilter {

    private final RateLimiter rateLimiter;
    private final ObjectMapper objectMapper;

    public RateLimitFilter(double requestsPerSecond, ObjectMapper objectMapper) {
        this.rateLimiter = RateLimiter.create(requestsPerSecond);
        this.objectMapper = objectMapper;
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        if (!rateLimiter.tryAcquire()) {
            log.warn("Rate limit exceeded for {} {}", request.getMethod(), request.getRequestURI());
            ErrorResponseWriter.write(response, objectMapper, ErrorResponse.tooManyRequests("rate limit exceeded"));
            return;
        }
        filterChain.doFilter(request, response);
    }
}
