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
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

import static io.controlplane.config.Constants.HEADER_AUTH_TOKEN;

/**
 * Rejects requests whose {@code X-Auth-Token} header does not match the configured token.
 */
@Slf4j
public class AuthFilter extends OncePerRequestFilter {

    private final byte[] expectedToken;
    private final ObjectMapper objectMapper;

    public AuthFilter(String expectedToken, ObjectMapper objectMapper) {
        this.expectedToken = expectedToken.getBytes(StandardCharsets.UTF_8);
        this.objectMapper = objectMapper;
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        String token = request.getHeader(HEADER_AUTH_TOKEN);
        if (token == null || !MessageDigest.isEqual(expectedToken, token.getBytes(StandardCharsets.UTF_8))) {
            log.warn("Rejected unauthenticated {} {}", request.getMethod(), request.getRequestURI());
            ErrorResponseWriter.write(response, objectMapper, ErrorResponse.unauthorized());
            return;
        }
        filterChain.doFilter(request, response);
    }
}
