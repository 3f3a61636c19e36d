package io.controlplane.api.filters;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.controlplane.api.models.responses.ErrorResponse;
import io.controlplane.metrics.MetricsProvider;
import io.controlplane.models.IdempotencyRecord;
import io.controlplane.stats.StatsAggregator;
import io.controlplane.stats.StatsEvent;
import io.controlplane.store.LedgerStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.lang.NonNull;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingResponseWrapper;

import javax.servlet.FilterChain;
import javax.servlet.ServletException;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static io.controlplane.config.Constants.HEADER_IDEMPOTENCY_KEY;
import static io.controlplane.config.Constants.MAX_IDEMPOTENCY_KEY_LENGTH;

/**
 * Transport-level idempotency for mutating requests.
 * <p>
 * A request must carry {@code X-Idempotency-Key} of at most 255 characters; a longer key could
 * never be stored, so it is rejected before the handler runs. The first response with a status below 400
 * is stored under the key; any later request with the same key gets the stored status,
 * content type and body back byte for byte without reaching the handler. Requests racing on
 * the same key may both reach the handler; the key's uniqueness in the store decides which
 * response is kept.
 */
@Slf4j
public class IdempotencyFilter extends OncePerRequestFilter {

    private static final Set<String> MUTATING_METHODS = Set.of("POST", "PUT", "PATCH", "DELETE");

    private final LedgerStore store;
    private final List<String> exemptPaths;
    private final ObjectMapper objectMapper;
    private final MetricsProvider metricsProvider;
    private final StatsAggregator statsAggregator;

    public IdempotencyFilter(LedgerStore store,
                             List<String> exemptPaths,
                             ObjectMapper objectMapper,
                             MetricsProvider metricsProvider,
                             StatsAggregator statsAggregator) {
        this.store = store;
        this.exemptPaths = List.copyOf(exemptPaths);
        this.objectMapper = objectMapper;
        this.metricsProvider = metricsProvider;
        this.statsAggregator = statsAggregator;
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        if (!MUTATING_METHODS.contains(request.getMethod().toUpperCase())) {
            return true;
        }
        return exemptPaths.contains(pathWithinApplication(request));
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        String key = request.getHeader(HEADER_IDEMPOTENCY_KEY);
        if (key == null || key.isBlank()) {
            log.warn("Rejected {} {} without {}", request.getMethod(), request.getRequestURI(), HEADER_IDEMPOTENCY_KEY);
            ErrorResponseWriter.write(response, objectMapper,
                ErrorResponse.badRequest(HEADER_IDEMPOTENCY_KEY + " header is required"));
            return;
        }
        if (key.length() > MAX_IDEMPOTENCY_KEY_LENGTH) {
            log.warn("Rejected {} {} with a {} of {} characters",
                request.getMethod(), request.getRequestURI(), HEADER_IDEMPOTENCY_KEY, key.length());
            ErrorResponseWriter.write(response, objectMapper, ErrorResponse.badRequest(
                HEADER_IDEMPOTENCY_KEY + " must be at most " + MAX_IDEMPOTENCY_KEY_LENGTH + " characters"));
            return;
        }

        Optional<IdempotencyRecord> cached;
        try {
            cached = store.findIdempotencyRecord(key);
        } catch (DataAccessException e) {
            log.error("[Idempotency] Lookup failed for key {}: {}", key, e.getMessage());
            ErrorResponseWriter.write(response, objectMapper, ErrorResponse.internalError("idempotency check failed"));
            return;
        }

        if (cached.isPresent()) {
            replay(key, cached.get(), response);
            return;
        }

        ContentCachingResponseWrapper wrapper = new ContentCachingResponseWrapper(response);
        try {
            filterChain.doFilter(request, wrapper);
            saveIfSuccessful(key, wrapper);
        } finally {
            wrapper.copyBodyToResponse();
        }
    }

    private void replay(String key, IdempotencyRecord record, HttpServletResponse response) throws IOException {
        log.info("[Idempotency] Replaying cached response for key {} (status {})", key, record.getStatusCode());
        metricsProvider.recordIdempotentReplay();
        statsAggregator.record(StatsEvent.of(StatsEvent.Type.IDEMPOTENT_REPLAY));

        response.setStatus(record.getStatusCode());
        if (record.getContentType() != null) {
            response.setContentType(record.getContentType());
        }
        byte[] body = record.getResponseBody() != null ? record.getResponseBody() : new byte[0];
        response.setContentLength(body.length);
        response.getOutputStream().write(body);
        response.flushBuffer();
    }

    private void saveIfSuccessful(String key, ContentCachingResponseWrapper wrapper) {
        int status = wrapper.getStatus();
        if (status >= 400) {
            log.debug("[Idempotency] Not caching status {} for key {}", status, key);
            return;
        }
        try {
            store.insertIdempotencyRecord(IdempotencyRecord.builder()
                .key(key)
                .statusCode(status)
                .responseBody(wrapper.getContentAsByteArray())
                .contentType(wrapper.getContentType())
                .build());
            log.debug("[Idempotency] Saved response for key {} (status {})", key, status);
        } catch (DuplicateKeyException e) {
            log.info("[Idempotency] Key {} was recorded by a concurrent request, keeping the first response", key);
        } catch (DataAccessException e) {
            log.error("[Idempotency] Failed to save response for key {}: {}", key, e.getMessage());
        }
    }

    private static String pathWithinApplication(HttpServletRequest request) {
        String uri = request.getRequestURI();
        String contextPath = request.getContextPath();
        if (contextPath != null && !contextPath.isEmpty() && uri.startsWith(contextPath)) {
            return uri.substring(contextPath.length());
        }
        return uri;
    }
}
