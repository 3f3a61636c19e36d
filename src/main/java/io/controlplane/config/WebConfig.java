package io.controlplane.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.controlplane.api.filters.AuthFilter;
import io.controlplane.api.filters.ConcurrencyLimitFilter;
import io.controlplane.api.filters.IdempotencyFilter;
import io.controlplane.api.filters.RateLimitFilter;
import io.controlplane.api.filters.RequestLoggingFilter;
import io.controlplane.metrics.MetricsProvider;
import io.controlplane.stats.StatsAggregator;
import io.controlplane.store.LedgerStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;

import javax.servlet.Filter;

import static io.controlplane.config.Constants.API_PREFIX;

/**
 * Servlet filter chain for the /v1 API.
 * Order: request logging, auth, rate limit, concurrency limit, idempotency. The admission
 * filters are registered only when their limit is configured.
 */
@Slf4j
@Configuration
public class WebConfig {

    private static final String API_PATTERN = API_PREFIX + "/*";
    private static final int BASE_ORDER = Ordered.HIGHEST_PRECEDENCE + 10;

    @Bean
    public FilterRegistrationBean<RequestLoggingFilter> requestLoggingFilter() {
        return register(new RequestLoggingFilter(), "requestLoggingFilter", 0);
    }

    @Bean
    public FilterRegistrationBean<AuthFilter> authFilter(ControlPlaneConfig config, ObjectMapper objectMapper) {
        return register(new AuthFilter(config.getAuthToken(), objectMapper), "authFilter", 1);
    }

    @Bean
    public FilterRegistrationBean<RateLimitFilter> rateLimitFilter(ControlPlaneConfig config, ObjectMapper objectMapper) {
        double rps = config.getRequestsPerSecond();
        FilterRegistrationBean<RateLimitFilter> registration =
            register(new RateLimitFilter(rps > 0 ? rps : Double.MAX_VALUE, objectMapper), "rateLimitFilter", 2);
        registration.setEnabled(rps > 0);
        log.info("Rate limiting {}", rps > 0 ? "enabled at " + rps + " req/s" : "disabled");
        return registration;
    }

    @Bean
    public FilterRegistrationBean<ConcurrencyLimitFilter> concurrencyLimitFilter(ControlPlaneConfig config,
                                                                                 ObjectMapper objectMapper) {
        int max = config.getMaxConcurrentRequests();
        FilterRegistrationBean<ConcurrencyLimitFilter> registration =
            register(new ConcurrencyLimitFilter(max > 0 ? max : Integer.MAX_VALUE, objectMapper), "concurrencyLimitFilter", 3);
        registration.setEnabled(max > 0);
        log.info("Concurrency limiting {}", max > 0 ? "enabled at " + max + " in-flight requests" : "disabled");
        return registration;
    }

    @Bean
    public FilterRegistrationBean<IdempotencyFilter> idempotencyFilter(ControlPlaneConfig config,
                                                                       LedgerStore store,
                                                                       ObjectMapper objectMapper,
                                                                       MetricsProvider metricsProvider,
                                                                       StatsAggregator statsAggregator) {
        IdempotencyFilter filter = new IdempotencyFilter(
            store, config.getIdempotencyExemptPaths(), objectMapper, metricsProvider, statsAggregator);
        return register(filter, "idempotencyFilter", 4);
    }

    private static <T extends Filter> FilterRegistrationBean<T> register(T filter, String name, int position) {
        FilterRegistrationBean<T> registration = new FilterRegistrationBean<>(filter);
        registration.setName(name);
        registration.addUrlPatterns(API_PATTERN);
        registration.setOrder(BASE_ORDER + position);
        return registration;
    }
}
