package io.controlplane.api.filters;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import javax.servlet.FilterChain;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class AdmissionFiltersTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void testConcurrencyLimit_RejectsWhenNoPermit() throws Exception {
        // Given
        ConcurrencyLimitFilter filter = new ConcurrencyLimitFilter(1, objectMapper);
        MockHttpServletResponse inner = new MockHttpServletResponse();
        AtomicInteger innerStatus = new AtomicInteger();

        // When - a nested request arrives while the first still holds the only permit
        FilterChain holdsPermit = (req, res) -> {
            filter.doFilter(new MockHttpServletRequest("POST", "/v1/provision"), inner, new MockFilterChain());
            innerStatus.set(inner.getStatus());
        };
        filter.doFilter(new MockHttpServletRequest("POST", "/v1/provision"), new MockHttpServletResponse(), holdsPermit);

        // Then
        assertThat(innerStatus.get()).isEqualTo(429);
        assertThat(inner.getContentAsString()).contains("too_many_requests");
        assertThat(filter.availablePermits()).isEqualTo(1);
    }

    @Test
    void testConcurrencyLimit_ReleasesPermitOnFailure() {
        ConcurrencyLimitFilter filter = new ConcurrencyLimitFilter(1, objectMapper);
        FilterChain failing = (req, res) -> {
            throw new IllegalStateException("boom");
        };

        assertThatThrownBy(() ->
            filter.doFilter(new MockHttpServletRequest("GET", "/v1/state"), new MockHttpServletResponse(), failing))
            .isInstanceOf(IllegalStateException.class);
        assertThat(filter.availablePermits()).isEqualTo(1);
    }

    @Test
    void testRateLimit_RejectsBurstBeyondBucket() throws Exception {
        // Given - one token per ten seconds
        RateLimitFilter filter = new RateLimitFilter(0.1, objectMapper);
        MockHttpServletResponse first = new MockHttpServletResponse();
        MockHttpServletResponse second = new MockHttpServletResponse();

        // When
        filter.doFilter(new MockHttpServletRequest("GET", "/v1/state"), first, new MockFilterChain());
        filter.doFilter(new MockHttpServletRequest("GET", "/v1/state"), second, new MockFilterChain());

        // Then
        assertThat(first.getStatus()).isEqualTo(200);
        assertThat(second.getStatus()).isEqualTo(429);
    }
}
