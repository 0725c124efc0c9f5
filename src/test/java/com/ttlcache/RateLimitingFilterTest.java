package com.ttlcache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ttlcache.core.BackoffPolicy;
import com.ttlcache.core.RateLimitConfig;
import com.ttlcache.core.RateLimitResult;
import com.ttlcache.core.RateLimiter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.http.HttpServletResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class RateLimitingFilterTest {

    private static final long RESET_TIME = 1_700_000_300_000L;

    @Mock
    private RateLimiter rateLimiter;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private RateLimitingFilter filter;
    private MockHttpServletRequest request;
    private MockHttpServletResponse response;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        when(rateLimiter.getConfig()).thenReturn(RateLimitConfig.builder()
                .name("api")
                .window(Duration.ofMinutes(5))
                .maxRequests(100)
                .exponentialBackoff(BackoffPolicy.disabled())
                .build());
        when(rateLimiter.generateKey(anyString())).thenAnswer(inv -> "rate-limit:" + inv.getArgument(0));

        filter = new RateLimitingFilter(rateLimiter, objectMapper);
        request = new MockHttpServletRequest("GET", "/api/quotes");
        request.addHeader("X-Forwarded-For", "203.0.113.7, 10.0.0.1");
        response = new MockHttpServletResponse();
    }

    @Test
    @DisplayName("Should pass allowed requests through and record success")
    void shouldAllowAndRecordSuccess() throws Exception {
        when(rateLimiter.checkRateLimit("rate-limit:203.0.113.7:GET:/api/quotes"))
                .thenReturn(RateLimitResult.builder()
                        .limited(false)
                        .remaining(42)
                        .resetTime(RESET_TIME)
                        .build());
        AtomicBoolean handled = new AtomicBoolean();

        filter.doFilter(request, response, (req, res) -> handled.set(true));

        assertTrue(handled.get());
        assertEquals(200, response.getStatus());
        assertEquals("100", response.getHeader("X-RateLimit-Limit"));
        assertEquals("42", response.getHeader("X-RateLimit-Remaining"));
        assertEquals("2023-11-14T22:18:20Z", response.getHeader("X-RateLimit-Reset"));
        verify(rateLimiter).recordRequest("rate-limit:203.0.113.7:GET:/api/quotes", true);
    }

    @Test
    @DisplayName("Should record error responses as failures")
    void shouldRecordFailure() throws Exception {
        when(rateLimiter.checkRateLimit(anyString())).thenReturn(RateLimitResult.builder()
                .limited(false)
                .remaining(10)
                .resetTime(RESET_TIME)
                .build());
        FilterChain failingChain = (req, res) -> ((HttpServletResponse) res).setStatus(401);

        filter.doFilter(request, response, failingChain);

        assertEquals(401, response.getStatus());
        verify(rateLimiter).recordRequest("rate-limit:203.0.113.7:GET:/api/quotes", false);
    }

    @Test
    @DisplayName("Should answer 429 without calling the handler when limited")
    void shouldRejectLimitedRequest() throws Exception {
        when(rateLimiter.checkRateLimit(anyString())).thenReturn(RateLimitResult.builder()
                .limited(true)
                .remaining(0)
                .resetTime(RESET_TIME)
                .retryAfter(17L)
                .blockedUntil(RESET_TIME - 1000)
                .build());
        AtomicBoolean handled = new AtomicBoolean();

        filter.doFilter(request, response, (req, res) -> handled.set(true));

        assertFalse(handled.get());
        assertEquals(429, response.getStatus());
        assertEquals("17", response.getHeader("Retry-After"));
        assertEquals("0", response.getHeader("X-RateLimit-Remaining"));

        JsonNode body = objectMapper.readTree(response.getContentAsString());
        assertEquals("Too many requests", body.get("message").asText());
        assertEquals(17, body.get("retryAfter").asLong());
        assertEquals(RESET_TIME - 1000, body.get("blockedUntil").asLong());
        verify(rateLimiter, never()).recordRequest(anyString(), anyBoolean());
    }

    @Test
    @DisplayName("Should omit Retry-After when the window is simply used up")
    void shouldOmitRetryAfterWithoutBlock() throws Exception {
        when(rateLimiter.checkRateLimit(anyString())).thenReturn(RateLimitResult.builder()
                .limited(true)
                .remaining(0)
                .resetTime(RESET_TIME)
                .build());

        filter.doFilter(request, response, (req, res) -> fail("handler must not run"));

        assertEquals(429, response.getStatus());
        assertNull(response.getHeader("Retry-After"));
        assertTrue(objectMapper.readTree(response.getContentAsString()).get("blockedUntil").isNull());
    }

    @Test
    @DisplayName("Should resolve the client ip from proxy headers")
    void shouldResolveClientIp() {
        MockHttpServletRequest forwarded = new MockHttpServletRequest();
        forwarded.addHeader("X-Forwarded-For", " 198.51.100.1 , 10.0.0.2");
        forwarded.addHeader("X-Real-IP", "10.0.0.9");
        assertEquals("198.51.100.1", RateLimitingFilter.clientIp(forwarded));

        MockHttpServletRequest realIp = new MockHttpServletRequest();
        realIp.addHeader("X-Real-IP", "10.0.0.9");
        assertEquals("10.0.0.9", RateLimitingFilter.clientIp(realIp));

        assertEquals("unknown", RateLimitingFilter.clientIp(new MockHttpServletRequest()));
    }
}
