package com.ttlcache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ttlcache.core.RateLimitResult;
import com.ttlcache.core.RateLimiter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Servlet filter applying a {@link RateLimiter} to every request it sees.
 *
 * Flow:
 * 1. Derive the key from client ip (X-Forwarded-For, then X-Real-IP), method and path
 * 2. Check the limit; when limited answer 429 without calling the handler
 * 3. Otherwise run the chain and record the request, successful when status < 400
 */
@Slf4j
public class RateLimitingFilter extends OncePerRequestFilter {

    static final String HEADER_LIMIT = "X-RateLimit-Limit";
    static final String HEADER_REMAINING = "X-RateLimit-Remaining";
    static final String HEADER_RESET = "X-RateLimit-Reset";
    static final String HEADER_RETRY_AFTER = "Retry-After";

    private final RateLimiter rateLimiter;
    private final ObjectMapper objectMapper;

    public RateLimitingFilter(RateLimiter rateLimiter, ObjectMapper objectMapper) {
        this.rateLimiter = rateLimiter;
        this.objectMapper = objectMapper;
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain) throws ServletException, IOException {

        String key = rateLimiter.generateKey(
                clientIp(request) + ":" + request.getMethod() + ":" + request.getRequestURI());
        RateLimitResult result = rateLimiter.checkRateLimit(key);

        if (result.isLimited()) {
            log.warn("Rate limit exceeded for {}", key);
            rejectRequest(response, result);
            return;
        }

        // Headers must be in place before the handler commits the response
        addRateLimitHeaders(response, result);
        filterChain.doFilter(request, response);

        rateLimiter.recordRequest(key, response.getStatus() < 400);
    }

    private void rejectRequest(HttpServletResponse response, RateLimitResult result) throws IOException {
        response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        addRateLimitHeaders(response, result);
        if (result.getRetryAfter() != null) {
            response.setHeader(HEADER_RETRY_AFTER, String.valueOf(result.getRetryAfter()));
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Too many requests");
        body.put("retryAfter", result.getRetryAfter());
        body.put("blockedUntil", result.getBlockedUntil());
        objectMapper.writeValue(response.getWriter(), body);
    }

    private void addRateLimitHeaders(HttpServletResponse response, RateLimitResult result) {
        response.setHeader(HEADER_LIMIT, String.valueOf(rateLimiter.getConfig().getMaxRequests()));
        response.setHeader(HEADER_REMAINING, String.valueOf(result.getRemaining()));
        response.setHeader(HEADER_RESET, Instant.ofEpochMilli(result.getResetTime()).toString());
    }

    static String clientIp(HttpServletRequest request) {
        String forwarded = request.getHeader("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",")[0].trim();
        }
        String realIp = request.getHeader("X-Real-IP");
        if (realIp != null && !realIp.isBlank()) {
            return realIp;
        }
        return "unknown";
    }
}
