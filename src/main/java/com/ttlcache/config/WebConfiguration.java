package com.ttlcache.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ttlcache.RateLimitingFilter;
import com.ttlcache.core.RateLimiter;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the API rate limiting filter
 */
@Configuration
public class WebConfiguration {
    
    @Bean
    public FilterRegistrationBean<RateLimitingFilter> rateLimitingFilter(
            @Qualifier("apiRateLimiter") RateLimiter apiRateLimiter,
            ObjectMapper objectMapper) {
        
        FilterRegistrationBean<RateLimitingFilter> registration =
                new FilterRegistrationBean<>(new RateLimitingFilter(apiRateLimiter, objectMapper));
        registration.addUrlPatterns("/api/*");
        registration.setName("rateLimitingFilter");
        return registration;
    }
}
