package com.socialfeed.ingest.config;

import com.google.common.util.concurrent.RateLimiter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RateLimiterConfig {

    @Value("${app.enrichment.rate-limit:2.0}") // permits per second, 0 = unlimited
    private double enrichmentRateLimit;

    @Bean("enrichmentRateLimiter")
    @SuppressWarnings("UnstableApiUsage")
    public RateLimiter enrichmentRateLimiter() {
        double effectiveQps = enrichmentRateLimit > 0 ? enrichmentRateLimit : Double.MAX_VALUE;
        return RateLimiter.create(effectiveQps);
    }
}
