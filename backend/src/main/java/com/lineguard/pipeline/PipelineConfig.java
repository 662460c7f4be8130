package com.lineguard.pipeline;

import com.lineguard.config.CaffeineConfig;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.cache.CacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.Objects;

/**
 * Pipeline configuration: properties and the classification client with its rate limiter.
 */
@Configuration
@EnableConfigurationProperties({PipelineProperties.class, ClassifierProperties.class})
public class PipelineConfig {

    @Bean(name = "classifierRateLimiter")
    public RateLimiter classifierRateLimiter(ClassifierProperties classifierProperties) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofMinutes(1))
                .limitForPeriod(Math.max(1, classifierProperties.getRequestsPerMinute()))
                .timeoutDuration(Duration.ZERO)
                .build();
        return RateLimiter.of("classifier", config);
    }

    @Bean
    public ItemClassifier itemClassifier(WebClient.Builder webClientBuilder,
                                         ClassifierProperties classifierProperties,
                                         @Qualifier("classifierRateLimiter") RateLimiter classifierRateLimiter,
                                         CacheManager cacheManager) {
        return new WebClientItemClassifier(
                webClientBuilder.baseUrl(classifierProperties.getBaseUrl()).build(),
                classifierRateLimiter,
                Duration.ofSeconds(Math.max(1, classifierProperties.getTimeoutSeconds())),
                Objects.requireNonNull(cacheManager.getCache(CaffeineConfig.CLASSIFICATION_CACHE)));
    }
}
