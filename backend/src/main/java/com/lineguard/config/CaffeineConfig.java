package com.lineguard.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Caffeine in-process caches. Match results are short-lived so catalog edits show up quickly;
 * classification scores are kept a day as the fallback when the classifier times out.
 */
@Configuration
@EnableCaching
public class CaffeineConfig {

    public static final String MATCH_RESULT_CACHE = "matchResultCache";
    public static final String CLASSIFICATION_CACHE = "classificationCache";

    @Bean
    public CacheManager caffeineCacheManager() {
        CaffeineCacheManager manager = new CaffeineCacheManager();
        manager.registerCustomCache(MATCH_RESULT_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(10, TimeUnit.MINUTES)
                .maximumSize(10_000)
                .build());
        manager.registerCustomCache(CLASSIFICATION_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(24, TimeUnit.HOURS)
                .maximumSize(10_000)
                .build());
        return manager;
    }
}
