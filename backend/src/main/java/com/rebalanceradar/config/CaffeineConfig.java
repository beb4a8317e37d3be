package com.rebalanceradar.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Caffeine in-process caches. Block timestamps never change once a block is final, so entries
 * only expire to bound memory.
 */
@Configuration
@EnableCaching
public class CaffeineConfig {

    public static final String BLOCK_TIMESTAMP_CACHE = "blockTimestampCache";

    @Bean
    public CacheManager caffeineCacheManager() {
        CaffeineCacheManager manager = new CaffeineCacheManager();
        manager.registerCustomCache(BLOCK_TIMESTAMP_CACHE, Caffeine.newBuilder()
                .expireAfterAccess(6, TimeUnit.HOURS)
                .maximumSize(50_000)
                .build());
        return manager;
    }
}
