package com.xcpradar.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Caffeine in-process caches. Block times never change once mined, so entries only expire to bound memory.
 */
@Configuration
public class CaffeineConfig {

    public static final String BLOCK_TIME_CACHE = "blockTimeCache";

    @Bean(name = BLOCK_TIME_CACHE)
    public Cache<Long, Long> blockTimeCache() {
        return Caffeine.newBuilder()
                .expireAfterAccess(24, TimeUnit.HOURS)
                .maximumSize(10_000)
                .build();
    }
}
