package com.zecinsight.performance.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.zecinsight.performance.QueryCache;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Raw Caffeine store backing {@link QueryCache}. Entries carry their own write time so per-call TTLs
 * can be shorter than the store-wide expiry.
 */
@Configuration
@EnableConfigurationProperties(PerformanceProperties.class)
public class PerformanceConfig {

    @Bean
    public Cache<String, QueryCache.Entry> queryCacheStore(PerformanceProperties properties) {
        return Caffeine.newBuilder()
                .maximumSize(properties.getQueryCacheMaxSize())
                .expireAfterWrite(properties.getQueryCacheTtl().plus(properties.getDashboardTtl()))
                .build();
    }
}
