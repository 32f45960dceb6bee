package com.example.transfersim.config;

import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.cache.RedisCacheConfiguration;
import org.springframework.data.redis.cache.RedisCacheManager;
import org.springframework.data.redis.connection.RedisConnectionFactory;

import java.time.Duration;

/**
 * Redis 快取配置
 *
 * 功能：
 * 1. 啟用 Spring Cache 框架 (@EnableCaching)
 * 2. 快取銀行連線設定（bankConnections），TTL 300 秒
 * 3. 快取鍵格式：{cacheName}:{key}
 * 4. 使用 JDK 序列化（BankConnectionInfo 為 Serializable）
 */
@Configuration
@EnableCaching
public class RedisCacheConfig {

    @Bean
    public CacheManager cacheManager(RedisConnectionFactory connectionFactory) {
        RedisCacheConfiguration cacheConfig = RedisCacheConfiguration.defaultCacheConfig()
            .entryTtl(Duration.ofSeconds(300))
            .computePrefixWith(cacheName -> cacheName + ":");

        return RedisCacheManager.builder(connectionFactory)
            .cacheDefaults(cacheConfig)
            .build();
    }
}
