package com.example.omnichat.config;

import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.data.redis.RedisProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

/**
 * Redisson backs the resolver locks and the cross-node room topic. Connection details come from the
 * standard {@code spring.data.redis.*} properties.
 */
@Configuration
public class RedissonConfig {

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    public RedissonClient redissonClient(RedisProperties redisProperties) {
        Config config = new Config();
        config.useSingleServer()
                .setAddress(buildAddress(redisProperties))
                .setDatabase(redisProperties.getDatabase())
                .setUsername(redisProperties.getUsername())
                .setPassword(StringUtils.hasText(redisProperties.getPassword()) ? redisProperties.getPassword() : null)
                .setConnectionMinimumIdleSize(2);
        return Redisson.create(config);
    }

    static String buildAddress(RedisProperties redisProperties) {
        boolean sslEnabled = redisProperties.getSsl() != null && redisProperties.getSsl().isEnabled();
        return (sslEnabled ? "rediss://" : "redis://") + redisProperties.getHost() + ":" + redisProperties.getPort();
    }
}
