package io.github.vevoly.jlayeredcache.starter.autoconfigure;

import io.github.vevoly.jlayeredcache.core.utils.I18nLogger;
import lombok.extern.slf4j.Slf4j;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.StringCodec;
import org.redisson.config.Config;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.data.redis.RedisProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Redisson 配置。
 * 应用中已经有 RedissonClient 时直接复用，否则按 {@code spring.data.redis.*} 创建一个单机客户端。
 * 客户端的生命周期由 Spring 容器管理，缓存本身从不关闭它。
 * @author vevoly
 */
@Slf4j
@Configuration(proxyBeanMethods = false)
@EnableConfigurationProperties(RedisProperties.class)
public class JLayeredCacheRedissonConfiguration {

    private static final int DEFAULT_TIMEOUT_MILLIS = 3000;
    private static final int DEFAULT_CONNECT_TIMEOUT_MILLIS = 10000;

    private final I18nLogger i18nLog = new I18nLogger(log);

    @Bean(name = "jLayeredCacheRedissonClient", destroyMethod = "shutdown")
    @ConditionalOnMissingBean(RedissonClient.class)
    public RedissonClient jLayeredCacheRedissonClient(RedisProperties redisProperties) {
        Config config = new Config();
        config.setCodec(new StringCodec());

        String address = toAddress(redisProperties);

        // 设置默认超时时间
        int timeout = DEFAULT_TIMEOUT_MILLIS;
        if (redisProperties.getTimeout() != null) {
            timeout = (int) redisProperties.getTimeout().toMillis();
        }
        int connectTimeout = DEFAULT_CONNECT_TIMEOUT_MILLIS;
        if (redisProperties.getConnectTimeout() != null) {
            connectTimeout = (int) redisProperties.getConnectTimeout().toMillis();
        }
        config.useSingleServer()
                .setAddress(address)
                .setDatabase(redisProperties.getDatabase())
                .setUsername(redisProperties.getUsername())
                .setPassword(redisProperties.getPassword())
                .setTimeout(timeout)
                .setConnectTimeout(connectTimeout);
        i18nLog.info("autoconfig.redisson_created", address);
        return Redisson.create(config);
    }

    static String toAddress(RedisProperties redisProperties) {
        String prefix = redisProperties.getSsl().isEnabled() ? "rediss://" : "redis://";
        return prefix + redisProperties.getHost() + ":" + redisProperties.getPort();
    }
}
