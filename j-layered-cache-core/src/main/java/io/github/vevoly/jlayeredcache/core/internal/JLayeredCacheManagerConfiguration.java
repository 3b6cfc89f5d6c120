package io.github.vevoly.jlayeredcache.core.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.vevoly.jlayeredcache.api.JLayeredCacheOps;
import io.github.vevoly.jlayeredcache.core.backend.LocalCacheBackend;
import io.github.vevoly.jlayeredcache.core.backend.RedissonSharedCacheBackend;
import io.github.vevoly.jlayeredcache.core.config.JLayeredCacheConfigResolver;
import io.github.vevoly.jlayeredcache.core.key.CacheKeyGenerator;
import org.redisson.api.RedissonClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * JLayeredCacheManager 配置类。
 * <p>
 * 按配置解析器给出的全局设置组装两级后端、编排器和缓存管理器。
 * {@link RedissonClient} 由外部提供，这里只注入使用。
 * @author vevoly
 */
@Configuration
public class JLayeredCacheManagerConfiguration {

    @Bean
    public LocalCacheBackend jLayeredCacheLocalBackend(JLayeredCacheConfigResolver configResolver) {
        return new LocalCacheBackend(configResolver.getLocalMaxTtl(), configResolver.getLocalMaxSize());
    }

    @Bean
    public RedissonSharedCacheBackend jLayeredCacheSharedBackend(
            RedissonClient redissonClient,
            @Qualifier("jLayeredCacheObjectMapper") ObjectMapper objectMapper,
            JLayeredCacheConfigResolver configResolver
    ) {
        return new RedissonSharedCacheBackend(redissonClient, objectMapper, configResolver.getSharedTimeout());
    }

    @Bean
    public LayeredCache jLayeredCacheLayeredCache(LocalCacheBackend localBackend, RedissonSharedCacheBackend sharedBackend) {
        return new LayeredCache(localBackend, sharedBackend);
    }

    @Bean
    public CacheKeyGenerator jLayeredCacheKeyGenerator(JLayeredCacheConfigResolver configResolver) {
        return new CacheKeyGenerator(configResolver.getMaxKeyLength());
    }

    @Bean
    public CollectionKeyRegistry jLayeredCacheCollectionKeyRegistry() {
        return new CollectionKeyRegistry();
    }

    @Bean
    public JLayeredCacheOps jLayeredCacheOps(
            LayeredCache layeredCache,
            CacheKeyGenerator keyGenerator,
            JLayeredCacheConfigResolver configResolver,
            CollectionKeyRegistry collectionKeyRegistry,
            @Qualifier("jLayeredCacheObjectMapper") ObjectMapper objectMapper
    ) {
        return new JLayeredCacheManager(layeredCache, keyGenerator, configResolver, collectionKeyRegistry, objectMapper);
    }
}
