package io.github.vevoly.jlayeredcache.starter.autoconfigure;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.github.vevoly.jlayeredcache.api.JLayeredCacheOps;
import io.github.vevoly.jlayeredcache.core.config.JLayeredCacheConfigResolver;
import io.github.vevoly.jlayeredcache.core.internal.JLayeredCacheManagerConfiguration;
import io.github.vevoly.jlayeredcache.core.internal.NoOpJLayeredCacheManager;
import io.github.vevoly.jlayeredcache.core.properties.JLayeredCacheRootProperties;
import io.github.vevoly.jlayeredcache.core.utils.I18nLogger;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RedissonClient;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

/**
 * j-layered-cache 的自动配置类。
 * <p>
 * 负责初始化和组装框架的所有核心组件，包括：
 * 1. 激活配置属性。
 * 2. 初始化配置解析器和框架专用的 ObjectMapper。
 * 3. 配置 Redis 客户端 (基于 Redisson，已有 RedissonClient 时直接复用)。
 * 4. 组装 L1/L2 后端、多级编排器和缓存管理器。
 * <p>
 * Auto-configuration class for j-layered-cache.
 * Responsible for initializing and assembling all core components of the framework, including:
 * 1. Activating configuration properties.
 * 2. Initializing the configuration resolver and the framework's own ObjectMapper.
 * 3. Configuring the Redis client (based on Redisson; an existing RedissonClient is reused).
 * 4. Assembling the L1/L2 backends, the layered orchestrator and the cache manager.
 *
 * @author vevoly
 */
@Slf4j
@AutoConfiguration(afterName = {
        "org.redisson.spring.starter.RedissonAutoConfiguration",
        "org.redisson.spring.starter.RedissonAutoConfigurationV2"
})
@ConditionalOnClass({RedissonClient.class, Caffeine.class})
@EnableConfigurationProperties(JLayeredCacheRootProperties.class)
public class JLayeredCacheAutoConfiguration {

    /**
     * 【启用模式】
     * {@code j-layered-cache.enabled} 为 true 或未配置。
     * 此时加载真实的组件：Redis 连接、两级后端、缓存管理器。
     */
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "j-layered-cache", name = "enabled", havingValue = "true", matchIfMissing = true)
    @Import({
            JLayeredCacheManagerConfiguration.class,   // 真实 Manager / Real Manager
            JLayeredCacheRedissonConfiguration.class,  // Redisson 配置 / Redisson configuration
    })
    static class JLayeredCacheActiveConfiguration {

        private final I18nLogger i18nLog = new I18nLogger(log);

        /**
         * 1. 配置 Jackson ObjectMapper
         * 配置框架专用的 ObjectMapper，避免受用户全局配置污染。
         * 缓存中的旧数据可能比当前类多出字段，因此忽略未知属性。
         */
        @Bean("jLayeredCacheObjectMapper")
        @ConditionalOnMissingBean(name = "jLayeredCacheObjectMapper")
        public ObjectMapper jLayeredCacheObjectMapper() {
            ObjectMapper mapper = new ObjectMapper();
            mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
            return mapper;
        }

        /**
         * 2. 配置 Config Resolver (核心配置解析器)
         * 它必须先于两级后端初始化，因为它提供了 L1 上限、L2 超时等全局配置。
         */
        @Bean
        public JLayeredCacheConfigResolver jLayeredCacheConfigResolver(JLayeredCacheRootProperties rootProperties) {
            i18nLog.info("autoconfig.enabled",
                    rootProperties.getLocal().getMaxTtl(),
                    rootProperties.getLocal().getMaxSize(),
                    rootProperties.getShared().getTimeout());
            return new JLayeredCacheConfigResolver(rootProperties);
        }
    }

    /**
     * 【降级模式】
     * {@code j-layered-cache.enabled=false}。
     * 此时不加载任何重资源（Redis/Caffeine），只注册一个空实现的 Manager，防止依赖注入报错。
     */
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "j-layered-cache", name = "enabled", havingValue = "false")
    static class JLayeredCacheFallbackConfiguration {

        @Bean
        @ConditionalOnMissingBean(JLayeredCacheOps.class)
        public JLayeredCacheOps jLayeredCacheFallback(JLayeredCacheRootProperties rootProperties) {
            // 返回空实现，所有读取都未命中；缓存键仍按配置的命名空间生成
            return new NoOpJLayeredCacheManager(rootProperties);
        }
    }
}
