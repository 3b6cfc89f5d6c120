package io.github.vevoly.jlayeredcache.core.config;

import io.github.vevoly.jlayeredcache.api.config.ResolvedJLayeredCacheConfig;
import io.github.vevoly.jlayeredcache.api.constants.JLayeredCacheConstants;
import io.github.vevoly.jlayeredcache.core.properties.JLayeredCacheDomainProperties;
import io.github.vevoly.jlayeredcache.core.properties.JLayeredCacheRootProperties;
import io.github.vevoly.jlayeredcache.core.utils.I18nLogger;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.InitializingBean;

import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 多级缓存配置解析器。
 * <p>
 * 此组件在 Spring 容器启动时运行 (通过 {@link InitializingBean})，先校验全局配置，
 * 再将 YML 中每个领域的配置与全局默认值、框架常量合并，构建成不可变的 {@link ResolvedJLayeredCacheConfig}。
 * YML 中没有配置的领域会在第一次使用时按默认值解析，命名空间即领域名称。
 * 全局配置错误是整个框架中唯一会抛出异常的地方，因为它们发生在任何调用者使用缓存之前。
 * <p>
 * The layered cache configuration resolver.
 * This component runs on Spring container startup (via {@link InitializingBean}). It validates the global settings first,
 * then merges every domain block from YML with the global defaults and the framework constants into an immutable
 * {@link ResolvedJLayeredCacheConfig}.
 * Domains missing from YML are resolved from the defaults on first use, with the domain name as namespace.
 * Invalid global settings are the only place the framework throws, because they happen before any caller uses the cache.
 *
 * @author vevoly
 */
@Slf4j
public class JLayeredCacheConfigResolver implements InitializingBean {

    public static final String LOG_PREFIX = "[JLayeredCacheResolver] ";

    private final I18nLogger i18nLog = new I18nLogger(log);

    private final JLayeredCacheRootProperties rootProperties;
    private final Map<String, ResolvedJLayeredCacheConfig> resolvedConfigMap = new ConcurrentHashMap<>();

    public JLayeredCacheConfigResolver(JLayeredCacheRootProperties rootProperties) {
        this.rootProperties = Optional.ofNullable(rootProperties).orElseGet(JLayeredCacheRootProperties::new);
    }

    /**
     * 在所有 Spring Bean 属性被设置后，由 Spring 容器自动调用。
     * <p>
     * Invoked by the Spring container after all bean properties have been set.
     *
     * @throws IllegalStateException 全局配置不合法时 / if a global setting is invalid
     */
    @Override
    public void afterPropertiesSet() {
        i18nLog.info("resolver.start_parse");
        validateGlobals();

        Map<String, JLayeredCacheDomainProperties> domains = rootProperties.getDomains();
        if (domains == null || domains.isEmpty()) {
            i18nLog.info("resolver.no_domains");
            return;
        }
        for (Map.Entry<String, JLayeredCacheDomainProperties> entry : domains.entrySet()) {
            if (StringUtils.isBlank(entry.getKey())) {
                throw new IllegalStateException(LOG_PREFIX + "Domain name under 'j-layered-cache.domains' must not be blank.");
            }
            resolvedConfigMap.put(entry.getKey(), build(entry.getKey(), entry.getValue()));
        }
        i18nLog.info("resolver.complete", resolvedConfigMap.size());
    }

    /**
     * 获取某个领域最终生效的配置。未配置的领域按默认值解析并缓存。
     * <p>
     * Gets the effective configuration of a domain. Unconfigured domains are resolved from the defaults and remembered.
     *
     * @param domain 领域标识 / the domain tag
     * @return 归一化后的配置对象 / the normalized configuration
     * @throws IllegalArgumentException 领域标识为空时 / if the domain tag is blank
     */
    public ResolvedJLayeredCacheConfig resolve(String domain) {
        if (StringUtils.isBlank(domain)) {
            throw new IllegalArgumentException(LOG_PREFIX + "Domain cannot be blank.");
        }
        return resolvedConfigMap.computeIfAbsent(domain, name -> {
            JLayeredCacheDomainProperties props = Optional.ofNullable(rootProperties.getDomains())
                    .map(map -> map.get(name))
                    .orElse(null);
            ResolvedJLayeredCacheConfig resolved = build(name, props);
            i18nLog.debug("resolver.domain_on_the_fly", name, resolved.getNamespace());
            return resolved;
        });
    }

    public Collection<ResolvedJLayeredCacheConfig> getAllResolvedConfigs() {
        return Collections.unmodifiableCollection(resolvedConfigMap.values());
    }

    public Duration getLocalMaxTtl() {
        return rootProperties.getLocal().getMaxTtl();
    }

    public long getLocalMaxSize() {
        return rootProperties.getLocal().getMaxSize();
    }

    public Duration getSharedTimeout() {
        return rootProperties.getShared().getTimeout();
    }

    public int getMaxKeyLength() {
        return rootProperties.getKey().getMaxLength();
    }

    private void validateGlobals() {
        Duration maxTtl = rootProperties.getLocal().getMaxTtl();
        if (maxTtl == null || maxTtl.isNegative() || maxTtl.isZero()) {
            throw new IllegalStateException(LOG_PREFIX + "'j-layered-cache.local.max-ttl' must be positive, got " + maxTtl);
        }
        if (rootProperties.getLocal().getMaxSize() <= 0) {
            throw new IllegalStateException(LOG_PREFIX + "'j-layered-cache.local.max-size' must be positive, got " + rootProperties.getLocal().getMaxSize());
        }
        Duration timeout = rootProperties.getShared().getTimeout();
        if (timeout == null || timeout.toMillis() < 1) {
            throw new IllegalStateException(LOG_PREFIX + "'j-layered-cache.shared.timeout' must be at least 1ms, got " + timeout);
        }
        if (rootProperties.getKey().getMaxLength() < JLayeredCacheConstants.MIN_MAX_KEY_LENGTH) {
            throw new IllegalStateException(LOG_PREFIX + "'j-layered-cache.key.max-length' must be at least "
                    + JLayeredCacheConstants.MIN_MAX_KEY_LENGTH + ", got " + rootProperties.getKey().getMaxLength());
        }
        JLayeredCacheDomainProperties defaults = defaults();
        mergeTtl("defaults", "ttl", null, defaults.getTtl(), JLayeredCacheConstants.DEFAULT_TTL);
        mergeTtl("defaults", "collection-ttl", null, defaults.getCollectionTtl(), JLayeredCacheConstants.DEFAULT_COLLECTION_TTL);
    }

    private ResolvedJLayeredCacheConfig build(String domain, JLayeredCacheDomainProperties props) {
        JLayeredCacheDomainProperties own = Optional.ofNullable(props).orElseGet(JLayeredCacheDomainProperties::new);
        JLayeredCacheDomainProperties defaults = defaults();

        // Namespace: Domain -> Domain Name, with the optional global prefix
        String namespace = StringUtils.defaultIfBlank(own.getNamespace(), domain);
        if (StringUtils.isNotBlank(defaults.getNamespace())) {
            namespace = defaults.getNamespace() + JLayeredCacheConstants.KEY_DELIMITER + namespace;
        }
        // TTL: Domain -> Default -> Constant
        Duration ttl = mergeTtl(domain, "ttl", own.getTtl(), defaults.getTtl(), JLayeredCacheConstants.DEFAULT_TTL);
        Duration collectionTtl = mergeTtl(domain, "collection-ttl", own.getCollectionTtl(), defaults.getCollectionTtl(), JLayeredCacheConstants.DEFAULT_COLLECTION_TTL);

        return ResolvedJLayeredCacheConfig.builder()
                .name(domain)
                .namespace(namespace)
                .ttl(ttl)
                .collectionTtl(collectionTtl)
                .build();
    }

    /**
     * 合并 TTL：领域 -> 默认 -> 常量。{@code -1} 表示不过期，返回 {@code null}；0 或其它负数是配置错误。
     * <p>
     * Merges a TTL: domain, then defaults, then the constant. {@code -1} means no expiry and yields {@code null};
     * zero or any other negative value is a configuration error.
     */
    private static Duration mergeTtl(String domain, String property, Duration own, Duration fallback, long constantSeconds) {
        Duration chosen = Optional.ofNullable(own)
                .or(() -> Optional.ofNullable(fallback))
                .orElse(Duration.ofSeconds(constantSeconds));
        if (isNoExpiry(chosen)) {
            return null;
        }
        if (chosen.isZero() || chosen.isNegative()) {
            throw new IllegalStateException(LOG_PREFIX + "'" + property + "' of '" + domain
                    + "' must be positive or -1 (no expiry), got " + chosen);
        }
        return chosen;
    }

    // 兼容 -1 (默认为毫秒) 和 -1s (秒)
    private static boolean isNoExpiry(Duration duration) {
        return duration.toMillis() == -1 || duration.getSeconds() == -1 && duration.getNano() == 0;
    }

    private JLayeredCacheDomainProperties defaults() {
        return Optional.ofNullable(rootProperties.getDefaults()).orElseGet(JLayeredCacheDomainProperties::new);
    }
}
