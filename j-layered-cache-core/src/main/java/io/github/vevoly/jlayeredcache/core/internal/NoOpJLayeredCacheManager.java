package io.github.vevoly.jlayeredcache.core.internal;

import com.fasterxml.jackson.core.type.TypeReference;
import io.github.vevoly.jlayeredcache.api.JLayeredCacheOps;
import io.github.vevoly.jlayeredcache.api.config.ResolvedJLayeredCacheConfig;
import io.github.vevoly.jlayeredcache.api.constants.JLayeredCacheConstants;
import io.github.vevoly.jlayeredcache.api.key.CacheKey;
import io.github.vevoly.jlayeredcache.api.structure.JLayeredCacheStats;
import io.github.vevoly.jlayeredcache.core.config.JLayeredCacheConfigResolver;
import io.github.vevoly.jlayeredcache.core.key.CacheKeyGenerator;
import io.github.vevoly.jlayeredcache.core.properties.JLayeredCacheRootProperties;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 降级实现类（当 {@code j-layered-cache.enabled=false} 时使用）。
 * 所有读取都未命中，所有写入都是空操作；缓存键仍然按配置的命名空间生成，与启用时一致。
 * @author vevoly
 */
@Slf4j
public class NoOpJLayeredCacheManager implements JLayeredCacheOps {

    private static final String LOG_PREFIX = "[JLayeredCache-NoOp] ";

    private final JLayeredCacheConfigResolver configResolver;
    private final CacheKeyGenerator keyGenerator;

    public NoOpJLayeredCacheManager() {
        this(new JLayeredCacheRootProperties());
    }

    public NoOpJLayeredCacheManager(JLayeredCacheRootProperties rootProperties) {
        this.configResolver = new JLayeredCacheConfigResolver(rootProperties);
        this.keyGenerator = new CacheKeyGenerator(Math.max(configResolver.getMaxKeyLength(), JLayeredCacheConstants.MIN_MAX_KEY_LENGTH));
        log.warn(LOG_PREFIX + "j-layered-cache.enabled=false, every read is a miss and every write is ignored.");
    }

    @Override
    public CacheKey generateKey(String prefix, List<?> positional, Map<String, ?> named) {
        return keyGenerator.generate(prefix, positional, named);
    }

    @Override
    public CacheKey generateKey(String prefix, Object... positional) {
        return keyGenerator.generate(prefix, positional);
    }

    @Override
    public CacheKey entityKey(String domain, Object id) {
        try {
            return keyGenerator.generate(configResolver.resolve(domain).getNamespace(), id);
        } catch (RuntimeException e) {
            log.warn(LOG_PREFIX + "Cannot build entity key. Domain: {}, Error: {}", domain, e.getMessage());
            return null;
        }
    }

    @Override
    public CacheKey collectionKey(String domain, Object id, int page, int limit) {
        try {
            ResolvedJLayeredCacheConfig config = configResolver.resolve(domain);
            Map<String, Object> named = new LinkedHashMap<>();
            named.put(JLayeredCacheConstants.PAGE_COMPONENT, page);
            named.put(JLayeredCacheConstants.LIMIT_COMPONENT, limit);
            return keyGenerator.generate(config.getCollectionNamespace(), Collections.singletonList(id), named);
        } catch (RuntimeException e) {
            log.warn(LOG_PREFIX + "Cannot build collection key. Domain: {}, Error: {}", domain, e.getMessage());
            return null;
        }
    }

    @Override
    public <T> Optional<T> get(String domain, Object id, Class<T> type) {
        return Optional.empty();
    }

    @Override
    public <T> Optional<T> get(String domain, Object id, TypeReference<T> type) {
        return Optional.empty();
    }

    @Override
    public void set(String domain, Object id, Object value, Duration ttl) {
    }

    @Override
    public void set(String domain, Object id, Object value) {
    }

    @Override
    public boolean exists(String domain, Object id) {
        return false;
    }

    @Override
    public <T> Optional<T> getCollection(String domain, Object id, int page, int limit, Class<T> type) {
        return Optional.empty();
    }

    @Override
    public <T> Optional<T> getCollection(String domain, Object id, int page, int limit, TypeReference<T> type) {
        return Optional.empty();
    }

    @Override
    public void setCollection(String domain, Object id, Object value, int page, int limit, Duration ttl) {
    }

    @Override
    public void setCollection(String domain, Object id, Object value, int page, int limit) {
    }

    @Override
    public void invalidate(String domain, Object id) {
    }

    @Override
    public long invalidatePattern(String pattern) {
        return 0L;
    }

    @Override
    public long clearAll() {
        return 0L;
    }

    @Override
    public void clearLocal() {
    }

    @Override
    public JLayeredCacheStats getStats() {
        return JLayeredCacheStats.builder().build();
    }
}
