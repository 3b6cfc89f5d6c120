package io.github.vevoly.jlayeredcache.api;

import io.github.vevoly.jlayeredcache.api.key.CacheKey;
import io.github.vevoly.jlayeredcache.api.structure.CachedRecord;

import java.time.Duration;
import java.util.Optional;

/**
 * 某个领域的类型化缓存视图。
 * 它只是 {@link JLayeredCacheOps} 的一层薄封装，把领域标识和结果类型固定下来，
 * 例如 {@code ops.domain("user", UserProfile.class)}。
 * <p>
 * A typed cache view over one domain.
 * It is a thin wrapper around {@link JLayeredCacheOps} that fixes the domain tag and the result type,
 * e.g. {@code ops.domain("user", UserProfile.class)}.
 *
 * @param <T> 领域对象类型 / the domain type
 * @author vevoly
 */
public final class CacheDomain<T> {

    private final JLayeredCacheOps ops;
    private final String domain;
    private final Class<T> type;

    CacheDomain(JLayeredCacheOps ops, String domain, Class<T> type) {
        this.ops = ops;
        this.domain = domain;
        this.type = type;
    }

    public String getDomain() {
        return domain;
    }

    public Optional<T> get(Object id) {
        return ops.get(domain, id, type);
    }

    /**
     * 读取实体并连同其缓存键一起返回。
     * <p>
     * Reads the entity and returns it together with its cache key.
     */
    public Optional<CachedRecord<T>> lookup(Object id) {
        return get(id).map(value -> new CachedRecord<>(keyOf(id), value));
    }

    public void set(Object id, T value) {
        ops.set(domain, id, value);
    }

    public void set(Object id, T value, Duration ttl) {
        ops.set(domain, id, value, ttl);
    }

    public boolean exists(Object id) {
        return ops.exists(domain, id);
    }

    public <C> Optional<C> getPage(Object id, int page, int limit, Class<C> pageType) {
        return ops.getCollection(domain, id, page, limit, pageType);
    }

    public void setPage(Object id, Object pageValue, int page, int limit) {
        ops.setCollection(domain, id, pageValue, page, limit);
    }

    public void setPage(Object id, Object pageValue, int page, int limit, Duration ttl) {
        ops.setCollection(domain, id, pageValue, page, limit, ttl);
    }

    public void invalidate(Object id) {
        ops.invalidate(domain, id);
    }

    private CacheKey keyOf(Object id) {
        return ops.entityKey(domain, id);
    }
}
