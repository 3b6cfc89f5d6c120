package io.github.vevoly.jlayeredcache.core.internal;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.vevoly.jlayeredcache.api.JLayeredCacheOps;
import io.github.vevoly.jlayeredcache.api.config.ResolvedJLayeredCacheConfig;
import io.github.vevoly.jlayeredcache.api.constants.JLayeredCacheConstants;
import io.github.vevoly.jlayeredcache.api.key.CacheKey;
import io.github.vevoly.jlayeredcache.api.structure.JLayeredCacheStats;
import io.github.vevoly.jlayeredcache.core.config.JLayeredCacheConfigResolver;
import io.github.vevoly.jlayeredcache.core.key.CacheKeyGenerator;
import io.github.vevoly.jlayeredcache.core.utils.I18nLogger;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * {@link JLayeredCacheOps} 接口的核心实现类。
 * <p>
 * 负责把领域标识解析为命名空间和 TTL、生成缓存键、在领域对象与 {@link JsonNode} 之间转换，
 * 并把读写委托给 {@link LayeredCache}。分页集合的键会登记到 {@link CollectionKeyRegistry}，
 * 以便在实体失效时一并删除。所有公开方法都不会抛出异常。
 * <p>
 * The core implementation of the {@link JLayeredCacheOps} interface.
 * It resolves a domain tag into its namespace and TTLs, generates keys, converts between domain objects and
 * {@link JsonNode}, and delegates reads and writes to the {@link LayeredCache}. Collection keys are registered with the
 * {@link CollectionKeyRegistry} so they are deleted together with their entity. No public method throws.
 *
 * @author vevoly
 */
@Slf4j
public class JLayeredCacheManager implements JLayeredCacheOps {

    private final I18nLogger i18nLog = new I18nLogger(log);

    private final LayeredCache layeredCache;
    private final CacheKeyGenerator keyGenerator;
    private final JLayeredCacheConfigResolver configResolver;
    private final CollectionKeyRegistry collectionKeyRegistry;
    private final ObjectMapper objectMapper;

    public JLayeredCacheManager(
            LayeredCache layeredCache,
            CacheKeyGenerator keyGenerator,
            JLayeredCacheConfigResolver configResolver,
            CollectionKeyRegistry collectionKeyRegistry,
            ObjectMapper objectMapper
    ) {
        this.layeredCache = layeredCache;
        this.keyGenerator = keyGenerator;
        this.configResolver = configResolver;
        this.collectionKeyRegistry = collectionKeyRegistry;
        this.objectMapper = objectMapper;
    }

    // ===================================================================
    // ====================== 缓存键 / Cache Keys =========================
    // ===================================================================

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
            return resolveEntityKey(domain, id);
        } catch (RuntimeException e) {
            logFailure("entityKey", domain, null, e);
            return null;
        }
    }

    @Override
    public CacheKey collectionKey(String domain, Object id, int page, int limit) {
        try {
            return resolveCollectionKey(domain, id, page, limit);
        } catch (RuntimeException e) {
            logFailure("collectionKey", domain, null, e);
            return null;
        }
    }

    private CacheKey resolveEntityKey(String domain, Object id) {
        ResolvedJLayeredCacheConfig config = configResolver.resolve(domain);
        return keyGenerator.generate(config.getNamespace(), id);
    }

    private CacheKey resolveCollectionKey(String domain, Object id, int page, int limit) {
        ResolvedJLayeredCacheConfig config = configResolver.resolve(domain);
        Map<String, Object> named = new LinkedHashMap<>();
        named.put(JLayeredCacheConstants.PAGE_COMPONENT, page);
        named.put(JLayeredCacheConstants.LIMIT_COMPONENT, limit);
        return keyGenerator.generate(config.getCollectionNamespace(), Collections.singletonList(id), named);
    }

    // ===================================================================
    // ====================== 单个实体 / Single Entity ====================
    // ===================================================================

    @Override
    public <T> Optional<T> get(String domain, Object id, Class<T> type) {
        return read("get", domain, () -> resolveEntityKey(domain, id), node -> objectMapper.convertValue(node, type));
    }

    @Override
    public <T> Optional<T> get(String domain, Object id, TypeReference<T> type) {
        return read("get", domain, () -> resolveEntityKey(domain, id), node -> objectMapper.convertValue(node, type));
    }

    @Override
    public void set(String domain, Object id, Object value, Duration ttl) {
        write("set", domain, () -> resolveEntityKey(domain, id), value, ttl);
    }

    @Override
    public void set(String domain, Object id, Object value) {
        try {
            Duration ttl = configResolver.resolve(domain).getTtl();
            set(domain, id, value, ttl);
        } catch (RuntimeException e) {
            logFailure("set", domain, null, e);
        }
    }

    @Override
    public boolean exists(String domain, Object id) {
        CacheKey key = null;
        try {
            key = resolveEntityKey(domain, id);
            return layeredCache.exists(key.getValue());
        } catch (RuntimeException e) {
            logFailure("exists", domain, key, e);
            return false;
        }
    }

    // ===================================================================
    // ====================== 分页集合 / Paginated Collections ============
    // ===================================================================

    @Override
    public <T> Optional<T> getCollection(String domain, Object id, int page, int limit, Class<T> type) {
        return read("getCollection", domain, () -> resolveCollectionKey(domain, id, page, limit), node -> objectMapper.convertValue(node, type));
    }

    @Override
    public <T> Optional<T> getCollection(String domain, Object id, int page, int limit, TypeReference<T> type) {
        return read("getCollection", domain, () -> resolveCollectionKey(domain, id, page, limit), node -> objectMapper.convertValue(node, type));
    }

    @Override
    public void setCollection(String domain, Object id, Object value, int page, int limit, Duration ttl) {
        CacheKey key = write("setCollection", domain, () -> resolveCollectionKey(domain, id, page, limit), value, ttl);
        if (key == null || value == null) {
            return;
        }
        try {
            collectionKeyRegistry.track(resolveEntityKey(domain, id).getValue(), key.getValue(), ttl);
        } catch (RuntimeException e) {
            logFailure("setCollection", domain, key, e);
        }
    }

    @Override
    public void setCollection(String domain, Object id, Object value, int page, int limit) {
        try {
            Duration ttl = configResolver.resolve(domain).getCollectionTtl();
            setCollection(domain, id, value, page, limit, ttl);
        } catch (RuntimeException e) {
            logFailure("setCollection", domain, null, e);
        }
    }

    // ===================================================================
    // ====================== 失效与管理 / Invalidation & Admin ===========
    // ===================================================================

    @Override
    public void invalidate(String domain, Object id) {
        CacheKey key = null;
        try {
            key = resolveEntityKey(domain, id);
            layeredCache.delete(key.getValue());
            Set<String> collectionKeys = collectionKeyRegistry.drain(key.getValue());
            for (String collectionKey : collectionKeys) {
                layeredCache.delete(collectionKey);
            }
            i18nLog.debug("manager.invalidated", key, collectionKeys.size());
        } catch (RuntimeException e) {
            logFailure("invalidate", domain, key, e);
        }
    }

    @Override
    public long invalidatePattern(String pattern) {
        try {
            long deleted = layeredCache.deleteByPattern(pattern);
            i18nLog.info("manager.pattern_invalidated", pattern, deleted);
            return deleted;
        } catch (RuntimeException e) {
            logFailure("invalidatePattern", null, null, e);
            return 0L;
        }
    }

    /**
     * 只删除本实例已解析领域的命名空间，不会清空整个 Redis 库。
     * <p>
     * Deletes only the namespaces of the domains this instance has resolved; the Redis database is never flushed.
     */
    @Override
    public long clearAll() {
        try {
            Set<String> namespaces = new LinkedHashSet<>();
            for (ResolvedJLayeredCacheConfig config : configResolver.getAllResolvedConfigs()) {
                namespaces.add(config.getNamespace());
            }
            long deleted = 0L;
            for (String namespace : namespaces) {
                deleted += deleteShared(escapeGlob(namespace) + JLayeredCacheConstants.KEY_DELIMITER + "*");
            }
            layeredCache.clearLocal();
            collectionKeyRegistry.clear();
            i18nLog.info("manager.cleared", namespaces.size(), deleted);
            return deleted;
        } catch (RuntimeException e) {
            logFailure("clearAll", null, null, e);
            return 0L;
        }
    }

    @Override
    public void clearLocal() {
        layeredCache.clearLocal();
    }

    @Override
    public JLayeredCacheStats getStats() {
        return layeredCache.stats();
    }

    // ===================================================================
    // ====================== 内部方法 / Internals ========================
    // ===================================================================

    private <T> Optional<T> read(String operation, String domain, Supplier<CacheKey> keySupplier, Function<JsonNode, T> converter) {
        CacheKey key = null;
        try {
            key = keySupplier.get();
            Optional<JsonNode> node = layeredCache.get(key.getValue());
            if (node.isEmpty()) {
                return Optional.empty();
            }
            return Optional.ofNullable(converter.apply(node.get()));
        } catch (RuntimeException e) {
            logFailure(operation, domain, key, e);
            return Optional.empty();
        }
    }

    /**
     * 写入一个值。值为 {@code null} 时删除该键。
     * <p>
     * Writes a value; a {@code null} value deletes the key.
     *
     * @return 写入的键，失败时为 {@code null} / the written key, {@code null} on failure
     */
    private CacheKey write(String operation, String domain, Supplier<CacheKey> keySupplier, Object value, Duration ttl) {
        CacheKey key = null;
        try {
            key = keySupplier.get();
            if (value == null) {
                layeredCache.delete(key.getValue());
                return key;
            }
            JsonNode node = objectMapper.valueToTree(value);
            layeredCache.set(key.getValue(), node, ttl);
            return key;
        } catch (RuntimeException e) {
            logFailure(operation, domain, key, e);
            return null;
        }
    }

    private long deleteShared(String pattern) {
        try {
            return layeredCache.getShared().deleteByPattern(pattern);
        } catch (RuntimeException e) {
            logFailure("clearAll", null, null, e);
            return 0L;
        }
    }

    /**
     * 转义 glob 特殊字符，让命名空间按字面匹配。
     * <p>
     * Escapes glob metacharacters so the namespace matches literally.
     */
    static String escapeGlob(String literal) {
        StringBuilder escaped = new StringBuilder(literal.length());
        for (char c : literal.toCharArray()) {
            if (c == '*' || c == '?' || c == '[' || c == ']' || c == '\\') {
                escaped.append('\\');
            }
            escaped.append(c);
        }
        return escaped.toString();
    }

    /**
     * 参数或类型转换错误记 WARN，其它意外错误记 ERROR。
     * <p>
     * Argument and conversion errors are logged at WARN, anything unexpected at ERROR.
     */
    private void logFailure(String operation, String domain, CacheKey key, RuntimeException e) {
        if (e instanceof IllegalArgumentException) {
            i18nLog.warn("manager.invalid_argument", e, operation, domain, key, e.getMessage());
        } else {
            i18nLog.error("manager.unexpected_error", e, operation, domain, key, e.getMessage());
        }
    }
}
