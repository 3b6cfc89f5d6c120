package io.github.vevoly.jlayeredcache.api;

import com.fasterxml.jackson.core.type.TypeReference;
import io.github.vevoly.jlayeredcache.api.key.CacheKey;
import io.github.vevoly.jlayeredcache.api.structure.JLayeredCacheStats;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * j-layered-cache 的核心 API 接口，也是其它子系统访问缓存的唯一入口。
 * <p>
 * 负责生成无冲突的缓存键，并提供按领域区分的类型化读写操作。
 * 此接口的任何方法都不会向调用者抛出异常：所有内部错误都会降级为“未命中”或“空操作”，只通过日志可见。
 * 缓存只是一层优化，未命中时由调用者自己从权威数据源加载并回填。
 * <p>
 * The core API of j-layered-cache and the only entry point other subsystems use.
 * It generates collision-safe cache keys and exposes typed, domain-scoped read and write operations.
 * No method of this interface ever throws to the caller: every internal failure degrades to a miss or a no-op and is only visible in the logs.
 * The cache is a pure optimization; on a miss the caller loads from the source of truth and populates the cache itself.
 *
 * @author vevoly
 */
public interface JLayeredCacheOps {

    // =================================================================
    // ======================== 缓存键 / Cache Keys =====================
    // =================================================================

    /**
     * 生成缓存键。
     * 位置参数按调用顺序拼接，命名参数按名称排序后拼接，因此命名参数的传入顺序不会影响结果。
     * 超过长度阈值的键会被替换为其摘要。
     * <p>
     * Generates a cache key.
     * Positional components are joined in call order and named components sorted by name, so the order in which
     * named components are passed never changes the result. Keys longer than the threshold are replaced by their digest.
     *
     * @param prefix     命名空间前缀 / the namespace prefix
     * @param positional 位置参数 / the positional components
     * @param named      命名参数 / the named components
     * @return 缓存键 / the cache key
     */
    CacheKey generateKey(String prefix, List<?> positional, Map<String, ?> named);

    /**
     * 只使用位置参数生成缓存键。
     * <p>
     * Generates a cache key from positional components only.
     *
     * @param prefix     命名空间前缀 / the namespace prefix
     * @param positional 位置参数 / the positional components
     * @return 缓存键 / the cache key
     */
    CacheKey generateKey(String prefix, Object... positional);

    /**
     * 计算领域实体的缓存键。
     * <p>
     * Computes the cache key of a domain entity.
     *
     * @param domain 领域标识 / the domain tag
     * @param id     实体标识 / the entity identifier
     * @return 缓存键，领域标识非法时为 {@code null} / the cache key, {@code null} when the domain tag is invalid
     */
    CacheKey entityKey(String domain, Object id);

    /**
     * 计算分页集合的缓存键。领域标识非法时返回 {@code null}。
     * <p>
     * Computes the cache key of a paginated collection, or {@code null} when the domain tag is invalid.
     */
    CacheKey collectionKey(String domain, Object id, int page, int limit);

    // =================================================================
    // ======================== 单个实体 / Single Entity ================
    // =================================================================

    /**
     * 读取领域实体缓存。
     * <p>
     * Reads a cached domain entity.
     *
     * @param domain 领域标识 / the domain tag
     * @param id     实体标识 / the entity identifier
     * @param type   结果类型 / the result type
     * @param <T>    结果类型 / the result type
     * @return 命中时返回值，否则为空 / the value on a hit, empty otherwise
     */
    <T> Optional<T> get(String domain, Object id, Class<T> type);

    /**
     * 读取领域实体缓存（泛型结果类型）。
     * <p>
     * Reads a cached domain entity with a generic result type.
     */
    <T> Optional<T> get(String domain, Object id, TypeReference<T> type);

    /**
     * 写入领域实体缓存。
     * <p>
     * Writes a domain entity to the cache.
     *
     * @param domain 领域标识 / the domain tag
     * @param id     实体标识 / the entity identifier
     * @param value  值 / the value
     * @param ttl    过期时间 / the time-to-live
     */
    void set(String domain, Object id, Object value, Duration ttl);

    /**
     * 使用领域配置的默认 TTL 写入实体缓存。
     * <p>
     * Writes a domain entity using the domain's configured TTL.
     */
    void set(String domain, Object id, Object value);

    /**
     * 判断领域实体缓存是否存在于任意一层。
     * <p>
     * Checks whether a domain entity is cached in either tier.
     */
    boolean exists(String domain, Object id);

    // =================================================================
    // ======================== 分页集合 / Paginated Collections ========
    // =================================================================

    /**
     * 读取某个实体下的分页集合缓存。缓存键包含 page 和 limit。
     * <p>
     * Reads a cached paginated collection belonging to an entity. The key includes page and limit.
     *
     * @param domain 领域标识 / the domain tag
     * @param id     所属实体标识 / the owning entity identifier
     * @param page   页码 / the page number
     * @param limit  每页数量 / the page size
     * @param type   结果类型 / the result type
     * @param <T>    结果类型 / the result type
     * @return 命中时返回值，否则为空 / the value on a hit, empty otherwise
     */
    <T> Optional<T> getCollection(String domain, Object id, int page, int limit, Class<T> type);

    /**
     * 读取分页集合缓存（泛型结果类型）。
     * <p>
     * Reads a cached paginated collection with a generic result type.
     */
    <T> Optional<T> getCollection(String domain, Object id, int page, int limit, TypeReference<T> type);

    /**
     * 写入分页集合缓存，并记录该键以便随实体一同失效。
     * <p>
     * Writes a paginated collection and tracks its key so it is invalidated together with the entity.
     */
    void setCollection(String domain, Object id, Object value, int page, int limit, Duration ttl);

    /**
     * 使用领域配置的集合 TTL 写入分页集合缓存。
     * <p>
     * Writes a paginated collection using the domain's configured collection TTL.
     */
    void setCollection(String domain, Object id, Object value, int page, int limit);

    // =================================================================
    // ======================== 失效与管理 / Invalidation & Admin =======
    // =================================================================

    /**
     * 清除实体缓存，以及本实例写入过的该实体的所有分页集合缓存。
     * 只保证清除本实例的两层缓存，不会广播到其它进程。
     * <p>
     * Evicts the entity key and every collection key this instance has written for the entity.
     * Only this instance's two tiers are guaranteed to be cleared; nothing is broadcast to other processes.
     *
     * @param domain 领域标识 / the domain tag
     * @param id     实体标识 / the entity identifier
     */
    void invalidate(String domain, Object id);

    /**
     * 按 glob 模式（{@code *}、{@code ?}、{@code [..]}，与 Redis {@code SCAN MATCH} 相同）删除两层中匹配的键。
     * L1 无法精确匹配 {@code ?} 或 {@code [..]} 时会整体清空。
     * <p>
     * Deletes the keys matching a glob pattern ({@code *}, {@code ?}, {@code [..]}, as in Redis {@code SCAN MATCH})
     * from both tiers. L1 is cleared entirely when it cannot match {@code ?} or {@code [..]} exactly.
     *
     * @param pattern glob 模式 / the glob pattern
     * @return 删除的键数量（两层之和） / the number of keys deleted, summed over both tiers
     */
    long invalidatePattern(String pattern);

    /**
     * 清空本实例已知的所有领域命名空间下的 L2 数据，并清空 L1。其它命名空间的数据不受影响。
     * <p>
     * Deletes every L2 key under the namespaces of the domains this instance knows, then clears L1.
     * Keys of other namespaces are left alone.
     *
     * @return L2 中删除的键数量 / the number of L2 keys deleted
     */
    long clearAll();

    /**
     * 清空本机 L1 缓存。L2 不受影响。
     * <p>
     * Clears the local L1 tier. L2 is left untouched.
     */
    void clearLocal();

    /**
     * 获取统计快照。
     * <p>
     * Gets a statistics snapshot.
     */
    JLayeredCacheStats getStats();

    /**
     * 获取某个领域的类型化视图。
     * <p>
     * Gets a typed view of a domain.
     *
     * @param domain 领域标识 / the domain tag
     * @param type   领域对象类型 / the domain type
     * @param <T>    领域对象类型 / the domain type
     * @return 类型化视图 / the typed view
     */
    default <T> CacheDomain<T> domain(String domain, Class<T> type) {
        return new CacheDomain<>(this, domain, type);
    }
}
