package io.github.vevoly.jlayeredcache.api.backend;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.util.Optional;

/**
 * 缓存后端的统一能力接口。
 * <p>
 * 所有缓存存储（本地内存、Redis 等）都必须实现此接口。框架的其它组件只依赖此接口，而不依赖具体实现。
 * 值以 Jackson {@link JsonNode} 的形式在各层之间传递，对后端而言它是不透明的序列化数据。
 * <p>
 * 实现类必须遵守 “fail-open” 约定：任何内部错误（序列化失败、连接失败、超时）都不能以异常形式抛给调用者，
 * 只能降级为安全默认值（{@code get}/{@code exists} 视为未命中，{@code set}/{@code delete} 视为空操作），并记录日志。
 * <p>
 * The unified capability contract for cache backends.
 * Every cache store (local memory, Redis, ...) implements this interface, and the rest of the framework depends on it only.
 * Values travel between tiers as Jackson {@link JsonNode} trees, which are opaque serialized data to a backend.
 * <p>
 * Implementations must be fail-open: an internal error (serialization, connectivity, timeout) never reaches the caller
 * as an exception. The operation degrades to its safe default (miss for {@code get}/{@code exists}, no-op for
 * {@code set}/{@code delete}) and the error is logged.
 *
 * @author vevoly
 */
public interface CacheBackend {

    /**
     * 获取指定 key 的值。过期的条目等同于不存在。
     * <p>
     * Gets the value of a key. An expired entry is treated as absent.
     *
     * @param key 缓存键 / the cache key
     * @return 命中时返回值，否则返回空 / the value on a hit, empty otherwise
     */
    Optional<JsonNode> get(String key);

    /**
     * 写入（或覆盖）一个值。
     * <p>
     * Writes (or overwrites) a value.
     *
     * @param key   缓存键 / the cache key
     * @param value 值 / the value
     * @param ttl   过期时间，{@code null} 表示不过期 / the time-to-live, {@code null} for no expiry
     */
    void set(String key, JsonNode value, Duration ttl);

    /**
     * 删除指定 key。
     * <p>
     * Deletes a key.
     *
     * @param key 缓存键 / the cache key
     */
    void delete(String key);

    /**
     * 判断 key 是否存在且未过期。
     * <p>
     * Checks whether a key is present and not expired.
     *
     * @param key 缓存键 / the cache key
     * @return {@code true} 如果存在 / {@code true} if present
     */
    boolean exists(String key);

    /**
     * 获取 key 的剩余存活时间。后端无法得知或条目永不过期时返回空。
     * 仅用于把上层命中的数据回填到更快的层时限制 TTL。
     * <p>
     * Gets the remaining time-to-live of a key. Empty when the backend cannot tell or the entry never expires.
     * Only used to cap the TTL when a value is promoted into a faster tier.
     *
     * @param key 缓存键 / the cache key
     * @return 剩余存活时间 / the remaining time-to-live
     */
    default Optional<Duration> remainingTtl(String key) {
        return Optional.empty();
    }

    /**
     * 在一次读取中同时获取值和剩余存活时间，用于把命中的数据回填到更快的层。
     * 两者必须来自同一时刻的观察；不能保证这一点的后端应返回 {@link TimedValue.Lifetime#UNKNOWN}。
     * <p>
     * Reads the value and its remaining lifetime in one observation, for promotion into a faster tier.
     * Backends that cannot observe both at once must report {@link TimedValue.Lifetime#UNKNOWN}.
     *
     * @param key 缓存键 / the cache key
     * @return 命中时返回值及剩余时间，否则返回空 / the value and its lifetime on a hit, empty otherwise
     */
    default Optional<TimedValue> getWithTtl(String key) {
        return get(key).map(TimedValue::unknown);
    }

    /**
     * 删除所有匹配 glob 模式（{@code *}、{@code ?}、{@code [...]}，与 Redis {@code SCAN MATCH} 相同）的 key。
     * <p>
     * Deletes every key matching a glob pattern ({@code *}, {@code ?}, {@code [...]}, as in Redis {@code SCAN MATCH}).
     *
     * @param pattern glob 模式 / the glob pattern
     * @return 删除的数量 / the number of deleted keys
     */
    long deleteByPattern(String pattern);
}
