package io.github.vevoly.jlayeredcache.api.structure;

import io.github.vevoly.jlayeredcache.api.key.CacheKey;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * 缓存中的一条领域数据：缓存键加上解码后的值。
 * 它只是权威数据的一份投影，从不被直接持久化。
 * <p>
 * A piece of domain data found in the cache: the cache key plus the decoded value.
 * It is only a projection of data owned elsewhere and is never persisted directly.
 *
 * @param <T> 领域对象类型 / the domain type
 * @author vevoly
 */
@Getter
@ToString
@AllArgsConstructor
public final class CachedRecord<T> {

    private final CacheKey key;
    private final T value;
}
