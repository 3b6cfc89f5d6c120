package io.github.vevoly.jlayeredcache.api.key;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * 一个已生成的缓存键。
 * <p>
 * {@link #getRaw()} 是由命名空间、位置参数和按名称排序的命名参数拼接出的原始字符串；
 * {@link #getValue()} 是真正用于读写后端的键。当原始字符串超过长度阈值时，{@code value} 是命名空间加上它的定长摘要。
 * <p>
 * A generated cache key.
 * {@link #getRaw()} is the string assembled from the namespace, the positional components and the
 * name-sorted named components. {@link #getValue()} is the key actually used against the backends;
 * when the raw string exceeds the length threshold it is the namespace followed by a fixed-length digest of it.
 *
 * @author vevoly
 */
@Getter
@EqualsAndHashCode(of = "value")
public final class CacheKey {

    private final String raw;
    private final String value;
    private final boolean hashed;

    private CacheKey(String raw, String value, boolean hashed) {
        this.raw = raw;
        this.value = value;
        this.hashed = hashed;
    }

    /**
     * 原始字符串即为最终键。
     * <p>
     * The raw string is used as the key.
     */
    public static CacheKey plain(String raw) {
        return new CacheKey(raw, raw, false);
    }

    /**
     * 原始字符串过长，最终键为带命名空间的摘要。
     * <p>
     * The raw string was too long, the key is its namespaced digest.
     */
    public static CacheKey hashed(String raw, String hashedValue) {
        return new CacheKey(raw, hashedValue, true);
    }

    @Override
    public String toString() {
        return value;
    }
}
