package io.github.vevoly.jlayeredcache.api.config;

import io.github.vevoly.jlayeredcache.api.constants.JLayeredCacheConstants;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * 归一化后的领域缓存配置。
 * <p>
 * 此对象是 YML 中领域配置、全局默认配置以及框架常量合并后的最终、不可变的结果。
 * 缓存管理器只依赖这个标准对象来获取某个领域的命名空间和 TTL。
 * <p>
 * The normalized per-domain cache configuration.
 * This object is the final, immutable result of merging the domain block from YML, the global defaults and the framework constants.
 * The cache manager relies solely on it to obtain the namespace and TTLs of a domain.
 *
 * @author vevoly
 */
@Getter
@Builder
@ToString
@AllArgsConstructor
public final class ResolvedJLayeredCacheConfig {

    /**
     * 领域标识，对应于 YML 中 {@code domains} 下的 Key。
     * <p>
     * The domain tag, corresponding to the key under {@code domains} in YML.
     */
    private final String name;

    /**
     * 缓存的命名空间，作为缓存键的前缀。
     * <p>
     * The cache namespace, used as the prefix of cache keys.
     */
    private final String namespace;

    /**
     * 实体缓存的默认过期时间。{@code null} 表示不过期（L1 仍受其上限约束）。
     * <p>
     * The default expiration for entity writes. {@code null} means no expiry (L1 is still bounded by its cap).
     */
    @Builder.Default
    private final Duration ttl = Duration.ofSeconds(JLayeredCacheConstants.DEFAULT_TTL);

    /**
     * 集合缓存的默认过期时间。
     * <p>
     * The default expiration for collection writes.
     */
    @Builder.Default
    private final Duration collectionTtl = Duration.ofSeconds(JLayeredCacheConstants.DEFAULT_COLLECTION_TTL);

    /**
     * 集合缓存键使用的命名空间。
     * <p>
     * The namespace used for collection keys.
     *
     * @return 例如 "applications:collection" / e.g. "applications:collection"
     */
    public String getCollectionNamespace() {
        return namespace + JLayeredCacheConstants.KEY_DELIMITER + JLayeredCacheConstants.COLLECTION_SUFFIX;
    }
}
