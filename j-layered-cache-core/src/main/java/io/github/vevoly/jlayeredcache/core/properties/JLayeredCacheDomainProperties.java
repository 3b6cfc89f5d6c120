package io.github.vevoly.jlayeredcache.core.properties;

import lombok.Data;

import java.time.Duration;

/**
 * 映射 application.yml 文件中单个领域缓存配置块的属性，也用于 {@code defaults} 块。
 * <p>
 * Maps the properties of a single domain block from the application.yml file; also used for the {@code defaults} block.
 *
 * @author vevoly
 */
@Data
public class JLayeredCacheDomainProperties {

    /**
     * 领域的命名空间，作为缓存键的前缀。不填时使用领域名称。
     * 在 {@code defaults} 块中填写时，作为所有领域命名空间的公共前缀（例如多个应用共用一个 Redis）。
     * <p>
     * The domain namespace, used as the cache key prefix. Defaults to the domain name.
     * Set in the {@code defaults} block it becomes a common prefix of every domain namespace (e.g. several applications sharing one Redis).
     */
    private String namespace;

    /**
     * 实体缓存的默认过期时间（例如: 30s, 5m, 1h）。{@code -1} 表示不过期。
     * <p>
     * The default expiration of entity writes (e.g., 30s, 5m, 1h). {@code -1} means no expiry.
     */
    private Duration ttl;

    /**
     * 分页集合缓存的默认过期时间。{@code -1} 表示不过期。
     * <p>
     * The default expiration of collection writes. {@code -1} means no expiry.
     */
    private Duration collectionTtl;
}
