package io.github.vevoly.jlayeredcache.core.properties;

import io.github.vevoly.jlayeredcache.api.constants.JLayeredCacheConstants;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * 映射 application.yml 文件中 {@code j-layered-cache} 根配置块的属性。
 * <p>
 * Maps the properties of the {@code j-layered-cache} root configuration block from the application.yml file.
 *
 * @author vevoly
 */
@Data
@ConfigurationProperties(prefix = "j-layered-cache")
public class JLayeredCacheRootProperties {

    /**
     * 是否启用多级缓存。为 false 时注册一个不做任何事的缓存管理器。
     * <p>
     * Whether the layered cache is enabled. When false a no-op cache manager is registered instead.
     */
    private boolean enabled = true;

    private Local local = new Local();

    private Shared shared = new Shared();

    private Key key = new Key();

    /**
     * 全局默认配置。此处定义的属性将作为所有未显式指定相应属性的领域的默认值。
     * <p>
     * Global default configuration. Properties defined here serve as defaults for every domain that does not specify them.
     */
    private JLayeredCacheDomainProperties defaults = new JLayeredCacheDomainProperties();

    /**
     * 所有领域的配置。Map 的 Key 是领域标识。
     * <p>
     * The configuration of every domain, keyed by the domain tag.
     */
    private Map<String, JLayeredCacheDomainProperties> domains = new HashMap<>();

    /**
     * L1 本地缓存配置。
     * <p>
     * L1 local tier settings.
     */
    @Data
    public static class Local {

        /**
         * 写入 L1 的 TTL 上限。
         * <p>
         * The cap applied to every TTL written to L1.
         */
        private Duration maxTtl = Duration.ofSeconds(JLayeredCacheConstants.DEFAULT_LOCAL_MAX_TTL);

        /**
         * L1 的最大条目数。
         * <p>
         * The maximum number of L1 entries.
         */
        private long maxSize = JLayeredCacheConstants.DEFAULT_LOCAL_MAX_SIZE;
    }

    /**
     * L2 共享缓存配置。
     * <p>
     * L2 shared tier settings.
     */
    @Data
    public static class Shared {

        /**
         * 每次 Redis 调用的超时时间。
         * <p>
         * The timeout of every Redis call.
         */
        private Duration timeout = Duration.ofMillis(JLayeredCacheConstants.DEFAULT_SHARED_TIMEOUT_MILLIS);
    }

    @Data
    public static class Key {

        /**
         * 超过此长度的键会被替换为 SHA-256 摘要。
         * <p>
         * Keys longer than this are replaced by their SHA-256 digest.
         */
        private int maxLength = JLayeredCacheConstants.DEFAULT_MAX_KEY_LENGTH;
    }
}
