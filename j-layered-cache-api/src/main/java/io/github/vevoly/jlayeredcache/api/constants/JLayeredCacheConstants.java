package io.github.vevoly.jlayeredcache.api.constants;

/**
 * 框架中使用的所有公共常量的集合。
 * <p>
 * A collection of all public constants used within the framework.
 *
 * @author vevoly
 */
public interface JLayeredCacheConstants {

    // ===================================================================
    // ====================== 缓存键相关常量 / Cache Key Constants =========
    // ===================================================================

    /**
     * 缓存键各组成部分之间的分隔符。
     * <p>
     * The delimiter between the components of a cache key.
     */
    String KEY_DELIMITER = ":";

    /**
     * 命名参数中名称与值之间的分隔符。
     * <p>
     * The separator between the name and the value of a named component.
     */
    String NAMED_COMPONENT_SEPARATOR = "=";

    /**
     * 参数为 null 时在键中的文本表示。
     * <p>
     * The text used for a null component in a key.
     */
    String NULL_COMPONENT = "null";

    /**
     * 缓存键的默认最大长度，超过后使用摘要代替。
     * <p>
     * The default maximum length of a cache key; longer keys are replaced by their digest.
     */
    int DEFAULT_MAX_KEY_LENGTH = 250;

    /**
     * 缓存键最大长度的下限，必须能容纳一个 SHA-256 十六进制摘要。
     * <p>
     * The lower bound of the maximum key length, which must fit a SHA-256 hex digest.
     */
    int MIN_MAX_KEY_LENGTH = 64;

    /**
     * 集合（分页列表）类缓存在命名空间后追加的后缀。
     * <p>
     * The suffix appended to a namespace for collection (paginated list) caches.
     */
    String COLLECTION_SUFFIX = "collection";

    /**
     * 分页参数名。
     * <p>
     * Pagination component names.
     */
    String PAGE_COMPONENT = "page";
    String LIMIT_COMPONENT = "limit";

    // ===================================================================
    // ====================== 全局默认配置值 / Global Default Values =======
    // ===================================================================

    /**
     * L1 本地缓存的默认 TTL 上限（秒）。(5 分钟)
     * <p>
     * The default TTL cap (in seconds) of the L1 local tier. (5 minutes)
     */
    long DEFAULT_LOCAL_MAX_TTL = 300L;

    /**
     * L1 本地缓存的默认最大容量。
     * <p>
     * The default maximum size of the L1 local tier.
     */
    long DEFAULT_LOCAL_MAX_SIZE = 10_000L;

    /**
     * L2 共享缓存单次操作的默认超时时间（毫秒）。
     * <p>
     * The default timeout (in milliseconds) of a single L2 shared-tier operation.
     */
    long DEFAULT_SHARED_TIMEOUT_MILLIS = 2_000L;

    /**
     * 实体缓存的默认 TTL（秒）。(1 小时)
     * <p>
     * The default TTL (in seconds) for entity writes. (1 hour)
     */
    long DEFAULT_TTL = 3600L;

    /**
     * 集合缓存的默认 TTL（秒）。(10 分钟)
     * <p>
     * The default TTL (in seconds) for collection writes. (10 minutes)
     */
    long DEFAULT_COLLECTION_TTL = 600L;

    /**
     * 每个实体最多跟踪的集合缓存键数量。
     * <p>
     * The maximum number of collection keys tracked per entity.
     */
    int MAX_TRACKED_COLLECTION_KEYS_PER_ENTITY = 1_000;

    /**
     * 最多跟踪集合缓存键的实体数量。
     * <p>
     * The maximum number of entities whose collection keys are tracked.
     */
    long MAX_TRACKED_ENTITIES = 50_000L;
}
