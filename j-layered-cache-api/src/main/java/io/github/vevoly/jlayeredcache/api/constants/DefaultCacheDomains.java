package io.github.vevoly.jlayeredcache.api.constants;

/**
 * 定义了常用的领域缓存标识。
 * <p>
 * 用户可以在 application.yml 的 {@code j-layered-cache.domains} 下为这些名称单独配置命名空间和 TTL，
 * 也可以使用任何其它字符串作为领域标识。
 * <p>
 * Defines commonly used domain cache tags.
 * Users can configure a namespace and TTLs for these names under {@code j-layered-cache.domains} in application.yml,
 * and any other string can be used as a domain tag as well.
 *
 * @author vevoly
 */
public final class DefaultCacheDomains {

    /**
     * 私有构造函数，防止实例化。
     * <p>
     * Private constructor to prevent instantiation.
     */
    private DefaultCacheDomains() {}

    /**
     * 用户资料。
     * <p>
     * User profiles.
     */
    public static final String USER = "user";

    /**
     * 用户的申请记录，通常按分页列表缓存。
     * <p>
     * A user's applications, usually cached as paginated lists.
     */
    public static final String APPLICATIONS = "applications";

    /**
     * 职位数据。
     * <p>
     * Job postings.
     */
    public static final String JOBS = "jobs";

    /**
     * 推荐结果。
     * <p>
     * Recommendation results.
     */
    public static final String RECOMMENDATIONS = "recommendations";
}
