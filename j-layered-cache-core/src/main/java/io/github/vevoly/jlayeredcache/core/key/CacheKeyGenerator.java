package io.github.vevoly.jlayeredcache.core.key;

import io.github.vevoly.jlayeredcache.api.constants.JLayeredCacheConstants;
import io.github.vevoly.jlayeredcache.api.key.CacheKey;
import io.github.vevoly.jlayeredcache.core.utils.I18nLogger;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.collections4.MapUtils;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * 缓存键生成器。
 * <p>
 * 键由命名空间、按调用顺序排列的位置参数、按名称排序的命名参数（{@code name=value}）以 {@code :} 拼接而成，
 * {@code null} 渲染为字面量 {@code "null"}。相同输入永远得到相同的键，与命名参数的传入顺序无关。
 * 拼接结果超过长度阈值时，最终键为 {@code 命名空间:SHA-256 十六进制摘要}，命名空间保留以便按命名空间批量删除；
 * 阈值放不下命名空间时截断命名空间，完全放不下时只用摘要。
 * <p>
 * The cache key generator.
 * A key is the namespace, the positional components in call order and the name-sorted named components
 * ({@code name=value}), joined by {@code :}; {@code null} renders as the literal {@code "null"}.
 * The same inputs always produce the same key, whatever the order of the named components.
 * When the assembled string exceeds the length threshold the key becomes {@code namespace:sha256-hex}, keeping the
 * namespace so namespace-wide deletes still reach it. The namespace is truncated when the threshold cannot hold it
 * and dropped when there is no room at all.
 *
 * @author vevoly
 */
@Slf4j
public class CacheKeyGenerator {

    private final I18nLogger i18nLog = new I18nLogger(log);

    @Getter
    private final int maxKeyLength;

    public CacheKeyGenerator() {
        this(JLayeredCacheConstants.DEFAULT_MAX_KEY_LENGTH);
    }

    public CacheKeyGenerator(int maxKeyLength) {
        if (maxKeyLength < JLayeredCacheConstants.MIN_MAX_KEY_LENGTH) {
            throw new IllegalArgumentException("maxKeyLength must be at least "
                    + JLayeredCacheConstants.MIN_MAX_KEY_LENGTH + ": " + maxKeyLength);
        }
        this.maxKeyLength = maxKeyLength;
    }

    public CacheKey generate(String prefix, Object... positional) {
        List<?> parts = positional == null ? Collections.singletonList(null) : Arrays.asList(positional);
        return generate(prefix, parts, null);
    }

    /**
     * 生成缓存键。
     * <p>
     * Generates a cache key.
     *
     * @param prefix     命名空间前缀 / the namespace prefix
     * @param positional 位置参数，可为空 / the positional components, may be null
     * @param named      命名参数，可为空 / the named components, may be null
     * @return 缓存键 / the cache key
     */
    public CacheKey generate(String prefix, List<?> positional, Map<String, ?> named) {
        StringJoiner joiner = new StringJoiner(JLayeredCacheConstants.KEY_DELIMITER);
        joiner.add(render(prefix));
        if (CollectionUtils.isNotEmpty(positional)) {
            for (Object part : positional) {
                joiner.add(render(part));
            }
        }
        if (MapUtils.isNotEmpty(named)) {
            List<Map.Entry<String, ?>> entries = new ArrayList<>(named.entrySet());
            entries.sort((a, b) -> render(a.getKey()).compareTo(render(b.getKey())));
            for (Map.Entry<String, ?> entry : entries) {
                joiner.add(render(entry.getKey()) + JLayeredCacheConstants.NAMED_COMPONENT_SEPARATOR + render(entry.getValue()));
            }
        }
        String raw = joiner.toString();
        if (raw.length() <= maxKeyLength) {
            return CacheKey.plain(raw);
        }
        String hashed = hashedValue(render(prefix), DigestUtils.sha256Hex(raw));
        i18nLog.debug("key.hashed", raw.length(), maxKeyLength, hashed);
        return CacheKey.hashed(raw, hashed);
    }

    private String hashedValue(String namespace, String digest) {
        int room = maxKeyLength - digest.length() - JLayeredCacheConstants.KEY_DELIMITER.length();
        if (room <= 0 || namespace.isEmpty()) {
            return digest;
        }
        return StringUtils.left(namespace, room) + JLayeredCacheConstants.KEY_DELIMITER + digest;
    }

    private static String render(Object component) {
        return component == null ? JLayeredCacheConstants.NULL_COMPONENT : String.valueOf(component);
    }
}
