package io.github.vevoly.jlayeredcache.core.backend;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.vevoly.jlayeredcache.core.utils.ExpiryNanos;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * L1 中保存的一条缓存记录：序列化后的值以及绝对过期时刻（Ticker 纳秒）。
 * <p>
 * One record held by the L1 tier: the serialized value and its absolute expiry instant in ticker nanoseconds.
 *
 * @author vevoly
 */
@Getter
@ToString
@RequiredArgsConstructor
final class CacheEntry {

    private final JsonNode value;

    /**
     * {@link ExpiryNanos#NEVER} 表示不过期。
     * <p>
     * {@link ExpiryNanos#NEVER} means no expiry.
     */
    private final long expireAtNanos;

    boolean isExpired(long now) {
        return ExpiryNanos.isExpired(expireAtNanos, now);
    }

    long remainingNanos(long now) {
        return ExpiryNanos.remaining(expireAtNanos, now);
    }
}
