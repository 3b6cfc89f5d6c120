package io.github.vevoly.jlayeredcache.api.backend;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.util.Objects;

/**
 * 一次读取得到的值及其剩余存活时间。
 * <p>
 * 剩余时间分三种情况：有限（{@link Lifetime#BOUNDED}）、永不过期（{@link Lifetime#UNBOUNDED}）、
 * 后端无法给出（{@link Lifetime#UNKNOWN}）。回填到更快的层时，只有前两种情况才能确定一个安全的 TTL。
 * <p>
 * A value together with its remaining lifetime, as observed by a single read.
 * The lifetime is either bounded, unbounded, or unknown to the backend. Only the first two allow a safe TTL
 * when the value is promoted into a faster tier.
 *
 * @author vevoly
 */
@Getter
@ToString
@EqualsAndHashCode
public final class TimedValue {

    public enum Lifetime {
        BOUNDED,
        UNBOUNDED,
        UNKNOWN
    }

    private final JsonNode value;
    private final Lifetime lifetime;
    /**
     * 仅在 {@link Lifetime#BOUNDED} 时非空。
     * <p>
     * Non-null only when the lifetime is {@link Lifetime#BOUNDED}.
     */
    private final Duration remainingTtl;

    private TimedValue(JsonNode value, Lifetime lifetime, Duration remainingTtl) {
        this.value = Objects.requireNonNull(value, "value");
        this.lifetime = lifetime;
        this.remainingTtl = remainingTtl;
    }

    public static TimedValue bounded(JsonNode value, Duration remainingTtl) {
        Objects.requireNonNull(remainingTtl, "remainingTtl");
        return new TimedValue(value, Lifetime.BOUNDED, remainingTtl);
    }

    public static TimedValue unbounded(JsonNode value) {
        return new TimedValue(value, Lifetime.UNBOUNDED, null);
    }

    public static TimedValue unknown(JsonNode value) {
        return new TimedValue(value, Lifetime.UNKNOWN, null);
    }
}
