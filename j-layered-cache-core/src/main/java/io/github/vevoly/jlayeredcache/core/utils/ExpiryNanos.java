package io.github.vevoly.jlayeredcache.core.utils;

import java.time.Duration;

/**
 * 基于 Caffeine {@code Ticker} 纳秒时间的过期时间计算工具。所有计算都做了饱和处理，不会溢出。
 * <p>
 * Expiry arithmetic on Caffeine {@code Ticker} nanoseconds. Every calculation saturates instead of overflowing.
 *
 * @author vevoly
 */
public final class ExpiryNanos {

    /**
     * 永不过期的哨兵值。
     * <p>
     * The far-future sentinel meaning "never expires".
     */
    public static final long NEVER = Long.MAX_VALUE;

    private ExpiryNanos() {}

    /**
     * 计算绝对过期时刻。{@code ttl} 为 null 时返回 {@link #NEVER}。
     * <p>
     * Computes the absolute expiry instant. Returns {@link #NEVER} for a {@code null} ttl.
     *
     * @param now 当前 ticker 时间 / the current ticker time
     * @param ttl 存活时间 / the time-to-live
     * @return 过期时刻 / the expiry instant
     */
    public static long deadline(long now, Duration ttl) {
        if (ttl == null) {
            return NEVER;
        }
        try {
            return Math.addExact(now, saturatedNanos(ttl));
        } catch (ArithmeticException e) {
            return ttl.isNegative() ? Long.MIN_VALUE : NEVER;
        }
    }

    /**
     * 计算剩余纳秒数，最小为 0；永不过期时返回 {@link Long#MAX_VALUE}。
     * <p>
     * Computes the remaining nanoseconds, never below 0; {@link Long#MAX_VALUE} when the deadline is {@link #NEVER}.
     */
    public static long remaining(long deadline, long now) {
        if (deadline == NEVER) {
            return Long.MAX_VALUE;
        }
        try {
            return Math.max(0L, Math.subtractExact(deadline, now));
        } catch (ArithmeticException e) {
            return deadline > now ? Long.MAX_VALUE : 0L;
        }
    }

    public static boolean isExpired(long deadline, long now) {
        return deadline != NEVER && remaining(deadline, now) == 0L;
    }

    private static long saturatedNanos(Duration ttl) {
        try {
            return ttl.toNanos();
        } catch (ArithmeticException e) {
            return ttl.isNegative() ? Long.MIN_VALUE : Long.MAX_VALUE;
        }
    }
}
