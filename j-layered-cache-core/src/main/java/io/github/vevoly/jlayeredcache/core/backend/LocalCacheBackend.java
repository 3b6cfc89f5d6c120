package io.github.vevoly.jlayeredcache.core.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import io.github.vevoly.jlayeredcache.api.backend.CacheBackend;
import io.github.vevoly.jlayeredcache.api.backend.TimedValue;
import io.github.vevoly.jlayeredcache.core.utils.ExpiryNanos;
import io.github.vevoly.jlayeredcache.core.utils.I18nLogger;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.util.PatternMatchUtils;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 基于 Caffeine 的进程内 L1 缓存后端。
 * <p>
 * 每条记录都有自己的过期时刻，通过 Caffeine 的 {@link Expiry} 实现按条目过期；同时有条目数量上限。
 * 读取时会再次核对过期时刻，已过期的条目当场移除并视为未命中，因此永远不会返回过期数据。
 * 写入 L1 的 TTL 应先经过 {@link #capTtl(Duration)} 截断，保证本地副本的陈旧程度有上限。
 * <p>
 * The in-process L1 cache backend, built on Caffeine.
 * Every record carries its own expiry instant, enforced per entry through Caffeine's {@link Expiry}, and the number of entries is bounded.
 * Reads re-check the expiry instant; an expired record is removed on the spot and reported absent, so stale data is never returned.
 * TTLs written to L1 should go through {@link #capTtl(Duration)} first, which bounds how stale a local copy can get.
 *
 * @author vevoly
 */
@Slf4j
public class LocalCacheBackend implements CacheBackend {

    private final I18nLogger i18nLog = new I18nLogger(log);

    @Getter
    private final Duration maxTtl;
    @Getter
    private final long maxSize;
    private final Ticker ticker;
    private final Cache<String, CacheEntry> cache;

    public LocalCacheBackend(Duration maxTtl, long maxSize) {
        this(maxTtl, maxSize, Ticker.systemTicker());
    }

    /**
     * @param maxTtl  L1 的 TTL 上限 / the L1 TTL cap
     * @param maxSize L1 的最大条目数 / the maximum number of L1 entries
     * @param ticker  时间源，测试中可替换 / the time source, replaceable in tests
     */
    public LocalCacheBackend(Duration maxTtl, long maxSize, Ticker ticker) {
        Objects.requireNonNull(maxTtl, "maxTtl");
        if (maxTtl.isNegative() || maxTtl.isZero()) {
            throw new IllegalArgumentException("maxTtl must be positive: " + maxTtl);
        }
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive: " + maxSize);
        }
        this.maxTtl = maxTtl;
        this.maxSize = maxSize;
        this.ticker = Objects.requireNonNull(ticker, "ticker");
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxSize)
                .expireAfter(new EntryExpiry())
                .ticker(ticker)
                .recordStats()
                .build();
    }

    @Override
    public Optional<JsonNode> get(String key) {
        if (key == null) {
            return Optional.empty();
        }
        try {
            CacheEntry entry = cache.getIfPresent(key);
            if (entry == null) {
                return Optional.empty();
            }
            if (entry.isExpired(ticker.read())) {
                // 惰性淘汰，只移除读到的这一条，避免误删并发写入的新值
                cache.asMap().remove(key, entry);
                return Optional.empty();
            }
            return Optional.of(entry.getValue().deepCopy());
        } catch (RuntimeException e) {
            i18nLog.error("l1.get_error", e, key, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void set(String key, JsonNode value, Duration ttl) {
        if (key == null) {
            return;
        }
        if (value == null || (ttl != null && (ttl.isNegative() || ttl.isZero()))) {
            delete(key);
            return;
        }
        try {
            long expireAt = ExpiryNanos.deadline(ticker.read(), ttl);
            cache.put(key, new CacheEntry(value.deepCopy(), expireAt));
        } catch (RuntimeException e) {
            i18nLog.error("l1.set_error", e, key, e.getMessage());
        }
    }

    @Override
    public void delete(String key) {
        if (key == null) {
            return;
        }
        try {
            cache.invalidate(key);
        } catch (RuntimeException e) {
            i18nLog.error("l1.delete_error", e, key, e.getMessage());
        }
    }

    @Override
    public boolean exists(String key) {
        return get(key).isPresent();
    }

    @Override
    public Optional<Duration> remainingTtl(String key) {
        if (key == null) {
            return Optional.empty();
        }
        CacheEntry entry = cache.getIfPresent(key);
        if (entry == null || entry.getExpireAtNanos() == ExpiryNanos.NEVER) {
            return Optional.empty();
        }
        long remaining = entry.remainingNanos(ticker.read());
        return remaining == 0L ? Optional.empty() : Optional.of(Duration.ofNanos(remaining));
    }

    @Override
    public Optional<TimedValue> getWithTtl(String key) {
        if (key == null) {
            return Optional.empty();
        }
        try {
            CacheEntry entry = cache.getIfPresent(key);
            if (entry == null) {
                return Optional.empty();
            }
            long now = ticker.read();
            if (entry.isExpired(now)) {
                cache.asMap().remove(key, entry);
                return Optional.empty();
            }
            JsonNode copy = entry.getValue().deepCopy();
            if (entry.getExpireAtNanos() == ExpiryNanos.NEVER) {
                return Optional.of(TimedValue.unbounded(copy));
            }
            return Optional.of(TimedValue.bounded(copy, Duration.ofNanos(entry.remainingNanos(now))));
        } catch (RuntimeException e) {
            i18nLog.error("l1.get_error", e, key, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * 只含 {@code *} 的模式逐条匹配删除；含 {@code ?}、{@code [} 或转义的模式直接清空 L1。
     * <p>
     * Patterns using only {@code *} are matched key by key. Patterns with {@code ?}, {@code [} or escapes clear all of L1.
     *
     * @return 移除的条目数 / the number of entries removed
     */
    @Override
    public long deleteByPattern(String pattern) {
        if (StringUtils.isEmpty(pattern)) {
            return 0L;
        }
        try {
            if (StringUtils.containsAny(pattern, '?', '[', ']', '\\')) {
                long size = cache.estimatedSize();
                cache.invalidateAll();
                i18nLog.debug("l1.pattern_cleared_all", pattern);
                return size;
            }
            Set<String> matched = cache.asMap().keySet().stream()
                    .filter(k -> PatternMatchUtils.simpleMatch(pattern, k))
                    .collect(Collectors.toSet());
            cache.invalidateAll(matched);
            return matched.size();
        } catch (RuntimeException e) {
            i18nLog.error("l1.delete_error", e, pattern, e.getMessage());
            return 0L;
        }
    }

    /**
     * 把请求的 TTL 截断到 L1 的上限。{@code null}（不过期）返回上限本身。
     * <p>
     * Caps the requested TTL at the L1 maximum. A {@code null} request (no expiry) yields the cap itself.
     *
     * @param requested 请求的 TTL / the requested TTL
     * @return {@code min(requested, maxTtl)}
     */
    public Duration capTtl(Duration requested) {
        if (requested == null || requested.compareTo(maxTtl) > 0) {
            return maxTtl;
        }
        return requested;
    }

    /**
     * 清空 L1。
     * <p>
     * Clears every L1 entry.
     */
    public void clear() {
        cache.invalidateAll();
    }

    public long estimatedSize() {
        return cache.estimatedSize();
    }

    public CacheStats stats() {
        return cache.stats();
    }

    /**
     * 立即执行 Caffeine 挂起的维护任务（淘汰、过期清理）。
     * <p>
     * Runs Caffeine's pending maintenance (eviction, expiry cleanup) right away.
     */
    public void cleanUp() {
        cache.cleanUp();
    }

    /**
     * 按条目自身的过期时刻计算剩余时间。更新时重新计算，读取不影响过期时间。
     * <p>
     * Derives the remaining lifetime from each entry's own expiry instant. Recomputed on update, untouched by reads.
     */
    private static final class EntryExpiry implements Expiry<String, CacheEntry> {

        @Override
        public long expireAfterCreate(String key, CacheEntry entry, long currentTime) {
            return entry.remainingNanos(currentTime);
        }

        @Override
        public long expireAfterUpdate(String key, CacheEntry entry, long currentTime, long currentDuration) {
            return entry.remainingNanos(currentTime);
        }

        @Override
        public long expireAfterRead(String key, CacheEntry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
