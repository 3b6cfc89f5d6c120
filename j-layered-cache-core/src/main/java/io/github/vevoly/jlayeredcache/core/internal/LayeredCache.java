package io.github.vevoly.jlayeredcache.core.internal;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.vevoly.jlayeredcache.api.backend.CacheBackend;
import io.github.vevoly.jlayeredcache.api.backend.TimedValue;
import io.github.vevoly.jlayeredcache.api.structure.JLayeredCacheStats;
import io.github.vevoly.jlayeredcache.core.backend.LocalCacheBackend;
import io.github.vevoly.jlayeredcache.core.utils.I18nLogger;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Supplier;

/**
 * 两级缓存编排器：L1 本地后端 + L2 共享后端。
 * <p>
 * 读：先查 L1，命中直接返回；未命中再查 L2，L2 命中后以 {@code min(L2 剩余 TTL, L1 上限)} 回填 L1 再返回。
 * L2 给不出剩余 TTL 时不回填。
 * 写：先写 L1（TTL 截断到上限），再以原始 TTL 写 L2，两层互不影响。
 * 删：两层都删。存在性：任意一层存在即为存在。
 * 每一层的调用都单独隔离，任何一层抛出的异常都只会被记录。
 * <p>
 * The two-tier orchestrator: an L1 local backend plus an L2 shared backend.
 * Read: L1 first and return on a hit; otherwise L2, and on an L2 hit promote into L1 with
 * {@code min(remaining L2 TTL, L1 cap)} before returning. Nothing is promoted when L2 cannot report the remaining TTL.
 * Write: L1 first with the TTL capped, then L2 with the requested TTL; the tiers do not affect each other.
 * Delete: both tiers. Exists: present in either tier.
 * Every tier call is isolated; an exception from either tier is only logged.
 *
 * @author vevoly
 */
@Slf4j
public class LayeredCache implements CacheBackend {

    private final I18nLogger i18nLog = new I18nLogger(log);

    @Getter
    private final LocalCacheBackend local;
    @Getter
    private final CacheBackend shared;

    private final LongAdder localHits = new LongAdder();
    private final LongAdder sharedHits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder promotions = new LongAdder();

    public LayeredCache(LocalCacheBackend local, CacheBackend shared) {
        this.local = Objects.requireNonNull(local, "local");
        this.shared = Objects.requireNonNull(shared, "shared");
    }

    @Override
    public Optional<JsonNode> get(String key) {
        return getWithTtl(key).map(TimedValue::getValue);
    }

    @Override
    public Optional<TimedValue> getWithTtl(String key) {
        Optional<TimedValue> fromLocal = tier("L1", "get", key, () -> local.getWithTtl(key), Optional.empty());
        if (fromLocal.isPresent()) {
            localHits.increment();
            return fromLocal;
        }
        Optional<TimedValue> fromShared = tier("L2", "get", key, () -> shared.getWithTtl(key), Optional.empty());
        if (fromShared.isEmpty()) {
            misses.increment();
            return Optional.empty();
        }
        sharedHits.increment();
        promote(key, fromShared.get());
        return fromShared;
    }

    @Override
    public void set(String key, JsonNode value, Duration ttl) {
        tier("L1", "set", key, () -> {
            local.set(key, value, local.capTtl(ttl));
            return null;
        }, null);
        tier("L2", "set", key, () -> {
            shared.set(key, value, ttl);
            return null;
        }, null);
    }

    @Override
    public void delete(String key) {
        tier("L1", "delete", key, () -> {
            local.delete(key);
            return null;
        }, null);
        tier("L2", "delete", key, () -> {
            shared.delete(key);
            return null;
        }, null);
    }

    @Override
    public boolean exists(String key) {
        return tier("L1", "exists", key, () -> local.exists(key), Boolean.FALSE)
                || tier("L2", "exists", key, () -> shared.exists(key), Boolean.FALSE);
    }

    /**
     * 剩余 TTL 以 L2 为准，L2 不知道时再看 L1。
     * <p>
     * The remaining TTL as known by L2, falling back to L1.
     */
    @Override
    public Optional<Duration> remainingTtl(String key) {
        Optional<Duration> fromShared = tier("L2", "ttl", key, () -> shared.remainingTtl(key), Optional.empty());
        return fromShared.isPresent() ? fromShared : tier("L1", "ttl", key, () -> local.remainingTtl(key), Optional.empty());
    }

    /**
     * 两层都按模式删除，返回两层删除数之和。
     * <p>
     * Deletes by pattern in both tiers and returns the combined count.
     */
    @Override
    public long deleteByPattern(String pattern) {
        long fromLocal = tier("L1", "deleteByPattern", pattern, () -> local.deleteByPattern(pattern), 0L);
        long fromShared = tier("L2", "deleteByPattern", pattern, () -> shared.deleteByPattern(pattern), 0L);
        return fromLocal + fromShared;
    }

    /**
     * 清空 L1，L2 不受影响。
     * <p>
     * Clears L1 only.
     */
    public void clearLocal() {
        local.clear();
        i18nLog.info("l1.cleared");
    }

    public JLayeredCacheStats stats() {
        return JLayeredCacheStats.builder()
                .localHits(localHits.sum())
                .sharedHits(sharedHits.sum())
                .misses(misses.sum())
                .promotions(promotions.sum())
                .localSize(local.estimatedSize())
                .localEvictions(local.stats().evictionCount())
                .build();
    }

    private void promote(String key, TimedValue found) {
        if (found.getLifetime() == TimedValue.Lifetime.UNKNOWN) {
            i18nLog.debug("l1.promotion_skipped", key);
            return;
        }
        tier("L1", "promote", key, () -> {
            // UNBOUNDED 时 remainingTtl 为 null，capTtl 取上限
            Duration ttl = local.capTtl(found.getRemainingTtl());
            local.set(key, found.getValue(), ttl);
            promotions.increment();
            i18nLog.debug("l1.promoted", key, ttl);
            return null;
        }, null);
    }

    private <T> T tier(String tier, String operation, String key, Supplier<T> call, T fallback) {
        try {
            T result = call.get();
            return result == null ? fallback : result;
        } catch (RuntimeException e) {
            i18nLog.error("tier.unexpected_error", e, tier, operation, key, e.getMessage());
            return fallback;
        }
    }
}
