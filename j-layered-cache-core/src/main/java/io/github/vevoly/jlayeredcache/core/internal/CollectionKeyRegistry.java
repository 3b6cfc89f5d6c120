package io.github.vevoly.jlayeredcache.core.internal;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import io.github.vevoly.jlayeredcache.api.constants.JLayeredCacheConstants;
import io.github.vevoly.jlayeredcache.core.utils.ExpiryNanos;
import io.github.vevoly.jlayeredcache.core.utils.I18nLogger;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 记录本实例写入过的分页集合缓存键，按所属实体分组，供实体失效时一并删除。
 * <p>
 * 记录本身是有界的：实体数量有上限，每个实体记录的键数量有上限，记录在其最长的集合 TTL 之后自动过期。
 * 超出上限或其它进程写入的键不会被记录，只能依靠自身的 TTL 过期。
 * <p>
 * Tracks the paginated collection keys this instance has written, grouped by owning entity, so they can be deleted
 * when the entity is invalidated.
 * The registry is bounded: the number of entities is capped, the number of keys per entity is capped, and a record
 * expires after the longest collection TTL it has seen. Keys beyond the caps, or written by other processes, are not
 * tracked and age out through their own TTL.
 *
 * @author vevoly
 */
@Slf4j
public class CollectionKeyRegistry {

    private final I18nLogger i18nLog = new I18nLogger(log);

    private final int maxKeysPerEntity;
    private final Ticker ticker;
    private final Cache<String, TrackedKeys> tracked;

    public CollectionKeyRegistry() {
        this(JLayeredCacheConstants.MAX_TRACKED_ENTITIES, JLayeredCacheConstants.MAX_TRACKED_COLLECTION_KEYS_PER_ENTITY, Ticker.systemTicker());
    }

    public CollectionKeyRegistry(long maxEntities, int maxKeysPerEntity, Ticker ticker) {
        this.maxKeysPerEntity = maxKeysPerEntity;
        this.ticker = ticker;
        this.tracked = Caffeine.newBuilder()
                .maximumSize(maxEntities)
                .expireAfter(new TrackedKeysExpiry())
                .ticker(ticker)
                .build();
    }

    /**
     * 记录一个集合键。
     * <p>
     * Tracks one collection key.
     *
     * @param entityKey     所属实体的缓存键 / the owning entity's cache key
     * @param collectionKey 集合缓存键 / the collection cache key
     * @param ttl           集合的 TTL，{@code null} 表示不过期 / the collection TTL, {@code null} for no expiry
     */
    public void track(String entityKey, String collectionKey, Duration ttl) {
        long deadline = ExpiryNanos.deadline(ticker.read(), ttl);
        tracked.asMap().compute(entityKey, (k, current) -> {
            TrackedKeys keys = current == null ? new TrackedKeys() : current;
            if (keys.keys.size() >= maxKeysPerEntity && !keys.keys.contains(collectionKey)) {
                i18nLog.warn("registry.entity_full", entityKey, maxKeysPerEntity, collectionKey);
                return keys;
            }
            keys.keys.add(collectionKey);
            keys.expireAtNanos = Math.max(keys.expireAtNanos, deadline);
            return keys;
        });
    }

    /**
     * 取出并移除某个实体下记录的所有集合键。
     * <p>
     * Removes and returns every collection key tracked for the entity.
     */
    public Set<String> drain(String entityKey) {
        TrackedKeys keys = tracked.asMap().remove(entityKey);
        if (keys == null) {
            return Collections.emptySet();
        }
        return new LinkedHashSet<>(keys.keys);
    }

    public Set<String> trackedKeys(String entityKey) {
        TrackedKeys keys = tracked.getIfPresent(entityKey);
        return keys == null ? Collections.emptySet() : Collections.unmodifiableSet(new LinkedHashSet<>(keys.keys));
    }

    public void clear() {
        tracked.invalidateAll();
    }

    public long trackedEntities() {
        return tracked.estimatedSize();
    }

    /**
     * 只在 {@code compute} 内部修改。
     * <p>
     * Mutated only inside {@code compute}.
     */
    private static final class TrackedKeys {
        private final Set<String> keys = ConcurrentHashMap.newKeySet();
        private volatile long expireAtNanos = Long.MIN_VALUE;
    }

    private static final class TrackedKeysExpiry implements Expiry<String, TrackedKeys> {

        @Override
        public long expireAfterCreate(String key, TrackedKeys value, long currentTime) {
            return ExpiryNanos.remaining(value.expireAtNanos, currentTime);
        }

        @Override
        public long expireAfterUpdate(String key, TrackedKeys value, long currentTime, long currentDuration) {
            return ExpiryNanos.remaining(value.expireAtNanos, currentTime);
        }

        @Override
        public long expireAfterRead(String key, TrackedKeys value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
