package io.github.vevoly.jlayeredcache.api.structure;

import lombok.Builder;
import lombok.Getter;

/**
 * 多级缓存的统计快照。
 * <p>
 * A point-in-time statistics snapshot of the layered cache.
 *
 * @author vevoly
 */
@Getter
@Builder
public final class JLayeredCacheStats {

    private final long localHits;
    private final long sharedHits;
    private final long misses;
    private final long promotions;
    private final long localSize;
    private final long localEvictions;

    public long getRequestCount() {
        return localHits + sharedHits + misses;
    }

    public double getHitRate() {
        long requests = getRequestCount();
        return requests == 0 ? 0.0 : (double) (localHits + sharedHits) / requests;
    }

    @Override
    public String toString() {
        return String.format(
                "HitRate: %.2f%% | " +
                        "LocalHits: %d | " +
                        "SharedHits: %d | " +
                        "Misses: %d | " +
                        "Promotions: %d | " +
                        "LocalSize: %d | " +
                        "LocalEvictions: %d",
                getHitRate() * 100,
                localHits,
                sharedHits,
                misses,
                promotions,
                localSize,
                localEvictions
        );
    }
}
