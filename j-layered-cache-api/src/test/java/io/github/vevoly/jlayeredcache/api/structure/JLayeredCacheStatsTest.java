package io.github.vevoly.jlayeredcache.api.structure;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class JLayeredCacheStatsTest {

    @Test
    @DisplayName("命中率按两层命中数计算")
    void shouldComputeHitRate() {
        JLayeredCacheStats stats = JLayeredCacheStats.builder()
                .localHits(6)
                .sharedHits(2)
                .misses(2)
                .promotions(2)
                .build();

        assertThat(stats.getRequestCount()).isEqualTo(10);
        assertThat(stats.getHitRate()).isCloseTo(0.8, within(1e-9));
        assertThat(stats.toString()).startsWith("HitRate: 80.00%");
    }

    @Test
    @DisplayName("没有请求时命中率为 0")
    void shouldHandleNoRequests() {
        assertThat(JLayeredCacheStats.builder().build().getHitRate()).isZero();
    }
}
