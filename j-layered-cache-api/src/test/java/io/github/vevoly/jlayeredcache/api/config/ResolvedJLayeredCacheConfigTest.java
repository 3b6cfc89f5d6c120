package io.github.vevoly.jlayeredcache.api.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class ResolvedJLayeredCacheConfigTest {

    @Test
    @DisplayName("集合命名空间由实体命名空间派生")
    void shouldDeriveCollectionNamespace() {
        ResolvedJLayeredCacheConfig config = ResolvedJLayeredCacheConfig.builder()
                .name("applications")
                .namespace("apps")
                .build();

        assertThat(config.getCollectionNamespace()).isEqualTo("apps:collection");
        assertThat(config.getTtl()).isEqualTo(Duration.ofHours(1));
        assertThat(config.getCollectionTtl()).isEqualTo(Duration.ofMinutes(10));
    }

    @Test
    @DisplayName("显式设置为 null 表示不过期")
    void shouldKeepExplicitNoExpiry() {
        ResolvedJLayeredCacheConfig config = ResolvedJLayeredCacheConfig.builder()
                .name("dict")
                .namespace("dict")
                .ttl(null)
                .build();

        assertThat(config.getTtl()).isNull();
    }
}
