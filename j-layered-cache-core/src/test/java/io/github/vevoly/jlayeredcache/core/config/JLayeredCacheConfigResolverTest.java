package io.github.vevoly.jlayeredcache.core.config;

import io.github.vevoly.jlayeredcache.api.config.ResolvedJLayeredCacheConfig;
import io.github.vevoly.jlayeredcache.core.properties.JLayeredCacheDomainProperties;
import io.github.vevoly.jlayeredcache.core.properties.JLayeredCacheRootProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JLayeredCacheConfigResolverTest {

    private JLayeredCacheRootProperties properties;

    @BeforeEach
    void setUp() {
        properties = new JLayeredCacheRootProperties();
    }

    private static JLayeredCacheDomainProperties domain(String namespace, Duration ttl, Duration collectionTtl) {
        JLayeredCacheDomainProperties props = new JLayeredCacheDomainProperties();
        props.setNamespace(namespace);
        props.setTtl(ttl);
        props.setCollectionTtl(collectionTtl);
        return props;
    }

    private JLayeredCacheConfigResolver started() {
        JLayeredCacheConfigResolver resolver = new JLayeredCacheConfigResolver(properties);
        resolver.afterPropertiesSet();
        return resolver;
    }

    @Nested
    @DisplayName("领域配置合并 / Domain merge")
    class MergeTest {

        @Test
        @DisplayName("领域配置优先于默认值")
        void shouldPreferDomainSettings() {
            properties.getDefaults().setTtl(Duration.ofMinutes(30));
            properties.getDomains().put("applications", domain("apps", Duration.ofMinutes(5), null));

            ResolvedJLayeredCacheConfig config = started().resolve("applications");

            assertThat(config.getName()).isEqualTo("applications");
            assertThat(config.getNamespace()).isEqualTo("apps");
            assertThat(config.getCollectionNamespace()).isEqualTo("apps:collection");
            assertThat(config.getTtl()).isEqualTo(Duration.ofMinutes(5));
            assertThat(config.getCollectionTtl()).isEqualTo(Duration.ofMinutes(10));
        }

        @Test
        @DisplayName("未配置的领域按默认值解析，命名空间即领域名")
        void shouldResolveUnknownDomainOnTheFly() {
            properties.getDefaults().setTtl(Duration.ofMinutes(30));
            JLayeredCacheConfigResolver resolver = started();

            ResolvedJLayeredCacheConfig config = resolver.resolve("orders");

            assertThat(config.getNamespace()).isEqualTo("orders");
            assertThat(config.getTtl()).isEqualTo(Duration.ofMinutes(30));
            assertThat(resolver.resolve("orders")).isSameAs(config);
            assertThat(resolver.getAllResolvedConfigs()).contains(config);
        }

        @Test
        @DisplayName("默认命名空间作为全局前缀")
        void shouldPrefixWithDefaultNamespace() {
            properties.getDefaults().setNamespace("shop");
            properties.getDomains().put("user", new JLayeredCacheDomainProperties());

            assertThat(started().resolve("user").getNamespace()).isEqualTo("shop:user");
        }

        @Test
        @DisplayName("-1 表示不过期")
        void shouldTreatMinusOneAsNoExpiry() {
            properties.getDomains().put("dict", domain(null, Duration.ofMillis(-1), Duration.ofSeconds(-1)));

            ResolvedJLayeredCacheConfig config = started().resolve("dict");

            assertThat(config.getTtl()).isNull();
            assertThat(config.getCollectionTtl()).isNull();
        }

        @Test
        @DisplayName("空领域标识抛出 IllegalArgumentException")
        void shouldRejectBlankDomain() {
            JLayeredCacheConfigResolver resolver = started();

            assertThatThrownBy(() -> resolver.resolve(" ")).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> resolver.resolve(null)).isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("全局配置校验 / Global validation")
    class ValidationTest {

        @Test
        @DisplayName("默认配置可以启动")
        void shouldAcceptDefaults() {
            JLayeredCacheConfigResolver resolver = started();

            assertThat(resolver.getLocalMaxTtl()).isEqualTo(Duration.ofSeconds(300));
            assertThat(resolver.getLocalMaxSize()).isEqualTo(10_000L);
            assertThat(resolver.getSharedTimeout()).isEqualTo(Duration.ofMillis(2_000));
            assertThat(resolver.getMaxKeyLength()).isEqualTo(250);
            assertThat(resolver.getAllResolvedConfigs()).isEmpty();
        }

        @Test
        @DisplayName("L1 最大 TTL 必须为正")
        void shouldRejectNonPositiveLocalTtl() {
            properties.getLocal().setMaxTtl(Duration.ZERO);

            assertThatThrownBy(JLayeredCacheConfigResolverTest.this::started)
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("local.max-ttl");
        }

        @Test
        @DisplayName("L1 容量必须为正")
        void shouldRejectNonPositiveLocalSize() {
            properties.getLocal().setMaxSize(0);

            assertThatThrownBy(JLayeredCacheConfigResolverTest.this::started).isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("L2 超时必须为正")
        void shouldRejectNonPositiveTimeout() {
            properties.getShared().setTimeout(Duration.ofMillis(-5));

            assertThatThrownBy(JLayeredCacheConfigResolverTest.this::started).isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("L2 超时不能小于 1 毫秒")
        void shouldRejectSubMillisecondTimeout() {
            properties.getShared().setTimeout(Duration.ofNanos(500_000));

            assertThatThrownBy(JLayeredCacheConfigResolverTest.this::started)
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("shared.timeout");
        }

        @Test
        @DisplayName("键长度阈值不能过小")
        void shouldRejectTinyKeyLength() {
            properties.getKey().setMaxLength(10);

            assertThatThrownBy(JLayeredCacheConfigResolverTest.this::started)
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("key.max-length");
        }

        @Test
        @DisplayName("领域 TTL 为 0 时启动失败")
        void shouldRejectZeroDomainTtl() {
            properties.getDomains().put("user", domain(null, Duration.ZERO, null));

            assertThatThrownBy(JLayeredCacheConfigResolverTest.this::started)
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("'ttl' of 'user'");
        }

        @Test
        @DisplayName("默认 TTL 为负数 (非 -1) 时启动失败")
        void shouldRejectNegativeDefaultTtl() {
            properties.getDefaults().setCollectionTtl(Duration.ofSeconds(-10));

            assertThatThrownBy(JLayeredCacheConfigResolverTest.this::started).isInstanceOf(IllegalStateException.class);
        }
    }
}
