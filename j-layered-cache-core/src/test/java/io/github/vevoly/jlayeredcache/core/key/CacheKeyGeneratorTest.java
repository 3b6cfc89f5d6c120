package io.github.vevoly.jlayeredcache.core.key;

import io.github.vevoly.jlayeredcache.api.key.CacheKey;
import org.apache.commons.codec.digest.DigestUtils;
import org.apache.commons.lang3.StringUtils;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CacheKeyGeneratorTest {

    private final CacheKeyGenerator generator = new CacheKeyGenerator();

    @Nested
    @DisplayName("键的拼接 / Key assembly")
    class AssemblyTest {

        @Test
        @DisplayName("位置参数按调用顺序拼接")
        void shouldJoinPositionalInCallOrder() {
            assertThat(generator.generate("user", 42).getValue()).isEqualTo("user:42");
            assertThat(generator.generate("apps", "a", "b").getValue()).isEqualTo("apps:a:b");
            assertThat(generator.generate("apps", "b", "a").getValue()).isEqualTo("apps:b:a");
        }

        @Test
        @DisplayName("命名参数按名称排序，与传入顺序无关")
        void shouldSortNamedComponents() {
            Map<String, Object> pageFirst = new LinkedHashMap<>();
            pageFirst.put("page", 2);
            pageFirst.put("limit", 20);
            Map<String, Object> limitFirst = new LinkedHashMap<>();
            limitFirst.put("limit", 20);
            limitFirst.put("page", 2);

            CacheKey a = generator.generate("apps", List.of(7), pageFirst);
            CacheKey b = generator.generate("apps", List.of(7), limitFirst);

            assertThat(a).isEqualTo(b);
            assertThat(a.getValue()).isEqualTo("apps:7:limit=20:page=2");
        }

        @Test
        @DisplayName("null 渲染为字面量 null")
        void shouldRenderNullLiterally() {
            Map<String, Object> named = new LinkedHashMap<>();
            named.put("status", null);

            assertThat(generator.generate("user", Arrays.asList(1, null), named).getValue())
                    .isEqualTo("user:1:null:status=null");
            assertThat(generator.generate(null, 1).getValue()).isEqualTo("null:1");
            assertThat(generator.generate("user", (Object) null).getValue()).isEqualTo("user:null");
        }

        @Test
        @DisplayName("没有参数时只有前缀")
        void shouldReturnPrefixOnly() {
            assertThat(generator.generate("jobs").getValue()).isEqualTo("jobs");
            assertThat(generator.generate("jobs", null, null).getValue()).isEqualTo("jobs");
        }

        @Test
        @DisplayName("相同输入永远得到相同的键")
        void shouldBeDeterministic() {
            for (int i = 0; i < 10; i++) {
                assertThat(generator.generate("recommendations", 9, "daily")).isEqualTo(generator.generate("recommendations", 9, "daily"));
            }
        }
    }

    @Nested
    @DisplayName("超长键 / Oversized keys")
    class HashingTest {

        @Test
        @DisplayName("超过阈值时使用带命名空间的 SHA-256 摘要")
        void shouldHashOversizedKey() {
            String longPart = StringUtils.repeat('x', 300);

            CacheKey key = generator.generate("apps", longPart);

            assertThat(key.isHashed()).isTrue();
            assertThat(key.getValue()).isEqualTo("apps:" + DigestUtils.sha256Hex("apps:" + longPart));
            assertThat(key.getRaw()).isEqualTo("apps:" + longPart);
        }

        @Test
        @DisplayName("相同的超长输入得到相同的摘要")
        void shouldHashIdenticallyOnEveryCall() {
            String longPart = StringUtils.repeat("abc", 120);

            assertThat(generator.generate("apps", longPart, 1).getValue())
                    .isEqualTo(generator.generate("apps", longPart, 1).getValue());
            assertThat(generator.generate("apps", longPart, 1).getValue())
                    .isNotEqualTo(generator.generate("apps", longPart, 2).getValue());
        }

        @Test
        @DisplayName("恰好等于阈值时不做摘要")
        void shouldKeepKeyAtThreshold() {
            String part = StringUtils.repeat('y', 250 - "apps:".length());

            CacheKey key = generator.generate("apps", part);

            assertThat(key.isHashed()).isFalse();
            assertThat(key.getValue()).hasSize(250);
        }

        @Test
        @DisplayName("阈值可以配置")
        void shouldHonorCustomThreshold() {
            CacheKeyGenerator strict = new CacheKeyGenerator(64);

            assertThat(strict.generate("apps", StringUtils.repeat('z', 60)).isHashed()).isTrue();
            assertThat(strict.generate("apps", 1).isHashed()).isFalse();
        }

        @Test
        @DisplayName("阈值放不下命名空间时截断命名空间，完全放不下时只用摘要")
        void shouldTruncateNamespaceToFitThreshold() {
            String longPart = StringUtils.repeat('z', 80);

            CacheKey truncated = new CacheKeyGenerator(70).generate("applications", longPart);
            CacheKey bare = new CacheKeyGenerator(64).generate("applications", longPart);

            assertThat(truncated.getValue())
                    .hasSize(70)
                    .isEqualTo("appli:" + DigestUtils.sha256Hex("applications:" + longPart));
            assertThat(bare.getValue()).isEqualTo(DigestUtils.sha256Hex("applications:" + longPart));
        }

        @Test
        @DisplayName("阈值过小是配置错误")
        void shouldRejectTooSmallThreshold() {
            assertThatThrownBy(() -> new CacheKeyGenerator(10)).isInstanceOf(IllegalArgumentException.class);
        }
    }
}
