package io.github.vevoly.jlayeredcache.core.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.vevoly.jlayeredcache.api.backend.TimedValue;
import io.github.vevoly.jlayeredcache.core.support.FakeTicker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LocalCacheBackendTest {

    private static final Duration MAX_TTL = Duration.ofSeconds(300);

    private FakeTicker ticker;
    private LocalCacheBackend backend;

    @BeforeEach
    void setUp() {
        ticker = new FakeTicker();
        backend = new LocalCacheBackend(MAX_TTL, 100, ticker);
    }

    private static JsonNode user(String name) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("name", name);
        return node;
    }

    @Nested
    @DisplayName("读写 / Read and write")
    class ReadWriteTest {

        @Test
        @DisplayName("写入后立即可以读到")
        void shouldReturnWhatWasSet() {
            backend.set("user:42", user("Jo"), Duration.ofSeconds(1800));

            assertThat(backend.get("user:42")).contains(user("Jo"));
            assertThat(backend.exists("user:42")).isTrue();
        }

        @Test
        @DisplayName("重复写入会覆盖旧值")
        void shouldOverwrite() {
            backend.set("user:42", user("Jo"), Duration.ofSeconds(60));
            backend.set("user:42", user("Ann"), Duration.ofSeconds(60));

            assertThat(backend.get("user:42")).contains(user("Ann"));
        }

        @Test
        @DisplayName("未写入的键返回空")
        void shouldMissUnknownKey() {
            assertThat(backend.get("nope")).isEmpty();
            assertThat(backend.exists("nope")).isFalse();
            assertThat(backend.get(null)).isEmpty();
        }

        @Test
        @DisplayName("删除后返回空")
        void shouldDelete() {
            backend.set("user:42", user("Jo"), Duration.ofSeconds(60));

            backend.delete("user:42");

            assertThat(backend.get("user:42")).isEmpty();
        }

        @Test
        @DisplayName("读到的是副本，修改它不影响缓存")
        void shouldIsolateStoredValue() {
            ObjectNode original = (ObjectNode) user("Jo");
            backend.set("user:42", original, Duration.ofSeconds(60));
            original.put("name", "changed");

            ObjectNode read = (ObjectNode) backend.get("user:42").orElseThrow();
            read.put("name", "changed again");

            assertThat(backend.get("user:42")).contains(user("Jo"));
        }

        @Test
        @DisplayName("null 值或非正 TTL 等同于删除")
        void shouldTreatNullValueAndNonPositiveTtlAsDelete() {
            backend.set("a", user("Jo"), Duration.ofSeconds(60));
            backend.set("a", null, Duration.ofSeconds(60));
            backend.set("b", user("Jo"), Duration.ofSeconds(60));
            backend.set("b", user("Jo"), Duration.ZERO);
            backend.set("c", user("Jo"), Duration.ofSeconds(-5));

            assertThat(backend.get("a")).isEmpty();
            assertThat(backend.get("b")).isEmpty();
            assertThat(backend.get("c")).isEmpty();
        }
    }

    @Nested
    @DisplayName("过期 / Expiry")
    class ExpiryTest {

        @Test
        @DisplayName("过期后视为不存在")
        void shouldExpireAfterTtl() {
            backend.set("temp:1", JsonNodeFactory.instance.textNode("x"), Duration.ofSeconds(1));

            ticker.advance(Duration.ofSeconds(2));

            assertThat(backend.get("temp:1")).isEmpty();
            assertThat(backend.exists("temp:1")).isFalse();
        }

        @Test
        @DisplayName("过期前仍然可以读到")
        void shouldLiveUntilTtl() {
            backend.set("temp:1", JsonNodeFactory.instance.textNode("x"), Duration.ofSeconds(10));

            ticker.advance(Duration.ofSeconds(9));

            assertThat(backend.get("temp:1")).isPresent();
            assertThat(backend.remainingTtl("temp:1")).contains(Duration.ofSeconds(1));
        }

        @Test
        @DisplayName("null TTL 不过期")
        void shouldNeverExpireWithoutTtl() {
            backend.set("forever", JsonNodeFactory.instance.textNode("x"), null);

            ticker.advance(Duration.ofDays(3650));

            assertThat(backend.get("forever")).isPresent();
            assertThat(backend.remainingTtl("forever")).isEmpty();
        }

        @Test
        @DisplayName("读取不会延长过期时间")
        void shouldNotRefreshOnRead() {
            backend.set("temp:1", JsonNodeFactory.instance.textNode("x"), Duration.ofSeconds(10));

            ticker.advance(Duration.ofSeconds(6));
            assertThat(backend.get("temp:1")).isPresent();
            ticker.advance(Duration.ofSeconds(6));

            assertThat(backend.get("temp:1")).isEmpty();
        }
    }

    @Nested
    @DisplayName("容量与 TTL 上限 / Bounds")
    class BoundsTest {

        @Test
        @DisplayName("capTtl 返回请求值与上限中较小者")
        void shouldCapTtl() {
            assertThat(backend.capTtl(Duration.ofSeconds(30))).isEqualTo(Duration.ofSeconds(30));
            assertThat(backend.capTtl(Duration.ofHours(2))).isEqualTo(MAX_TTL);
            assertThat(backend.capTtl(null)).isEqualTo(MAX_TTL);
        }

        @Test
        @DisplayName("条目数量不会超过上限")
        void shouldBoundSize() {
            LocalCacheBackend small = new LocalCacheBackend(MAX_TTL, 10, ticker);
            for (int i = 0; i < 100; i++) {
                small.set("k" + i, JsonNodeFactory.instance.numberNode(i), Duration.ofSeconds(60));
            }

            small.cleanUp();

            assertThat(small.estimatedSize()).isLessThanOrEqualTo(10);
            assertThat(small.stats().evictionCount()).isGreaterThan(0);
        }

        @Test
        @DisplayName("clear 清空所有条目")
        void shouldClear() {
            backend.set("a", JsonNodeFactory.instance.textNode("x"), null);
            backend.set("b", JsonNodeFactory.instance.textNode("y"), null);

            backend.clear();

            assertThat(backend.get("a")).isEmpty();
            assertThat(backend.get("b")).isEmpty();
        }

        @Test
        @DisplayName("非法的构造参数")
        void shouldRejectInvalidSettings() {
            assertThatThrownBy(() -> new LocalCacheBackend(Duration.ZERO, 10)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> new LocalCacheBackend(MAX_TTL, 0)).isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("剩余 TTL 与按模式删除 / getWithTtl and deleteByPattern")
    class TimedAndPatternTest {

        @Test
        @DisplayName("getWithTtl 区分有限 TTL 与永不过期")
        void shouldReportLifetime() {
            backend.set("user:42", user("Jo"), Duration.ofSeconds(60));
            backend.set("user:43", user("Ann"), null);
            ticker.advance(Duration.ofSeconds(10));

            assertThat(backend.getWithTtl("user:42")).contains(TimedValue.bounded(user("Jo"), Duration.ofSeconds(50)));
            assertThat(backend.getWithTtl("user:43")).contains(TimedValue.unbounded(user("Ann")));
            assertThat(backend.getWithTtl("user:44")).isEmpty();
        }

        @Test
        @DisplayName("getWithTtl 不返回过期条目")
        void shouldNotReturnExpiredEntry() {
            backend.set("user:42", user("Jo"), Duration.ofSeconds(1));
            ticker.advance(Duration.ofSeconds(2));

            assertThat(backend.getWithTtl("user:42")).isEmpty();
        }

        @Test
        @DisplayName("只含 * 的模式逐条匹配")
        void shouldDeleteMatchingKeysOnly() {
            backend.set("user:1", user("A"), Duration.ofSeconds(60));
            backend.set("user:collection:1:limit=20:page=1", user("B"), Duration.ofSeconds(60));
            backend.set("apps:1", user("C"), Duration.ofSeconds(60));

            assertThat(backend.deleteByPattern("user:*")).isEqualTo(2);

            assertThat(backend.get("user:1")).isEmpty();
            assertThat(backend.get("user:collection:1:limit=20:page=1")).isEmpty();
            assertThat(backend.get("apps:1")).contains(user("C"));
        }

        @Test
        @DisplayName("无法本地匹配的模式清空全部条目")
        void shouldClearEverythingOnComplexPattern() {
            backend.set("user:1", user("A"), Duration.ofSeconds(60));
            backend.set("apps:1", user("C"), Duration.ofSeconds(60));

            backend.deleteByPattern("user:?");

            assertThat(backend.get("user:1")).isEmpty();
            assertThat(backend.get("apps:1")).isEmpty();
        }

        @Test
        @DisplayName("空模式什么都不删")
        void shouldIgnoreEmptyPattern() {
            backend.set("user:1", user("A"), Duration.ofSeconds(60));

            assertThat(backend.deleteByPattern("")).isZero();
            assertThat(backend.get("user:1")).contains(user("A"));
        }
    }
}
