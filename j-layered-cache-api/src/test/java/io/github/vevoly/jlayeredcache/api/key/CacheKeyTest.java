package io.github.vevoly.jlayeredcache.api.key;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CacheKeyTest {

    @Test
    @DisplayName("普通键的存储值就是原始键")
    void plainKeyUsesRawValue() {
        CacheKey key = CacheKey.plain("user:42");

        assertThat(key.getRaw()).isEqualTo("user:42");
        assertThat(key.getValue()).isEqualTo("user:42");
        assertThat(key.isHashed()).isFalse();
        assertThat(key).hasToString("user:42");
    }

    @Test
    @DisplayName("摘要键保留原始键用于排查")
    void hashedKeyKeepsRaw() {
        CacheKey key = CacheKey.hashed("very:long:key", "abc123");

        assertThat(key.getValue()).isEqualTo("abc123");
        assertThat(key.getRaw()).isEqualTo("very:long:key");
        assertThat(key.isHashed()).isTrue();
    }

    @Test
    @DisplayName("相等性只看存储值")
    void equalityUsesStoredValue() {
        assertThat(CacheKey.plain("user:42")).isEqualTo(CacheKey.plain("user:42"));
        assertThat(CacheKey.hashed("a", "d")).isEqualTo(CacheKey.hashed("b", "d"));
        assertThat(CacheKey.plain("user:42")).isNotEqualTo(CacheKey.plain("user:43"));
    }
}
