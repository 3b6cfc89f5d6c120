package io.github.vevoly.jlayeredcache.core.utils;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class ExpiryNanosTest {

    @Test
    @DisplayName("null TTL 永不过期")
    void nullTtlNeverExpires() {
        long deadline = ExpiryNanos.deadline(100L, null);

        assertThat(deadline).isEqualTo(ExpiryNanos.NEVER);
        assertThat(ExpiryNanos.isExpired(deadline, Long.MAX_VALUE - 1)).isFalse();
        assertThat(ExpiryNanos.remaining(deadline, 100L)).isEqualTo(Long.MAX_VALUE);
    }

    @Test
    @DisplayName("到达过期时刻即视为过期")
    void expiresAtDeadline() {
        long deadline = ExpiryNanos.deadline(100L, Duration.ofNanos(50));

        assertThat(ExpiryNanos.remaining(deadline, 120L)).isEqualTo(30L);
        assertThat(ExpiryNanos.isExpired(deadline, 149L)).isFalse();
        assertThat(ExpiryNanos.isExpired(deadline, 150L)).isTrue();
        assertThat(ExpiryNanos.remaining(deadline, 500L)).isZero();
    }

    @Test
    @DisplayName("极大的 TTL 不会溢出")
    void saturatesOnOverflow() {
        assertThat(ExpiryNanos.deadline(Long.MAX_VALUE - 10, Duration.ofDays(365 * 1000L))).isEqualTo(ExpiryNanos.NEVER);
        assertThat(ExpiryNanos.remaining(Long.MAX_VALUE - 1, -10L)).isEqualTo(Long.MAX_VALUE);
        assertThat(ExpiryNanos.remaining(-10L, Long.MAX_VALUE - 1)).isZero();
    }
}
