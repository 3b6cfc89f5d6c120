package io.github.vevoly.jlayeredcache.core.support;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.vevoly.jlayeredcache.api.backend.CacheBackend;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 每次调用都抛出异常的后端，用来验证调用方的隔离。
 */
public class FailingCacheBackend implements CacheBackend {

    private final AtomicInteger calls = new AtomicInteger();

    @Override
    public Optional<JsonNode> get(String key) {
        throw fail();
    }

    @Override
    public void set(String key, JsonNode value, Duration ttl) {
        throw fail();
    }

    @Override
    public void delete(String key) {
        throw fail();
    }

    @Override
    public boolean exists(String key) {
        throw fail();
    }

    @Override
    public Optional<Duration> remainingTtl(String key) {
        throw fail();
    }

    @Override
    public long deleteByPattern(String pattern) {
        throw fail();
    }

    public int getCalls() {
        return calls.get();
    }

    private IllegalStateException fail() {
        calls.incrementAndGet();
        return new IllegalStateException("backend is broken");
    }
}
