package io.github.vevoly.jlayeredcache.core.backend;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.vevoly.jlayeredcache.api.backend.CacheBackend;
import io.github.vevoly.jlayeredcache.api.backend.TimedValue;
import io.github.vevoly.jlayeredcache.core.exception.CacheBackendUnavailableException;
import io.github.vevoly.jlayeredcache.core.exception.CacheSerializationException;
import io.github.vevoly.jlayeredcache.core.utils.I18nLogger;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.redisson.api.BatchOptions;
import org.redisson.api.RBatch;
import org.redisson.api.RBucket;
import org.redisson.api.RBucketAsync;
import org.redisson.api.RFuture;
import org.redisson.api.RedissonClient;
import org.redisson.client.RedisException;
import org.redisson.client.codec.StringCodec;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * 基于 Redisson 的 L2 共享缓存后端。
 * <p>
 * 值以 JSON 文本形式保存在 Redis String 中（{@link StringCodec}）。每次调用都走 Redisson 的异步 API，
 * 并以固定超时等待结果；超时、连接失败、数据损坏都会被记录并降级为未命中或空操作，不会抛给调用者。
 * {@link RedissonClient} 由调用方（通常是 Spring 容器）创建和关闭，此类只使用它。
 * <p>
 * The L2 shared cache backend, built on Redisson.
 * Values are stored as JSON text in Redis strings ({@link StringCodec}). Every call goes through Redisson's async API
 * and is awaited with a fixed timeout; timeouts, connection failures and corrupt payloads are logged and degrade to
 * a miss or a no-op, never reaching the caller.
 * The {@link RedissonClient} is created and shut down by its owner (usually the Spring context); this class only uses it.
 *
 * @author vevoly
 */
@Slf4j
public class RedissonSharedCacheBackend implements CacheBackend {

    private static final long TTL_NO_EXPIRY = -1L;
    private static final long TTL_KEY_ABSENT = -2L;

    private final I18nLogger i18nLog = new I18nLogger(log);

    private final RedissonClient redisson;
    private final ObjectMapper objectMapper;
    @Getter
    private final Duration timeout;

    public RedissonSharedCacheBackend(RedissonClient redisson, ObjectMapper objectMapper, Duration timeout) {
        this.redisson = Objects.requireNonNull(redisson, "redisson");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.toMillis() < 1) {
            throw new IllegalArgumentException("timeout must be at least 1ms: " + timeout);
        }
        this.timeout = timeout;
    }

    // ===================================================================
    // ====================== 同步接口 / Blocking API =====================
    // ===================================================================

    @Override
    public Optional<JsonNode> get(String key) {
        if (key == null) {
            return Optional.empty();
        }
        return execute("get", key, Optional.empty(), () -> {
            String text = await(bucket(key).getAsync(), "get", key);
            return text == null ? Optional.empty() : Optional.of(decode(key, text));
        });
    }

    @Override
    public void set(String key, JsonNode value, Duration ttl) {
        if (key == null) {
            return;
        }
        if (value == null || (ttl != null && (ttl.isNegative() || ttl.isZero()))) {
            delete(key);
            return;
        }
        execute("set", key, null, () -> {
            String text = encode(key, value);
            await(write(key, text, ttl), "set", key);
            return null;
        });
    }

    @Override
    public void delete(String key) {
        if (key == null) {
            return;
        }
        execute("delete", key, null, () -> {
            await(bucket(key).deleteAsync(), "delete", key);
            return null;
        });
    }

    @Override
    public boolean exists(String key) {
        if (key == null) {
            return false;
        }
        return execute("exists", key, Boolean.FALSE, () -> Boolean.TRUE.equals(await(bucket(key).isExistsAsync(), "exists", key)));
    }

    /**
     * 读取 Redis 中的剩余存活时间。键不存在（-2）或没有过期时间（-1）都返回空。
     * <p>
     * Reads the remaining time-to-live from Redis. Empty when the key is absent (-2) or has no expiry (-1).
     */
    @Override
    public Optional<Duration> remainingTtl(String key) {
        if (key == null) {
            return Optional.empty();
        }
        return execute("ttl", key, Optional.empty(), () -> toTtl(await(bucket(key).remainTimeToLiveAsync(), "ttl", key)));
    }

    /**
     * 在同一个原子批次（MULTI/EXEC）中执行 GET 和 PTTL，值和剩余时间来自同一时刻。
     * 键在两次命令之间不会被删除或过期，因此不会把已经消失的数据交给上层回填。
     * <p>
     * Runs GET and PTTL in one atomic batch (MULTI/EXEC), so the value and its lifetime are observed together.
     * The key cannot vanish between the two commands, so a value that is already gone is never handed out for promotion.
     */
    @Override
    public Optional<TimedValue> getWithTtl(String key) {
        if (key == null) {
            return Optional.empty();
        }
        return execute("getWithTtl", key, Optional.empty(), () -> {
            RBatch batch = redisson.createBatch(BatchOptions.defaults().executionMode(BatchOptions.ExecutionMode.IN_MEMORY_ATOMIC));
            RBucketAsync<String> batchBucket = batch.getBucket(key, StringCodec.INSTANCE);
            RFuture<String> text = batchBucket.getAsync();
            RFuture<Long> pttl = batchBucket.remainTimeToLiveAsync();
            await(batch.executeAsync(), "getWithTtl", key);
            return toTimedValue(key, await(text, "getWithTtl", key), await(pttl, "getWithTtl", key));
        });
    }

    /**
     * 通过 {@code SCAN} + {@code DEL} 删除匹配的键，不使用 {@code KEYS}。
     * <p>
     * Deletes matching keys through {@code SCAN} and {@code DEL}, never {@code KEYS}.
     */
    @Override
    public long deleteByPattern(String pattern) {
        if (StringUtils.isEmpty(pattern)) {
            return 0L;
        }
        return execute("deleteByPattern", pattern, 0L, () -> {
            Long deleted = await(redisson.getKeys().deleteByPatternAsync(pattern), "deleteByPattern", pattern);
            return deleted == null ? 0L : deleted;
        });
    }

    // ===================================================================
    // ====================== 异步接口 / Async API ========================
    // ===================================================================

    /**
     * 异步读取。返回的 Future 已经带有超时，且永远不会异常完成。
     * <p>
     * Reads asynchronously. The returned future is already bounded by the timeout and never completes exceptionally.
     */
    public CompletableFuture<Optional<JsonNode>> getAsync(String key) {
        if (key == null) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        return async("get", key, Optional.empty(), () -> bucket(key).getAsync(),
                text -> text == null ? Optional.<JsonNode>empty() : Optional.of(decode(key, text)));
    }

    public CompletableFuture<Void> setAsync(String key, JsonNode value, Duration ttl) {
        if (key == null) {
            return CompletableFuture.completedFuture(null);
        }
        if (value == null || (ttl != null && (ttl.isNegative() || ttl.isZero()))) {
            return deleteAsync(key).thenApply(deleted -> null);
        }
        return async("set", key, null, () -> write(key, encode(key, value), ttl), ignored -> null);
    }

    public CompletableFuture<Boolean> deleteAsync(String key) {
        if (key == null) {
            return CompletableFuture.completedFuture(Boolean.FALSE);
        }
        return async("delete", key, Boolean.FALSE, () -> bucket(key).deleteAsync(), Boolean.TRUE::equals);
    }

    public CompletableFuture<Boolean> existsAsync(String key) {
        if (key == null) {
            return CompletableFuture.completedFuture(Boolean.FALSE);
        }
        return async("exists", key, Boolean.FALSE, () -> bucket(key).isExistsAsync(), Boolean.TRUE::equals);
    }

    // ===================================================================
    // ====================== 内部方法 / Internals ========================
    // ===================================================================

    private RBucket<String> bucket(String key) {
        return redisson.getBucket(key, StringCodec.INSTANCE);
    }

    private RFuture<Void> write(String key, String text, Duration ttl) {
        RBucket<String> bucket = bucket(key);
        return ttl == null ? bucket.setAsync(text) : bucket.setAsync(text, ceilToMillis(ttl));
    }

    /**
     * Redis 的过期精度是毫秒，不足 1 毫秒的部分向上取整，避免正数 TTL 变成 {@code PSETEX 0}。
     * <p>
     * Redis expiry has millisecond precision; sub-millisecond remainders round up so a positive TTL never becomes
     * {@code PSETEX 0}.
     */
    static Duration ceilToMillis(Duration ttl) {
        Duration truncated = Duration.ofMillis(ttl.toMillis());
        return truncated.compareTo(ttl) < 0 ? truncated.plusMillis(1) : truncated;
    }

    private String encode(String key, JsonNode value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new CacheSerializationException("Failed to encode value for key " + key, e);
        }
    }

    private JsonNode decode(String key, String text) {
        try {
            JsonNode node = objectMapper.readTree(text);
            if (node == null || node.isMissingNode()) {
                throw new CacheSerializationException("Empty payload for key " + key);
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new CacheSerializationException("Failed to decode payload for key " + key, e);
        }
    }

    /**
     * PTTL：{@code -1} 永不过期，{@code -2} 或 0 视为已经不存在，{@code null} 视为未知。
     * <p>
     * PTTL: {@code -1} never expires, {@code -2} or 0 counts as already gone, {@code null} as unknown.
     */
    private Optional<TimedValue> toTimedValue(String key, String text, Long pttl) {
        if (text == null) {
            return Optional.empty();
        }
        if (pttl == null) {
            return Optional.of(TimedValue.unknown(decode(key, text)));
        }
        if (pttl == TTL_NO_EXPIRY) {
            return Optional.of(TimedValue.unbounded(decode(key, text)));
        }
        if (pttl <= 0) {
            return Optional.empty();
        }
        return Optional.of(TimedValue.bounded(decode(key, text), Duration.ofMillis(pttl)));
    }

    private static Optional<Duration> toTtl(Long millis) {
        if (millis == null || millis == TTL_NO_EXPIRY || millis == TTL_KEY_ABSENT || millis <= 0) {
            return Optional.empty();
        }
        return Optional.of(Duration.ofMillis(millis));
    }

    /**
     * 以固定超时等待 Redisson 的结果。超时会取消请求；所有基础设施错误都转换为 {@link CacheBackendUnavailableException}。
     * <p>
     * Awaits a Redisson result with the fixed timeout. A timeout cancels the request; every infrastructure error
     * is turned into a {@link CacheBackendUnavailableException}.
     */
    private <T> T await(RFuture<T> future, String operation, String key) {
        CompletableFuture<T> completable = future.toCompletableFuture();
        try {
            return completable.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            completable.cancel(true);
            throw new CacheBackendUnavailableException(operation + " timed out after " + timeout.toMillis() + "ms for key " + key, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            completable.cancel(true);
            throw new CacheBackendUnavailableException(operation + " interrupted for key " + key, e);
        } catch (ExecutionException e) {
            throw new CacheBackendUnavailableException(operation + " failed for key " + key, e.getCause() != null ? e.getCause() : e);
        } catch (CancellationException e) {
            throw new CacheBackendUnavailableException(operation + " cancelled for key " + key, e);
        }
    }

    private <T> T execute(String operation, String key, T fallback, Supplier<T> action) {
        try {
            return action.get();
        } catch (RuntimeException e) {
            logFailure(operation, key, e);
            return fallback;
        }
    }

    private <R, T> CompletableFuture<T> async(String operation, String key, T fallback,
                                              Supplier<RFuture<R>> call, Function<R, T> mapper) {
        CompletableFuture<R> future;
        try {
            future = call.get().toCompletableFuture();
        } catch (RuntimeException e) {
            logFailure(operation, key, e);
            return CompletableFuture.completedFuture(fallback);
        }
        return future
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .thenApply(mapper)
                .exceptionally(e -> {
                    logFailure(operation, key, e);
                    return fallback;
                });
    }

    /**
     * 基础设施错误和数据错误记 WARN，其它（编程错误）记 ERROR。两种情况都不向上抛出。
     * <p>
     * Infrastructure and payload errors are logged at WARN, anything else (a programming error) at ERROR.
     * Neither is rethrown.
     */
    private void logFailure(String operation, String key, Throwable failure) {
        Throwable e = failure;
        while (e instanceof CompletionException && e.getCause() != null) {
            e = e.getCause();
        }
        if (e instanceof CacheSerializationException || e instanceof JsonProcessingException) {
            i18nLog.warn("l2.serialization_failed", e, operation, key, e.getMessage());
        } else if (e instanceof CacheBackendUnavailableException
                || e instanceof RedisException
                || e instanceof TimeoutException
                || e instanceof CancellationException
                || e instanceof ExecutionException) {
            i18nLog.warn("l2.unavailable", e, operation, key, e.getMessage());
        } else {
            i18nLog.error("l2.unexpected_error", e, operation, key, e.getMessage());
        }
    }
}
