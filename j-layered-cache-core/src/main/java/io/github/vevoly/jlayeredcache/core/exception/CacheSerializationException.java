package io.github.vevoly.jlayeredcache.core.exception;

/**
 * 值无法编码写入共享后端，或读取到的数据无法解码。读取时视为未命中，写入时视为空操作。
 * <p>
 * A value could not be encoded for the shared backend, or a stored payload could not be decoded.
 * Treated as a miss on read and a no-op on write.
 *
 * @author vevoly
 */
public class CacheSerializationException extends JLayeredCacheException {

    public CacheSerializationException(String message) {
        super(message);
    }

    public CacheSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
