package io.github.vevoly.jlayeredcache.core.exception;

/**
 * 共享后端无法连接、超时或被中断。操作降级为默认值，记录 WARN 日志。
 * <p>
 * The shared backend could not be reached, timed out or was interrupted. The operation degrades to its default and is logged at WARN.
 *
 * @author vevoly
 */
public class CacheBackendUnavailableException extends JLayeredCacheException {

    public CacheBackendUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
