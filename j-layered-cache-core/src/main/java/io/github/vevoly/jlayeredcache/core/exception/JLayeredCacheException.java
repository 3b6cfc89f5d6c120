package io.github.vevoly.jlayeredcache.core.exception;

/**
 * 框架内部异常的基类。
 * 这些异常只在后端内部抛出，并在公开方法的边界处被捕获和记录，永远不会传递给调用者。
 * <p>
 * Base class of the framework's internal exceptions.
 * They are thrown inside the backends only, caught and logged at the public method boundary, and never reach a caller.
 *
 * @author vevoly
 */
public class JLayeredCacheException extends RuntimeException {

    public JLayeredCacheException(String message) {
        super(message);
    }

    public JLayeredCacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
