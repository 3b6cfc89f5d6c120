package io.github.vevoly.jlayeredcache.core.utils;

import org.slf4j.Logger;

import java.text.MessageFormat;
import java.util.Locale;
import java.util.MissingResourceException;
import java.util.ResourceBundle;

/**
 * 支持国际化 (i18n) 日志输出的辅助类。
 * <p>
 * 封装了 {@link ResourceBundle} 和 {@link Logger}，日志代码中只使用与语言无关的“键”，
 * 消息模板根据当前 Locale 从 {@code i18n/jlayeredcache_messages*.properties} 中加载并格式化。
 * 只有在对应级别开启时才会查找和格式化消息，因此放在热路径上也没有额外开销。
 * <p>
 * A helper for internationalized (i18n) log output.
 * It wraps a {@link ResourceBundle} and a {@link Logger}; logging code uses language-neutral keys and the message
 * templates are loaded from {@code i18n/jlayeredcache_messages*.properties} for the current Locale and formatted.
 * Messages are only looked up and formatted when the level is enabled, so it is safe on hot paths.
 *
 * @author vevoly
 */
public class I18nLogger {

    /**
     * 国际化资源文件的基础名称。
     * <p>
     * The base name of the i18n resource bundle.
     */
    private static final String BUNDLE_BASE_NAME = "i18n.jlayeredcache_messages";

    private final Logger slf4jLogger;
    private final ResourceBundle resourceBundle;

    public I18nLogger(Logger slf4jLogger) {
        this.slf4jLogger = slf4jLogger;
        this.resourceBundle = loadBundle(slf4jLogger);
    }

    public void debug(String key, Object... args) {
        if (slf4jLogger.isDebugEnabled()) {
            slf4jLogger.debug(format(key, args));
        }
    }

    public void info(String key, Object... args) {
        if (slf4jLogger.isInfoEnabled()) {
            slf4jLogger.info(format(key, args));
        }
    }

    public void warn(String key, Object... args) {
        if (slf4jLogger.isWarnEnabled()) {
            slf4jLogger.warn(format(key, args));
        }
    }

    /**
     * 以 WARN 级别记录一条带异常信息的国际化日志。异常堆栈只在 DEBUG 开启时输出，避免后端故障时刷屏。
     * <p>
     * Logs a message with an exception at WARN. The stack trace is only attached when DEBUG is enabled,
     * so an outage of a backend does not flood the log.
     */
    public void warn(String key, Throwable t, Object... args) {
        if (!slf4jLogger.isWarnEnabled()) {
            return;
        }
        if (slf4jLogger.isDebugEnabled()) {
            slf4jLogger.warn(format(key, args), t);
        } else {
            slf4jLogger.warn(format(key, args));
        }
    }

    public void error(String key, Throwable t, Object... args) {
        if (slf4jLogger.isErrorEnabled()) {
            slf4jLogger.error(format(key, args), t);
        }
    }

    /**
     * 根据给定的键和参数格式化最终的日志消息。
     * <p>
     * Formats the final log message for the given key and arguments.
     */
    String format(String key, Object... args) {
        if (resourceBundle == null) {
            return "[i18n disabled] " + key;
        }
        try {
            String pattern = resourceBundle.getString(key);
            return MessageFormat.format(pattern, args);
        } catch (MissingResourceException e) {
            return "!!! LOG KEY NOT FOUND: " + key + " !!!";
        } catch (IllegalArgumentException e) {
            return "!!! LOG FORMATTING ERROR for key: " + key + " !!!";
        }
    }

    private static ResourceBundle loadBundle(Logger logger) {
        try {
            return ResourceBundle.getBundle(BUNDLE_BASE_NAME, Locale.getDefault(), I18nLogger.class.getClassLoader());
        } catch (MissingResourceException e) {
            // 找不到资源文件时不影响运行，后续日志输出原始 Key
            // Keep running without the bundle; subsequent logs print the raw key.
            logger.warn("Could not find i18n resource bundle with base name '{}'. Internationalized logging will be disabled.", BUNDLE_BASE_NAME);
            return null;
        }
    }
}
