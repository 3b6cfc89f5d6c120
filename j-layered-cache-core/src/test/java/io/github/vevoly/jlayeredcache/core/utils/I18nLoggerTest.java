package io.github.vevoly.jlayeredcache.core.utils;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;

class I18nLoggerTest {

    private final Logger logger = mock(Logger.class);
    private final I18nLogger i18nLog = new I18nLogger(logger);

    @Test
    @DisplayName("按资源文件格式化参数")
    void shouldFormatArguments() {
        assertThat(i18nLog.format("key.hashed", 300, 250, "abc")).contains("300", "250", "abc");
    }

    @Test
    @DisplayName("缺失的 Key 输出提示而不是抛出异常")
    void shouldReportMissingKey() {
        assertThat(i18nLog.format("no.such.key")).isEqualTo("!!! LOG KEY NOT FOUND: no.such.key !!!");
    }

    @Test
    @DisplayName("未开启 DEBUG 时 WARN 不附带堆栈")
    void shouldOmitStackTraceWithoutDebug() {
        given(logger.isWarnEnabled()).willReturn(true);
        RuntimeException failure = new RuntimeException("boom");

        i18nLog.warn("l2.unavailable", failure, "get", "user:42", "boom");

        then(logger).should().warn(contains("user:42"));
        then(logger).should(never()).warn(anyString(), eq(failure));
    }

    @Test
    @DisplayName("开启 DEBUG 时 WARN 附带堆栈")
    void shouldAttachStackTraceWithDebug() {
        given(logger.isWarnEnabled()).willReturn(true);
        given(logger.isDebugEnabled()).willReturn(true);
        RuntimeException failure = new RuntimeException("boom");

        i18nLog.warn("l2.unavailable", failure, "get", "user:42", "boom");

        then(logger).should().warn(contains("user:42"), eq(failure));
    }

    @Test
    @DisplayName("日志级别关闭时不格式化")
    void shouldSkipDisabledLevel() {
        i18nLog.debug("l1.promoted", "user:42", "PT1M");

        then(logger).should(never()).debug(anyString());
    }
}
