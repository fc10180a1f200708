package io.codefmt.logging;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.OutputStreamAppender;
import ch.qos.logback.core.encoder.LayoutWrappingEncoder;
import io.codefmt.config.LogFormat;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingConfiguratorTest {

    @AfterEach
    void restoreTextFormat() {
        LoggingConfigurator.configure(LogFormat.TEXT);
    }

    @Test
    void switchesStderrAppenderBetweenFormats() {
        LoggingConfigurator.configure(LogFormat.JSON);

        assertThat(stderrAppender().getEncoder()).isInstanceOf(LayoutWrappingEncoder.class);
        assertThat(((LayoutWrappingEncoder<ILoggingEvent>) stderrAppender().getEncoder()).getLayout())
                .isInstanceOf(JsonLogLayout.class);
        assertThat(stderrAppender().isStarted()).isTrue();

        LoggingConfigurator.configure(LogFormat.TEXT);

        assertThat(stderrAppender().getEncoder()).isInstanceOf(PatternLayoutEncoder.class);
        assertThat(((PatternLayoutEncoder) stderrAppender().getEncoder()).getPattern())
                .isEqualTo(LoggingConfigurator.TEXT_PATTERN);
    }

    @SuppressWarnings("unchecked")
    private static OutputStreamAppender<ILoggingEvent> stderrAppender() {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        return (OutputStreamAppender<ILoggingEvent>) context.getLogger(Logger.ROOT_LOGGER_NAME).getAppender("STDERR");
    }
}
