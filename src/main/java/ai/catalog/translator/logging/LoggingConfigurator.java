package ai.catalog.translator.logging;

import ai.catalog.translator.config.LogFormat;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.OutputStreamAppender;
import ch.qos.logback.core.encoder.Encoder;
import ch.qos.logback.core.encoder.LayoutWrappingEncoder;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import org.slf4j.LoggerFactory;

/**
 * Applies the configured {@link LogFormat} to the running logback context. Every stream appender
 * attached to any logger gets a fresh encoder; an appender shared by several loggers is switched
 * once. Both formats carry the pipeline run's request and tenant MDC entries.
 */
public final class LoggingConfigurator {

    static final String TEXT_PATTERN = "%d{HH:mm:ss.SSS} %-5level [%thread] %X{request:-} %X{tenant:-} %logger{36} - %msg%n";
    static final int JSON_STACK_FRAMES = 5;

    private LoggingConfigurator() {
    }

    public static void configure(LogFormat format) {
        if (LoggerFactory.getILoggerFactory() instanceof LoggerContext context) {
            configure(context, format);
        }
    }

    /**
     * @return the number of appenders that received the new encoder
     */
    static int configure(LoggerContext context, LogFormat format) {
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(format, "format");
        Map<OutputStreamAppender<ILoggingEvent>, Boolean> appenders = new IdentityHashMap<>();
        for (Logger logger : context.getLoggerList()) {
            for (Iterator<Appender<ILoggingEvent>> iterator = logger.iteratorForAppenders(); iterator.hasNext(); ) {
                if (iterator.next() instanceof OutputStreamAppender<ILoggingEvent> appender) {
                    appenders.put(appender, Boolean.TRUE);
                }
            }
        }
        appenders.keySet().forEach(appender -> swapEncoder(appender, encoderFor(context, format)));
        return appenders.size();
    }

    private static Encoder<ILoggingEvent> encoderFor(LoggerContext context, LogFormat format) {
        if (format == LogFormat.JSON) {
            SimpleJsonLayout layout = new SimpleJsonLayout();
            layout.setContext(context);
            layout.setMaxStackFrames(JSON_STACK_FRAMES);
            layout.start();
            LayoutWrappingEncoder<ILoggingEvent> encoder = new LayoutWrappingEncoder<>();
            encoder.setContext(context);
            encoder.setLayout(layout);
            encoder.start();
            return encoder;
        }
        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern(TEXT_PATTERN);
        encoder.start();
        return encoder;
    }

    private static void swapEncoder(OutputStreamAppender<ILoggingEvent> appender, Encoder<ILoggingEvent> encoder) {
        boolean started = appender.isStarted();
        if (started) {
            appender.stop();
        }
        appender.setEncoder(encoder);
        if (started) {
            appender.start();
        }
    }
}
