package ai.catalog.translator.logging;

import static org.assertj.core.api.Assertions.assertThat;

import ai.catalog.translator.config.LogFormat;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.LoggingEvent;
import ch.qos.logback.core.OutputStreamAppender;
import ch.qos.logback.core.read.ListAppender;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class LoggingConfiguratorTest {

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private LoggerContext context;
    private OutputStreamAppender<ILoggingEvent> appender;

    @BeforeEach
    void setUp() {
        context = new LoggerContext();
        context.start();
        appender = new OutputStreamAppender<>() {
            @Override
            public void start() {
                setOutputStream(buffer);
                super.start();
            }
        };
        appender.setContext(context);
        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern("%msg%n");
        encoder.start();
        appender.setEncoder(encoder);
        appender.start();

        context.getLogger(Logger.ROOT_LOGGER_NAME).addAppender(appender);
        context.getLogger("ai.catalog.translator").addAppender(appender);
        ListAppender<ILoggingEvent> list = new ListAppender<>();
        list.setContext(context);
        list.start();
        context.getLogger("ai.catalog.translator").addAppender(list);
    }

    @Test
    @DisplayName("json format switches each stream appender once and writes request and tenant as fields")
    void switchesSharedAppendersToJson() {
        int switched = LoggingConfigurator.configure(context, LogFormat.JSON);
        appender.doAppend(event("translation started"));

        assertThat(switched).isEqualTo(1);
        assertThat(appender.isStarted()).isTrue();
        String line = buffer.toString(StandardCharsets.UTF_8);
        assertThat(line).startsWith("{\"timestamp\":");
        assertThat(line).contains("\"request\":\"req-1\",\"tenant\":\"acme\",\"message\":\"translation started\"");
    }

    @Test
    void textFormatShowsRequestAndTenant() {
        LoggingConfigurator.configure(context, LogFormat.TEXT);
        appender.doAppend(event("translation started"));

        assertThat(buffer.toString(StandardCharsets.UTF_8))
                .contains("[main] req-1 acme test.logger - translation started");
    }

    private LoggingEvent event(String message) {
        LoggingEvent event = new LoggingEvent();
        event.setLevel(Level.INFO);
        event.setLoggerName("test.logger");
        event.setMessage(message);
        event.setThreadName("main");
        event.setTimeStamp(0L);
        event.setLoggerContext(context);
        event.setMDCPropertyMap(Map.of("request", "req-1", "tenant", "acme"));
        return event;
    }
}
