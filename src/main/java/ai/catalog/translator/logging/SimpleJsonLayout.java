package ai.catalog.translator.logging;

import ai.catalog.translator.pipeline.TranslationPipeline;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.classic.spi.StackTraceElementProxy;
import ch.qos.logback.core.LayoutBase;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * One JSON object per line. The request and tenant of a pipeline run are lifted out of the MDC
 * into top-level fields so log shippers can index them; any other MDC entries follow under
 * {@code mdc}, sorted by key. An exception is written as an object with its cause chain and the
 * first {@link #setMaxStackFrames(int) maxStackFrames} frames of the outermost throwable.
 */
public class SimpleJsonLayout extends LayoutBase<ILoggingEvent> {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ISO_OFFSET_DATE_TIME;
    private static final int MAX_CAUSES = 8;

    private int maxStackFrames = 5;

    public void setMaxStackFrames(int maxStackFrames) {
        this.maxStackFrames = Math.max(0, maxStackFrames);
    }

    @Override
    public String doLayout(ILoggingEvent event) {
        Map<String, String> mdc = new TreeMap<>();
        if (event.getMDCPropertyMap() != null) {
            mdc.putAll(event.getMDCPropertyMap());
        }
        JsonObject json = new JsonObject()
                .field("timestamp", TIMESTAMP.format(Instant.ofEpochMilli(event.getTimeStamp()).atOffset(ZoneOffset.UTC)))
                .field("level", event.getLevel().toString())
                .field("logger", event.getLoggerName())
                .field("thread", event.getThreadName());
        String request = mdc.remove(TranslationPipeline.MDC_REQUEST);
        if (request != null) {
            json.field("request", request);
        }
        String tenant = mdc.remove(TranslationPipeline.MDC_TENANT);
        if (tenant != null) {
            json.field("tenant", tenant);
        }
        json.field("message", event.getFormattedMessage());
        if (!mdc.isEmpty()) {
            JsonObject extra = new JsonObject();
            mdc.forEach(extra::field);
            json.raw("mdc", extra.toString());
        }
        IThrowableProxy throwable = event.getThrowableProxy();
        if (throwable != null) {
            json.raw("exception", exception(throwable));
        }
        return json + System.lineSeparator();
    }

    private String exception(IThrowableProxy throwable) {
        JsonObject json = new JsonObject()
                .field("class", throwable.getClassName())
                .field("message", throwable.getMessage());
        List<String> causes = new ArrayList<>();
        IThrowableProxy cause = throwable.getCause();
        while (cause != null && causes.size() < MAX_CAUSES) {
            causes.add(new JsonObject()
                    .field("class", cause.getClassName())
                    .field("message", cause.getMessage())
                    .toString());
            cause = cause.getCause();
        }
        if (!causes.isEmpty()) {
            json.raw("causes", "[" + String.join(",", causes) + "]");
        }
        StackTraceElementProxy[] frames = throwable.getStackTraceElementProxyArray();
        if (frames != null && frames.length > 0 && maxStackFrames > 0) {
            List<String> written = new ArrayList<>();
            for (int index = 0; index < Math.min(frames.length, maxStackFrames); index++) {
                written.add(quote(frames[index].getStackTraceElement().toString()));
            }
            json.raw("frames", "[" + String.join(",", written) + "]");
        }
        return json.toString();
    }

    static String quote(String value) {
        if (value == null) {
            return "null";
        }
        StringBuilder escaped = new StringBuilder(value.length() + 16);
        escaped.append('"');
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            switch (ch) {
                case '\\' -> escaped.append("\\\\");
                case '"' -> escaped.append("\\\"");
                case '\n' -> escaped.append("\\n");
                case '\r' -> escaped.append("\\r");
                case '\t' -> escaped.append("\\t");
                default -> {
                    if (ch < 0x20) {
                        escaped.append(String.format("\\u%04x", (int) ch));
                    } else {
                        escaped.append(ch);
                    }
                }
            }
        }
        escaped.append('"');
        return escaped.toString();
    }

    private static final class JsonObject {

        private final StringBuilder body = new StringBuilder(256);

        JsonObject field(String name, String value) {
            return raw(name, quote(value));
        }

        JsonObject raw(String name, String json) {
            if (body.length() > 0) {
                body.append(',');
            }
            body.append(quote(name)).append(':').append(json);
            return this;
        }

        @Override
        public String toString() {
            return "{" + body + "}";
        }
    }
}
