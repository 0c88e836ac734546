package app.mstudio.render.support;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Tagged event log for the render pipeline. Every event is written through SLF4J as {@code [TAG] message}
 * and counted under {@code render.events} with the tag as the {@code event} dimension.
 */
@Component
public class RenderEvents {

    private static final Logger log = LoggerFactory.getLogger("app.mstudio.render.events");

    private final MeterRegistry meterRegistry;

    public RenderEvents(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public void info(String tag, String message, Object... args) {
        if (log.isInfoEnabled()) {
            log.info(prefix(tag) + message, args);
        }
        count(tag);
    }

    public void warn(String tag, String message, Object... args) {
        log.warn(prefix(tag) + message, args);
        count(tag);
    }

    public void error(String tag, String message, Object... args) {
        log.error(prefix(tag) + message, args);
        count(tag);
    }

    private void count(String tag) {
        Counter.builder("render.events")
                .tag("event", tag)
                .register(meterRegistry)
                .increment();
    }

    private static String prefix(String tag) {
        return "[" + tag + "] ";
    }

    /**
     * Collapses whitespace and truncates an exception message for logs and job error fields.
     */
    public static String safeMessage(Throwable ex, int max) {
        if (ex == null || ex.getMessage() == null) {
            return "";
        }
        return truncate(ex.getMessage(), max);
    }

    public static String truncate(String message, int max) {
        if (message == null) {
            return null;
        }
        String trimmed = message.replaceAll("[\\r\\n]+", " ").trim();
        return trimmed.length() <= max ? trimmed : trimmed.substring(0, max) + "...";
    }
}
