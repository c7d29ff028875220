package com.character.roster.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and automatically removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forLoad(loadId, source.describe())) {
 *     log.info("load.completed registered={} errors={}", registered, errors);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for one loader run.
     */
    public static LogContext forLoad(String loadId, String source) {
        LogContext ctx = new LogContext();
        ctx.put("loadId", loadId);
        ctx.put("source", source);
        ctx.put("operation", "load");
        return ctx;
    }

    /**
     * Creates a log context for relationship linking of one character.
     * Nests inside {@link #forLoad(String, String)} without touching its keys.
     */
    public static LogContext forLinking(String entityId) {
        LogContext ctx = new LogContext();
        ctx.put("entityId", entityId);
        return ctx;
    }

    /**
     * Generates a unique id for a load run.
     */
    public static String generateLoadId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Adds an additional key-value pair to this log context.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
