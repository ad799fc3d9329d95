package com.churnguard.common.trace;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Correlates the log lines of one loop cycle.
 *
 * <p>Every cycle gets a fresh id from {@link #newTraceId()}. Loops run on Reactor
 * threads, so MDC is never used as a persistent store: it is only populated for the
 * duration of a single log statement through {@link #withMdc(String, Runnable)}.
 */
public final class TraceContextUtil {

    public static final String TRACE_ID_KEY = "traceId";

    private TraceContextUtil() {}

    /** Short random id, enough to tell concurrent cycles apart in the logs. */
    public static String newTraceId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Bridges {@code traceId} into MDC while {@code logAction} runs, then removes it.
     *
     * @param traceId   the id to expose as {@value #TRACE_ID_KEY}
     * @param logAction the log statement to execute
     */
    public static void withMdc(String traceId, Runnable logAction) {
        MDC.put(TRACE_ID_KEY, traceId);
        try {
            logAction.run();
        } finally {
            MDC.remove(TRACE_ID_KEY);
        }
    }
}
