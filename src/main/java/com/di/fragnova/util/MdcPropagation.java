package com.di.fragnova.util;

import org.slf4j.MDC;

import java.util.Collections;
import java.util.Map;

/**
 * Carries SLF4J MDC (e.g. {@code requestId}, {@code epoch}) from the thread that requests a migration
 * to the transport threads that complete it, so their log lines correlate with the epoch that issued them.
 * <p>
 * Usage: capture with {@link #copyMdc()} on the submitting thread, then on the worker
 * {@code MdcPropagation.runWithMdcContext(saved, () -> complete(item));}
 */
public final class MdcPropagation {

    private MdcPropagation() {
    }

    /**
     * Returns a copy of the current thread's MDC context map, or an empty map if none.
     *
     * @return copy of MDC context; never null
     */
    public static Map<String, String> copyMdc() {
        Map<String, String> map = MDC.getCopyOfContextMap();
        return map == null ? Collections.emptyMap() : map;
    }

    /**
     * Runs the given task in the current thread with the provided context set in MDC for the duration.
     *
     * @param contextMap MDC key-value map from a previous {@link #copyMdc()}
     * @param task       task to run
     */
    public static void runWithMdcContext(Map<String, String> contextMap, Runnable task) {
        setMdc(contextMap);
        try {
            task.run();
        } finally {
            clearMdc(contextMap);
        }
    }

    private static void setMdc(Map<String, String> contextMap) {
        if (contextMap != null && !contextMap.isEmpty()) {
            contextMap.forEach(MDC::put);
        }
    }

    private static void clearMdc(Map<String, String> contextMap) {
        if (contextMap != null && !contextMap.isEmpty()) {
            contextMap.keySet().forEach(MDC::remove);
        }
    }
}
