package com.webfront.core.utils;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread factory helpers for the background and worker pools.
 */
public class ThreadUtils {

    private ThreadUtils() {
        // Utility class
    }

    /**
     * Creates a factory for daemon threads named {@code prefix-0},
     * {@code prefix-1}, ...
     *
     * @param prefix Thread name prefix.
     * @return A new thread factory.
     */
    public static ThreadFactory daemonFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
    }
}
