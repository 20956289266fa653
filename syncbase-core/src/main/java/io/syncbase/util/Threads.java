/*
 * Copyright Syncbase Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.syncbase.util;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Utilities related to threads and threading.
 */
public final class Threads {

    private static final String THREAD_NAME_PREFIX = "syncbase-";
    private static final Logger LOGGER = LoggerFactory.getLogger(Threads.class);

    /**
     * Expires after a defined period of time.
     */
    public interface Timer {

        /**
         * @return true if the period has elapsed since the timer was created
         */
        boolean expired();

        Duration remaining();
    }

    /**
     * Obtain a {@link Timer} that expires once the given time has elapsed on the clock.
     *
     * @param clock the clock; may not be null
     * @param time the period after which the timer expires; may not be null
     * @return the timer; never null
     */
    public static Timer timer(Clock clock, Duration time) {
        final long start = clock.currentTimeInMillis();
        return new Timer() {
            @Override
            public boolean expired() {
                return elapsed() > time.toMillis();
            }

            @Override
            public Duration remaining() {
                return time.minus(elapsed(), ChronoUnit.MILLIS);
            }

            private long elapsed() {
                final long elapsed = clock.currentTimeInMillis() - start;
                return elapsed <= 0L ? 0L : elapsed;
            }
        };
    }

    /**
     * Returns a thread factory that names its threads {@code syncbase-<engine name>-<thread name>}.
     *
     * @param engineName the name of the engine owning the threads
     * @param name the name of the thread
     * @param indexed true if the thread name should be suffixed with an index
     * @param daemon true if the threads should be daemon threads
     * @return the thread factory; never null
     */
    public static ThreadFactory threadFactory(String engineName, String name, boolean indexed, boolean daemon) {
        LOGGER.debug("Requested thread factory for engine {} named {}", engineName, name);
        return new ThreadFactory() {
            private final AtomicInteger index = new AtomicInteger(0);

            @Override
            public Thread newThread(Runnable r) {
                StringBuilder threadName = new StringBuilder(THREAD_NAME_PREFIX)
                        .append(engineName)
                        .append('-')
                        .append(name);
                if (indexed) {
                    threadName.append('-').append(index.getAndIncrement());
                }
                LOGGER.info("Creating thread {}", threadName);
                final Thread t = new Thread(r, threadName.toString());
                t.setDaemon(daemon);
                return t;
            }
        };
    }

    public static ScheduledExecutorService newSingleThreadScheduledExecutor(String engineName, String name, boolean daemon) {
        return Executors.newSingleThreadScheduledExecutor(threadFactory(engineName, name, false, daemon));
    }

    private Threads() {
    }
}
