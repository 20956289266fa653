/*
 * Copyright Syncbase Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.syncbase.util;

import java.time.Duration;

/**
 * Paces a repeated action at a regular interval: call {@link #pause()} before each repetition.
 */
@FunctionalInterface
public interface Metronome {

    /**
     * Pause until the next tick of the metronome.
     *
     * @throws InterruptedException if the thread was interrupted while pausing
     */
    void pause() throws InterruptedException;

    /**
     * Create a metronome that starts ticking immediately and waits with {@link Thread#sleep(long)}. Precision is
     * limited to that of the clock and of the scheduler, so periods of a few milliseconds are not honored exactly.
     *
     * @param period the period between ticks; may not be null
     * @param clock the clock providing the current time; may not be null
     * @return the new metronome; never null
     */
    static Metronome sleeper(Duration period, Clock clock) {
        final long periodInMillis = period.toMillis();
        return new Metronome() {
            private long next = clock.currentTimeInMillis() + periodInMillis;

            @Override
            public void pause() throws InterruptedException {
                for (;;) {
                    final long now = clock.currentTimeInMillis();
                    if (next <= now) {
                        break;
                    }
                    Thread.sleep(next - now);
                }
                next = next + periodInMillis;
            }

            @Override
            public String toString() {
                return "Metronome (sleep for " + periodInMillis + " ms)";
            }
        };
    }
}
