/*
 * Copyright Syncbase Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.syncbase.util;

import java.time.Instant;

/**
 * An abstraction for a clock, so that time-dependent components can be driven deterministically in tests.
 */
public interface Clock {

    /**
     * The {@link Clock} backed by the {@link System} methods.
     */
    Clock SYSTEM = new Clock() {
        @Override
        public long currentTimeInMillis() {
            return System.currentTimeMillis();
        }

        @Override
        public Instant currentTimeAsInstant() {
            return Instant.now();
        }
    };

    static Clock system() {
        return SYSTEM;
    }

    /**
     * Get a clock that always reports the supplied instant.
     *
     * @param instant the fixed time; may not be null
     * @return the clock; never null
     */
    static Clock fixed(Instant instant) {
        return new Clock() {
            @Override
            public long currentTimeInMillis() {
                return instant.toEpochMilli();
            }

            @Override
            public Instant currentTimeAsInstant() {
                return instant;
            }
        };
    }

    /**
     * @return the current time in milliseconds since the epoch
     */
    long currentTimeInMillis();

    default Instant currentTimeAsInstant() {
        return Instant.ofEpochMilli(currentTimeInMillis());
    }
}
