/*
 * Copyright Syncbase Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.syncbase.pipeline;

import java.time.Duration;
import java.util.Optional;

import io.syncbase.annotation.Immutable;
import io.syncbase.engine.DeliveryException;

/**
 * The outcome of handing one batch to the sink.
 */
@Immutable
public final class DeliveryResult {

    private final int batchSize;
    private final Duration duration;
    private final DeliveryException failure;

    private DeliveryResult(int batchSize, Duration duration, DeliveryException failure) {
        this.batchSize = batchSize;
        this.duration = duration;
        this.failure = failure;
    }

    static DeliveryResult success(int batchSize, Duration duration) {
        return new DeliveryResult(batchSize, duration, null);
    }

    static DeliveryResult failure(int batchSize, Duration duration, DeliveryException failure) {
        return new DeliveryResult(batchSize, duration, failure);
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public int batchSize() {
        return batchSize;
    }

    public Duration duration() {
        return duration;
    }

    public Optional<DeliveryException> failure() {
        return Optional.ofNullable(failure);
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "DeliveryResult{delivered " + batchSize + " events in " + duration.toMillis() + " ms}"
                : "DeliveryResult{failed " + batchSize + " events: " + failure.getMessage() + "}";
    }
}
