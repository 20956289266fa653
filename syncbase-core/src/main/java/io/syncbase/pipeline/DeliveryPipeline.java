/*
 * Copyright Syncbase Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.syncbase.pipeline;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.syncbase.data.ChangeEvent;
import io.syncbase.engine.BatchSink;
import io.syncbase.engine.DeliveryException;
import io.syncbase.util.Clock;

/**
 * Hands batches to the {@link BatchSink} and advances the watermarks of the tables in a batch once the sink accepted
 * it. A failure of the sink is reported in the {@link DeliveryResult}, never thrown.
 *
 * @author Syncbase Authors
 */
public class DeliveryPipeline {

    private static final Logger LOGGER = LoggerFactory.getLogger(DeliveryPipeline.class);

    private final BatchSink sink;
    private final WatermarkTracker watermarks;
    private final Clock clock;

    public DeliveryPipeline(BatchSink sink, WatermarkTracker watermarks, Clock clock) {
        this.sink = Objects.requireNonNull(sink);
        this.watermarks = Objects.requireNonNull(watermarks);
        this.clock = Objects.requireNonNull(clock);
    }

    /**
     * Deliver a batch to the sink.
     *
     * @param batch the events; may not be null or empty
     * @return the outcome; never null
     */
    public DeliveryResult deliver(List<ChangeEvent> batch) {
        if (batch.isEmpty()) {
            throw new IllegalArgumentException("Cannot deliver an empty batch");
        }
        final long start = clock.currentTimeInMillis();
        try {
            sink.handleBatch(Collections.unmodifiableList(batch));
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failed(batch, start, e);
        }
        catch (Exception e) {
            return failed(batch, start, e);
        }
        watermarks.advance(batch);
        final Duration duration = elapsedSince(start);
        LOGGER.debug("Delivered batch of {} events in {} ms", batch.size(), duration.toMillis());
        return DeliveryResult.success(batch.size(), duration);
    }

    private DeliveryResult failed(List<ChangeEvent> batch, long start, Exception cause) {
        final DeliveryException failure = new DeliveryException("Sink failed to handle a batch of " + batch.size() + " events", batch.size(), cause);
        LOGGER.warn("{}; the batch will be retried on the next flush", failure.getMessage(), cause);
        return DeliveryResult.failure(batch.size(), elapsedSince(start), failure);
    }

    private Duration elapsedSince(long start) {
        return Duration.ofMillis(Math.max(0L, clock.currentTimeInMillis() - start));
    }

    public WatermarkTracker watermarks() {
        return watermarks;
    }
}
