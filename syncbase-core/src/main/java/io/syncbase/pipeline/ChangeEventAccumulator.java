/*
 * Copyright Syncbase Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.syncbase.pipeline;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.ListIterator;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.syncbase.annotation.GuardedBy;
import io.syncbase.annotation.ThreadSafe;
import io.syncbase.annotation.VisibleForTesting;
import io.syncbase.data.ChangeEvent;
import io.syncbase.util.Threads;

/**
 * Buffers change events in arrival order and cuts them into batches for the {@link DeliveryPipeline}.
 * <p>
 * A batch is cut as soon as the buffer holds {@code maxBatchSize} events, and a recurring flush cuts whatever is
 * buffered every {@code maxBatchAge}. Cut batches are delivered one at a time, in order, on a single delivery thread;
 * {@link #push(ChangeEvent)} never waits for the sink. When the sink fails, the failed batch and every batch cut after
 * it go back to the front of the buffer, ahead of events that arrived in the meantime, and are retried by the next
 * flush.
 * <p>
 * Events live only in memory: anything buffered when the process dies is lost.
 *
 * @author Syncbase Authors
 */
@ThreadSafe
public class ChangeEventAccumulator {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChangeEventAccumulator.class);

    private final String engineName;
    private final int maxBatchSize;
    private final Duration maxBatchAge;
    private final Duration shutdownTimeout;
    private final DeliveryPipeline pipeline;

    private final ReentrantLock lock = new ReentrantLock();

    @GuardedBy("lock")
    private final Deque<ChangeEvent> buffer = new ArrayDeque<>();
    @GuardedBy("lock")
    private final Deque<List<ChangeEvent>> pendingBatches = new ArrayDeque<>();
    @GuardedBy("lock")
    private boolean deliveryScheduled;
    @GuardedBy("lock")
    private long generation;
    @GuardedBy("lock")
    private int inFlightEvents;
    @GuardedBy("lock")
    private ScheduledExecutorService executor;
    @GuardedBy("lock")
    private ScheduledFuture<?> flushTask;

    public ChangeEventAccumulator(String engineName, int maxBatchSize, Duration maxBatchAge, Duration shutdownTimeout,
                                  DeliveryPipeline pipeline) {
        if (maxBatchSize <= 0) {
            throw new IllegalArgumentException("The maximum batch size must be positive but was " + maxBatchSize);
        }
        if (maxBatchAge.isZero() || maxBatchAge.isNegative()) {
            throw new IllegalArgumentException("The maximum batch age must be positive but was " + maxBatchAge);
        }
        this.engineName = Objects.requireNonNull(engineName);
        this.maxBatchSize = maxBatchSize;
        this.maxBatchAge = maxBatchAge;
        this.shutdownTimeout = Objects.requireNonNull(shutdownTimeout);
        this.pipeline = Objects.requireNonNull(pipeline);
    }

    /**
     * Start the recurring flush. Starting a started accumulator has no effect.
     */
    public void start() {
        lock.lock();
        try {
            if (flushTask != null) {
                return;
            }
            ensureExecutor();
            final long periodMillis = maxBatchAge.toMillis();
            flushTask = executor.scheduleAtFixedRate(this::flush, periodMillis, periodMillis, TimeUnit.MILLISECONDS);
            if (!pendingBatches.isEmpty()) {
                scheduleDelivery();
            }
            LOGGER.debug("Flushing buffered events every {} ms or every {} events", periodMillis, maxBatchSize);
        }
        finally {
            lock.unlock();
        }
    }

    @GuardedBy("lock")
    private void ensureExecutor() {
        if (executor == null) {
            executor = Threads.newSingleThreadScheduledExecutor(engineName, "batch-delivery", true);
        }
    }

    /**
     * Append an event to the buffer, cutting a batch when the buffer reaches the maximum batch size.
     *
     * @param event the event; may not be null
     */
    public void push(ChangeEvent event) {
        Objects.requireNonNull(event, "event");
        lock.lock();
        try {
            buffer.addLast(event);
            if (buffer.size() >= maxBatchSize) {
                while (buffer.size() >= maxBatchSize) {
                    pendingBatches.addLast(cut(maxBatchSize));
                }
                scheduleDelivery();
            }
        }
        finally {
            lock.unlock();
        }
    }

    /**
     * Cut everything that is buffered into batches and schedule their delivery. This is the body of the recurring
     * flush.
     */
    @VisibleForTesting
    public void flush() {
        lock.lock();
        try {
            if (buffer.isEmpty()) {
                return;
            }
            cutAll();
            scheduleDelivery();
        }
        finally {
            lock.unlock();
        }
    }

    /**
     * Stop the recurring flush and deliver everything that is buffered, waiting at most for the shutdown timeout. A
     * batch the sink rejects during the drain is put back and the drain ends. When the timeout expires the delivery
     * thread is interrupted and abandoned; a batch still held by the sink is counted as undelivered until the sink
     * returns, and if it then fails the batch goes back to the front of the buffer.
     *
     * @return true if every event was delivered
     */
    public boolean drain() {
        final ScheduledExecutorService toStop;
        lock.lock();
        try {
            if (flushTask != null) {
                flushTask.cancel(false);
                flushTask = null;
            }
            ensureExecutor();
            cutAll();
            scheduleDelivery();
            toStop = executor;
            executor = null;
            toStop.shutdown();
        }
        finally {
            lock.unlock();
        }
        boolean terminated;
        try {
            terminated = toStop.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            terminated = false;
        }
        if (!terminated) {
            LOGGER.warn("Delivery of buffered events did not complete within {} ms", shutdownTimeout.toMillis());
            toStop.shutdownNow();
        }
        lock.lock();
        try {
            // a delivery thread that is still running belongs to the previous generation and takes no further batches
            generation++;
            deliveryScheduled = false;
            cutAllBack();
            final int remaining = buffer.size() + inFlightEvents;
            if (remaining > 0) {
                LOGGER.warn("{} buffered events were not delivered, {} of them still held by the sink", remaining, inFlightEvents);
                return false;
            }
            return true;
        }
        finally {
            lock.unlock();
        }
    }

    /**
     * @return the number of events not yet delivered, including a batch currently in the hands of the sink
     */
    public int bufferedEventCount() {
        lock.lock();
        try {
            int count = buffer.size() + inFlightEvents;
            for (List<ChangeEvent> batch : pendingBatches) {
                count += batch.size();
            }
            return count;
        }
        finally {
            lock.unlock();
        }
    }

    /**
     * @return the number of events currently in the hands of the sink
     */
    @VisibleForTesting
    int inFlightEventCount() {
        lock.lock();
        try {
            return inFlightEvents;
        }
        finally {
            lock.unlock();
        }
    }

    public boolean isStarted() {
        lock.lock();
        try {
            return flushTask != null;
        }
        finally {
            lock.unlock();
        }
    }

    @GuardedBy("lock")
    private List<ChangeEvent> cut(int size) {
        final List<ChangeEvent> batch = new ArrayList<>(Math.min(size, buffer.size()));
        while (batch.size() < size && !buffer.isEmpty()) {
            batch.add(buffer.pollFirst());
        }
        return batch;
    }

    @GuardedBy("lock")
    private void cutAll() {
        while (!buffer.isEmpty()) {
            pendingBatches.addLast(cut(maxBatchSize));
        }
    }

    @GuardedBy("lock")
    private void cutAllBack() {
        final List<ChangeEvent> events = new ArrayList<>();
        pendingBatches.forEach(events::addAll);
        pendingBatches.clear();
        restoreToFront(events);
    }

    @GuardedBy("lock")
    private void restoreToFront(List<ChangeEvent> events) {
        for (ListIterator<ChangeEvent> it = events.listIterator(events.size()); it.hasPrevious();) {
            buffer.addFirst(it.previous());
        }
    }

    @GuardedBy("lock")
    private void scheduleDelivery() {
        if (deliveryScheduled || pendingBatches.isEmpty() || executor == null || executor.isShutdown()) {
            return;
        }
        deliveryScheduled = true;
        final long owner = generation;
        executor.execute(() -> deliverPending(owner));
    }

    private void deliverPending(long owner) {
        while (true) {
            final List<ChangeEvent> batch;
            lock.lock();
            try {
                if (owner != generation) {
                    return;
                }
                batch = pendingBatches.pollFirst();
                if (batch == null) {
                    deliveryScheduled = false;
                    return;
                }
                inFlightEvents += batch.size();
            }
            finally {
                lock.unlock();
            }
            DeliveryResult result = null;
            try {
                result = pipeline.deliver(batch);
            }
            finally {
                complete(owner, batch, result != null && result.isSuccess());
            }
            if (!result.isSuccess()) {
                return;
            }
        }
    }

    private void complete(long owner, List<ChangeEvent> batch, boolean delivered) {
        lock.lock();
        try {
            inFlightEvents -= batch.size();
            if (delivered) {
                return;
            }
            final List<ChangeEvent> events = new ArrayList<>(batch);
            pendingBatches.forEach(events::addAll);
            pendingBatches.clear();
            restoreToFront(events);
            if (owner == generation) {
                deliveryScheduled = false;
            }
            LOGGER.debug("Returned {} events to the front of the buffer, {} events now buffered", events.size(), buffer.size());
        }
        finally {
            lock.unlock();
        }
    }
}
