/*
 * Copyright Syncbase Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.syncbase.subscription;

import java.util.concurrent.atomic.AtomicReference;

import io.syncbase.annotation.ThreadSafe;
import io.syncbase.transport.ChangeChannel;

/**
 * The live subscription to the changes of one table.
 */
@ThreadSafe
public final class Subscription {

    private final String table;
    private final AtomicReference<SubscriptionStatus> status = new AtomicReference<>(SubscriptionStatus.PENDING);
    private volatile ChangeChannel channel;
    private volatile Throwable error;

    Subscription(String table) {
        this.table = table;
    }

    public String table() {
        return table;
    }

    public SubscriptionStatus status() {
        return status.get();
    }

    /**
     * @return the channel, or null while the subscription is pending
     */
    public ChangeChannel channel() {
        return channel;
    }

    /**
     * @return the error reported by the channel, if the subscription is errored
     */
    public Throwable error() {
        return error;
    }

    void activate(ChangeChannel channel) {
        this.channel = channel;
        status.compareAndSet(SubscriptionStatus.PENDING, SubscriptionStatus.ACTIVE);
    }

    boolean fail(Throwable error) {
        if (status.compareAndSet(SubscriptionStatus.ACTIVE, SubscriptionStatus.ERRORED)
                || status.compareAndSet(SubscriptionStatus.PENDING, SubscriptionStatus.ERRORED)) {
            this.error = error;
            return true;
        }
        return false;
    }

    void close() {
        status.set(SubscriptionStatus.CLOSED);
    }

    @Override
    public String toString() {
        return "Subscription{table='" + table + "', status=" + status.get() + "}";
    }
}
