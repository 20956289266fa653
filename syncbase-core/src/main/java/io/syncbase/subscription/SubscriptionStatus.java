/*
 * Copyright Syncbase Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.syncbase.subscription;

/**
 * The status of a {@link Subscription}.
 */
public enum SubscriptionStatus {
    PENDING,
    ACTIVE,
    /**
     * The channel reported an error after it was established. Errored subscriptions are not re-established
     * automatically.
     */
    ERRORED,
    CLOSED
}
