/*
 * Copyright Syncbase Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.syncbase.subscription;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.syncbase.annotation.ThreadSafe;
import io.syncbase.data.ChangeEvent;
import io.syncbase.data.Operation;
import io.syncbase.transport.ChangeChannel;
import io.syncbase.transport.ChangeListener;
import io.syncbase.transport.RealtimeChange;
import io.syncbase.transport.RealtimeTransport;
import io.syncbase.util.Clock;

/**
 * Keeps exactly one {@link Subscription} per watched table and turns the changes published on each channel into
 * {@link ChangeEvent}s for the consumer, typically {@link io.syncbase.pipeline.ChangeEventAccumulator#push}.
 * <p>
 * Changes that cannot be translated are logged and dropped; they never reach the consumer and never propagate back
 * into the transport. An insert or update whose row images were truncated by the source is not translated either; its
 * table is handed to the truncated change handler instead, which typically catches the table up.
 *
 * @author Syncbase Authors
 */
@ThreadSafe
public class SubscriptionRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(SubscriptionRegistry.class);

    private final RealtimeTransport transport;
    private final Set<String> watchedTables;
    private final Consumer<ChangeEvent> consumer;
    private final Consumer<String> truncatedChangeHandler;
    private final Clock clock;
    private final ConcurrentMap<String, Subscription> subscriptions = new ConcurrentHashMap<>();

    public SubscriptionRegistry(RealtimeTransport transport, Set<String> watchedTables, Consumer<ChangeEvent> consumer, Clock clock) {
        this(transport, watchedTables, consumer,
                table -> LOGGER.warn("Dropping truncated change on '{}'; catch up the table to pick it up", table), clock);
    }

    public SubscriptionRegistry(RealtimeTransport transport, Set<String> watchedTables, Consumer<ChangeEvent> consumer,
                                Consumer<String> truncatedChangeHandler, Clock clock) {
        this.transport = Objects.requireNonNull(transport);
        this.watchedTables = Collections.unmodifiableSet(new LinkedHashSet<>(watchedTables));
        this.consumer = Objects.requireNonNull(consumer);
        this.truncatedChangeHandler = Objects.requireNonNull(truncatedChangeHandler);
        this.clock = Objects.requireNonNull(clock);
    }

    /**
     * Open a channel for the changes of a watched table.
     *
     * @param table the table; may not be null
     * @return the active subscription; never null
     * @throws SubscriptionException if the table is not watched, is already subscribed, or the channel could not be
     *             opened
     */
    public Subscription subscribe(String table) {
        if (!watchedTables.contains(table)) {
            throw new SubscriptionException(table, "Table '" + table + "' is not a watched table");
        }
        final Subscription subscription = new Subscription(table);
        if (subscriptions.putIfAbsent(table, subscription) != null) {
            throw new SubscriptionException(table, "Table '" + table + "' is already subscribed");
        }
        try {
            final ChangeChannel channel = transport.openChannel(table, new TableListener(subscription));
            subscription.activate(channel);
        }
        catch (RuntimeException e) {
            subscriptions.remove(table, subscription);
            throw new SubscriptionException(table, "Unable to subscribe to changes of table '" + table + "': " + e.getMessage(), e);
        }
        LOGGER.info("Subscribed to changes of table '{}'", table);
        return subscription;
    }

    /**
     * Close the subscription of a table. Has no effect if the table is not subscribed. Failures to close the channel are
     * logged, not thrown.
     *
     * @param table the table
     */
    public void unsubscribe(String table) {
        final Subscription subscription = subscriptions.remove(table);
        if (subscription == null) {
            return;
        }
        subscription.close();
        final ChangeChannel channel = subscription.channel();
        if (channel != null) {
            try {
                channel.close();
            }
            catch (RuntimeException e) {
                LOGGER.warn("Failed to close the channel of table '{}'", table, e);
            }
        }
        LOGGER.info("Unsubscribed from changes of table '{}'", table);
    }

    public void unsubscribeAll() {
        new ArrayList<>(subscriptions.keySet()).forEach(this::unsubscribe);
    }

    /**
     * Translate a published change into an event.
     *
     * @param table the table of the channel that published the change
     * @param change the published change; may not be null
     * @return the event, or empty if the table is not watched, the change is malformed, or it is a truncated insert or
     *         update
     */
    public Optional<ChangeEvent> onEvent(String table, RealtimeChange change) {
        if (!watchedTables.contains(table)) {
            LOGGER.debug("Ignoring change on unwatched table '{}'", table);
            return Optional.empty();
        }
        final Operation operation = Operation.parse(change.eventType());
        if (operation == null) {
            LOGGER.warn("Dropping change on '{}' with unknown operation '{}'", table, change.eventType());
            return Optional.empty();
        }
        if (requiresCatchUp(change)) {
            LOGGER.debug("Not translating truncated {} on '{}'", operation, table);
            return Optional.empty();
        }
        final Map<String, Object> record = operation == Operation.DELETE
                ? (change.oldRecord() != null ? change.oldRecord() : change.newRecord())
                : change.newRecord();
        if (record == null) {
            LOGGER.warn("Dropping {} on '{}' without a row image", operation, table);
            return Optional.empty();
        }
        final Instant commitTime;
        try {
            commitTime = parseTimestamp(change.commitTimestamp());
        }
        catch (DateTimeParseException e) {
            LOGGER.warn("Dropping {} on '{}' with invalid commit timestamp '{}'", operation, table, change.commitTimestamp());
            return Optional.empty();
        }
        return Optional.of(ChangeEvent.create()
                .table(table)
                .operation(operation)
                .record(record)
                .previousRecord(change.oldRecord())
                .observedAt(clock.currentTimeAsInstant())
                .sourceCommitTime(commitTime)
                .build());
    }

    /**
     * A truncated delete still identifies the deleted row by its key; truncated inserts and updates have to be read back
     * from the table.
     */
    static boolean requiresCatchUp(RealtimeChange change) {
        if (!change.isTruncated()) {
            return false;
        }
        final Operation operation = Operation.parse(change.eventType());
        return operation == Operation.INSERT || operation == Operation.UPDATE;
    }

    static Instant parseTimestamp(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value.trim()).toInstant();
        }
        catch (DateTimeParseException e) {
            return Instant.parse(value.trim());
        }
    }

    public Optional<Subscription> subscription(String table) {
        return Optional.ofNullable(subscriptions.get(table));
    }

    public Set<String> watchedTables() {
        return watchedTables;
    }

    /**
     * @return the tables with an active subscription
     */
    public Set<String> subscribedTables() {
        return tablesWithStatus(SubscriptionStatus.ACTIVE);
    }

    /**
     * @return the tables whose channel reported an error
     */
    public Set<String> erroredTables() {
        return tablesWithStatus(SubscriptionStatus.ERRORED);
    }

    private Set<String> tablesWithStatus(SubscriptionStatus status) {
        final Set<String> tables = new TreeSet<>();
        subscriptions.values().forEach(subscription -> {
            if (subscription.status() == status) {
                tables.add(subscription.table());
            }
        });
        return tables;
    }

    private class TableListener implements ChangeListener {
        private final Subscription subscription;

        TableListener(Subscription subscription) {
            this.subscription = subscription;
        }

        @Override
        public void onChange(RealtimeChange change) {
            if (subscription.status() == SubscriptionStatus.CLOSED) {
                return;
            }
            try {
                final Optional<ChangeEvent> event = onEvent(subscription.table(), change);
                if (event.isPresent()) {
                    consumer.accept(event.get());
                }
                else if (requiresCatchUp(change) && watchedTables.contains(subscription.table())) {
                    LOGGER.info("Change on '{}' was too large to publish; requesting a catch-up", subscription.table());
                    truncatedChangeHandler.accept(subscription.table());
                }
            }
            catch (RuntimeException e) {
                LOGGER.error("Failed to process change {} on '{}'", change, subscription.table(), e);
            }
        }

        @Override
        public void onError(Throwable error) {
            if (subscription.fail(error)) {
                LOGGER.error("Subscription to table '{}' failed", subscription.table(), error);
            }
        }
    }
}
