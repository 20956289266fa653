/*
 * Copyright Syncbase Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.syncbase.engine;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Set;

import org.junit.jupiter.api.Test;

import io.syncbase.engine.SyncEngine.State;
import io.syncbase.engine.SyncEngine.Status;

class SyncEngineStatusTest {

    @Test
    void shouldReportRunningOnlyInRunningState() {
        assertThat(new Status(State.RUNNING, 0, Set.of(), Set.of()).running()).isTrue();
        for (State state : new State[]{ State.STOPPED, State.STARTING, State.STOPPING, State.ERRORED }) {
            assertThat(new Status(state, 0, Set.of(), Set.of()).running()).isFalse();
        }
    }

    @Test
    void shouldSortTables() {
        Status status = new Status(State.RUNNING, 3, Set.of("users", "accounts", "orders"), Set.of("orders"));

        assertThat(status.subscribedTables()).containsExactly("accounts", "orders", "users");
        assertThat(status.erroredTables()).containsExactly("orders");
        assertThat(status.bufferedEventCount()).isEqualTo(3);
    }
}
