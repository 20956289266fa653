/*
 * Copyright Syncbase Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.syncbase.sink;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import io.syncbase.data.ChangeEvent;
import io.syncbase.data.Operation;
import io.syncbase.engine.BatchSink;

class CompositeBatchSinkTest {

    private final List<ChangeEvent> batch = List.of(ChangeEvent.create()
            .table("orders")
            .operation(Operation.INSERT)
            .record(Map.of("id", 1))
            .observedAt(Instant.EPOCH)
            .build());

    @Test
    void shouldCallSinksInOrder() throws Exception {
        BatchSink first = mock(BatchSink.class);
        BatchSink second = mock(BatchSink.class);

        new CompositeBatchSink(first, second).handleBatch(batch);

        InOrder order = inOrder(first, second);
        order.verify(first).handleBatch(batch);
        order.verify(second).handleBatch(batch);
    }

    @Test
    void shouldStopAtFirstFailure() throws Exception {
        BatchSink first = mock(BatchSink.class);
        BatchSink second = mock(BatchSink.class);
        doThrow(new IllegalStateException("boom")).when(first).handleBatch(anyList());

        assertThatThrownBy(() -> new CompositeBatchSink(first, second).handleBatch(batch)).hasMessage("boom");

        verify(first).handleBatch(batch);
        verifyNoInteractions(second);
    }

    @Test
    void shouldRequireAtLeastOneSink() {
        assertThatThrownBy(() -> new CompositeBatchSink()).isInstanceOf(IllegalArgumentException.class);
    }
}
