/*
 * Copyright Syncbase Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.syncbase.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.syncbase.data.ChangeEvent;
import io.syncbase.data.Operation;
import io.syncbase.engine.BatchSink;
import io.syncbase.engine.DeliveryException;
import io.syncbase.util.Clock;

class DeliveryPipelineTest {

    private static final Instant COMMITTED = Instant.parse("2024-05-01T10:00:00Z");

    private BatchSink sink;
    private WatermarkTracker watermarks;
    private DeliveryPipeline pipeline;

    @BeforeEach
    void setUp() {
        sink = mock(BatchSink.class);
        watermarks = new WatermarkTracker();
        pipeline = new DeliveryPipeline(sink, watermarks, Clock.fixed(COMMITTED));
    }

    private static ChangeEvent event(int id, Instant committed) {
        return ChangeEvent.create()
                .table("orders")
                .operation(Operation.INSERT)
                .record(Map.of("id", id))
                .observedAt(COMMITTED)
                .sourceCommitTime(committed)
                .build();
    }

    @Test
    void shouldAdvanceWatermarkOnSuccess() throws Exception {
        List<ChangeEvent> batch = List.of(event(1, COMMITTED), event(2, COMMITTED.plusSeconds(5)));

        DeliveryResult result = pipeline.deliver(batch);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.batchSize()).isEqualTo(2);
        assertThat(result.failure()).isEmpty();
        assertThat(watermarks.watermark("orders")).contains(COMMITTED.plusSeconds(5));
        verify(sink).handleBatch(batch);
    }

    @Test
    void shouldReportFailureWithoutThrowing() throws Exception {
        doThrow(new IllegalStateException("boom")).when(sink).handleBatch(anyList());

        DeliveryResult result = pipeline.deliver(List.of(event(1, COMMITTED)));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.failure()).get()
                .isInstanceOf(DeliveryException.class)
                .satisfies(e -> assertThat(e.getBatchSize()).isEqualTo(1))
                .satisfies(e -> assertThat(e.getCause()).hasMessage("boom"));
        assertThat(watermarks.watermark("orders")).isEmpty();
    }

    @Test
    void shouldRestoreInterruptFlagWhenSinkIsInterrupted() throws Exception {
        doThrow(new InterruptedException()).when(sink).handleBatch(anyList());

        try {
            DeliveryResult result = pipeline.deliver(List.of(event(1, COMMITTED)));
            assertThat(result.isSuccess()).isFalse();
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        }
        finally {
            Thread.interrupted();
        }
    }

    @Test
    void shouldRejectEmptyBatch() {
        assertThatThrownBy(() -> pipeline.deliver(List.of())).isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(sink);
    }
}
