/*
 * Copyright Syncbase Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.syncbase.connector.postgresql;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;

import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.Test;

import io.syncbase.transport.RealtimeChange;

class NotificationPayloadsTest {

    @Test
    void shouldParseUpdate() {
        RealtimeChange change = NotificationPayloads.parse("{\"type\":\"UPDATE\",\"schema\":\"public\",\"table\":\"orders\","
                + "\"commit_timestamp\":\"2024-05-01T10:00:00.123+00:00\","
                + "\"record\":{\"id\":7,\"status\":\"paid\",\"total\":12.5},"
                + "\"old_record\":{\"id\":7,\"status\":\"open\",\"total\":12.5}}");

        assertThat(change.eventType()).isEqualTo("UPDATE");
        assertThat(change.schema()).isEqualTo("public");
        assertThat(change.table()).isEqualTo("orders");
        assertThat(change.commitTimestamp()).isEqualTo("2024-05-01T10:00:00.123+00:00");
        assertThat(change.newRecord()).containsEntry("id", 7).containsEntry("status", "paid").containsEntry("total", 12.5);
        assertThat(change.oldRecord()).containsEntry("status", "open");
    }

    @Test
    void shouldTreatNullImagesAsMissing() {
        RealtimeChange change = NotificationPayloads.parse("{\"type\":\"DELETE\",\"record\":null,\"old_record\":{\"id\":7}}");

        assertThat(change.newRecord()).isNull();
        assertThat(change.oldRecord()).containsEntry("id", 7);
        assertThat(change.commitTimestamp()).isNull();
    }

    @Test
    void shouldReadTruncatedFlag() {
        RealtimeChange truncated = NotificationPayloads.parse("{\"type\":\"UPDATE\",\"truncated\":true,"
                + "\"record\":{\"id\":3},\"old_record\":{\"id\":3}}");
        RealtimeChange complete = NotificationPayloads.parse("{\"type\":\"UPDATE\",\"record\":{\"id\":3}}");

        assertThat(truncated.isTruncated()).isTrue();
        assertThat(truncated.newRecord()).containsOnlyKeys("id");
        assertThat(complete.isTruncated()).isFalse();
    }

    @Test
    void shouldKeepNestedValues() {
        RealtimeChange change = NotificationPayloads.parse("{\"type\":\"INSERT\",\"record\":{\"id\":1,\"tags\":[\"a\",\"b\"],\"meta\":{\"k\":\"v\"}}}");

        assertThat(change.newRecord().get("tags")).asInstanceOf(InstanceOfAssertFactories.LIST).containsExactly("a", "b");
        assertThat(change.newRecord().get("meta")).isEqualTo(Map.of("k", "v"));
    }

    @Test
    void shouldRejectMalformedPayloads() {
        assertThatThrownBy(() -> NotificationPayloads.parse(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> NotificationPayloads.parse("  ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> NotificationPayloads.parse("{\"type\":")).isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not valid JSON");
        assertThatThrownBy(() -> NotificationPayloads.parse("[1,2]")).isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not a JSON object");
    }
}
