/*
 * Copyright Syncbase Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.syncbase.data;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class OperationTest {

    @Test
    void shouldParseNamesAndCodes() {
        assertThat(Operation.parse("INSERT")).isEqualTo(Operation.INSERT);
        assertThat(Operation.parse(" update ")).isEqualTo(Operation.UPDATE);
        assertThat(Operation.parse("d")).isEqualTo(Operation.DELETE);
        assertThat(Operation.parse("C")).isEqualTo(Operation.INSERT);
    }

    @Test
    void shouldReturnNullForUnknownValues() {
        assertThat(Operation.parse(null)).isNull();
        assertThat(Operation.parse("TRUNCATE")).isNull();
        assertThat(Operation.forCode("x")).isNull();
        assertThat(Operation.forCode(null)).isNull();
    }
}
