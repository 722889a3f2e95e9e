package io.nosqlbench.bucketize.importer;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import com.fasterxml.jackson.databind.ObjectMapper;
import io.nosqlbench.bucketize.api.Cell;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("JsonRowFlattener")
class JsonRowFlattenerTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private List<Cell> flatten(String json) throws Exception {
        return JsonRowFlattener.flatten(mapper.readTree(json));
    }

    @Test
    @DisplayName("should map scalars to typed cells and drop nulls")
    void shouldMapScalars() throws Exception {
        List<Cell> cells = flatten("{\"s\":\"x\",\"i\":3,\"d\":2.5,\"b\":false,\"n\":null}");

        assertThat(cells).extracting(Cell::column).containsExactly("s", "i", "d", "b");
        assertThat(cells).extracting(Cell::value).containsExactly("x", 3L, 2.5d, false);
        assertThat(cells).extracting(Cell::timestamp).containsOnly(Instant.EPOCH);
    }

    @Test
    @DisplayName("should flatten nested objects with dotted names")
    void shouldFlattenObjects() throws Exception {
        List<Cell> cells = flatten("{\"a\":{\"b\":{\"c\":1},\"d\":\"e\"}}");

        assertThat(cells).extracting(Cell::column).containsExactly("a.b.c", "a.d");
    }

    @Test
    @DisplayName("should turn arrays of scalars into one flag per element")
    void shouldFlagScalarArrayElements() throws Exception {
        List<Cell> cells = flatten("{\"tags\":[\"red\",7,true,1.5]}");

        assertThat(cells).extracting(Cell::column)
            .containsExactly("tags.red", "tags.7", "tags.true", "tags.1.5");
        assertThat(cells).extracting(Cell::value).containsOnly(true);
    }

    @Test
    @DisplayName("should keep arrays of containers as JSON text")
    void shouldKeepNestedArraysAsText() throws Exception {
        List<Cell> cells = flatten("{\"m\":[[1,2],{\"k\":\"v\"}]}");

        assertThat(cells).singleElement().satisfies(cell -> {
            assertThat(cell.column()).isEqualTo("m");
            assertThat(cell.value()).isEqualTo("[[1,2],{\"k\":\"v\"}]");
        });
    }

    @Test
    void shouldRejectNonObjects() {
        assertThatThrownBy(() -> flatten("[1]")).isInstanceOf(IllegalArgumentException.class);
    }
}
